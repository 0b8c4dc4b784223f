package com.flagship.footy_marketplace.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sender: writes the notification to the log instead of delivering it.
 */
@Component
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(Notification notification) {
        log.info("Notification [{}] to {} {}: {} | {} (from {} {})",
            notification.getChannel(),
            notification.getRecipientType(),
            notification.getRecipientId(),
            notification.getSubject(),
            notification.getBody(),
            notification.getSourceEventType(),
            notification.getSourceEventId());
    }
}
