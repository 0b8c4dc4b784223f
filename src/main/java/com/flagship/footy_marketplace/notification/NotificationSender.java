package com.flagship.footy_marketplace.notification;

public interface NotificationSender {

    /**
     * Delivers a notification. Implementations throw on failure so the consuming event is redelivered.
     */
    void send(Notification notification);
}
