package com.flagship.footy_marketplace.notification;

import lombok.Value;

import java.util.UUID;

/**
 * A message for a candidate or a team. Recipients are addressed by id; resolving contact
 * details belongs to the sender.
 */
@Value
public class Notification {
    NotificationChannel channel;
    String recipientType;
    UUID recipientId;
    String subject;
    String body;
    String sourceEventType;
    UUID sourceEventId;

    public static Notification toCandidate(UUID candidateId, String subject, String body,
                                           String sourceEventType, UUID sourceEventId) {
        return new Notification(NotificationChannel.EMAIL, "candidate", candidateId, subject, body,
            sourceEventType, sourceEventId);
    }

    public static Notification toTeam(UUID teamId, String subject, String body,
                                      String sourceEventType, UUID sourceEventId) {
        return new Notification(NotificationChannel.EMAIL, "team", teamId, subject, body,
            sourceEventType, sourceEventId);
    }
}
