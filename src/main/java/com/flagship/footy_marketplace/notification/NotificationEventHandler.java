package com.flagship.footy_marketplace.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.footy_marketplace.membership.event.MembershipActivatedEvent;
import com.flagship.footy_marketplace.membership.event.MembershipCancelledEvent;
import com.flagship.footy_marketplace.membership.event.MembershipExpiredEvent;
import com.flagship.footy_marketplace.placement.event.InvoiceIssuedEvent;
import com.flagship.footy_marketplace.placement.event.InvoicePaidEvent;
import com.flagship.footy_marketplace.placement.event.InvoiceVoidedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns published domain events into notifications for candidates and teams.
 *
 * Events are read as JSON trees rather than bound back to the event classes; only a
 * handful of fields are needed and producers may add fields freely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationEventHandler {

    static final Set<String> HANDLED_TYPES = Set.of(
        MembershipActivatedEvent.EVENT_TYPE,
        MembershipExpiredEvent.EVENT_TYPE,
        MembershipCancelledEvent.EVENT_TYPE,
        InvoiceIssuedEvent.EVENT_TYPE,
        InvoicePaidEvent.EVENT_TYPE,
        InvoiceVoidedEvent.EVENT_TYPE
    );

    private final NotificationSender sender;

    public boolean handles(String eventType) {
        return HANDLED_TYPES.contains(eventType);
    }

    public void handle(String eventType, UUID eventId, JsonNode event) {
        toNotification(eventType, eventId, event).ifPresent(notification -> {
            sender.send(notification);
            log.debug("Notification sent for {} {}", eventType, eventId);
        });
    }

    Optional<Notification> toNotification(String eventType, UUID eventId, JsonNode event) {
        switch (eventType) {
            case MembershipActivatedEvent.EVENT_TYPE:
                return Optional.of(Notification.toCandidate(
                    uuid(event, "candidateId"),
                    "Your " + text(event, "planType") + " membership is active",
                    String.format("Thanks for your payment of %s %s. Your membership renews on %s.",
                        text(event, "price"), text(event, "currency").toUpperCase(), text(event, "renewalDate")),
                    eventType, eventId));
            case MembershipExpiredEvent.EVENT_TYPE:
                return Optional.of(Notification.toCandidate(
                    uuid(event, "candidateId"),
                    "Your membership has expired",
                    "Your " + text(event, "planType") + " membership expired on " + text(event, "renewalDate")
                        + ". Renew to keep your profile visible to teams.",
                    eventType, eventId));
            case MembershipCancelledEvent.EVENT_TYPE:
                if ("PENDING".equals(text(event, "previousStatus"))) {
                    // an abandoned or failed checkout, the candidate was never charged
                    return Optional.empty();
                }
                return Optional.of(Notification.toCandidate(
                    uuid(event, "candidateId"),
                    "Your membership was cancelled",
                    "Your " + text(event, "planType") + " membership was cancelled: " + text(event, "reason"),
                    eventType, eventId));
            case InvoiceIssuedEvent.EVENT_TYPE:
                return Optional.of(Notification.toTeam(
                    uuid(event, "teamId"),
                    "Placement fee invoice",
                    String.format("A placement fee of %s %s is due by %s. New vacancies are on hold until it is paid.",
                        text(event, "amount"), text(event, "currency").toUpperCase(), text(event, "dueDate")),
                    eventType, eventId));
            case InvoicePaidEvent.EVENT_TYPE:
                return Optional.of(Notification.toTeam(
                    uuid(event, "teamId"),
                    "Payment received",
                    String.format("We received %s %s for invoice %s.",
                        text(event, "amount"), text(event, "currency").toUpperCase(), text(event, "invoiceId")),
                    eventType, eventId));
            case InvoiceVoidedEvent.EVENT_TYPE:
                return Optional.of(Notification.toTeam(
                    uuid(event, "teamId"),
                    "Invoice voided",
                    "Invoice " + text(event, "invoiceId") + " was voided: " + text(event, "reason"),
                    eventType, eventId));
            default:
                return Optional.empty();
        }
    }

    private static String text(JsonNode event, String field) {
        JsonNode value = event.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static UUID uuid(JsonNode event, String field) {
        String value = text(event, field);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Event is missing " + field);
        }
        return UUID.fromString(value);
    }
}
