package com.flagship.footy_marketplace.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class NotificationEventHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NotificationSender sender = mock(NotificationSender.class);
    private final NotificationEventHandler handler = new NotificationEventHandler(sender);

    private JsonNode json(Map<String, Object> fields) {
        return objectMapper.valueToTree(fields);
    }

    @Test
    @DisplayName("Activation notifies the candidate with plan, price and renewal date")
    void membershipActivated() {
        UUID candidateId = UUID.randomUUID();
        UUID eventId = UUID.randomUUID();

        handler.handle("MembershipActivated", eventId, json(Map.of(
            "candidateId", candidateId.toString(),
            "planType", "PROFESSIONAL",
            "price", 29.99,
            "currency", "usd",
            "renewalDate", "2026-11-18T10:00:00Z")));

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(sender).send(captor.capture());
        Notification sent = captor.getValue();
        assertEquals("candidate", sent.getRecipientType());
        assertEquals(candidateId, sent.getRecipientId());
        assertEquals(NotificationChannel.EMAIL, sent.getChannel());
        assertTrue(sent.getSubject().contains("PROFESSIONAL"));
        assertTrue(sent.getBody().contains("29.99 USD"));
        assertTrue(sent.getBody().contains("2026-11-18T10:00:00Z"));
        assertEquals(eventId, sent.getSourceEventId());
    }

    @Test
    @DisplayName("An issued invoice notifies the team that vacancies are on hold")
    void invoiceIssued() {
        UUID teamId = UUID.randomUUID();

        Optional<Notification> notification = handler.toNotification("InvoiceIssued", UUID.randomUUID(), json(Map.of(
            "teamId", teamId.toString(),
            "amount", "50.00",
            "currency", "usd",
            "dueDate", "2026-11-18T10:00:00Z")));

        assertTrue(notification.isPresent());
        assertEquals("team", notification.get().getRecipientType());
        assertEquals(teamId, notification.get().getRecipientId());
        assertTrue(notification.get().getBody().contains("50.00 USD"));
        assertTrue(notification.get().getBody().contains("on hold"));
    }

    @Test
    @DisplayName("Cancelling a checkout that never activated sends nothing")
    void abandonedCheckoutIsSilent() {
        handler.handle("MembershipCancelled", UUID.randomUUID(), json(Map.of(
            "candidateId", UUID.randomUUID().toString(),
            "planType", "BASIC",
            "previousStatus", "PENDING",
            "reason", "Payment canceled")));

        verify(sender, never()).send(any());
    }

    @Test
    @DisplayName("Cancelling an active membership tells the candidate why")
    void activeCancellationNotifies() {
        Optional<Notification> notification = handler.toNotification("MembershipCancelled", UUID.randomUUID(),
            json(Map.of(
                "candidateId", UUID.randomUUID().toString(),
                "planType", "PREMIUM",
                "previousStatus", "ACTIVE",
                "reason", "Found a club")));

        assertTrue(notification.isPresent());
        assertTrue(notification.get().getBody().contains("Found a club"));
    }

    @Test
    @DisplayName("Only known event types are handled")
    void handledTypes() {
        assertTrue(handler.handles("InvoicePaid"));
        assertTrue(handler.handles("MembershipExpired"));
        assertFalse(handler.handles("MembershipCreated"));
        assertTrue(handler.toNotification("MembershipCreated", UUID.randomUUID(), json(Map.of())).isEmpty());
    }

    @Test
    @DisplayName("An event without its recipient id is rejected")
    void missingRecipient() {
        assertThrows(IllegalArgumentException.class,
            () -> handler.handle("InvoiceVoided", UUID.randomUUID(), json(Map.of("reason", "duplicate"))));
        verify(sender, never()).send(any());
    }
}
