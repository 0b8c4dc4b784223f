package com.flagship.footy_marketplace.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.footy_marketplace.notification.NotificationEventHandler;
import com.flagship.footy_marketplace.outbox.OutboxPublisher;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class NotificationEventConsumerTest {

    private final IdempotentEventProcessor eventProcessor = mock(IdempotentEventProcessor.class);
    private final NotificationEventHandler notificationHandler = mock(NotificationEventHandler.class);
    private final Acknowledgment ack = mock(Acknowledgment.class);
    private NotificationEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new NotificationEventConsumer(eventProcessor, notificationHandler, new ObjectMapper());
        ReflectionTestUtils.setField(consumer, "membershipsTopic", "memberships");
    }

    private ConsumerRecord<String, String> record(String topic, UUID key, String value) {
        return new ConsumerRecord<>(topic, 0, 42L, key.toString(), value);
    }

    @Test
    @DisplayName("A handled event goes through the idempotent processor and is acknowledged")
    void handledEvent() {
        UUID eventId = UUID.randomUUID();
        UUID invoiceId = UUID.randomUUID();
        when(notificationHandler.handles("InvoicePaid")).thenReturn(true);
        when(eventProcessor.processEvent(eq(eventId), eq("InvoicePaid"), eq(OutboxPublisher.INVOICE_AGGREGATE),
            eq(invoiceId), eq(NotificationEventConsumer.CONSUMER_GROUP), any())).thenReturn(true);

        consumer.consume(record("billing", invoiceId,
            "{\"eventId\":\"" + eventId + "\",\"eventType\":\"InvoicePaid\"}"), ack);

        verify(eventProcessor).processEvent(eq(eventId), eq("InvoicePaid"), eq(OutboxPublisher.INVOICE_AGGREGATE),
            eq(invoiceId), eq(NotificationEventConsumer.CONSUMER_GROUP), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Events from the memberships topic are attributed to the membership aggregate")
    void membershipAggregate() {
        UUID eventId = UUID.randomUUID();
        UUID membershipId = UUID.randomUUID();
        when(notificationHandler.handles("MembershipExpired")).thenReturn(true);

        consumer.consume(record("memberships", membershipId,
            "{\"eventId\":\"" + eventId + "\",\"eventType\":\"MembershipExpired\"}"), ack);

        verify(eventProcessor).processEvent(eq(eventId), eq("MembershipExpired"),
            eq(OutboxPublisher.MEMBERSHIP_AGGREGATE), eq(membershipId), anyString(), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("An event type without a notification is recorded as skipped")
    void unhandledTypeSkipped() {
        UUID eventId = UUID.randomUUID();
        when(notificationHandler.handles("InvoiceReminder")).thenReturn(false);

        consumer.consume(record("billing", UUID.randomUUID(),
            "{\"eventId\":\"" + eventId + "\",\"eventType\":\"InvoiceReminder\"}"), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("InvoiceReminder"), anyString(), any(),
            eq(NotificationEventConsumer.CONSUMER_GROUP), anyString());
        verify(eventProcessor, never()).processEvent(any(), anyString(), anyString(), any(), anyString(), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("An unparseable message is acknowledged and dropped")
    void poisonMessageDropped() {
        consumer.consume(record("billing", UUID.randomUUID(), "not json"), ack);

        verifyNoInteractions(eventProcessor);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A handler failure propagates without acknowledging so Kafka redelivers")
    void failureNotAcknowledged() {
        when(notificationHandler.handles("InvoiceIssued")).thenReturn(true);
        when(eventProcessor.processEvent(any(), anyString(), anyString(), any(), anyString(), any()))
            .thenThrow(new IllegalStateException("mail relay down"));

        assertThrows(IllegalStateException.class, () -> consumer.consume(record("billing", UUID.randomUUID(),
            "{\"eventId\":\"" + UUID.randomUUID() + "\",\"eventType\":\"InvoiceIssued\"}"), ack));

        verify(ack, never()).acknowledge();
    }
}
