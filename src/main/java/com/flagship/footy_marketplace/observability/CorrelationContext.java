package com.flagship.footy_marketplace.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The id comes from the X-Correlation-ID header (or is generated) and ends up on every log
 * line of the request through the logging pattern's %X{correlationId}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CANDIDATE_ID_MDC_KEY = "candidateId";
    public static final String MEMBERSHIP_ID_MDC_KEY = "membershipId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";
    public static final String WEBHOOK_EVENT_ID_MDC_KEY = "webhookEventId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
