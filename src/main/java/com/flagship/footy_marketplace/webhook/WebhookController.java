package com.flagship.footy_marketplace.webhook;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Gateway callback. Anything short of a handler failure is acknowledged with 200 so the
 * gateway stops retrying; handler failures reach GlobalExceptionHandler as a 500.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final WebhookService webhookService;

    @PostMapping("/payments")
    public Map<String, String> payments(
            @RequestBody(required = false) String payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        WebhookOutcome outcome = webhookService.handle(payload, signature);
        return Map.of("status", outcome.status());
    }
}
