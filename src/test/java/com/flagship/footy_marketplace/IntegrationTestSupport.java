package com.flagship.footy_marketplace;

import com.flagship.footy_marketplace.gateway.GatewayIntentStatus;
import com.flagship.footy_marketplace.gateway.GatewayPaymentIntent;
import com.flagship.footy_marketplace.gateway.PaymentGateway;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Shared Spring context for database-backed tests.
 *
 * One PostgreSQL container serves every subclass so the cached application context keeps
 * pointing at a live database. The payment gateway is mocked; each created intent gets a
 * fresh id.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestSupport {

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
        .withDatabaseName("footy_marketplace_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @MockBean
    protected PaymentGateway paymentGateway;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetDatabaseAndGateway() {
        jdbcTemplate.execute("""
            TRUNCATE TABLE processed_events, outbox_events, webhook_events, payment_intents,
                invoices, placements, vacancies, memberships
            """);

        when(paymentGateway.createPaymentIntent(any(BigDecimal.class), anyString(), anyMap()))
            .thenAnswer(invocation -> new GatewayPaymentIntent(
                "pi_" + UUID.randomUUID().toString().replace("-", ""),
                "secret_" + UUID.randomUUID(),
                invocation.getArgument(0),
                invocation.getArgument(1),
                GatewayIntentStatus.CREATED));
    }

    protected void gatewayReports(String intentId, GatewayIntentStatus status) {
        when(paymentGateway.retrievePaymentIntent(intentId))
            .thenReturn(new GatewayPaymentIntent(intentId, null, BigDecimal.ONE, "usd", status));
    }
}
