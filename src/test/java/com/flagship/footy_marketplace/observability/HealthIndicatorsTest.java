package com.flagship.footy_marketplace.observability;

import com.flagship.footy_marketplace.outbox.OutboxEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.boot.actuate.health.Health;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthIndicatorsTest {

    @ParameterizedTest
    @CsvSource({"0, UP", "999, UP", "1000, WARNING", "9999, WARNING", "10000, DOWN"})
    @DisplayName("Outbox health follows the backlog thresholds")
    void outboxBacklogBands(long backlog, String expectedStatus) {
        OutboxEventRepository repository = mock(OutboxEventRepository.class);
        when(repository.countUnpublished()).thenReturn(backlog);

        Health health = new HealthIndicators.OutboxHealthIndicator(repository, 1000, 10000).health();

        assertEquals(expectedStatus, health.getStatus().getCode());
        assertEquals(backlog, health.getDetails().get("backlogSize"));
    }
}
