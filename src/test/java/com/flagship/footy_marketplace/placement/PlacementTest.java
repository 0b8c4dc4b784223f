package com.flagship.footy_marketplace.placement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PlacementTest {

    private Placement pending() {
        return Placement.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
    }

    @Test
    @DisplayName("Placements start PENDING and confirm once")
    void confirm() {
        Placement placement = pending();
        assertEquals(PlacementStatus.PENDING, placement.getStatus());

        Placement confirmed = placement.confirm();
        assertEquals(PlacementStatus.CONFIRMED, confirmed.getStatus());
        assertEquals(PlacementStatus.CONFIRMED, confirmed.confirm().getStatus());
    }

    @Test
    @DisplayName("Confirmed placements cannot be cancelled and cancelled ones cannot be confirmed")
    void terminalStates() {
        assertThrows(IllegalStateException.class, () -> pending().confirm().cancel());
        assertThrows(IllegalStateException.class, () -> pending().cancel().confirm());
    }
}
