package com.example.merchant.service;

import org.junit.jupiter.api.Test;

import static com.example.merchant.service.SettlementState.*;
import static org.junit.jupiter.api.Assertions.*;

class SettlementStateTest {

    @Test
    void happyPathReachesSettled() {
        SettlementState state = CART.moveTo(QUOTED).moveTo(SETTLEMENT_REQUESTED).moveTo(SETTLED);

        assertEquals(SETTLED, state);
    }

    @Test
    void requestedSettlementCanFail() {
        assertEquals(SETTLEMENT_DENIED, SETTLEMENT_REQUESTED.moveTo(SETTLEMENT_DENIED));
        assertEquals(FACILITATOR_UNREACHABLE, SETTLEMENT_REQUESTED.moveTo(FACILITATOR_UNREACHABLE));
    }

    @Test
    void cannotSkipSettlement() {
        assertThrows(IllegalStateException.class, () -> CART.moveTo(SETTLED));
        assertThrows(IllegalStateException.class, () -> QUOTED.moveTo(SETTLED));
    }

    @Test
    void terminalStatesAreFinal() {
        for (SettlementState terminal : new SettlementState[]{SETTLED, SETTLEMENT_DENIED, FACILITATOR_UNREACHABLE}) {
            for (SettlementState next : values()) {
                assertFalse(terminal.canMoveTo(next), terminal + " -> " + next);
            }
        }
        assertThrows(IllegalStateException.class, () -> FACILITATOR_UNREACHABLE.moveTo(SETTLED));
    }

}
