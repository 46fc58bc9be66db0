package com.bingohub.realtime.claim;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClaimStatusTest {

    @Test
    void directEdgesOnly() {
        assertTrue(ClaimStatus.NONE.canTransitionTo(ClaimStatus.PENDING));
        assertTrue(ClaimStatus.VALIDATING.canTransitionTo(ClaimStatus.REJECTED));
        assertTrue(ClaimStatus.VALID.canTransitionTo(ClaimStatus.VALIDATED));
        assertFalse(ClaimStatus.PENDING.canTransitionTo(ClaimStatus.VALIDATED));
        assertFalse(ClaimStatus.VALIDATED.canTransitionTo(ClaimStatus.REJECTED));
    }

    @Test
    void playerProjectionMayJumpForwardButNeverBack() {
        assertTrue(ClaimStatus.PENDING.canAdvanceTo(ClaimStatus.VALIDATED));
        assertTrue(ClaimStatus.PENDING.canAdvanceTo(ClaimStatus.REJECTED));
        assertFalse(ClaimStatus.VALID.canAdvanceTo(ClaimStatus.VALIDATING));
        assertFalse(ClaimStatus.INVALID.canAdvanceTo(ClaimStatus.VALID));
        assertFalse(ClaimStatus.VALID.canAdvanceTo(ClaimStatus.VALID));
    }

    @Test
    void validIsNotTerminal() {
        assertFalse(ClaimStatus.VALID.isTerminal());
        assertTrue(ClaimStatus.VALIDATED.isTerminal());
        assertTrue(ClaimStatus.INVALID.isTerminal());
        assertTrue(ClaimStatus.REJECTED.isTerminal());
    }
}
