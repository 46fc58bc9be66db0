package com.bingohub.realtime.connection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackoffPolicyTest {

    @Test
    void delayDoublesUntilCapped() {
        BackoffPolicy p = new BackoffPolicy(1000, 10_000, 10);
        assertEquals(1000, p.delayFor(0));
        assertEquals(2000, p.delayFor(1));
        assertEquals(4000, p.delayFor(2));
        assertEquals(8000, p.delayFor(3));
        assertEquals(10_000, p.delayFor(4));
        assertEquals(10_000, p.delayFor(9));
    }

    @Test
    void hugeAttemptDoesNotOverflow() {
        BackoffPolicy p = new BackoffPolicy(1000, 10_000, 100);
        assertEquals(10_000, p.delayFor(63));
        assertEquals(10_000, p.delayFor(Integer.MAX_VALUE));
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(0, 1000, 3));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(2000, 1000, 3));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(1000, 1000, -1));
    }
}
