package com.valuationoracle.common.consensus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StalenessGateTest {

    @Test
    @DisplayName("self-relative comparison never reports stale for a non-negative window")
    void neverStale() {
        assertFalse(StalenessGate.isStale(100, 3600));
        assertFalse(StalenessGate.isStale(100, 0));
        assertFalse(StalenessGate.isStale(1_700_000_000L, 3600));
    }
}
