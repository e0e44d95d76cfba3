package com.valuationoracle.common.result;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OracleErrorTest {

    @Test
    @DisplayName("numbered codes are stable")
    void stableCodes() {
        assertEquals(100, OracleError.NOT_ORACLE.code());
        assertEquals(101, OracleError.INVALID_SUBJECT_ID.code());
        assertEquals(102, OracleError.INVALID_PRICE.code());
        assertEquals(103, OracleError.INSUFFICIENT_ORACLES.code());
        assertEquals(104, OracleError.CONSENSUS_FAILED.code());
        assertEquals(105, OracleError.STALE_DATA.code());
        assertEquals(106, OracleError.ORACLE_NOT_APPROVED.code());
        assertEquals(107, OracleError.MAX_ORACLES_EXCEEDED.code());
        assertEquals(108, OracleError.INVALID_WEIGHT.code());
        assertEquals(109, OracleError.VALUATION_NOT_FOUND.code());
        assertEquals(110, OracleError.INVALID_TIMESTAMP.code());
        assertEquals(111, OracleError.MAX_SUBMISSIONS_EXCEEDED.code());
    }

    @Test
    @DisplayName("failure result carries the code; success carries none")
    void resultCodes() {
        assertEquals(111, OracleResult.failure(OracleError.MAX_SUBMISSIONS_EXCEEDED).errorCode());
        assertNull(OracleResult.success(5L).errorCode());
        assertThrows(NullPointerException.class, () -> OracleResult.failure(null));
    }
}
