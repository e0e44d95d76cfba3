package com.valuationoracle.common.result;

/**
 * Stable, externally observable failure codes.
 *
 * <p>Codes 100–111 are fixed for compatibility with existing consumers and must never be
 * renumbered. Codes from 112 upward cover admin failures that need to be told apart.
 */
public enum OracleError {
    NOT_ORACLE(100),
    INVALID_SUBJECT_ID(101),
    INVALID_PRICE(102),
    INSUFFICIENT_ORACLES(103),
    CONSENSUS_FAILED(104),
    STALE_DATA(105),
    ORACLE_NOT_APPROVED(106),
    MAX_ORACLES_EXCEEDED(107),
    INVALID_WEIGHT(108),
    VALUATION_NOT_FOUND(109),
    INVALID_TIMESTAMP(110),
    MAX_SUBMISSIONS_EXCEEDED(111),
    NOT_ADMIN(112),
    ORACLE_ALREADY_APPROVED(113),
    INVALID_SETTING(114);

    private final int code;

    OracleError(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Consensus failures are raised after the submission was recorded; only the
     * valuation publication was skipped.
     */
    public boolean isConsensusFailure() {
        return this == INSUFFICIENT_ORACLES || this == CONSENSUS_FAILED;
    }
}
