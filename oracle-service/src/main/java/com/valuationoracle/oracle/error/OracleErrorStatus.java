package com.valuationoracle.oracle.error;

import com.valuationoracle.common.result.OracleError;
import com.valuationoracle.common.result.OracleResult;
import org.springframework.http.HttpStatus;

/**
 * Maps oracle error codes onto HTTP statuses.
 *
 * <p>Consensus failures map to {@code 202 Accepted}: the submission was recorded, only the
 * valuation was not (re)published.
 */
public final class OracleErrorStatus {

    private OracleErrorStatus() {}

    public static HttpStatus of(OracleResult<?> result) {
        return result.ok() ? HttpStatus.OK : of(result.error());
    }

    public static HttpStatus of(OracleError error) {
        return switch (error) {
            case NOT_ORACLE, NOT_ADMIN, ORACLE_NOT_APPROVED       -> HttpStatus.FORBIDDEN;
            case INVALID_SUBJECT_ID, INVALID_PRICE, INVALID_WEIGHT,
                 INVALID_SETTING, INVALID_TIMESTAMP                -> HttpStatus.BAD_REQUEST;
            case ORACLE_ALREADY_APPROVED, MAX_ORACLES_EXCEEDED     -> HttpStatus.CONFLICT;
            case MAX_SUBMISSIONS_EXCEEDED                          -> HttpStatus.TOO_MANY_REQUESTS;
            case STALE_DATA                                        -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INSUFFICIENT_ORACLES, CONSENSUS_FAILED            -> HttpStatus.ACCEPTED;
            case VALUATION_NOT_FOUND                               -> HttpStatus.NOT_FOUND;
        };
    }
}
