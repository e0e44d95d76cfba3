package com.valuationoracle.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.valuationoracle.common.result.OracleResult;

/**
 * Wire form of an {@link OracleResult}: {@code value} on success,
 * {@code errorCode} / {@code error} on failure.
 */
public record OperationResponse<T>(
    @JsonProperty("ok")        boolean ok,
    @JsonProperty("value")     T       value,
    @JsonProperty("errorCode") Integer errorCode,
    @JsonProperty("error")     String  error
) {
    public static <T> OperationResponse<T> from(OracleResult<T> result) {
        return new OperationResponse<>(
            result.ok(),
            result.value(),
            result.errorCode(),
            result.error() == null ? null : result.error().name());
    }
}
