package com.valuationoracle.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.valuationoracle.common.result.OracleError;

import java.time.Instant;

public record ErrorResponse(
    @JsonProperty("errorCode") int     errorCode,
    @JsonProperty("error")     String  error,
    @JsonProperty("message")   String  message,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static ErrorResponse of(OracleError error, String message) {
        return new ErrorResponse(error.code(), error.name(), message, Instant.now());
    }
}
