package com.valuationoracle.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Price observation posted by an oracle. {@code oracleId} must match the caller identity.
 */
public record SubmissionRequest(
    @JsonProperty("subjectId") long   subjectId,
    @JsonProperty("price")     long   price,
    @JsonProperty("oracleId")  String oracleId
) {}
