package com.valuationoracle.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifetime submission counter of a single oracle across all subjects.
 * Never decremented.
 */
public record OracleActivity(
    @JsonProperty("submissionCount") int  submissionCount,
    @JsonProperty("lastActive")      long lastActive
) {

    public static OracleActivity first(long now) {
        return new OracleActivity(1, now);
    }

    public OracleActivity next(long now) {
        return new OracleActivity(submissionCount + 1, now);
    }
}
