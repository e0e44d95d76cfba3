package com.valuationoracle.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Latest price observation one oracle made for one subject.
 * A newer observation from the same oracle for the same subject replaces this one.
 */
public record Submission(
    @JsonProperty("subjectId") long   subjectId,
    @JsonProperty("oracleId")  String oracleId,
    @JsonProperty("price")     long   price,
    @JsonProperty("timestamp") long   timestamp
) {}
