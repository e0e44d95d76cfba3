package com.valuationoracle.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OracleWeightResponse(
    @JsonProperty("oracleId") String oracleId,
    @JsonProperty("weight")   int    weight
) {}
