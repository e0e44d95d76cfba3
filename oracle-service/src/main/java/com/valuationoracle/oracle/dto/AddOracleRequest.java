package com.valuationoracle.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AddOracleRequest(
    @JsonProperty("oracleId") String oracleId,
    @JsonProperty("weight")   int    weight
) {}
