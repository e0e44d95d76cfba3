package com.valuationoracle.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An approved data source and the trust weight it was admitted with.
 * Weight is in [1, 100]; an oracle outside the approved set has no weight at all.
 */
public record Oracle(
    @JsonProperty("oracleId") String oracleId,
    @JsonProperty("weight")   int    weight
) {}
