package com.valuationoracle.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConfigurationSnapshot(
    @JsonProperty("adminId")                 String adminId,
    @JsonProperty("maxOracles")              int    maxOracles,
    @JsonProperty("consensusThreshold")      int    consensusThreshold,
    @JsonProperty("maxSubmissionsPerOracle") int    maxSubmissionsPerOracle,
    @JsonProperty("stalenessWindow")         long   stalenessWindow
) {}
