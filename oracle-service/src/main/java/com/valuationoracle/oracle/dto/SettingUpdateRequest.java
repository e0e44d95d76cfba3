package com.valuationoracle.oracle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SettingUpdateRequest(
    @JsonProperty("value") long value
) {}
