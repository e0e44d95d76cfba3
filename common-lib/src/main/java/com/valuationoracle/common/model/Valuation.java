package com.valuationoracle.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Published consensus valuation of a subject.
 *
 * <ul>
 *   <li>{@code value}       – aggregated price selected from the contributing submissions</li>
 *   <li>{@code timestamp}   – logical time of the computation that produced it</li>
 *   <li>{@code sourceCount} – number of submissions that contributed</li>
 * </ul>
 *
 * No logic, pure model.
 */
public record Valuation(
    @JsonProperty("value")       long value,
    @JsonProperty("timestamp")   long timestamp,
    @JsonProperty("sourceCount") int  sourceCount
) {}
