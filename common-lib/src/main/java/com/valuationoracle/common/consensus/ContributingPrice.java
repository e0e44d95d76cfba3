package com.valuationoracle.common.consensus;

/**
 * One approved oracle's latest price for a subject, paired with its current weight.
 */
public record ContributingPrice(
    String oracleId,
    long   price,
    int    weight
) {}
