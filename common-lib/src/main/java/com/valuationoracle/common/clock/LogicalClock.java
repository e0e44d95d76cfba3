package com.valuationoracle.common.clock;

/**
 * Source of the logical time used to stamp submissions, activity and valuations.
 * Implementations must be monotonic non-decreasing.
 */
@FunctionalInterface
public interface LogicalClock {

    long now();
}
