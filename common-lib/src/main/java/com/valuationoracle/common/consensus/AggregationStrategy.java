package com.valuationoracle.common.consensus;

import java.util.List;

/**
 * Strategy contract for collapsing the contributing prices of a subject into the single
 * published value.
 *
 * <p>Implementations must be stateless, free of side effects and deterministic: the same
 * set of contributions must always yield the same value regardless of list order.
 *
 * <p>Current implementation: {@link UpperMedianAggregationStrategy}.
 */
public interface AggregationStrategy {

    /**
     * @param contributions non-null, non-empty list; quorum has already been checked
     * @return the aggregated price
     */
    long aggregate(List<ContributingPrice> contributions);
}
