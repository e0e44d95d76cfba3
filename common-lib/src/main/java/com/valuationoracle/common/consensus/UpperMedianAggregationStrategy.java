package com.valuationoracle.common.consensus;

import java.util.List;

/**
 * Median of the contributing prices.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Sort prices ascending.</li>
 *   <li>Take the element at index {@code floor(n / 2)}.</li>
 * </ol>
 *
 * <p>For even {@code n} this is the upper of the two middle elements; the pair is never
 * averaged, so the result is always a price some oracle actually submitted. Weights do
 * not move the selected element.
 *
 * <p>This class is stateless and thread-safe.
 */
public class UpperMedianAggregationStrategy implements AggregationStrategy {

    @Override
    public long aggregate(List<ContributingPrice> contributions) {
        if (contributions == null || contributions.isEmpty()) {
            throw new IllegalArgumentException("cannot aggregate an empty contribution set");
        }
        long[] prices = contributions.stream()
            .mapToLong(ContributingPrice::price)
            .sorted()
            .toArray();
        return prices[prices.length / 2];
    }
}
