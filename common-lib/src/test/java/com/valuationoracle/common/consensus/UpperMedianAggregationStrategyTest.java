package com.valuationoracle.common.consensus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpperMedianAggregationStrategyTest {

    private final AggregationStrategy strategy = new UpperMedianAggregationStrategy();

    private static ContributingPrice price(long value, int weight) {
        return new ContributingPrice("oracle-" + value, value, weight);
    }

    @Test
    @DisplayName("odd count → middle element of the sorted prices")
    void oddCount() {
        assertEquals(500_000, strategy.aggregate(List.of(
            price(500_000, 50), price(520_000, 30), price(480_000, 20))));
    }

    @Test
    @DisplayName("even count → upper-middle element, never an average")
    void evenCount() {
        assertEquals(300, strategy.aggregate(List.of(
            price(400, 1), price(100, 1), price(300, 1), price(200, 1))));
    }

    @Test
    @DisplayName("weights do not move the selected element")
    void weightsIgnored() {
        assertEquals(20, strategy.aggregate(List.of(
            price(10, 100), price(20, 1), price(30, 1))));
    }

    @Test
    @DisplayName("single contribution → itself")
    void singleContribution() {
        assertEquals(42, strategy.aggregate(List.of(price(42, 7))));
    }

    @Test
    @DisplayName("input order does not matter")
    void orderIndependent() {
        List<ContributingPrice> a = List.of(price(3, 1), price(1, 1), price(2, 1), price(5, 1), price(4, 1));
        List<ContributingPrice> b = List.of(price(5, 1), price(4, 1), price(3, 1), price(2, 1), price(1, 1));

        assertEquals(strategy.aggregate(a), strategy.aggregate(b));
    }

    @Test
    @DisplayName("empty contribution set is rejected")
    void emptyRejected() {
        assertThrows(IllegalArgumentException.class, () -> strategy.aggregate(List.of()));
    }
}
