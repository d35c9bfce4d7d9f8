package com.shopstream.pageviews.join;

import com.shopstream.pageviews.model.SaleEvent;

import java.util.List;
import java.util.Optional;

/**
 * Picks the sale a view is attributed to: the most recent sale of the product whose event
 * time is at most {@code view event time + match window}.  On equal event times the sale
 * that arrived last wins.
 */
final class SaleMatcher {

    private SaleMatcher() {
    }

    /**
     * @param sales         sales of the product, in arrival order
     * @param matchWindowMs {@code null} for no upper bound
     */
    static Optional<SaleEvent> mostRecentSale(List<SaleEvent> sales, long viewEventTime, Long matchWindowMs) {
        long limit = matchWindowMs == null ? Long.MAX_VALUE : saturatedAdd(viewEventTime, matchWindowMs);
        SaleEvent best = null;
        for (SaleEvent sale : sales) {
            if (sale.getEventTime() <= limit && (best == null || sale.getEventTime() >= best.getEventTime())) {
                best = sale;
            }
        }
        return Optional.ofNullable(best);
    }

    static long saturatedAdd(long value, long delta) {
        long result = value + delta;
        if (delta > 0 && result < value) {
            return Long.MAX_VALUE;
        }
        if (delta < 0 && result > value) {
            return Long.MIN_VALUE;
        }
        return result;
    }
}
