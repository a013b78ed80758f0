package com.dishdash.statistics.domain;

import java.math.BigDecimal;

/**
 * Metrics for one time window.
 *
 * @param revenue          total of delivered and paid orders
 * @param completionRate   delivered / orderCount, 0 for an empty window
 * @param averageOrderValue revenue / deliveredCount, 0 when nothing was delivered
 * @param deliveryFees     delivery fees of delivered orders
 */
public record WindowStats(
        long orderCount,
        long deliveredCount,
        long cancelledCount,
        BigDecimal revenue,
        BigDecimal completionRate,
        BigDecimal averageOrderValue,
        BigDecimal averageRating,
        long ratingCount,
        BigDecimal deliveryFees
) {
}
