package com.dishdash.statistics.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order summary shown on a customer's profile.
 *
 * @param pendingOrders      orders not yet delivered or cancelled
 * @param totalSpent         sum of the totals of delivered orders
 * @param favoriteRestaurant restaurant ordered from most often; null without history
 * @param mostRecentOrderAt  creation time of the newest order; null without history
 */
public record CustomerOrderStats(
        LocalDateTime generatedAt,
        long totalOrders,
        long completedOrders,
        long cancelledOrders,
        long pendingOrders,
        BigDecimal totalSpent,
        FavoriteRestaurant favoriteRestaurant,
        LocalDateTime mostRecentOrderAt
) {
}
