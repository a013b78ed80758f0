package com.dishdash.statistics.service;

import com.dishdash.common.config.DishDashProperties;
import com.dishdash.common.resilience.StoreCallGuard;
import com.dishdash.order.domain.Order;
import com.dishdash.order.store.OrderFilter;
import com.dishdash.order.store.OrderStore;
import com.dishdash.statistics.domain.CustomerOrderStats;
import com.dishdash.statistics.domain.OrderStats;
import com.dishdash.statistics.domain.StatisticsWindows;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Dashboard statistics, recomputed from the full order history on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatisticsService {

    private final OrderStore orderStore;
    private final StoreCallGuard storeCallGuard;
    private final OrderStatisticsAggregator aggregator;
    private final DishDashProperties properties;
    private final Clock clock;

    public OrderStats restaurantStats(String restaurantId) {
        return statsFor(OrderFilter.forRestaurant(restaurantId));
    }

    public OrderStats courierStats(String courierId) {
        return statsFor(OrderFilter.forCourier(courierId));
    }

    public CustomerOrderStats customerStats(String customerId) {
        List<Order> history = storeCallGuard.call("find", () -> orderStore.find(OrderFilter.forCustomer(customerId)));
        log.debug("Aggregating customer statistics: customerId={}, orders={}", customerId, history.size());
        return aggregator.aggregateCustomer(history, LocalDateTime.now(clock));
    }

    private OrderStats statsFor(OrderFilter filter) {
        List<Order> history = storeCallGuard.call("find", () -> orderStore.find(filter));
        DishDashProperties.Statistics settings = properties.getStatistics();
        StatisticsWindows windows = StatisticsWindows.of(LocalDateTime.now(clock), settings.getWeekStart());
        log.debug("Aggregating statistics: filter={}, orders={}", filter, history.size());
        return aggregator.aggregate(history, windows, settings.getPopularItemLimit());
    }
}
