package com.dishdash.projection;

import com.dishdash.common.config.DishDashProperties;
import com.dishdash.common.resilience.StoreCallGuard;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.store.OrderFilter;
import com.dishdash.order.store.OrderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Opens projections for the predefined viewers.
 *
 * <p>The subscription is opened before the history read so nothing that happens in
 * between is lost; the projection's version check drops whatever arrives twice.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderProjectionService {

    private static final Set<OrderStatus> WITH_COURIER = EnumSet.of(OrderStatus.PICKED_UP, OrderStatus.ON_THE_WAY);

    private final OrderStore orderStore;
    private final StoreCallGuard storeCallGuard;
    private final DishDashProperties properties;

    /** Every order of the restaurant, newest first. */
    public OrderProjection restaurantBoard(String restaurantId) {
        return open("restaurant-board:" + restaurantId, OrderFilter.forRestaurant(restaurantId), defaultLimit());
    }

    /** Orders still waiting for the restaurant to confirm them. */
    public OrderProjection restaurantPending(String restaurantId) {
        return open("restaurant-pending:" + restaurantId,
                OrderFilter.forRestaurant(restaurantId).withStatuses(Set.of(OrderStatus.PLACED)), null);
    }

    /** Ready orders no courier has claimed yet, across all restaurants. */
    public OrderProjection courierPickupBoard() {
        return open("courier-pickup-board", OrderFilter.awaitingCourier(), defaultLimit());
    }

    public OrderProjection courierDeliveries(String courierId) {
        return open("courier-deliveries:" + courierId,
                OrderFilter.forCourier(courierId).withStatuses(WITH_COURIER), null);
    }

    public OrderProjection customerOrders(String customerId) {
        return open("customer-orders:" + customerId, OrderFilter.forCustomer(customerId), defaultLimit());
    }

    /** Closes {@code projection} and opens a fresh one with the same definition. */
    public OrderProjection reopen(OrderProjection projection) {
        projection.close();
        log.info("Reopening projection: name={}", projection.getName());
        return open(projection.getName(), projection.getFilter(), projection.getLimit());
    }

    public OrderProjection open(String name, OrderFilter filter, Integer limit) {
        OrderProjection projection = new OrderProjection(name, filter, limit);
        projection.attach(orderStore.subscribe(filter, projection));
        try {
            projection.seed(storeCallGuard.call("find", () -> orderStore.find(filter)));
        } catch (RuntimeException e) {
            projection.close();
            throw e;
        }
        log.debug("Projection opened: name={}, size={}", name, projection.current().orders().size());
        return projection;
    }

    private Integer defaultLimit() {
        int limit = properties.getProjection().getDefaultLimit();
        return limit > 0 ? limit : null;
    }
}
