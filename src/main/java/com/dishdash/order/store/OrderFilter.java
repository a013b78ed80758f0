package com.dishdash.order.store;

import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import lombok.Builder;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Predicate over order documents used both for history reads and subscriptions.
 * Unset fields do not constrain.
 *
 * @param unassignedOnly when true only orders without a courier match
 */
@Builder(toBuilder = true)
public record OrderFilter(
        String restaurantId,
        String customerId,
        String courierId,
        Set<OrderStatus> statuses,
        boolean unassignedOnly
) implements Predicate<Order> {

    public static final OrderFilter ALL = OrderFilter.builder().build();

    public static OrderFilter forRestaurant(String restaurantId) {
        return OrderFilter.builder().restaurantId(restaurantId).build();
    }

    public static OrderFilter forCustomer(String customerId) {
        return OrderFilter.builder().customerId(customerId).build();
    }

    public static OrderFilter forCourier(String courierId) {
        return OrderFilter.builder().courierId(courierId).build();
    }

    public static OrderFilter awaitingCourier() {
        return OrderFilter.builder()
                .statuses(Set.of(OrderStatus.READY_FOR_PICKUP))
                .unassignedOnly(true)
                .build();
    }

    public OrderFilter withStatuses(Set<OrderStatus> value) {
        return toBuilder().statuses(value).build();
    }

    @Override
    public boolean test(Order order) {
        if (order == null) {
            return false;
        }
        if (restaurantId != null && !restaurantId.equals(order.getRestaurantId())) {
            return false;
        }
        if (customerId != null && !customerId.equals(order.getCustomerId())) {
            return false;
        }
        if (courierId != null && !courierId.equals(order.getCourierId())) {
            return false;
        }
        if (unassignedOnly && order.hasCourier()) {
            return false;
        }
        return statuses == null || statuses.isEmpty() || statuses.contains(order.getStatus());
    }
}
