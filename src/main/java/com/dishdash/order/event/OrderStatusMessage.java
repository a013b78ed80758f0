package com.dishdash.order.event;

import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;

import java.time.LocalDateTime;

/**
 * Payload published on the order status channel.
 */
public record OrderStatusMessage(
        String orderId,
        String orderNumber,
        String restaurantId,
        String customerId,
        String courierId,
        OrderStatus previousStatus,
        OrderStatus status,
        String statusText,
        long version,
        LocalDateTime timestamp
) {
    public static OrderStatusMessage of(Order order, OrderStatus previousStatus) {
        return new OrderStatusMessage(
                order.getId(),
                order.getOrderNumber(),
                order.getRestaurantId(),
                order.getCustomerId(),
                order.getCourierId(),
                previousStatus,
                order.getStatus(),
                order.getStatus().displayText(),
                order.getVersion(),
                order.getUpdatedAt());
    }
}
