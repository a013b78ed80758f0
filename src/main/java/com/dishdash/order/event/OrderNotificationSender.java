package com.dishdash.order.event;

import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;

/**
 * Outbound notification port. Delivery is best effort: implementations may throw,
 * callers never let a failure reach the lifecycle operation that triggered it.
 */
public interface OrderNotificationSender {

    void orderCreated(Order order);

    void statusChanged(Order order, OrderStatus previousStatus);
}
