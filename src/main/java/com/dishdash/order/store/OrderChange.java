package com.dishdash.order.store;

import com.dishdash.order.domain.Order;

/**
 * One store change notification carrying the before- and after-image of the document.
 * {@code previous} is null for CREATED, {@code current} is null for DELETED.
 */
public record OrderChange(ChangeType type, Order previous, Order current) {

    public static OrderChange created(Order order) {
        return new OrderChange(ChangeType.CREATED, null, order);
    }

    public static OrderChange updated(Order previous, Order current) {
        return new OrderChange(ChangeType.UPDATED, previous, current);
    }

    public static OrderChange deleted(Order previous) {
        return new OrderChange(ChangeType.DELETED, previous, null);
    }

    public String orderId() {
        return current != null ? current.getId() : previous.getId();
    }

    /** Version of the newest image this change carries. */
    public long version() {
        return current != null ? current.getVersion() : previous.getVersion();
    }

    public boolean touches(OrderFilter filter) {
        return filter.test(current) || filter.test(previous);
    }
}
