package com.dishdash.order.store;

import com.dishdash.order.domain.Order;

import java.util.List;
import java.util.Optional;

/**
 * Thin adapter over the order document store.
 *
 * <p>The store is a black box offering append-only create, point reads, conditional
 * (compare-and-swap) updates keyed on the document version, filtered history reads and
 * change subscriptions. Documents are never deleted.</p>
 */
public interface OrderStore {

    /**
     * Appends a new order document. The store assigns the id, the order number and
     * the initial version; the caller's id and version are ignored.
     *
     * @return the assigned id
     */
    String create(Order order);

    Optional<Order> get(String id);

    /**
     * Applies {@code patch} only if the stored version still equals {@code expectedVersion}.
     *
     * @return the stored snapshot after the update, with its version incremented
     * @throws com.dishdash.common.exception.BusinessException CONFLICT when the version moved on,
     *         ORDER_NOT_FOUND when there is no such document
     */
    Order conditionalUpdate(String id, long expectedVersion, OrderPatch patch);

    /** Matching orders, newest first. */
    List<Order> find(OrderFilter filter);

    /**
     * Streams every create/update/delete whose before- or after-image matches {@code filter}
     * to {@code listener} until the returned subscription is cancelled.
     */
    OrderSubscription subscribe(OrderFilter filter, OrderChangeListener listener);
}
