package com.dishdash.order.store;

import com.dishdash.order.domain.Order;

/**
 * Pure function from the currently stored snapshot to its replacement. The store keeps
 * the id and assigns the version itself.
 */
@FunctionalInterface
public interface OrderPatch {

    Order apply(Order current);
}
