package com.dishdash.order.store;

import java.util.List;

/**
 * Receives store change notifications for one subscription. Calls for a single
 * subscription never overlap.
 */
public interface OrderChangeListener {

    void onChange(OrderChange change);

    /**
     * Delivers every notification that queued up while the previous delivery was running.
     * Listeners that can coalesce work override this.
     */
    default void onChanges(List<OrderChange> changes) {
        changes.forEach(this::onChange);
    }

    /** The subscription failed and has been cancelled; no further calls follow. */
    void onError(Throwable error);
}
