package com.dishdash.order.store;

public interface OrderSubscription {

    /**
     * Stops delivery. When this returns no further listener call will start and any
     * queued notifications have been dropped. Safe to call more than once.
     */
    void cancel();

    boolean isActive();
}
