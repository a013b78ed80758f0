package com.dishdash.projection;

import com.dishdash.order.domain.Order;

import java.util.List;

/**
 * One published state of a projection.
 *
 * @param revision increases by one with every publication of the same projection
 * @param error    set only when {@code state} is FAILED
 */
public record ProjectionView(String name, List<Order> orders, long revision, State state, String error) {

    public enum State {
        LIVE,
        FAILED
    }

    public boolean isLive() {
        return state == State.LIVE;
    }
}
