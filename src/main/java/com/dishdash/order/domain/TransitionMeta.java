package com.dishdash.order.domain;

/**
 * Optional data carried with a transition. Only {@code cancelReason} is read today,
 * and only on the cancel edge.
 */
public record TransitionMeta(String cancelReason) {

    public static final TransitionMeta NONE = new TransitionMeta(null);

    public static TransitionMeta cancel(String reason) {
        return new TransitionMeta(reason);
    }
}
