package com.dishdash.order.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Order lifecycle status. The transition table below is the only place that
 * decides which moves are legal.
 *
 * <pre>
 * PLACED → CONFIRMED → PREPARING → READY_FOR_PICKUP → PICKED_UP → ON_THE_WAY → DELIVERED
 *    └──────────┴───────────┴──→ CANCELLED
 * </pre>
 *
 * Once the courier holds the goods (PICKED_UP onwards) the order can no longer be cancelled.
 */
public enum OrderStatus {
    PLACED("placed", "Order Placed"),
    CONFIRMED("confirmed", "Order Confirmed"),
    PREPARING("preparing", "Being Prepared"),
    READY_FOR_PICKUP("ready_for_pickup", "Ready for Pickup"),
    PICKED_UP("picked_up", "Picked Up"),
    ON_THE_WAY("on_the_way", "On the Way"),
    DELIVERED("delivered", "Delivered"),
    CANCELLED("cancelled", "Cancelled");

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PLACED, EnumSet.of(CONFIRMED, CANCELLED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(PREPARING, CANCELLED));
        TRANSITIONS.put(PREPARING, EnumSet.of(READY_FOR_PICKUP, CANCELLED));
        TRANSITIONS.put(READY_FOR_PICKUP, EnumSet.of(PICKED_UP));
        TRANSITIONS.put(PICKED_UP, EnumSet.of(ON_THE_WAY));
        TRANSITIONS.put(ON_THE_WAY, EnumSet.of(DELIVERED));
        TRANSITIONS.put(DELIVERED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
    }

    private final String wireName;
    private final String displayText;

    OrderStatus(String wireName, String displayText) {
        this.wireName = wireName;
        this.displayText = displayText;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayText() {
        return displayText;
    }

    public Set<OrderStatus> allowedNext() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /** True for PICKED_UP and later delivery states: a courier holds the goods. */
    public boolean isWithCourier() {
        return this == PICKED_UP || this == ON_THE_WAY || this == DELIVERED;
    }

    @JsonCreator
    public static OrderStatus fromWireName(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
