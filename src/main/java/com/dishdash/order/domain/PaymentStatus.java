package com.dishdash.order.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Payment axis, independent of {@link OrderStatus}. Capture itself happens outside this service.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PaymentStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
