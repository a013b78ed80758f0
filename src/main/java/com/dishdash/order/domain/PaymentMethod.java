package com.dishdash.order.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentMethod {
    CARD,
    MOBILE_MONEY,
    CASH;

    /** Cash is collected on delivery, every other method is captured up front. */
    public PaymentStatus initialPaymentStatus() {
        return this == CASH ? PaymentStatus.PENDING : PaymentStatus.PAID;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PaymentMethod fromWireName(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
