package com.dishdash.order.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActorRole {
    CUSTOMER,
    RESTAURANT,
    COURIER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ActorRole fromWireName(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
