package com.dishdash.order.domain;

import java.util.Objects;

/**
 * The party asking for a change: a customer, a restaurant (human operator or the
 * auto-accept actor acting on its behalf) or a courier.
 */
public record Actor(ActorRole role, String id, String name, String phone) {

    public Actor {
        Objects.requireNonNull(role, "role");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Actor id is required");
        }
    }

    public static Actor customer(String customerId) {
        return new Actor(ActorRole.CUSTOMER, customerId, null, null);
    }

    public static Actor restaurant(String restaurantId) {
        return new Actor(ActorRole.RESTAURANT, restaurantId, null, null);
    }

    public static Actor courier(String courierId, String name, String phone) {
        return new Actor(ActorRole.COURIER, courierId, name, phone);
    }

    public boolean is(ActorRole expected) {
        return role == expected;
    }
}
