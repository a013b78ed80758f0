package com.dishdash.order.domain;

public record Address(
        String street,
        String city,
        String state,
        String zipCode,
        String country,
        String label
) {
}
