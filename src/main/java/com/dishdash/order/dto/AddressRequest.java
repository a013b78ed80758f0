package com.dishdash.order.dto;

import com.dishdash.order.domain.Address;
import jakarta.validation.constraints.NotBlank;

public record AddressRequest(
        @NotBlank String street,
        @NotBlank String city,
        String state,
        String zipCode,
        String country,
        String label
) {
    public Address toDomain() {
        return new Address(street, city, state, zipCode, country, label);
    }
}
