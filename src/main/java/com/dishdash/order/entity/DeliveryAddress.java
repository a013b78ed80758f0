package com.dishdash.order.entity;

import com.dishdash.order.domain.Address;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryAddress {

    @Column(name = "address_street")
    private String street;

    @Column(name = "address_city")
    private String city;

    @Column(name = "address_state")
    private String state;

    @Column(name = "address_zip_code")
    private String zipCode;

    @Column(name = "address_country")
    private String country;

    @Column(name = "address_label")
    private String label;

    static DeliveryAddress from(Address address) {
        if (address == null) {
            return null;
        }
        DeliveryAddress entity = new DeliveryAddress();
        entity.street = address.street();
        entity.city = address.city();
        entity.state = address.state();
        entity.zipCode = address.zipCode();
        entity.country = address.country();
        entity.label = address.label();
        return entity;
    }

    Address toDomain() {
        return new Address(street, city, state, zipCode, country, label);
    }
}
