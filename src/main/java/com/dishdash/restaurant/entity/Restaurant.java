package com.dishdash.restaurant.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Restaurant profile as far as the order lifecycle needs it: whether it takes orders,
 * whether it auto-accepts them and how its orders are priced.
 */
@Entity
@Table(name = "restaurants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Restaurant {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String name;

    private boolean active;

    private boolean autoAcceptOrders;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal serviceChargePercent;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal taxPercent;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal deliveryFee;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal minimumOrder;

    private String deliveryTimeEstimate;

    @Builder
    public Restaurant(String id, String name, boolean active, boolean autoAcceptOrders,
                      BigDecimal serviceChargePercent, BigDecimal taxPercent,
                      BigDecimal deliveryFee, BigDecimal minimumOrder, String deliveryTimeEstimate) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.name = name;
        this.active = active;
        this.autoAcceptOrders = autoAcceptOrders;
        this.serviceChargePercent = orZero(serviceChargePercent);
        this.taxPercent = orZero(taxPercent);
        this.deliveryFee = orZero(deliveryFee);
        this.minimumOrder = orZero(minimumOrder);
        this.deliveryTimeEstimate = deliveryTimeEstimate;
    }

    public void changeAutoAccept(boolean enabled) {
        this.autoAcceptOrders = enabled;
    }

    public void changeActive(boolean value) {
        this.active = value;
    }

    public void changeRates(BigDecimal serviceChargePercent, BigDecimal taxPercent,
                            BigDecimal deliveryFee, BigDecimal minimumOrder) {
        this.serviceChargePercent = orZero(serviceChargePercent);
        this.taxPercent = orZero(taxPercent);
        this.deliveryFee = orZero(deliveryFee);
        this.minimumOrder = orZero(minimumOrder);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
