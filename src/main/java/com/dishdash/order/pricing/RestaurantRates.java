package com.dishdash.order.pricing;

import java.math.BigDecimal;

/**
 * Pricing inputs taken from the restaurant profile. Percentages are expressed as
 * whole numbers, so {@code 10} means ten percent.
 */
public record RestaurantRates(
        BigDecimal serviceChargePercent,
        BigDecimal taxPercent,
        BigDecimal deliveryFee,
        BigDecimal minimumOrder,
        String deliveryTimeEstimate
) {
    public static RestaurantRates of(String serviceChargePercent, String taxPercent,
                                     String deliveryFee, String minimumOrder) {
        return new RestaurantRates(new BigDecimal(serviceChargePercent), new BigDecimal(taxPercent),
                new BigDecimal(deliveryFee), new BigDecimal(minimumOrder), null);
    }
}
