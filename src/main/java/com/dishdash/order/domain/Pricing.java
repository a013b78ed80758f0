package com.dishdash.order.domain;

import java.math.BigDecimal;

/**
 * Derived order totals. {@code total} is always the sum of the four components.
 */
public record Pricing(
        BigDecimal subtotal,
        BigDecimal serviceCharge,
        BigDecimal tax,
        BigDecimal deliveryFee,
        BigDecimal total
) {
    public static Pricing of(BigDecimal subtotal, BigDecimal serviceCharge,
                             BigDecimal tax, BigDecimal deliveryFee) {
        return new Pricing(subtotal, serviceCharge, tax, deliveryFee,
                subtotal.add(serviceCharge).add(tax).add(deliveryFee));
    }
}
