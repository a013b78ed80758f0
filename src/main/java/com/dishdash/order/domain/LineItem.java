package com.dishdash.order.domain;

import java.math.BigDecimal;

/**
 * One priced line of an order. {@code subtotal} is filled in by the pricing engine.
 */
public record LineItem(
        String menuItemId,
        String name,
        BigDecimal unitPrice,
        int quantity,
        BigDecimal subtotal,
        String specialInstructions
) {
    public static LineItem of(String name, BigDecimal unitPrice, int quantity) {
        return new LineItem(null, name, unitPrice, quantity, null, null);
    }

    public LineItem withSubtotal(BigDecimal value) {
        return new LineItem(menuItemId, name, unitPrice, quantity, value, specialInstructions);
    }

    public boolean hasSpecialInstructions() {
        return specialInstructions != null && !specialInstructions.isBlank();
    }
}
