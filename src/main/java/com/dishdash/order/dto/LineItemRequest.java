package com.dishdash.order.dto;

import com.dishdash.order.domain.LineItem;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record LineItemRequest(
        String menuItemId,
        @NotBlank String name,
        @NotNull BigDecimal unitPrice,
        int quantity,
        String specialInstructions
) {
    public LineItem toDomain() {
        return new LineItem(menuItemId, name, unitPrice, quantity, null, specialInstructions);
    }
}
