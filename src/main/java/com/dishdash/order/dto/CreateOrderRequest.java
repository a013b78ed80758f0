package com.dishdash.order.dto;

import com.dishdash.order.domain.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Checkout payload. Prices are computed server side from the line items and the
 * restaurant rates; client-side totals are never trusted.
 */
public record CreateOrderRequest(
        @NotBlank String restaurantId,
        String customerEmail,
        String customerName,
        @NotEmpty List<@Valid LineItemRequest> items,
        @NotNull @Valid AddressRequest deliveryAddress,
        String deliveryInstructions,
        @NotNull PaymentMethod paymentMethod
) {
}
