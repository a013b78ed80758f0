package com.dishdash.restaurant.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record RatesRequest(
        @NotNull @DecimalMin("0") BigDecimal serviceChargePercent,
        @NotNull @DecimalMin("0") BigDecimal taxPercent,
        @NotNull @DecimalMin("0") BigDecimal deliveryFee,
        @NotNull @DecimalMin("0") BigDecimal minimumOrder
) {
}
