package com.dishdash.order.dto;

import com.dishdash.order.domain.PaymentStatus;
import jakarta.validation.constraints.NotNull;

public record PaymentStatusRequest(@NotNull PaymentStatus paymentStatus, Long expectedVersion) {
}
