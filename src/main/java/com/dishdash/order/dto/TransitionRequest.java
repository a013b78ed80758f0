package com.dishdash.order.dto;

import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.TransitionMeta;
import jakarta.validation.constraints.NotNull;

/**
 * @param expectedVersion version the client last saw; when present a newer stored
 *                        version is rejected with CONFLICT
 */
public record TransitionRequest(
        @NotNull OrderStatus status,
        Long expectedVersion,
        String cancelReason,
        String courierName,
        String courierPhone
) {
    public TransitionMeta meta() {
        return cancelReason == null ? TransitionMeta.NONE : TransitionMeta.cancel(cancelReason);
    }
}
