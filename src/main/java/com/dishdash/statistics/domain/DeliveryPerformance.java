package com.dishdash.statistics.domain;

import java.math.BigDecimal;

/**
 * Courier timing over delivered orders that carry both pickup and delivery timestamps.
 *
 * @param onTimeRate share of those deliveries completed within the estimate plus ten minutes
 */
public record DeliveryPerformance(
        long measuredDeliveries,
        BigDecimal averageDeliveryMinutes,
        BigDecimal onTimeRate
) {
}
