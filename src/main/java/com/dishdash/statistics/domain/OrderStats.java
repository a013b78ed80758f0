package com.dishdash.statistics.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record OrderStats(
        LocalDateTime generatedAt,
        Map<StatisticsWindow, WindowStats> windows,
        long pendingCount,
        List<PopularItem> popularItems,
        DeliveryPerformance deliveryPerformance
) {
    public WindowStats window(StatisticsWindow window) {
        return windows.get(window);
    }
}
