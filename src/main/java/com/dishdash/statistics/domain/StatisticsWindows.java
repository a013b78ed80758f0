package com.dishdash.statistics.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Window start boundaries derived from one reference instant. A window holds every
 * order created at or after its start; ALL_TIME holds every order.
 */
public record StatisticsWindows(
        LocalDateTime now,
        LocalDateTime todayStart,
        LocalDateTime weekStart,
        LocalDateTime monthStart
) {
    public static StatisticsWindows of(LocalDateTime now, DayOfWeek firstDayOfWeek) {
        LocalDate today = now.toLocalDate();
        return new StatisticsWindows(
                now,
                today.atStartOfDay(),
                today.with(TemporalAdjusters.previousOrSame(firstDayOfWeek)).atStartOfDay(),
                today.withDayOfMonth(1).atStartOfDay());
    }

    public boolean contains(StatisticsWindow window, LocalDateTime createdAt) {
        if (window == StatisticsWindow.ALL_TIME) {
            return true;
        }
        if (createdAt == null) {
            return false;
        }
        LocalDateTime start = switch (window) {
            case TODAY -> todayStart;
            case THIS_WEEK -> weekStart;
            case THIS_MONTH -> monthStart;
            case ALL_TIME -> throw new IllegalStateException();
        };
        return !createdAt.isBefore(start);
    }
}
