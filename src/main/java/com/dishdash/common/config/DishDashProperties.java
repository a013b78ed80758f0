package com.dishdash.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;

/**
 * Typed view of the {@code dishdash.*} settings in application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "dishdash")
public class DishDashProperties {

    private Store store = new Store();
    private AutoAccept autoAccept = new AutoAccept();
    private Statistics statistics = new Statistics();
    private Projection projection = new Projection();
    private Notifications notifications = new Notifications();

    @Getter
    @Setter
    public static class Store {
        /** jpa (default) or memory */
        private String type = "jpa";
        /** Threads running store calls under the time limiter. */
        private int callPoolSize = 16;
        private int callQueueCapacity = 200;
    }

    @Getter
    @Setter
    public static class AutoAccept {
        private Duration gracePeriod = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Statistics {
        private DayOfWeek weekStart = DayOfWeek.SUNDAY;
        private int popularItemLimit = 5;
    }

    @Getter
    @Setter
    public static class Projection {
        private int defaultLimit = 50;
        private long sseTimeoutMillis = 0L;
    }

    @Getter
    @Setter
    public static class Notifications {
        private String channel = "order:status";
    }
}
