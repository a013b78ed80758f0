package com.dishdash.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the order lifecycle.
 *
 * <ul>
 *   <li>orderChangeExecutor: delivers store change notifications, one serial lane per subscription</li>
 *   <li>storeCallExecutor: runs store calls under the time limiter</li>
 *   <li>notificationExecutor: fire-and-forget notification dispatch</li>
 *   <li>autoAcceptScheduler: grace-delay timers of the auto-accept actor</li>
 * </ul>
 */
@Configuration
public class AsyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orderChangeExecutor() {
        return Executors.newCachedThreadPool(daemonFactory("order-change-"));
    }

    /** Fixed size with a bounded queue; a full pool rejects and the guard reports UNAVAILABLE. */
    @Bean
    public ThreadPoolTaskExecutor storeCallExecutor(DishDashProperties properties) {
        DishDashProperties.Store store = properties.getStore();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(store.getCallPoolSize());
        executor.setMaxPoolSize(store.getCallPoolSize());
        executor.setQueueCapacity(store.getCallQueueCapacity());
        executor.setThreadNamePrefix("order-store-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("order-notify-");
        executor.initialize();
        return executor;
    }

    @Bean
    public TaskScheduler autoAcceptScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("auto-accept-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
