package com.dishdash.order.store;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans store change notifications out to subscribers.
 *
 * <p>Each subscription owns a lane: a queue plus at most one running drain task on the
 * shared executor. A slow listener only holds up its own lane, never the publisher or the
 * other subscribers. Notifications that pile up while a lane is busy are handed over as
 * one batch.</p>
 */
@Slf4j
@Component
public class OrderChangeHub {

    private final Executor executor;
    private final Set<Lane> lanes = ConcurrentHashMap.newKeySet();

    public OrderChangeHub(@Qualifier("orderChangeExecutor") Executor executor) {
        this.executor = executor;
    }

    public OrderSubscription subscribe(OrderFilter filter, OrderChangeListener listener) {
        Lane lane = new Lane(filter, listener);
        lanes.add(lane);
        log.debug("Subscription opened: filter={}, active={}", filter, lanes.size());
        return lane;
    }

    /** Never blocks on listeners. */
    public void publish(OrderChange change) {
        for (Lane lane : lanes) {
            lane.offer(change);
        }
    }

    /** Terminates every open subscription with {@code error}. */
    public void failAll(Throwable error) {
        for (Lane lane : lanes) {
            lane.fail(error);
        }
    }

    /** Ends every open subscription with an error; open SSE streams complete as FAILED. */
    @PreDestroy
    public void shutdown() {
        if (!lanes.isEmpty()) {
            log.info("Order change feed shutting down: closing {} subscription(s)", lanes.size());
            failAll(new IllegalStateException("Order change feed is shutting down"));
        }
    }

    public int activeSubscriptions() {
        return lanes.size();
    }

    private final class Lane implements OrderSubscription {

        private final OrderFilter filter;
        private final OrderChangeListener listener;
        private final Queue<OrderChange> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final Object deliveryLock = new Object();

        private Lane(OrderFilter filter, OrderChangeListener listener) {
            this.filter = filter;
            this.listener = listener;
        }

        private void offer(OrderChange change) {
            if (!active.get() || !change.touches(filter)) {
                return;
            }
            pending.add(change);
            schedule();
        }

        private void schedule() {
            if (!scheduled.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                fail(e);
            }
        }

        private void drain() {
            try {
                List<OrderChange> batch = new ArrayList<>();
                OrderChange next;
                while ((next = pending.poll()) != null) {
                    batch.add(next);
                }
                if (!batch.isEmpty()) {
                    deliver(batch);
                }
            } finally {
                scheduled.set(false);
                if (active.get() && !pending.isEmpty()) {
                    schedule();
                }
            }
        }

        private void deliver(List<OrderChange> batch) {
            synchronized (deliveryLock) {
                if (!active.get()) {
                    return;
                }
                try {
                    listener.onChanges(batch);
                } catch (RuntimeException e) {
                    log.error("Subscriber failed while handling {} change(s), filter={}", batch.size(), filter, e);
                }
            }
        }

        private void fail(Throwable error) {
            synchronized (deliveryLock) {
                if (!active.get()) {
                    return;
                }
                cancel();
                try {
                    listener.onError(error);
                } catch (RuntimeException e) {
                    log.error("Subscriber failed while handling subscription error, filter={}", filter, e);
                }
            }
        }

        @Override
        public void cancel() {
            synchronized (deliveryLock) {
                if (active.compareAndSet(true, false)) {
                    lanes.remove(this);
                    pending.clear();
                    log.debug("Subscription cancelled: filter={}, active={}", filter, lanes.size());
                }
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
