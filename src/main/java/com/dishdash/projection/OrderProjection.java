package com.dishdash.projection;

import com.dishdash.order.domain.Order;
import com.dishdash.order.store.ChangeType;
import com.dishdash.order.store.OrderChange;
import com.dishdash.order.store.OrderChangeListener;
import com.dishdash.order.store.OrderFilter;
import com.dishdash.order.store.OrderSubscription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Live, filtered and ordered view over the order store for one viewer.
 *
 * <p>Each document is held at the highest version seen so far, so a late or replayed
 * notification can never move the view backwards. Versions are tracked for visible
 * documents; documents that left the view keep their last version in a bounded
 * most-recent map, so a view over an open-ended feed such as the pickup board does not
 * grow with every order it ever showed. All notifications that queued up
 * while the previous batch was being handled are folded into a single recomputation
 * and publication. A subscription error moves the projection to FAILED for good; a
 * fresh projection has to be opened to recover.</p>
 */
@Slf4j
public class OrderProjection implements OrderChangeListener {

    static final Comparator<Order> NEWEST_FIRST = Comparator
            .comparing(Order::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Order::getId);

    private final String name;
    private final OrderFilter filter;
    private final Integer limit;
    private final List<Consumer<ProjectionView>> listeners = new CopyOnWriteArrayList<>();

    static final int RETIRED_CAPACITY = 1024;

    private final Map<String, Long> seenVersions = new HashMap<>();
    private final Map<String, Long> retiredVersions = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
            return size() > RETIRED_CAPACITY;
        }
    };
    private final Map<String, Order> visible = new HashMap<>();
    private long revision;
    private boolean failed;
    private volatile ProjectionView current;
    private volatile OrderSubscription subscription;

    public OrderProjection(String name, OrderFilter filter, Integer limit) {
        this.name = name;
        this.filter = filter;
        this.limit = limit;
        this.current = new ProjectionView(name, List.of(), 0, ProjectionView.State.LIVE, null);
    }

    public String getName() {
        return name;
    }

    public OrderFilter getFilter() {
        return filter;
    }

    public Integer getLimit() {
        return limit;
    }

    public ProjectionView current() {
        return current;
    }

    /** Registers a listener and immediately hands it the current view. */
    public void addListener(Consumer<ProjectionView> listener) {
        listeners.add(listener);
        notify(listener, current);
    }

    public void removeListener(Consumer<ProjectionView> listener) {
        listeners.remove(listener);
    }

    void attach(OrderSubscription value) {
        this.subscription = value;
    }

    /** Loads the initial history. Documents the subscription already delivered at a newer version win. */
    synchronized void seed(Collection<Order> orders) {
        if (failed) {
            return;
        }
        orders.forEach(this::merge);
        recomputeAndPublish();
    }

    @Override
    public void onChange(OrderChange change) {
        onChanges(List.of(change));
    }

    @Override
    public synchronized void onChanges(List<OrderChange> changes) {
        if (failed) {
            return;
        }
        boolean dirty = false;
        for (OrderChange change : changes) {
            dirty |= apply(change);
        }
        if (dirty) {
            recomputeAndPublish();
        }
    }

    @Override
    public synchronized void onError(Throwable error) {
        if (failed) {
            return;
        }
        failed = true;
        log.warn("Projection failed: name={}, cause={}", name, error.getMessage());
        publish(new ProjectionView(name, current.orders(), ++revision, ProjectionView.State.FAILED,
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName()));
    }

    public boolean isFailed() {
        return current.state() == ProjectionView.State.FAILED;
    }

    /** Stops receiving changes. Listeners keep the last published view. */
    public void close() {
        OrderSubscription active = subscription;
        if (active != null) {
            active.cancel();
        }
    }

    private boolean apply(OrderChange change) {
        if (change.type() == ChangeType.DELETED) {
            Order previous = change.previous();
            if (isStale(previous.getId(), previous.getVersion())) {
                return false;
            }
            return retire(previous.getId(), previous.getVersion());
        }
        return merge(change.current());
    }

    private boolean merge(Order order) {
        if (isStale(order.getId(), order.getVersion())) {
            return false;
        }
        if (filter.test(order)) {
            retiredVersions.remove(order.getId());
            seenVersions.put(order.getId(), order.getVersion());
            visible.put(order.getId(), order);
            return true;
        }
        return retire(order.getId(), order.getVersion());
    }

    private boolean retire(String id, long version) {
        seenVersions.remove(id);
        retiredVersions.remove(id);
        retiredVersions.put(id, version);
        return visible.remove(id) != null;
    }

    private boolean isStale(String id, long version) {
        Long seen = seenVersions.get(id);
        if (seen == null) {
            seen = retiredVersions.get(id);
        }
        return seen != null && seen >= version;
    }

    synchronized int trackedVersionCount() {
        return seenVersions.size() + retiredVersions.size();
    }

    private void recomputeAndPublish() {
        List<Order> ordered = new ArrayList<>(visible.values());
        ordered.sort(NEWEST_FIRST);
        if (limit != null && limit > 0 && ordered.size() > limit) {
            ordered = ordered.subList(0, limit);
        }
        publish(new ProjectionView(name, List.copyOf(ordered), ++revision, ProjectionView.State.LIVE, null));
    }

    private void publish(ProjectionView view) {
        current = view;
        for (Consumer<ProjectionView> listener : listeners) {
            notify(listener, view);
        }
    }

    private void notify(Consumer<ProjectionView> listener, ProjectionView view) {
        try {
            listener.accept(view);
        } catch (RuntimeException e) {
            log.warn("Projection listener failed: name={}, revision={}, cause={}",
                    name, view.revision(), e.getMessage());
        }
    }
}
