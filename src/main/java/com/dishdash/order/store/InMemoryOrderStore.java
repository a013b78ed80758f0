package com.dishdash.order.store;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.domain.Order;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Order store kept in process memory. Conditional updates are a compare-and-swap on the
 * document version inside {@link ConcurrentHashMap#computeIfPresent}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "dishdash.store", name = "type", havingValue = "memory")
public class InMemoryOrderStore implements OrderStore {

    static final Comparator<Order> NEWEST_FIRST = Comparator
            .comparing(Order::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Order::getId);

    private final Map<String, Order> documents = new ConcurrentHashMap<>();
    private final OrderChangeHub changeHub;

    @Override
    public String create(Order order) {
        String id = UUID.randomUUID().toString();
        Order stored = order.toBuilder()
                .id(id)
                .orderNumber(Order.orderNumberFor(id))
                .version(0L)
                .build();
        documents.put(id, stored);
        log.debug("Order document created: id={}", id);
        changeHub.publish(OrderChange.created(stored));
        return id;
    }

    @Override
    public Optional<Order> get(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public Order conditionalUpdate(String id, long expectedVersion, OrderPatch patch) {
        AtomicReference<Order> before = new AtomicReference<>();
        Order after = documents.computeIfPresent(id, (key, current) -> {
            if (current.getVersion() != expectedVersion) {
                throw new BusinessException(ErrorCode.CONFLICT,
                        "Order " + id + " is at version " + current.getVersion()
                                + ", expected " + expectedVersion);
            }
            before.set(current);
            return patch.apply(current).toBuilder()
                    .id(current.getId())
                    .version(current.getVersion() + 1)
                    .build();
        });
        if (after == null) {
            throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
        }
        changeHub.publish(OrderChange.updated(before.get(), after));
        return after;
    }

    @Override
    public List<Order> find(OrderFilter filter) {
        return documents.values().stream()
                .filter(filter)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public OrderSubscription subscribe(OrderFilter filter, OrderChangeListener listener) {
        return changeHub.subscribe(filter, listener);
    }
}
