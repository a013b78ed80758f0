package com.dishdash.order.store;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.domain.Order;
import com.dishdash.order.entity.OrderEntity;
import com.dishdash.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order store on a relational database through Spring Data JPA.
 *
 * <p>Conditional updates rely on the entity {@code @Version}: the expected version is
 * checked on read, and a writer that raced past that check still loses at flush because
 * the UPDATE carries {@code WHERE version = ?}. Change notifications are published as
 * application events and only reach subscribers after the transaction commits
 * (see {@link OrderChangeRelay}).</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
@ConditionalOnProperty(prefix = "dishdash.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaOrderStore implements OrderStore {

    private final OrderRepository orderRepository;
    private final OrderChangeHub changeHub;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public String create(Order order) {
        String id = UUID.randomUUID().toString();
        OrderEntity entity = orderRepository.saveAndFlush(OrderEntity.create(id, order));
        eventPublisher.publishEvent(OrderChange.created(entity.toDomain()));
        log.debug("Order document created: id={}", id);
        return id;
    }

    @Override
    public Optional<Order> get(String id) {
        return orderRepository.findWithItemsById(id).map(OrderEntity::toDomain);
    }

    @Override
    @Transactional
    public Order conditionalUpdate(String id, long expectedVersion, OrderPatch patch) {
        OrderEntity entity = orderRepository.findWithItemsById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
        if (entity.currentVersion() != expectedVersion) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    "Order " + id + " is at version " + entity.currentVersion()
                            + ", expected " + expectedVersion);
        }

        Order before = entity.toDomain();
        entity.apply(patch.apply(before));
        try {
            orderRepository.saveAndFlush(entity);
        } catch (OptimisticLockingFailureException e) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    "Order " + id + " was updated concurrently", e);
        }

        Order after = entity.toDomain();
        eventPublisher.publishEvent(OrderChange.updated(before, after));
        return after;
    }

    @Override
    public List<Order> find(OrderFilter filter) {
        return candidates(filter).stream()
                .map(OrderEntity::toDomain)
                .filter(filter)
                .toList();
    }

    @Override
    public OrderSubscription subscribe(OrderFilter filter, OrderChangeListener listener) {
        return changeHub.subscribe(filter, listener);
    }

    // Narrow by the most selective indexed column, the filter itself does the rest.
    private List<OrderEntity> candidates(OrderFilter filter) {
        if (filter.courierId() != null) {
            return orderRepository.findByCourierIdOrderByCreatedAtDesc(filter.courierId());
        }
        if (filter.customerId() != null) {
            return orderRepository.findByCustomerIdOrderByCreatedAtDesc(filter.customerId());
        }
        if (filter.restaurantId() != null) {
            return orderRepository.findByRestaurantIdOrderByCreatedAtDesc(filter.restaurantId());
        }
        if (filter.statuses() != null && !filter.statuses().isEmpty()) {
            return orderRepository.findByStatusInOrderByCreatedAtDesc(filter.statuses());
        }
        return orderRepository.findAllByOrderByCreatedAtDesc();
    }
}
