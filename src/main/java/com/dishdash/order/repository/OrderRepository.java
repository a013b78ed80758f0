package com.dishdash.order.repository;

import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.entity.OrderEntity;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Line items are fetched with the order through @EntityGraph so a board read is one query
 * rather than one per order.
 */
public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    @EntityGraph(attributePaths = {"items"})
    Optional<OrderEntity> findWithItemsById(String id);

    @EntityGraph(attributePaths = {"items"})
    List<OrderEntity> findByRestaurantIdOrderByCreatedAtDesc(String restaurantId);

    @EntityGraph(attributePaths = {"items"})
    List<OrderEntity> findByCustomerIdOrderByCreatedAtDesc(String customerId);

    @EntityGraph(attributePaths = {"items"})
    List<OrderEntity> findByCourierIdOrderByCreatedAtDesc(String courierId);

    @EntityGraph(attributePaths = {"items"})
    List<OrderEntity> findByStatusInOrderByCreatedAtDesc(Collection<OrderStatus> statuses);

    @EntityGraph(attributePaths = {"items"})
    List<OrderEntity> findAllByOrderByCreatedAtDesc();
}
