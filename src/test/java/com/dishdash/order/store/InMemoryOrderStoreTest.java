package com.dishdash.order.store;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.OrderFixtures;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.dishdash.order.OrderFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryOrderStoreTest {

    private final OrderChangeHub changeHub = new OrderChangeHub(Runnable::run);
    private final InMemoryOrderStore orderStore = new InMemoryOrderStore(changeHub);

    @Test
    @DisplayName("Create assigns id, order number and version 0, ignoring caller values")
    void create_assignsIdentity() {
        String id = orderStore.create(OrderFixtures.placedOrder().id("client-id").version(42).build());

        Order stored = orderStore.get(id).orElseThrow();
        assertThat(id).isNotEqualTo("client-id");
        assertThat(stored.getId()).isEqualTo(id);
        assertThat(stored.getVersion()).isZero();
        assertThat(stored.getOrderNumber()).isEqualTo(Order.orderNumberFor(id)).startsWith("ORD-");
    }

    @Test
    @DisplayName("Conditional update on the current version applies the patch and bumps the version")
    void conditionalUpdate_matchingVersion() {
        String id = orderStore.create(OrderFixtures.placedOrder().build());

        Order updated = orderStore.conditionalUpdate(id, 0,
                current -> current.toBuilder().status(OrderStatus.CONFIRMED).build());

        assertThat(updated.getVersion()).isEqualTo(1);
        assertThat(updated.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
    }

    @Test
    @DisplayName("Conditional update on a stale version fails with CONFLICT and leaves the document untouched")
    void conditionalUpdate_staleVersion() {
        String id = orderStore.create(OrderFixtures.placedOrder().build());
        orderStore.conditionalUpdate(id, 0, current -> current.toBuilder().status(OrderStatus.CONFIRMED).build());

        assertThatThrownBy(() -> orderStore.conditionalUpdate(id, 0,
                current -> current.toBuilder().status(OrderStatus.CANCELLED).build()))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONFLICT);
        assertThat(orderStore.get(id)).get().extracting(Order::getStatus).isEqualTo(OrderStatus.CONFIRMED);
    }

    @Test
    @DisplayName("Conditional update of an unknown id fails with ORDER_NOT_FOUND")
    void conditionalUpdate_unknownId() {
        assertThatThrownBy(() -> orderStore.conditionalUpdate("missing", 0, current -> current))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ORDER_NOT_FOUND);
    }

    @Test
    @DisplayName("Find filters and returns newest first")
    void find_filtersNewestFirst() {
        String older = orderStore.create(OrderFixtures.placedOrder().createdAt(NOW.minusHours(2)).build());
        String newer = orderStore.create(OrderFixtures.placedOrder().createdAt(NOW).build());
        orderStore.create(OrderFixtures.placedOrder().restaurantId("rest-other").build());

        List<Order> found = orderStore.find(OrderFilter.forRestaurant(OrderFixtures.RESTAURANT_ID));

        assertThat(found).extracting(Order::getId).containsExactly(newer, older);
    }

    @Test
    @DisplayName("Subscribers receive created and updated changes with before and after images")
    void subscribe_receivesChanges() {
        List<OrderChange> received = new ArrayList<>();
        orderStore.subscribe(OrderFilter.forRestaurant(OrderFixtures.RESTAURANT_ID), new RecordingListener(received));

        String id = orderStore.create(OrderFixtures.placedOrder().build());
        orderStore.conditionalUpdate(id, 0, current -> current.toBuilder().status(OrderStatus.CONFIRMED).build());

        assertThat(received).extracting(OrderChange::type).containsExactly(ChangeType.CREATED, ChangeType.UPDATED);
        assertThat(received.get(1).previous().getStatus()).isEqualTo(OrderStatus.PLACED);
        assertThat(received.get(1).current().getStatus()).isEqualTo(OrderStatus.CONFIRMED);
    }

    @Test
    @DisplayName("An order leaving the filter is still delivered once so viewers can drop it")
    void subscribe_deliversLeavingOrders() {
        List<OrderChange> received = new ArrayList<>();
        OrderFilter pending = OrderFilter.forRestaurant(OrderFixtures.RESTAURANT_ID)
                .withStatuses(Set.of(OrderStatus.PLACED));
        String id = orderStore.create(OrderFixtures.placedOrder().build());
        orderStore.subscribe(pending, new RecordingListener(received));

        orderStore.conditionalUpdate(id, 0, current -> current.toBuilder().status(OrderStatus.CONFIRMED).build());
        orderStore.conditionalUpdate(id, 1, current -> current.toBuilder().status(OrderStatus.PREPARING).build());

        assertThat(received).hasSize(1);
        assertThat(received.get(0).current().getStatus()).isEqualTo(OrderStatus.CONFIRMED);
    }

    record RecordingListener(List<OrderChange> received) implements OrderChangeListener {

        @Override
        public void onChange(OrderChange change) {
            received.add(change);
        }

        @Override
        public void onError(Throwable error) {
            throw new AssertionError("unexpected subscription error", error);
        }
    }
}
