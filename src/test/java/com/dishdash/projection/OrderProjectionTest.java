package com.dishdash.projection;

import com.dishdash.common.config.DishDashProperties;
import com.dishdash.common.resilience.StoreCallGuard;
import com.dishdash.order.OrderFixtures;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.store.InMemoryOrderStore;
import com.dishdash.order.store.OrderChange;
import com.dishdash.order.store.OrderChangeHub;
import com.dishdash.order.store.OrderFilter;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.dishdash.order.OrderFixtures.NOW;
import static com.dishdash.order.OrderFixtures.RESTAURANT_ID;
import static org.assertj.core.api.Assertions.assertThat;

class OrderProjectionTest {

    private ExecutorService storeExecutor;
    private OrderChangeHub changeHub;
    private InMemoryOrderStore orderStore;
    private OrderProjectionService projectionService;

    @BeforeEach
    void setUp() {
        storeExecutor = Executors.newCachedThreadPool();
        changeHub = new OrderChangeHub(Runnable::run);
        orderStore = new InMemoryOrderStore(changeHub);
        DishDashProperties properties = new DishDashProperties();
        properties.getProjection().setDefaultLimit(3);
        projectionService = new OrderProjectionService(orderStore,
                new StoreCallGuard(TimeLimiter.of(Duration.ofSeconds(2)), storeExecutor), properties);
    }

    @AfterEach
    void tearDown() {
        storeExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Projection is seeded from history, newest first")
    void open_seedsFromHistory() {
        String older = create(OrderFixtures.placedOrder().createdAt(NOW.minusMinutes(10)));
        String newer = create(OrderFixtures.placedOrder().createdAt(NOW));

        OrderProjection board = projectionService.restaurantBoard(RESTAURANT_ID);

        assertThat(board.current().isLive()).isTrue();
        assertThat(board.current().orders()).extracting(Order::getId).containsExactly(newer, older);
    }

    @Test
    @DisplayName("New orders appear and orders leaving the filter disappear")
    void liveUpdates_followTheFilter() {
        OrderProjection pending = projectionService.restaurantPending(RESTAURANT_ID);

        String id = create(OrderFixtures.placedOrder());
        assertThat(pending.current().orders()).extracting(Order::getId).containsExactly(id);

        orderStore.conditionalUpdate(id, 0, current -> current.toBuilder().status(OrderStatus.CONFIRMED).build());
        assertThat(pending.current().orders()).isEmpty();
    }

    @Test
    @DisplayName("Courier pickup board shows only unclaimed ready orders")
    void pickupBoard_onlyUnclaimedReadyOrders() {
        String ready = create(OrderFixtures.placedOrder().status(OrderStatus.READY_FOR_PICKUP));
        create(OrderFixtures.placedOrder().status(OrderStatus.PREPARING));
        OrderProjection board = projectionService.courierPickupBoard();
        assertThat(board.current().orders()).extracting(Order::getId).containsExactly(ready);

        orderStore.conditionalUpdate(ready, 0, current -> current.toBuilder()
                .status(OrderStatus.PICKED_UP).courierId("courier-1").build());

        assertThat(board.current().orders()).isEmpty();
    }

    @Test
    @DisplayName("Orders with the same creation time are ordered by id")
    void ordering_stableTieBreak() {
        create(OrderFixtures.placedOrder());
        create(OrderFixtures.placedOrder());
        create(OrderFixtures.placedOrder());

        OrderProjection board = projectionService.customerOrders(OrderFixtures.CUSTOMER_ID);

        List<String> ids = board.current().orders().stream().map(Order::getId).toList();
        assertThat(ids).isSorted();
    }

    @Test
    @DisplayName("Default limit keeps the newest orders only")
    void limit_keepsNewest() {
        for (int i = 0; i < 5; i++) {
            create(OrderFixtures.placedOrder().createdAt(NOW.minusMinutes(i)));
        }

        OrderProjection board = projectionService.restaurantBoard(RESTAURANT_ID);

        assertThat(board.current().orders()).hasSize(3)
                .extracting(Order::getCreatedAt)
                .containsExactly(NOW, NOW.minusMinutes(1), NOW.minusMinutes(2));
    }

    @Test
    @DisplayName("A change older than the held version never moves the view backwards")
    void staleChange_ignored() {
        String id = create(OrderFixtures.placedOrder());
        Order v0 = orderStore.get(id).orElseThrow();
        Order v1 = orderStore.conditionalUpdate(id, 0, current -> current.toBuilder().status(OrderStatus.CONFIRMED).build());
        OrderProjection board = projectionService.restaurantBoard(RESTAURANT_ID);
        long revision = board.current().revision();

        board.onChanges(List.of(OrderChange.updated(null, v0)));

        assertThat(board.current().revision()).isEqualTo(revision);
        assertThat(board.current().orders()).containsExactly(v1);
    }

    @Test
    @DisplayName("Version tracking on the pickup board stays bounded as orders are claimed")
    void pickupBoard_versionTrackingStaysBounded() {
        OrderProjection board = projectionService.courierPickupBoard();
        Order lastReady = null;

        for (int i = 0; i < OrderProjection.RETIRED_CAPACITY + 200; i++) {
            String id = create(OrderFixtures.placedOrder().status(OrderStatus.READY_FOR_PICKUP));
            lastReady = orderStore.get(id).orElseThrow();
            orderStore.conditionalUpdate(id, 0, current -> current.toBuilder()
                    .status(OrderStatus.PICKED_UP).courierId("courier-1").build());
        }

        assertThat(board.current().orders()).isEmpty();
        assertThat(board.trackedVersionCount()).isLessThanOrEqualTo(OrderProjection.RETIRED_CAPACITY);

        long revision = board.current().revision();
        board.onChanges(List.of(OrderChange.created(lastReady)));
        assertThat(board.current().revision()).isEqualTo(revision);
        assertThat(board.current().orders()).isEmpty();
    }

    @Test
    @DisplayName("A batch of changes is published once")
    void batch_publishedOnce() {
        OrderProjection board = new OrderProjection("board", OrderFilter.forRestaurant(RESTAURANT_ID), null);
        List<ProjectionView> published = new CopyOnWriteArrayList<>();
        board.addListener(published::add);
        published.clear();

        Order first = OrderFixtures.placedOrder().id("a").build();
        Order second = OrderFixtures.placedOrder().id("b").build();
        board.onChanges(List.of(OrderChange.created(first), OrderChange.created(second),
                OrderChange.updated(first, first.toBuilder().version(1).status(OrderStatus.CONFIRMED).build())));

        assertThat(published).hasSize(1);
        assertThat(published.get(0).orders()).extracting(Order::getStatus)
                .containsExactly(OrderStatus.CONFIRMED, OrderStatus.PLACED);
    }

    @Test
    @DisplayName("A subscription error is terminal and reopen yields a fresh live projection")
    void subscriptionError_terminalUntilReopened() {
        OrderProjection board = projectionService.restaurantBoard(RESTAURANT_ID);

        changeHub.failAll(new IllegalStateException("listener connection lost"));
        create(OrderFixtures.placedOrder());

        assertThat(board.isFailed()).isTrue();
        assertThat(board.current().error()).isEqualTo("listener connection lost");
        assertThat(board.current().orders()).isEmpty();

        OrderProjection reopened = projectionService.reopen(board);
        assertThat(reopened.current().isLive()).isTrue();
        assertThat(reopened.current().orders()).hasSize(1);
    }

    @Test
    @DisplayName("Closing a projection cancels its subscription")
    void close_cancelsSubscription() {
        OrderProjection board = projectionService.restaurantBoard(RESTAURANT_ID);
        assertThat(changeHub.activeSubscriptions()).isEqualTo(1);

        board.close();

        assertThat(changeHub.activeSubscriptions()).isZero();
    }

    private String create(Order.OrderBuilder builder) {
        return orderStore.create(builder.build());
    }
}
