package com.dishdash.autoaccept;

import com.dishdash.common.config.DishDashProperties;
import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.common.resilience.StoreCallGuard;
import com.dishdash.order.domain.Actor;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.TransitionMeta;
import com.dishdash.order.statemachine.OrderStateMachine;
import com.dishdash.order.store.ChangeType;
import com.dishdash.order.store.OrderChange;
import com.dishdash.order.store.OrderChangeListener;
import com.dishdash.order.store.OrderFilter;
import com.dishdash.order.store.OrderStore;
import com.dishdash.order.store.OrderSubscription;
import com.dishdash.restaurant.entity.Restaurant;
import com.dishdash.restaurant.service.RestaurantService;
import com.dishdash.restaurant.service.RestaurantService.AutoAcceptToggledEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Confirms new orders on the restaurant's behalf when the restaurant opted in.
 *
 * <p>For every enabled restaurant one subscription watches its {@code placed} orders. A newly
 * created order gets exactly one delayed action. When the grace period is over the action
 * re-reads the order and confirms it only if nobody moved it in the meantime; the write is
 * still conditional on the version just read, so a human confirm or cancel that lands
 * between the re-read and the write wins and the action gives up.</p>
 *
 * <p>Disabling stops new actions from being scheduled. Actions already scheduled still run.</p>
 */
@Slf4j
@Service
public class AutoAcceptService {

    private final OrderStore orderStore;
    private final StoreCallGuard storeCallGuard;
    private final OrderStateMachine stateMachine;
    private final RestaurantService restaurantService;
    private final TaskScheduler scheduler;
    private final DishDashProperties properties;
    private final Clock clock;

    private final Map<String, OrderSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public AutoAcceptService(OrderStore orderStore,
                             StoreCallGuard storeCallGuard,
                             OrderStateMachine stateMachine,
                             RestaurantService restaurantService,
                             @Qualifier("autoAcceptScheduler") TaskScheduler scheduler,
                             DishDashProperties properties,
                             Clock clock) {
        this.orderStore = orderStore;
        this.storeCallGuard = storeCallGuard;
        this.stateMachine = stateMachine;
        this.restaurantService = restaurantService;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void enableOptedInRestaurants() {
        for (Restaurant restaurant : restaurantService.getAutoAcceptRestaurants()) {
            enable(restaurant.getId());
        }
        log.info("Auto-accept started: restaurants={}", subscriptions.size());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onAutoAcceptToggled(AutoAcceptToggledEvent event) {
        if (event.enabled()) {
            enable(event.restaurantId());
        } else {
            disable(event.restaurantId());
        }
    }

    public void enable(String restaurantId) {
        subscriptions.computeIfAbsent(restaurantId, id -> {
            OrderFilter filter = OrderFilter.forRestaurant(id).withStatuses(Set.of(OrderStatus.PLACED));
            log.info("Auto-accept enabled: restaurantId={}", id);
            return orderStore.subscribe(filter, new NewOrderWatcher(id));
        });
    }

    public void disable(String restaurantId) {
        OrderSubscription subscription = subscriptions.remove(restaurantId);
        if (subscription != null) {
            subscription.cancel();
            log.info("Auto-accept disabled: restaurantId={}", restaurantId);
        }
    }

    public boolean isEnabled(String restaurantId) {
        return subscriptions.containsKey(restaurantId);
    }

    public int pendingActions() {
        return pending.size();
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.keySet().forEach(this::disable);
    }

    void scheduleConfirm(String restaurantId, String orderId) {
        if (!pending.add(orderId)) {
            log.debug("Auto-accept already scheduled: orderId={}", orderId);
            return;
        }
        Duration grace = properties.getAutoAccept().getGracePeriod();
        scheduler.schedule(() -> confirmIfStillPlaced(restaurantId, orderId), clock.instant().plus(grace));
        log.debug("Auto-accept scheduled: restaurantId={}, orderId={}, grace={}", restaurantId, orderId, grace);
    }

    void confirmIfStillPlaced(String restaurantId, String orderId) {
        try {
            Order order = storeCallGuard.call("get", () -> orderStore.get(orderId)).orElse(null);
            if (order == null) {
                log.warn("Auto-accept skipped, order not found: orderId={}", orderId);
                return;
            }
            if (order.getStatus() != OrderStatus.PLACED) {
                log.info("Auto-accept skipped, already {}: orderId={}", order.getStatus(), orderId);
                return;
            }
            stateMachine.transition(order, OrderStatus.CONFIRMED, Actor.restaurant(restaurantId), TransitionMeta.NONE);
            log.info("Order auto-accepted: restaurantId={}, orderId={}", restaurantId, orderId);
        } catch (BusinessException e) {
            if (e.getErrorCode() == ErrorCode.CONFLICT || e.getErrorCode() == ErrorCode.ILLEGAL_TRANSITION) {
                log.warn("Auto-accept dropped, order moved concurrently: orderId={}, cause={}", orderId, e.getMessage());
            } else {
                log.error("Auto-accept failed: orderId={}, code={}", orderId, e.getErrorCode(), e);
            }
        } catch (RuntimeException e) {
            log.error("Auto-accept failed: orderId={}", orderId, e);
        } finally {
            pending.remove(orderId);
        }
    }

    private final class NewOrderWatcher implements OrderChangeListener {

        private final String restaurantId;

        private NewOrderWatcher(String restaurantId) {
            this.restaurantId = restaurantId;
        }

        @Override
        public void onChange(OrderChange change) {
            if (change.type() == ChangeType.CREATED && change.current().getStatus() == OrderStatus.PLACED) {
                scheduleConfirm(restaurantId, change.orderId());
            }
        }

        @Override
        public void onError(Throwable error) {
            subscriptions.remove(restaurantId);
            log.error("Auto-accept subscription failed, restaurant needs to be re-enabled: restaurantId={}",
                    restaurantId, error);
        }
    }
}
