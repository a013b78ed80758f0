package com.dishdash.order.statemachine;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.common.resilience.StoreCallGuard;
import com.dishdash.order.domain.Actor;
import com.dishdash.order.domain.ActorRole;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.TransitionMeta;
import com.dishdash.order.event.OrderNotificationDispatcher;
import com.dishdash.order.store.OrderPatch;
import com.dishdash.order.store.OrderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Validates and applies one order status transition.
 *
 * <ol>
 *   <li>the edge must be in the {@link OrderStatus} table, else ILLEGAL_TRANSITION</li>
 *   <li>the actor must hold authority over the edge, else FORBIDDEN</li>
 *   <li>the patch stamps the milestone and, on the claim edge, binds the courier</li>
 *   <li>the write is conditional on the version the caller observed, else CONFLICT</li>
 *   <li>a notification is dispatched without waiting for it</li>
 * </ol>
 *
 * Shared by every actor, including the auto-accept actor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStateMachine {

    static final String ALREADY_CLAIMED = "Order already picked up by another courier";

    private final OrderStore orderStore;
    private final StoreCallGuard storeCallGuard;
    private final OrderNotificationDispatcher notificationDispatcher;
    private final Clock clock;

    /**
     * @param observed the order as the caller last read it; its version guards the write
     * @return the stored order after the transition
     */
    public Order transition(Order observed, OrderStatus target, Actor actor, TransitionMeta meta) {
        OrderStatus current = observed.getStatus();
        checkEdge(observed, target, actor);
        checkAuthority(observed, target, actor);

        TransitionMeta transitionMeta = meta == null ? TransitionMeta.NONE : meta;
        LocalDateTime now = LocalDateTime.now(clock);
        OrderPatch patch = stored -> applyTransition(stored, target, actor, transitionMeta, now);

        Order updated;
        try {
            updated = storeCallGuard.call("transition",
                    () -> orderStore.conditionalUpdate(observed.getId(), observed.getVersion(), patch));
        } catch (BusinessException e) {
            if (e.getErrorCode() == ErrorCode.CONFLICT && target == OrderStatus.PICKED_UP
                    && claimedByAnotherCourier(observed.getId(), actor)) {
                throw new BusinessException(ErrorCode.CONFLICT, ALREADY_CLAIMED, e);
            }
            throw e;
        }

        log.info("Order transitioned: orderId={}, {} -> {}, actor={}:{}, version={}",
                updated.getId(), current, target, actor.role(), actor.id(), updated.getVersion());
        notificationDispatcher.statusChanged(updated, current);
        return updated;
    }

    // A lost claim race and an unrelated version bump (payment update) both surface as CONFLICT.
    private boolean claimedByAnotherCourier(String orderId, Actor courier) {
        try {
            return storeCallGuard.call("get", () -> orderStore.get(orderId))
                    .map(latest -> latest.hasCourier() && !latest.isAssignedTo(courier.id()))
                    .orElse(false);
        } catch (BusinessException e) {
            log.warn("Could not re-read order after claim conflict: orderId={}, cause={}", orderId, e.getMessage());
            return false;
        }
    }

    private static void checkEdge(Order order, OrderStatus target, Actor actor) {
        OrderStatus current = order.getStatus();
        if (current.canTransitionTo(target)) {
            return;
        }
        if (target == OrderStatus.PICKED_UP && actor.is(ActorRole.COURIER)
                && order.hasCourier() && !order.isAssignedTo(actor.id())) {
            throw new BusinessException(ErrorCode.ILLEGAL_TRANSITION, ALREADY_CLAIMED);
        }
        if (target == OrderStatus.CANCELLED) {
            throw new BusinessException(ErrorCode.ILLEGAL_TRANSITION,
                    "Order is " + current.displayText().toLowerCase() + " and can no longer be cancelled");
        }
        throw new BusinessException(ErrorCode.ILLEGAL_TRANSITION,
                "Cannot move order from " + current.wireName() + " to " + target.wireName());
    }

    private static void checkAuthority(Order order, OrderStatus target, Actor actor) {
        boolean allowed = switch (target) {
            case CONFIRMED, PREPARING, READY_FOR_PICKUP -> isOwningRestaurant(order, actor);
            case PICKED_UP -> actor.is(ActorRole.COURIER)
                    && (!order.hasCourier() || order.isAssignedTo(actor.id()));
            case ON_THE_WAY, DELIVERED -> actor.is(ActorRole.COURIER) && order.isAssignedTo(actor.id());
            case CANCELLED -> isOwningRestaurant(order, actor)
                    || (order.getStatus() != OrderStatus.PREPARING && isOwningCustomer(order, actor));
            case PLACED -> false;
        };
        if (!allowed) {
            log.warn("Transition refused: orderId={}, target={}, actor={}:{}",
                    order.getId(), target, actor.role(), actor.id());
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    actor.role().name().toLowerCase() + " " + actor.id()
                            + " may not move order " + order.getOrderNumber() + " to " + target.wireName());
        }
    }

    private static Order applyTransition(Order stored, OrderStatus target, Actor actor,
                                         TransitionMeta meta, LocalDateTime now) {
        Order.OrderBuilder builder = stored.toBuilder()
                .status(target)
                .updatedAt(now);
        switch (target) {
            case CONFIRMED -> builder.confirmedAt(now);
            case PREPARING -> builder.preparingAt(now);
            case READY_FOR_PICKUP -> builder.readyAt(now);
            case PICKED_UP -> {
                builder.pickedUpAt(now);
                if (!stored.hasCourier()) {
                    builder.courierId(actor.id())
                            .courierName(actor.name())
                            .courierPhone(actor.phone());
                }
            }
            case ON_THE_WAY -> builder.onTheWayAt(now);
            case DELIVERED -> builder.deliveredAt(now);
            case CANCELLED -> builder.cancelledAt(now)
                    .cancelReason(meta.cancelReason())
                    .cancelledBy(actor.role());
            case PLACED -> throw new IllegalStateException("PLACED is never a transition target");
        }
        return builder.build();
    }

    private static boolean isOwningRestaurant(Order order, Actor actor) {
        return actor.is(ActorRole.RESTAURANT) && actor.id().equals(order.getRestaurantId());
    }

    private static boolean isOwningCustomer(Order order, Actor actor) {
        return actor.is(ActorRole.CUSTOMER) && actor.id().equals(order.getCustomerId());
    }
}
