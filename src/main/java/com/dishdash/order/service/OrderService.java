package com.dishdash.order.service;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.common.resilience.StoreCallGuard;
import com.dishdash.order.domain.Actor;
import com.dishdash.order.domain.ActorRole;
import com.dishdash.order.domain.LineItem;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.PaymentStatus;
import com.dishdash.order.domain.TransitionMeta;
import com.dishdash.order.dto.CreateOrderRequest;
import com.dishdash.order.dto.LineItemRequest;
import com.dishdash.order.event.OrderNotificationDispatcher;
import com.dishdash.order.pricing.PricedOrder;
import com.dishdash.order.pricing.PricingEngine;
import com.dishdash.order.pricing.RestaurantRates;
import com.dishdash.order.statemachine.OrderStateMachine;
import com.dishdash.order.store.OrderFilter;
import com.dishdash.order.store.OrderStore;
import com.dishdash.restaurant.service.RestaurantProfileReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for every order operation driven by a customer, restaurant or courier.
 *
 * <p>Status changes always go through {@link OrderStateMachine}; this service only
 * re-reads the order and hands over the version the caller is acting on.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final String TRACKING_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int TRACKING_CODE_LENGTH = 8;
    private static final Set<OrderStatus> ACTIVE_STATUSES = EnumSet.complementOf(
            EnumSet.of(OrderStatus.DELIVERED, OrderStatus.CANCELLED));

    private final OrderStore orderStore;
    private final StoreCallGuard storeCallGuard;
    private final OrderStateMachine stateMachine;
    private final PricingEngine pricingEngine;
    private final RestaurantProfileReader restaurantProfileReader;
    private final OrderNotificationDispatcher notificationDispatcher;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public Order createOrder(Actor customer, CreateOrderRequest request) {
        if (!customer.is(ActorRole.CUSTOMER)) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Only customers can place orders");
        }
        log.info("Creating order: customerId={}, restaurantId={}", customer.id(), request.restaurantId());

        if (!restaurantProfileReader.isActive(request.restaurantId())) {
            throw new BusinessException(ErrorCode.RESTAURANT_INACTIVE);
        }
        RestaurantRates rates = restaurantProfileReader.getRates(request.restaurantId());

        List<LineItem> items = request.items() == null ? List.of()
                : request.items().stream().map(LineItemRequest::toDomain).toList();
        PricedOrder priced = pricingEngine.compute(items, rates);
        pricingEngine.checkMinimumOrder(priced.pricing(), rates);

        LocalDateTime now = LocalDateTime.now(clock);
        Order draft = Order.builder()
                .trackingCode(newTrackingCode())
                .customerId(customer.id())
                .customerEmail(request.customerEmail())
                .customerName(request.customerName())
                .restaurantId(request.restaurantId())
                .restaurantName(restaurantProfileReader.getName(request.restaurantId()))
                .items(priced.items())
                .deliveryAddress(request.deliveryAddress().toDomain())
                .deliveryInstructions(request.deliveryInstructions())
                .paymentMethod(request.paymentMethod())
                .pricing(priced.pricing())
                .estimatedDeliveryTime(pricingEngine.estimateDeliveryTime(
                        rates.deliveryTimeEstimate(), pricingEngine.orderComplexity(priced.items())))
                .status(OrderStatus.PLACED)
                .paymentStatus(request.paymentMethod().initialPaymentStatus())
                .createdAt(now)
                .updatedAt(now)
                .build();

        String id = storeCallGuard.call("create", () -> orderStore.create(draft));
        Order created = getOrder(id);
        notificationDispatcher.orderCreated(created);

        log.info("Order placed: orderId={}, orderNumber={}, total={}",
                created.getId(), created.getOrderNumber(), created.getPricing().total());
        return created;
    }

    public Order getOrder(String orderId) {
        return storeCallGuard.call("get", () -> orderStore.get(orderId))
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }

    /**
     * Re-reads the order and applies the transition on the version just read.
     *
     * @param expectedVersion version the client acted on, or null to act on whatever is stored
     */
    public Order transition(String orderId, Long expectedVersion, OrderStatus target,
                            Actor actor, TransitionMeta meta) {
        Order current = getOrder(orderId);
        checkNotStale(current, expectedVersion);
        return stateMachine.transition(current, target, actor, meta);
    }

    /**
     * Records a payment outcome reported by the restaurant or the bound courier
     * (cash collected at the door).
     */
    public Order updatePaymentStatus(String orderId, Long expectedVersion, PaymentStatus paymentStatus, Actor actor) {
        Order current = getOrder(orderId);
        checkNotStale(current, expectedVersion);
        boolean allowed = (actor.is(ActorRole.RESTAURANT) && actor.id().equals(current.getRestaurantId()))
                || (actor.is(ActorRole.COURIER) && current.isAssignedTo(actor.id()));
        if (!allowed) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Not allowed to update payment of this order");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Order updated = storeCallGuard.call("updatePaymentStatus", () -> orderStore.conditionalUpdate(
                orderId, current.getVersion(),
                stored -> stored.toBuilder().paymentStatus(paymentStatus).updatedAt(now).build()));
        log.info("Payment status updated: orderId={}, {} -> {}", orderId, current.getPaymentStatus(), paymentStatus);
        return updated;
    }

    /**
     * Stores the customer's rating of a delivered order. Each order can be rated once.
     */
    public Order rateDelivery(String orderId, Actor customer, int rating, String feedback) {
        if (rating < 1 || rating > 5) {
            throw new BusinessException(ErrorCode.INVALID_RATING);
        }
        Order current = getOrder(orderId);
        if (!customer.is(ActorRole.CUSTOMER) || !customer.id().equals(current.getCustomerId())) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Only the ordering customer can rate this delivery");
        }
        if (current.getStatus() != OrderStatus.DELIVERED) {
            throw new BusinessException(ErrorCode.INVALID_RATING, "Only delivered orders can be rated");
        }
        if (current.getDeliveryRating() != null) {
            throw new BusinessException(ErrorCode.INVALID_RATING, "Order has already been rated");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Order updated = storeCallGuard.call("rateDelivery", () -> orderStore.conditionalUpdate(
                orderId, current.getVersion(),
                stored -> stored.toBuilder().deliveryRating(rating).deliveryFeedback(feedback).updatedAt(now).build()));
        log.info("Delivery rated: orderId={}, courierId={}, rating={}", orderId, current.getCourierId(), rating);
        return updated;
    }

    /** Customer order history filtered by order number, restaurant, tracking code or item name. */
    public List<Order> searchOrders(String customerId, String query) {
        return storeCallGuard.call("find", () -> orderStore.find(OrderFilter.forCustomer(customerId)))
                .stream()
                .filter(order -> order.matchesSearch(query))
                .toList();
    }

    public List<Order> activeOrders(OrderFilter filter) {
        return storeCallGuard.call("find", () -> orderStore.find(filter.withStatuses(ACTIVE_STATUSES)));
    }

    public List<Order> findOrders(OrderFilter filter) {
        return storeCallGuard.call("find", () -> orderStore.find(filter));
    }

    private static void checkNotStale(Order current, Long expectedVersion) {
        if (expectedVersion != null && expectedVersion != current.getVersion()) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    "Order " + current.getOrderNumber() + " changed since it was read (version "
                            + expectedVersion + ", now " + current.getVersion() + ")");
        }
    }

    private String newTrackingCode() {
        StringBuilder code = new StringBuilder(TRACKING_CODE_LENGTH);
        for (int i = 0; i < TRACKING_CODE_LENGTH; i++) {
            code.append(TRACKING_ALPHABET.charAt(random.nextInt(TRACKING_ALPHABET.length())));
        }
        return code.toString();
    }
}
