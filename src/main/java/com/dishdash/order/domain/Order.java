package com.dishdash.order.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Immutable snapshot of one order document, as read from or written to the order store.
 *
 * <p>Every change produces a new snapshot through {@code toBuilder()}. The store assigns
 * {@code id} on create and bumps {@code version} on every successful conditional update.</p>
 */
@Value
@Builder(toBuilder = true)
public class Order {

    public static final String ORDER_NUMBER_PREFIX = "ORD-";

    String id;
    String orderNumber;
    String trackingCode;
    long version;

    String customerId;
    String customerEmail;
    String customerName;

    String restaurantId;
    String restaurantName;

    String courierId;
    String courierName;
    String courierPhone;

    @Singular
    List<LineItem> items;
    Address deliveryAddress;
    String deliveryInstructions;
    PaymentMethod paymentMethod;
    Pricing pricing;
    String estimatedDeliveryTime;

    OrderStatus status;
    PaymentStatus paymentStatus;

    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    LocalDateTime confirmedAt;
    LocalDateTime preparingAt;
    LocalDateTime readyAt;
    LocalDateTime pickedUpAt;
    LocalDateTime onTheWayAt;
    LocalDateTime deliveredAt;
    LocalDateTime cancelledAt;

    String cancelReason;
    ActorRole cancelledBy;

    Integer deliveryRating;
    String deliveryFeedback;

    /** Human-readable number: fixed prefix plus the last six characters of the id. */
    public static String orderNumberFor(String id) {
        String compact = id.replace("-", "");
        String tail = compact.length() <= 6 ? compact : compact.substring(compact.length() - 6);
        return ORDER_NUMBER_PREFIX + tail.toUpperCase(Locale.ROOT);
    }

    public LocalDateTime milestone(OrderStatus milestoneStatus) {
        return switch (milestoneStatus) {
            case PLACED -> createdAt;
            case CONFIRMED -> confirmedAt;
            case PREPARING -> preparingAt;
            case READY_FOR_PICKUP -> readyAt;
            case PICKED_UP -> pickedUpAt;
            case ON_THE_WAY -> onTheWayAt;
            case DELIVERED -> deliveredAt;
            case CANCELLED -> cancelledAt;
        };
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    public boolean hasCourier() {
        return courierId != null;
    }

    public boolean isAssignedTo(String candidateCourierId) {
        return courierId != null && courierId.equals(candidateCourierId);
    }

    public boolean isPaid() {
        return paymentStatus == PaymentStatus.PAID;
    }

    public int itemCount() {
        return items.stream().mapToInt(LineItem::quantity).sum();
    }

    /** Case-insensitive match on order number, restaurant name, tracking code or any item name. */
    public boolean matchesSearch(String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return contains(orderNumber, needle)
                || contains(restaurantName, needle)
                || contains(trackingCode, needle)
                || items.stream().anyMatch(item -> contains(item.name(), needle));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
