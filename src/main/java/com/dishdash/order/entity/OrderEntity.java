package com.dishdash.order.entity;

import com.dishdash.order.domain.ActorRole;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.PaymentMethod;
import com.dishdash.order.domain.PaymentStatus;
import com.dishdash.order.domain.Pricing;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored shape of an order document.
 *
 * <h3>Design points</h3>
 * <ul>
 *   <li>@Version: optimistic lock, the conditional-update primitive of the order store.
 *       A second writer holding the same version gets an OptimisticLockException at flush.</li>
 *   <li>Line items and pricing are written once on create and never patched afterwards.</li>
 *   <li>Composite index (restaurant_id, created_at): restaurant boards read newest first.</li>
 * </ul>
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_restaurant_created", columnList = "restaurantId, createdAt"),
        @Index(name = "idx_order_customer", columnList = "customerId"),
        @Index(name = "idx_order_courier", columnList = "courierId"),
        @Index(name = "idx_order_status", columnList = "status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Version
    private Long version;

    @Column(nullable = false, length = 16)
    private String orderNumber;

    @Column(length = 16)
    private String trackingCode;

    @Column(nullable = false)
    private String customerId;
    private String customerEmail;
    private String customerName;

    @Column(nullable = false)
    private String restaurantId;
    private String restaurantName;

    private String courierId;
    private String courierName;
    private String courierPhone;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "order_line_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    private List<OrderLineItem> items = new ArrayList<>();

    @Embedded
    private DeliveryAddress deliveryAddress;

    @Column(length = 500)
    private String deliveryInstructions;

    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal serviceCharge;
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal tax;
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal deliveryFee;
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    private String estimatedDeliveryTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PaymentStatus paymentStatus;

    @Column(nullable = false)
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime confirmedAt;
    private LocalDateTime preparingAt;
    private LocalDateTime readyAt;
    private LocalDateTime pickedUpAt;
    private LocalDateTime onTheWayAt;
    private LocalDateTime deliveredAt;
    private LocalDateTime cancelledAt;

    @Column(length = 500)
    private String cancelReason;

    @Enumerated(EnumType.STRING)
    private ActorRole cancelledBy;

    private Integer deliveryRating;

    @Column(length = 1000)
    private String deliveryFeedback;

    /** New document for an order that has not been stored yet. */
    public static OrderEntity create(String id, Order order) {
        OrderEntity entity = new OrderEntity();
        entity.id = id;
        entity.orderNumber = Order.orderNumberFor(id);
        entity.trackingCode = order.getTrackingCode();
        entity.customerId = order.getCustomerId();
        entity.customerEmail = order.getCustomerEmail();
        entity.customerName = order.getCustomerName();
        entity.restaurantId = order.getRestaurantId();
        entity.restaurantName = order.getRestaurantName();
        order.getItems().forEach(item -> entity.items.add(OrderLineItem.from(item)));
        entity.deliveryAddress = DeliveryAddress.from(order.getDeliveryAddress());
        entity.deliveryInstructions = order.getDeliveryInstructions();
        entity.paymentMethod = order.getPaymentMethod();
        Pricing pricing = order.getPricing();
        entity.subtotal = pricing.subtotal();
        entity.serviceCharge = pricing.serviceCharge();
        entity.tax = pricing.tax();
        entity.deliveryFee = pricing.deliveryFee();
        entity.total = pricing.total();
        entity.estimatedDeliveryTime = order.getEstimatedDeliveryTime();
        entity.createdAt = order.getCreatedAt();
        entity.apply(order);
        return entity;
    }

    /** Copies the fields a lifecycle patch may change. */
    public void apply(Order snapshot) {
        this.courierId = snapshot.getCourierId();
        this.courierName = snapshot.getCourierName();
        this.courierPhone = snapshot.getCourierPhone();
        this.status = snapshot.getStatus();
        this.paymentStatus = snapshot.getPaymentStatus();
        this.updatedAt = snapshot.getUpdatedAt();
        this.confirmedAt = snapshot.getConfirmedAt();
        this.preparingAt = snapshot.getPreparingAt();
        this.readyAt = snapshot.getReadyAt();
        this.pickedUpAt = snapshot.getPickedUpAt();
        this.onTheWayAt = snapshot.getOnTheWayAt();
        this.deliveredAt = snapshot.getDeliveredAt();
        this.cancelledAt = snapshot.getCancelledAt();
        this.cancelReason = snapshot.getCancelReason();
        this.cancelledBy = snapshot.getCancelledBy();
        this.deliveryRating = snapshot.getDeliveryRating();
        this.deliveryFeedback = snapshot.getDeliveryFeedback();
    }

    public long currentVersion() {
        return version == null ? 0L : version;
    }

    public Order toDomain() {
        return Order.builder()
                .id(id)
                .version(currentVersion())
                .orderNumber(orderNumber)
                .trackingCode(trackingCode)
                .customerId(customerId)
                .customerEmail(customerEmail)
                .customerName(customerName)
                .restaurantId(restaurantId)
                .restaurantName(restaurantName)
                .courierId(courierId)
                .courierName(courierName)
                .courierPhone(courierPhone)
                .items(items.stream().map(OrderLineItem::toDomain).toList())
                .deliveryAddress(deliveryAddress == null ? null : deliveryAddress.toDomain())
                .deliveryInstructions(deliveryInstructions)
                .paymentMethod(paymentMethod)
                .pricing(new Pricing(subtotal, serviceCharge, tax, deliveryFee, total))
                .estimatedDeliveryTime(estimatedDeliveryTime)
                .status(status)
                .paymentStatus(paymentStatus)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .confirmedAt(confirmedAt)
                .preparingAt(preparingAt)
                .readyAt(readyAt)
                .pickedUpAt(pickedUpAt)
                .onTheWayAt(onTheWayAt)
                .deliveredAt(deliveredAt)
                .cancelledAt(cancelledAt)
                .cancelReason(cancelReason)
                .cancelledBy(cancelledBy)
                .deliveryRating(deliveryRating)
                .deliveryFeedback(deliveryFeedback)
                .build();
    }
}
