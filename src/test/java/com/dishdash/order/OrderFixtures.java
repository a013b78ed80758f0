package com.dishdash.order;

import com.dishdash.order.domain.Address;
import com.dishdash.order.domain.LineItem;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.PaymentMethod;
import com.dishdash.order.domain.PaymentStatus;
import com.dishdash.order.domain.Pricing;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class OrderFixtures {

    public static final String RESTAURANT_ID = "rest-1";
    public static final String CUSTOMER_ID = "cust-1";
    public static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 15, 12, 0);
    public static final ZoneId ZONE = ZoneOffset.UTC;

    private OrderFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZONE);
    }

    public static LineItem item(String name, String unitPrice, int quantity) {
        BigDecimal price = new BigDecimal(unitPrice);
        return new LineItem(null, name, price, quantity, price.multiply(BigDecimal.valueOf(quantity)), null);
    }

    /** A freshly placed card order of 2 x 1500 for {@link #RESTAURANT_ID}. */
    public static Order.OrderBuilder placedOrder() {
        return Order.builder()
                .trackingCode("TRACK001")
                .customerId(CUSTOMER_ID)
                .customerEmail("jane@example.com")
                .customerName("Jane")
                .restaurantId(RESTAURANT_ID)
                .restaurantName("Mama Put")
                .item(item("Jollof Rice", "1500", 2))
                .deliveryAddress(new Address("1 Allen Ave", "Ikeja", "Lagos", "100001", "NG", "Home"))
                .paymentMethod(PaymentMethod.CARD)
                .pricing(Pricing.of(new BigDecimal("3000"), new BigDecimal("300.00"),
                        new BigDecimal("480.00"), new BigDecimal("100")))
                .estimatedDeliveryTime("30-45 min")
                .status(OrderStatus.PLACED)
                .paymentStatus(PaymentStatus.PAID)
                .createdAt(NOW)
                .updatedAt(NOW);
    }
}
