package com.dishdash.order.entity;

import com.dishdash.order.domain.LineItem;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderLineItem {

    private String menuItemId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(length = 500)
    private String specialInstructions;

    static OrderLineItem from(LineItem item) {
        OrderLineItem entity = new OrderLineItem();
        entity.menuItemId = item.menuItemId();
        entity.name = item.name();
        entity.unitPrice = item.unitPrice();
        entity.quantity = item.quantity();
        entity.subtotal = item.subtotal();
        entity.specialInstructions = item.specialInstructions();
        return entity;
    }

    LineItem toDomain() {
        return new LineItem(menuItemId, name, unitPrice, quantity, subtotal, specialInstructions);
    }
}
