package com.dishdash.order.pricing;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.domain.LineItem;
import com.dishdash.order.domain.Pricing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PricingEngineTest {

    private final PricingEngine pricingEngine = new PricingEngine();
    private final RestaurantRates rates = RestaurantRates.of("10", "16", "100", "1000");

    @Test
    @DisplayName("2 x 1500 at 10% service and 16% tax with a flat 100 fee totals 3880")
    void compute_referenceExample() {
        PricedOrder priced = pricingEngine.compute(
                List.of(LineItem.of("Jollof Rice", new BigDecimal("1500"), 2)), rates);

        Pricing pricing = priced.pricing();
        assertThat(pricing.subtotal()).isEqualByComparingTo("3000");
        assertThat(pricing.serviceCharge()).isEqualByComparingTo("300");
        assertThat(pricing.tax()).isEqualByComparingTo("480");
        assertThat(pricing.deliveryFee()).isEqualByComparingTo("100");
        assertThat(pricing.total()).isEqualByComparingTo("3880");
        assertThat(priced.items().get(0).subtotal()).isEqualByComparingTo("3000");
    }

    @Test
    @DisplayName("Percentage components round half up to two decimals and the total is their exact sum")
    void compute_roundsComponentsAndSumsExactly() {
        RestaurantRates oddRates = RestaurantRates.of("12.5", "7.5", "2.99", "0");

        Pricing pricing = pricingEngine.compute(List.of(
                LineItem.of("Suya", new BigDecimal("3.33"), 3),
                LineItem.of("Zobo", new BigDecimal("1.05"), 1)), oddRates).pricing();

        // subtotal 11.04: 12.5% = 1.38, 7.5% = 0.828 -> 0.83
        assertThat(pricing.subtotal()).isEqualByComparingTo("11.04");
        assertThat(pricing.serviceCharge()).isEqualByComparingTo("1.38");
        assertThat(pricing.tax()).isEqualByComparingTo("0.83");
        assertThat(pricing.total()).isEqualByComparingTo(
                pricing.subtotal().add(pricing.serviceCharge()).add(pricing.tax()).add(pricing.deliveryFee()));
        assertThat(pricing.total()).isEqualByComparingTo("16.24");
    }

    @Test
    @DisplayName("Same input always yields the same pricing")
    void compute_isDeterministic() {
        List<LineItem> items = List.of(
                LineItem.of("Egusi", new BigDecimal("2499.99"), 3),
                LineItem.of("Pounded Yam", new BigDecimal("800"), 2));

        Pricing first = pricingEngine.compute(items, rates).pricing();
        Pricing second = pricingEngine.compute(items, rates).pricing();

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Empty order is rejected")
    void compute_emptyOrder() {
        assertThatThrownBy(() -> pricingEngine.compute(List.of(), rates))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.EMPTY_ORDER);
    }

    @Test
    @DisplayName("Zero quantity is an invalid line item")
    void compute_zeroQuantity() {
        assertThatThrownBy(() -> pricingEngine.compute(
                List.of(LineItem.of("Chin Chin", new BigDecimal("500"), 0)), rates))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_LINE_ITEM);
    }

    @Test
    @DisplayName("Negative unit price is an invalid line item")
    void compute_negativePrice() {
        assertThatThrownBy(() -> pricingEngine.compute(
                List.of(LineItem.of("Refund hack", new BigDecimal("-1"), 1)), rates))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_LINE_ITEM);
    }

    @Test
    @DisplayName("Subtotal under the restaurant minimum is rejected")
    void checkMinimumOrder_belowMinimum() {
        Pricing pricing = pricingEngine.compute(
                List.of(LineItem.of("Puff Puff", new BigDecimal("200"), 2)), rates).pricing();

        assertThatThrownBy(() -> pricingEngine.checkMinimumOrder(pricing, rates))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.BELOW_MINIMUM_ORDER);
    }

    @Test
    @DisplayName("Complexity grows with item count and special instructions, capped at 2.0")
    void orderComplexity() {
        LineItem plain = LineItem.of("Meat Pie", new BigDecimal("700"), 3);
        LineItem many = LineItem.of("Meat Pie", new BigDecimal("700"), 11);
        LineItem special = new LineItem(null, "Pepper Soup", new BigDecimal("1200"), 1, null, "extra hot");

        assertThat(pricingEngine.orderComplexity(List.of(plain))).isCloseTo(1.0, within(1e-9));
        assertThat(pricingEngine.orderComplexity(List.of(plain, plain))).isCloseTo(1.2, within(1e-9));
        assertThat(pricingEngine.orderComplexity(List.of(many, special))).isCloseTo(1.6, within(1e-9));
    }

    @Test
    @DisplayName("Restaurant estimate is scaled by complexity, unparseable estimates pass through")
    void estimateDeliveryTime() {
        assertThat(pricingEngine.estimateDeliveryTime("30-45 min", 1.0)).isEqualTo("30-45 min");
        assertThat(pricingEngine.estimateDeliveryTime("30-45 min", 1.2)).isEqualTo("36-54 min");
        assertThat(pricingEngine.estimateDeliveryTime("20 min", 1.5)).isEqualTo("30-30 min");
        assertThat(pricingEngine.estimateDeliveryTime("about an hour", 1.5)).isEqualTo("about an hour");
    }
}
