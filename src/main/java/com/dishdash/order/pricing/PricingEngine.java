package com.dishdash.order.pricing;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.domain.LineItem;
import com.dishdash.order.domain.Pricing;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives order totals from line items and restaurant rates.
 *
 * <pre>
 *   subtotal      = Σ unitPrice × quantity
 *   serviceCharge = round2(subtotal × serviceChargePercent / 100)
 *   tax           = round2(subtotal × taxPercent / 100)
 *   total         = subtotal + serviceCharge + tax + deliveryFee
 * </pre>
 *
 * Pure and deterministic: the same input always yields the same output.
 */
@Component
public class PricingEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MONEY_SCALE = 2;
    private static final double MAX_COMPLEXITY = 2.0;
    private static final Pattern ESTIMATE = Pattern.compile("(\\d+)-?(\\d+)?\\s*min");

    public PricedOrder compute(List<LineItem> items, RestaurantRates rates) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.EMPTY_ORDER);
        }

        List<LineItem> priced = new ArrayList<>(items.size());
        BigDecimal subtotal = BigDecimal.ZERO;
        for (LineItem item : items) {
            validate(item);
            BigDecimal lineTotal = item.unitPrice().multiply(BigDecimal.valueOf(item.quantity()));
            priced.add(item.withSubtotal(lineTotal));
            subtotal = subtotal.add(lineTotal);
        }

        BigDecimal serviceCharge = percentOf(subtotal, rates.serviceChargePercent());
        BigDecimal tax = percentOf(subtotal, rates.taxPercent());
        BigDecimal deliveryFee = rates.deliveryFee() == null ? BigDecimal.ZERO : rates.deliveryFee();

        return new PricedOrder(List.copyOf(priced), Pricing.of(subtotal, serviceCharge, tax, deliveryFee));
    }

    public void checkMinimumOrder(Pricing pricing, RestaurantRates rates) {
        BigDecimal minimum = rates.minimumOrder();
        if (minimum != null && pricing.subtotal().compareTo(minimum) < 0) {
            throw new BusinessException(ErrorCode.BELOW_MINIMUM_ORDER,
                    "Order subtotal " + pricing.subtotal().toPlainString()
                            + " is below the restaurant minimum of " + minimum.toPlainString());
        }
    }

    /** Preparation multiplier: 1.0 baseline, more items and special instructions add to it, capped at 2.0. */
    public double orderComplexity(List<LineItem> items) {
        int itemCount = items.stream().mapToInt(LineItem::quantity).sum();
        double complexity = 1.0;
        if (itemCount > 5) {
            complexity += 0.2;
        }
        if (itemCount > 10) {
            complexity += 0.3;
        }
        if (items.stream().anyMatch(LineItem::hasSpecialInstructions)) {
            complexity += 0.1;
        }
        return Math.min(complexity, MAX_COMPLEXITY);
    }

    /**
     * Scales a restaurant estimate such as {@code "30-45 min"} by the order complexity.
     * Estimates that do not follow that shape are returned unchanged.
     */
    public String estimateDeliveryTime(String restaurantEstimate, double complexity) {
        if (restaurantEstimate == null) {
            return null;
        }
        Matcher matcher = ESTIMATE.matcher(restaurantEstimate);
        if (!matcher.find()) {
            return restaurantEstimate;
        }
        int min = Integer.parseInt(matcher.group(1));
        int max = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : min;
        return Math.round(min * complexity) + "-" + Math.round(max * complexity) + " min";
    }

    private static void validate(LineItem item) {
        if (item == null || item.name() == null || item.name().isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_LINE_ITEM, "Line item name is required");
        }
        if (item.quantity() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_LINE_ITEM,
                    "Quantity must be at least 1 for item '" + item.name() + "'");
        }
        if (item.unitPrice() == null || item.unitPrice().signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_LINE_ITEM,
                    "Unit price must not be negative for item '" + item.name() + "'");
        }
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        if (percent == null || percent.signum() == 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        return amount.multiply(percent).divide(HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
