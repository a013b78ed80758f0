package com.dishdash.order.pricing;

import com.dishdash.order.domain.LineItem;
import com.dishdash.order.domain.Pricing;

import java.util.List;

/** Line items with their subtotals filled in, together with the derived totals. */
public record PricedOrder(List<LineItem> items, Pricing pricing) {
}
