package com.dishdash.restaurant.service;

import com.dishdash.order.pricing.RestaurantRates;

/**
 * Read-only view of the restaurant profile used by the order lifecycle.
 */
public interface RestaurantProfileReader {

    RestaurantRates getRates(String restaurantId);

    boolean getAutoAcceptFlag(String restaurantId);

    boolean isActive(String restaurantId);

    String getName(String restaurantId);
}
