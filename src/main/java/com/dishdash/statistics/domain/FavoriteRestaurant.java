package com.dishdash.statistics.domain;

public record FavoriteRestaurant(String restaurantId, String restaurantName, long orderCount) {
}
