package com.dishdash.restaurant.controller;

import com.dishdash.common.dto.ApiResponse;
import com.dishdash.restaurant.dto.RatesRequest;
import com.dishdash.restaurant.dto.RestaurantRequest;
import com.dishdash.restaurant.dto.ToggleRequest;
import com.dishdash.restaurant.entity.Restaurant;
import com.dishdash.restaurant.service.RestaurantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/restaurants")
@RequiredArgsConstructor
public class RestaurantController {

    private final RestaurantService restaurantService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Restaurant> register(@Valid @RequestBody RestaurantRequest request) {
        Restaurant restaurant = Restaurant.builder()
                .id(request.id())
                .name(request.name())
                .active(request.active())
                .autoAcceptOrders(request.autoAcceptOrders())
                .serviceChargePercent(request.serviceChargePercent())
                .taxPercent(request.taxPercent())
                .deliveryFee(request.deliveryFee())
                .minimumOrder(request.minimumOrder())
                .deliveryTimeEstimate(request.deliveryTimeEstimate())
                .build();
        return ApiResponse.ok(restaurantService.register(restaurant));
    }

    @GetMapping
    public ApiResponse<List<Restaurant>> getActiveRestaurants() {
        return ApiResponse.ok(restaurantService.getActiveRestaurants());
    }

    @GetMapping("/{id}")
    public ApiResponse<Restaurant> getRestaurant(@PathVariable String id) {
        return ApiResponse.ok(restaurantService.getRestaurant(id));
    }

    @PutMapping("/{id}/auto-accept")
    public ApiResponse<Restaurant> updateAutoAccept(@PathVariable String id,
                                                    @Valid @RequestBody ToggleRequest request) {
        Restaurant restaurant = restaurantService.updateAutoAccept(id, request.enabled());
        return ApiResponse.ok(restaurant, request.enabled()
                ? "Auto-accept enabled: new orders are confirmed after the grace period"
                : "Auto-accept disabled");
    }

    @PutMapping("/{id}/active")
    public ApiResponse<Restaurant> updateActive(@PathVariable String id,
                                                @Valid @RequestBody ToggleRequest request) {
        return ApiResponse.ok(restaurantService.updateActive(id, request.enabled()));
    }

    @PutMapping("/{id}/rates")
    public ApiResponse<Restaurant> updateRates(@PathVariable String id,
                                               @Valid @RequestBody RatesRequest request) {
        return ApiResponse.ok(restaurantService.updateRates(id, request.serviceChargePercent(),
                request.taxPercent(), request.deliveryFee(), request.minimumOrder()));
    }
}
