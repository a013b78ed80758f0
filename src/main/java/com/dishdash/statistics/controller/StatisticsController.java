package com.dishdash.statistics.controller;

import com.dishdash.common.dto.ApiResponse;
import com.dishdash.statistics.domain.CustomerOrderStats;
import com.dishdash.statistics.domain.OrderStats;
import com.dishdash.statistics.service.StatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsService statisticsService;

    @GetMapping("/restaurants/{restaurantId}")
    public ApiResponse<OrderStats> restaurantStats(@PathVariable String restaurantId) {
        return ApiResponse.ok(statisticsService.restaurantStats(restaurantId));
    }

    @GetMapping("/couriers/{courierId}")
    public ApiResponse<OrderStats> courierStats(@PathVariable String courierId) {
        return ApiResponse.ok(statisticsService.courierStats(courierId));
    }

    @GetMapping("/customers/{customerId}")
    public ApiResponse<CustomerOrderStats> customerStats(@PathVariable String customerId) {
        return ApiResponse.ok(statisticsService.customerStats(customerId));
    }
}
