package com.dishdash.restaurant.service;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.pricing.RestaurantRates;
import com.dishdash.restaurant.entity.Restaurant;
import com.dishdash.restaurant.repository.RestaurantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RestaurantService implements RestaurantProfileReader {

    public static final String RATES_CACHE = "restaurantRates";

    private final RestaurantRepository restaurantRepository;
    private final ApplicationEventPublisher eventPublisher;

    public Restaurant getRestaurant(String id) {
        return restaurantRepository.findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESTAURANT_NOT_FOUND));
    }

    public List<Restaurant> getActiveRestaurants() {
        return restaurantRepository.findByActiveTrueOrderByNameAsc();
    }

    public List<Restaurant> getAutoAcceptRestaurants() {
        return restaurantRepository.findByAutoAcceptOrdersTrue();
    }

    /**
     * Rates change rarely and are read on every order, so they sit in the local Caffeine cache.
     */
    @Override
    @Cacheable(value = RATES_CACHE, key = "#restaurantId")
    public RestaurantRates getRates(String restaurantId) {
        Restaurant restaurant = getRestaurant(restaurantId);
        return new RestaurantRates(
                restaurant.getServiceChargePercent(),
                restaurant.getTaxPercent(),
                restaurant.getDeliveryFee(),
                restaurant.getMinimumOrder(),
                restaurant.getDeliveryTimeEstimate());
    }

    @Override
    public boolean getAutoAcceptFlag(String restaurantId) {
        return getRestaurant(restaurantId).isAutoAcceptOrders();
    }

    @Override
    public boolean isActive(String restaurantId) {
        return getRestaurant(restaurantId).isActive();
    }

    @Override
    public String getName(String restaurantId) {
        return getRestaurant(restaurantId).getName();
    }

    @Transactional
    public Restaurant register(Restaurant restaurant) {
        Restaurant saved = restaurantRepository.save(restaurant);
        log.info("Restaurant registered: restaurantId={}, name={}, autoAccept={}",
                saved.getId(), saved.getName(), saved.isAutoAcceptOrders());
        if (saved.isAutoAcceptOrders()) {
            eventPublisher.publishEvent(new AutoAcceptToggledEvent(saved.getId(), true));
        }
        return saved;
    }

    /**
     * Flips the auto-accept flag and tells the auto-accept actor once the change is committed.
     */
    @Transactional
    public Restaurant updateAutoAccept(String restaurantId, boolean enabled) {
        Restaurant restaurant = getRestaurant(restaurantId);
        restaurant.changeAutoAccept(enabled);
        log.info("Auto-accept toggled: restaurantId={}, enabled={}", restaurantId, enabled);
        eventPublisher.publishEvent(new AutoAcceptToggledEvent(restaurantId, enabled));
        return restaurant;
    }

    @Transactional
    public Restaurant updateActive(String restaurantId, boolean active) {
        Restaurant restaurant = getRestaurant(restaurantId);
        restaurant.changeActive(active);
        log.info("Restaurant availability changed: restaurantId={}, active={}", restaurantId, active);
        return restaurant;
    }

    @Transactional
    @CacheEvict(value = RATES_CACHE, key = "#restaurantId")
    public Restaurant updateRates(String restaurantId, BigDecimal serviceChargePercent, BigDecimal taxPercent,
                                  BigDecimal deliveryFee, BigDecimal minimumOrder) {
        Restaurant restaurant = getRestaurant(restaurantId);
        restaurant.changeRates(serviceChargePercent, taxPercent, deliveryFee, minimumOrder);
        return restaurant;
    }

    public record AutoAcceptToggledEvent(String restaurantId, boolean enabled) {}
}
