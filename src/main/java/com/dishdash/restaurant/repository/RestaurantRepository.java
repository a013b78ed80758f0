package com.dishdash.restaurant.repository;

import com.dishdash.restaurant.entity.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RestaurantRepository extends JpaRepository<Restaurant, String> {

    List<Restaurant> findByAutoAcceptOrdersTrue();

    List<Restaurant> findByActiveTrueOrderByNameAsc();
}
