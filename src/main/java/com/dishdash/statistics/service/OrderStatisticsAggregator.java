package com.dishdash.statistics.service;

import com.dishdash.order.domain.LineItem;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.statistics.domain.CustomerOrderStats;
import com.dishdash.statistics.domain.DeliveryPerformance;
import com.dishdash.statistics.domain.FavoriteRestaurant;
import com.dishdash.statistics.domain.OrderStats;
import com.dishdash.statistics.domain.PopularItem;
import com.dishdash.statistics.domain.StatisticsWindow;
import com.dishdash.statistics.domain.StatisticsWindows;
import com.dishdash.statistics.domain.WindowStats;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Folds an order history into dashboard metrics. Stateless: the input is only read,
 * and concurrent calls for different actors share nothing.
 */
@Component
public class OrderStatisticsAggregator {

    static final int DEFAULT_ESTIMATE_MINUTES = 30;
    static final int ON_TIME_SLACK_MINUTES = 10;

    private static final int MONEY_SCALE = 2;
    private static final int RATE_SCALE = 4;
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");
    private static final Comparator<PopularItem> POPULARITY = Comparator
            .comparingLong(PopularItem::quantity).reversed()
            .thenComparing(PopularItem::name);
    private static final Comparator<FavoriteRestaurant> FAVORITE = Comparator
            .comparingLong(FavoriteRestaurant::orderCount).reversed()
            .thenComparing(FavoriteRestaurant::restaurantName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(FavoriteRestaurant::restaurantId);

    public OrderStats aggregate(Collection<Order> orders, StatisticsWindows windows) {
        return aggregate(orders, windows, Integer.MAX_VALUE);
    }

    public OrderStats aggregate(Collection<Order> orders, StatisticsWindows windows, int popularItemLimit) {
        Map<StatisticsWindow, WindowStats> byWindow = new EnumMap<>(StatisticsWindow.class);
        for (StatisticsWindow window : StatisticsWindow.values()) {
            List<Order> bucket = orders.stream()
                    .filter(order -> windows.contains(window, order.getCreatedAt()))
                    .toList();
            byWindow.put(window, windowStats(bucket));
        }

        long pending = orders.stream().filter(Order::isActive).count();
        return new OrderStats(
                windows.now(),
                Collections.unmodifiableMap(byWindow),
                pending,
                popularItems(orders, popularItemLimit),
                deliveryPerformance(orders));
    }

    /**
     * Customer-side summary. Every order counts towards the favorite restaurant; ties go to
     * the restaurant name that sorts first, then the id.
     */
    public CustomerOrderStats aggregateCustomer(Collection<Order> orders, LocalDateTime now) {
        long completed = 0;
        long cancelled = 0;
        BigDecimal spent = zeroMoney();
        Map<String, Long> countsByRestaurant = new HashMap<>();
        Map<String, String> restaurantNames = new HashMap<>();
        LocalDateTime mostRecent = null;

        for (Order order : orders) {
            if (order.getStatus() == OrderStatus.DELIVERED) {
                completed++;
                spent = spent.add(order.getPricing().total());
            } else if (order.getStatus() == OrderStatus.CANCELLED) {
                cancelled++;
            }
            countsByRestaurant.merge(order.getRestaurantId(), 1L, Long::sum);
            if (order.getRestaurantName() != null) {
                restaurantNames.putIfAbsent(order.getRestaurantId(), order.getRestaurantName());
            }
            if (order.getCreatedAt() != null && (mostRecent == null || order.getCreatedAt().isAfter(mostRecent))) {
                mostRecent = order.getCreatedAt();
            }
        }

        FavoriteRestaurant favorite = countsByRestaurant.entrySet().stream()
                .filter(entry -> Objects.nonNull(entry.getKey()))
                .map(entry -> new FavoriteRestaurant(entry.getKey(), restaurantNames.get(entry.getKey()), entry.getValue()))
                .min(FAVORITE)
                .orElse(null);

        return new CustomerOrderStats(
                now,
                orders.size(),
                completed,
                cancelled,
                orders.size() - completed - cancelled,
                spent.setScale(MONEY_SCALE, RoundingMode.HALF_UP),
                favorite,
                mostRecent);
    }

    private static WindowStats windowStats(List<Order> bucket) {
        long total = bucket.size();
        long delivered = 0;
        long cancelled = 0;
        long ratingCount = 0;
        long ratingSum = 0;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal deliveryFees = BigDecimal.ZERO;

        for (Order order : bucket) {
            if (order.getStatus() == OrderStatus.CANCELLED) {
                cancelled++;
            }
            if (order.getStatus() != OrderStatus.DELIVERED) {
                continue;
            }
            delivered++;
            if (order.isPaid()) {
                revenue = revenue.add(order.getPricing().total());
            }
            deliveryFees = deliveryFees.add(order.getPricing().deliveryFee());
            if (order.getDeliveryRating() != null) {
                ratingCount++;
                ratingSum += order.getDeliveryRating();
            }
        }

        return new WindowStats(
                total,
                delivered,
                cancelled,
                revenue,
                ratio(delivered, total),
                delivered == 0 ? zeroMoney() : revenue.divide(BigDecimal.valueOf(delivered), MONEY_SCALE, RoundingMode.HALF_UP),
                ratingCount == 0 ? zeroMoney()
                        : BigDecimal.valueOf(ratingSum).divide(BigDecimal.valueOf(ratingCount), MONEY_SCALE, RoundingMode.HALF_UP),
                ratingCount,
                deliveryFees);
    }

    private static List<PopularItem> popularItems(Collection<Order> orders, int limit) {
        Map<String, Long> quantities = new HashMap<>();
        for (Order order : orders) {
            if (order.getStatus() != OrderStatus.DELIVERED) {
                continue;
            }
            for (LineItem item : order.getItems()) {
                quantities.merge(item.name(), (long) item.quantity(), Long::sum);
            }
        }
        return quantities.entrySet().stream()
                .map(entry -> new PopularItem(entry.getKey(), entry.getValue()))
                .sorted(POPULARITY)
                .limit(limit)
                .toList();
    }

    private static DeliveryPerformance deliveryPerformance(Collection<Order> orders) {
        long measured = 0;
        long onTime = 0;
        long totalSeconds = 0;
        for (Order order : orders) {
            if (order.getStatus() != OrderStatus.DELIVERED
                    || order.getPickedUpAt() == null || order.getDeliveredAt() == null) {
                continue;
            }
            Duration trip = Duration.between(order.getPickedUpAt(), order.getDeliveredAt());
            measured++;
            totalSeconds += trip.getSeconds();
            long allowedSeconds = (estimateMinutes(order.getEstimatedDeliveryTime()) + ON_TIME_SLACK_MINUTES) * 60L;
            if (trip.getSeconds() <= allowedSeconds) {
                onTime++;
            }
        }
        BigDecimal averageMinutes = measured == 0 ? BigDecimal.ZERO.setScale(1)
                : BigDecimal.valueOf(totalSeconds).divide(BigDecimal.valueOf(measured * 60L), 1, RoundingMode.HALF_UP);
        return new DeliveryPerformance(measured, averageMinutes, ratio(onTime, measured));
    }

    /** First number of an estimate such as {@code "30-45 min"}; 30 when there is none. */
    static int estimateMinutes(String estimate) {
        if (estimate == null) {
            return DEFAULT_ESTIMATE_MINUTES;
        }
        Matcher matcher = LEADING_NUMBER.matcher(estimate);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : DEFAULT_ESTIMATE_MINUTES;
    }

    private static BigDecimal ratio(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO.setScale(RATE_SCALE);
        }
        return BigDecimal.valueOf(part).divide(BigDecimal.valueOf(whole), RATE_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal zeroMoney() {
        return BigDecimal.ZERO.setScale(MONEY_SCALE);
    }
}
