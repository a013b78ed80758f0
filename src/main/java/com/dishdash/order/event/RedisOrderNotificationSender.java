package com.dishdash.order.event;

import com.dishdash.common.config.DishDashProperties;
import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes order status changes to a Redis Pub/Sub channel ({@code order:status} by default).
 *
 * <p>Fire-and-forget: nothing is persisted and messages published while nobody
 * subscribes are dropped.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisOrderNotificationSender implements OrderNotificationSender {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final DishDashProperties properties;

    @Override
    public void orderCreated(Order order) {
        publish(OrderStatusMessage.of(order, null));
    }

    @Override
    public void statusChanged(Order order, OrderStatus previousStatus) {
        publish(OrderStatusMessage.of(order, previousStatus));
    }

    private void publish(OrderStatusMessage message) {
        String channel = properties.getNotifications().getChannel();
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize order status message for " + message.orderId(), e);
        }
        log.debug("Order status published: channel={}, orderId={}, status={}",
                channel, message.orderId(), message.status());
    }
}
