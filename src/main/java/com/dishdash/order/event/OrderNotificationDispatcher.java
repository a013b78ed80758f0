package com.dishdash.order.event;

import com.dishdash.order.domain.Order;
import com.dishdash.order.domain.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;

/**
 * Hands notifications to the sender on the notification pool. Returns immediately;
 * failures are logged and dropped.
 */
@Slf4j
@Component
public class OrderNotificationDispatcher {

    private final OrderNotificationSender sender;
    private final TaskExecutor executor;

    public OrderNotificationDispatcher(OrderNotificationSender sender,
                                       @Qualifier("notificationExecutor") TaskExecutor executor) {
        this.sender = sender;
        this.executor = executor;
    }

    public void orderCreated(Order order) {
        dispatch(order, () -> sender.orderCreated(order));
    }

    public void statusChanged(Order order, OrderStatus previousStatus) {
        dispatch(order, () -> sender.statusChanged(order, previousStatus));
    }

    private void dispatch(Order order, Runnable send) {
        try {
            executor.execute(() -> {
                try {
                    send.run();
                } catch (RuntimeException e) {
                    log.warn("Notification dropped: orderId={}, status={}, cause={}",
                            order.getId(), order.getStatus(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Notification dropped, executor saturated: orderId={}, status={}",
                    order.getId(), order.getStatus());
        }
    }
}
