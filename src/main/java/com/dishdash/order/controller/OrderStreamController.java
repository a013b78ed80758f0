package com.dishdash.order.controller;

import com.dishdash.common.config.DishDashProperties;
import com.dishdash.projection.OrderProjection;
import com.dishdash.projection.OrderProjectionService;
import com.dishdash.projection.ProjectionView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Server-Sent Events endpoints, one per predefined viewer. Every event carries the
 * complete current view; the event id is the projection revision.
 */
@Slf4j
@RestController
@RequestMapping("/api/orders/stream")
@RequiredArgsConstructor
public class OrderStreamController {

    private final OrderProjectionService projectionService;
    private final DishDashProperties properties;

    @GetMapping(value = "/restaurants/{restaurantId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter restaurantBoard(@PathVariable String restaurantId) {
        return stream(projectionService.restaurantBoard(restaurantId));
    }

    @GetMapping(value = "/restaurants/{restaurantId}/pending", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter restaurantPending(@PathVariable String restaurantId) {
        return stream(projectionService.restaurantPending(restaurantId));
    }

    @GetMapping(value = "/couriers/pickup-board", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter courierPickupBoard() {
        return stream(projectionService.courierPickupBoard());
    }

    @GetMapping(value = "/couriers/{courierId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter courierDeliveries(@PathVariable String courierId) {
        return stream(projectionService.courierDeliveries(courierId));
    }

    @GetMapping(value = "/customers/{customerId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter customerOrders(@PathVariable String customerId) {
        return stream(projectionService.customerOrders(customerId));
    }

    private SseEmitter stream(OrderProjection projection) {
        SseEmitter emitter = new SseEmitter(properties.getProjection().getSseTimeoutMillis());
        Consumer<ProjectionView> forward = view -> send(emitter, projection, view);

        emitter.onCompletion(projection::close);
        emitter.onTimeout(projection::close);
        emitter.onError(error -> projection.close());

        projection.addListener(forward);
        return emitter;
    }

    private void send(SseEmitter emitter, OrderProjection projection, ProjectionView view) {
        try {
            emitter.send(SseEmitter.event()
                    .id(Long.toString(view.revision()))
                    .name(view.isLive() ? "orders" : "failed")
                    .data(view, MediaType.APPLICATION_JSON));
            if (!view.isLive()) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE client gone: projection={}, cause={}", projection.getName(), e.getMessage());
            projection.close();
            emitter.completeWithError(e);
        }
    }
}
