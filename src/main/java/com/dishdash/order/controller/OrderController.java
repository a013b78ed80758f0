package com.dishdash.order.controller;

import com.dishdash.common.dto.ApiResponse;
import com.dishdash.order.domain.Actor;
import com.dishdash.order.domain.ActorRole;
import com.dishdash.order.domain.Order;
import com.dishdash.order.dto.CreateOrderRequest;
import com.dishdash.order.dto.PaymentStatusRequest;
import com.dishdash.order.dto.RatingRequest;
import com.dishdash.order.dto.TransitionRequest;
import com.dishdash.order.service.OrderService;
import com.dishdash.order.store.OrderFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Order> createOrder(@RequestHeader(ActorHeaders.ROLE) String role,
                                          @RequestHeader(ActorHeaders.ID) String actorId,
                                          @Valid @RequestBody CreateOrderRequest request) {
        Actor customer = ActorHeaders.toActor(role, actorId, null, null);
        return ApiResponse.ok(orderService.createOrder(customer, request));
    }

    @GetMapping("/{id}")
    public ApiResponse<Order> getOrder(@PathVariable String id) {
        return ApiResponse.ok(orderService.getOrder(id));
    }

    /**
     * Moves the order to {@code request.status}. A courier claiming an order sends its
     * display name and phone in {@code X-Actor-Name} / {@code X-Actor-Phone} or in the body.
     */
    @PostMapping("/{id}/transitions")
    public ApiResponse<Order> transition(@PathVariable String id,
                                         @RequestHeader(ActorHeaders.ROLE) String role,
                                         @RequestHeader(ActorHeaders.ID) String actorId,
                                         @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                         @RequestHeader(value = ActorHeaders.PHONE, required = false) String actorPhone,
                                         @Valid @RequestBody TransitionRequest request) {
        Actor actor = ActorHeaders.toActor(role, actorId,
                request.courierName() != null ? request.courierName() : actorName,
                request.courierPhone() != null ? request.courierPhone() : actorPhone);
        return ApiResponse.ok(orderService.transition(
                id, request.expectedVersion(), request.status(), actor, request.meta()));
    }

    @PutMapping("/{id}/payment-status")
    public ApiResponse<Order> updatePaymentStatus(@PathVariable String id,
                                                  @RequestHeader(ActorHeaders.ROLE) String role,
                                                  @RequestHeader(ActorHeaders.ID) String actorId,
                                                  @Valid @RequestBody PaymentStatusRequest request) {
        Actor actor = ActorHeaders.toActor(role, actorId, null, null);
        return ApiResponse.ok(orderService.updatePaymentStatus(
                id, request.expectedVersion(), request.paymentStatus(), actor));
    }

    @PostMapping("/{id}/rating")
    public ApiResponse<Order> rateDelivery(@PathVariable String id,
                                           @RequestHeader(ActorHeaders.ROLE) String role,
                                           @RequestHeader(ActorHeaders.ID) String actorId,
                                           @Valid @RequestBody RatingRequest request) {
        Actor customer = ActorHeaders.toActor(role, actorId, null, null);
        return ApiResponse.ok(orderService.rateDelivery(id, customer, request.rating(), request.feedback()));
    }

    @GetMapping("/search")
    public ApiResponse<List<Order>> searchOrders(@RequestHeader(ActorHeaders.ID) String customerId,
                                                 @RequestParam(value = "q", required = false) String query) {
        return ApiResponse.ok(orderService.searchOrders(customerId, query));
    }

    /** Non-terminal orders of the calling party. */
    @GetMapping("/active")
    public ApiResponse<List<Order>> activeOrders(@RequestHeader(ActorHeaders.ROLE) String role,
                                                 @RequestHeader(ActorHeaders.ID) String actorId) {
        Actor actor = ActorHeaders.toActor(role, actorId, null, null);
        return ApiResponse.ok(orderService.activeOrders(filterFor(actor)));
    }

    @GetMapping
    public ApiResponse<List<Order>> history(@RequestHeader(ActorHeaders.ROLE) String role,
                                            @RequestHeader(ActorHeaders.ID) String actorId) {
        Actor actor = ActorHeaders.toActor(role, actorId, null, null);
        return ApiResponse.ok(orderService.findOrders(filterFor(actor)));
    }

    private static OrderFilter filterFor(Actor actor) {
        if (actor.is(ActorRole.RESTAURANT)) {
            return OrderFilter.forRestaurant(actor.id());
        }
        if (actor.is(ActorRole.COURIER)) {
            return OrderFilter.forCourier(actor.id());
        }
        return OrderFilter.forCustomer(actor.id());
    }
}
