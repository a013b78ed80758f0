package com.dishdash.order.controller;

import com.dishdash.common.exception.BusinessException;
import com.dishdash.common.exception.ErrorCode;
import com.dishdash.order.OrderFixtures;
import com.dishdash.order.domain.Actor;
import com.dishdash.order.domain.ActorRole;
import com.dishdash.order.domain.OrderStatus;
import com.dishdash.order.domain.TransitionMeta;
import com.dishdash.order.service.OrderService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OrderController.class)
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrderService orderService;

    @Test
    @DisplayName("Orders are wrapped in the response envelope with wire-format statuses")
    void getOrder() throws Exception {
        given(orderService.getOrder("order-1"))
                .willReturn(OrderFixtures.placedOrder().id("order-1").build());

        mockMvc.perform(get("/api/orders/order-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.id").value("order-1"))
                .andExpect(jsonPath("$.data.status").value("placed"))
                .andExpect(jsonPath("$.data.paymentStatus").value("paid"));
    }

    @Test
    @DisplayName("A courier claim carries the courier's name and phone from the headers")
    void transition_courierClaim() throws Exception {
        given(orderService.transition(eq("order-1"), isNull(), eq(OrderStatus.PICKED_UP), any(), any()))
                .willReturn(OrderFixtures.placedOrder().id("order-1").status(OrderStatus.PICKED_UP)
                        .courierId("courier-1").build());

        mockMvc.perform(post("/api/orders/order-1/transitions")
                        .header("X-Actor-Role", "courier")
                        .header("X-Actor-Id", "courier-1")
                        .header("X-Actor-Name", "Tunde")
                        .header("X-Actor-Phone", "+2348000000000")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"picked_up\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.courierId").value("courier-1"));

        ArgumentCaptor<Actor> actor = ArgumentCaptor.forClass(Actor.class);
        verify(orderService).transition(eq("order-1"), isNull(), eq(OrderStatus.PICKED_UP),
                actor.capture(), eq(TransitionMeta.NONE));
        assertThat(actor.getValue()).isEqualTo(
                new Actor(ActorRole.COURIER, "courier-1", "Tunde", "+2348000000000"));
    }

    @Test
    @DisplayName("A lost race is reported as a non-retryable 409 problem")
    void transition_conflict() throws Exception {
        given(orderService.transition(any(), any(), any(), any(), any()))
                .willThrow(new BusinessException(ErrorCode.ILLEGAL_TRANSITION,
                        "Order already picked up by another courier"));

        mockMvc.perform(post("/api/orders/order-1/transitions")
                        .header("X-Actor-Role", "courier")
                        .header("X-Actor-Id", "courier-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"picked_up\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("ILLEGAL_TRANSITION"))
                .andExpect(jsonPath("$.detail").value("Order already picked up by another courier"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("Store outages surface as a retryable 503")
    void getOrder_unavailable() throws Exception {
        given(orderService.getOrder("order-1")).willThrow(new BusinessException(ErrorCode.UNAVAILABLE));

        mockMvc.perform(get("/api/orders/order-1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("A checkout without items fails validation before reaching the service")
    void createOrder_invalidRequest() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("X-Actor-Role", "customer")
                        .header("X-Actor-Id", "cust-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"restaurantId\":\"rest-1\",\"items\":[],"
                                + "\"deliveryAddress\":{\"street\":\"1 Allen Ave\",\"city\":\"Ikeja\"},"
                                + "\"paymentMethod\":\"card\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));

        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("Requests without the actor headers are rejected")
    void transition_missingActor() throws Exception {
        mockMvc.perform(post("/api/orders/order-1/transitions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"confirmed\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));
    }
}
