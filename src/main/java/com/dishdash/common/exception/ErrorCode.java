package com.dishdash.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes shared by every order lifecycle component.
 *
 * <p>Only {@link #UNAVAILABLE} is retryable. {@link #CONFLICT} asks the caller to
 * re-read the order and decide again, the rest are surfaced to the user as-is.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value", false),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", false),

    // Pricing
    INVALID_LINE_ITEM(HttpStatus.BAD_REQUEST, "Line item has an invalid quantity or price", false),
    EMPTY_ORDER(HttpStatus.BAD_REQUEST, "Order must contain at least one item", false),
    BELOW_MINIMUM_ORDER(HttpStatus.BAD_REQUEST, "Order subtotal is below the restaurant minimum", false),

    // Restaurant
    RESTAURANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Restaurant not found", false),
    RESTAURANT_INACTIVE(HttpStatus.BAD_REQUEST, "Restaurant is not accepting orders", false),

    // Order
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found", false),
    ILLEGAL_TRANSITION(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid order status transition", false),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Not allowed to change this order", false),
    CONFLICT(HttpStatus.CONFLICT, "Order was modified by someone else", false),
    INVALID_RATING(HttpStatus.BAD_REQUEST, "Delivery rating must be between 1 and 5", false),

    // Store
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Order store temporarily unavailable", true);

    private final HttpStatus status;
    private final String message;
    private final boolean retryable;
}
