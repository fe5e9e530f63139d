package com.marketplace.dispatch.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes returned by the dispatch API. Each code maps onto one of four
 * kinds: not found (404), conflict (409), forbidden (403), invalid state (400).
 */
@Getter
@RequiredArgsConstructor
public enum DispatchError {

    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    OFFER_NOT_FOUND(HttpStatus.NOT_FOUND, "No pending offer for this driver"),

    ORDER_ALREADY_ASSIGNED(HttpStatus.CONFLICT, "Order already assigned to another driver"),

    SELF_ASSIGNMENT_FORBIDDEN(HttpStatus.FORBIDDEN, "Drivers cannot accept their own orders"),
    DRIVER_NOT_APPROVED(HttpStatus.FORBIDDEN, "Driver profile is missing or not approved"),
    DRIVER_NOT_ELIGIBLE(HttpStatus.FORBIDDEN, "Driver is not eligible for this order"),
    NO_LIVE_OFFER(HttpStatus.FORBIDDEN, "Order was not offered to this driver or the offer expired"),

    INVALID_STATE(HttpStatus.BAD_REQUEST, "Order is not in a valid state for this action"),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST, "Invalid order status transition");

    private final HttpStatus status;
    private final String message;
}
