package com.marketplace.dispatch.controller;

import com.marketplace.dispatch.model.CreateOrderRequest;
import com.marketplace.dispatch.model.OrderResponse;
import com.marketplace.dispatch.service.OrderIntakeService;
import com.marketplace.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderIntakeService intakeService;

    @PostMapping
    public ResponseEntity<ApiResponse<OrderResponse>> createOrder(
            @Valid @RequestBody CreateOrderRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        OrderResponse response = intakeService.createOrder(request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<ApiResponse<OrderResponse>> getOrder(@PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(ApiResponse.ok(intakeService.getOrder(orderId)));
    }

    @PostMapping("/{orderId}/dispatch")
    public ResponseEntity<ApiResponse<OrderResponse>> releaseForDispatch(@PathVariable("orderId") UUID orderId) {
        return ResponseEntity.ok(ApiResponse.ok(intakeService.releaseForDispatch(orderId)));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<ApiResponse<OrderResponse>> cancelOrder(
            @PathVariable("orderId") UUID orderId,
            @RequestParam("customerId") String customerId) {

        return ResponseEntity.ok(ApiResponse.ok(intakeService.cancelOrder(orderId, customerId)));
    }
}
