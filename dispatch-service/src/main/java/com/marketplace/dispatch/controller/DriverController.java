package com.marketplace.dispatch.controller;

import com.marketplace.dispatch.model.DriverStatusResponse;
import com.marketplace.dispatch.model.LocationUpdateRequest;
import com.marketplace.dispatch.model.OnlineStatusRequest;
import com.marketplace.dispatch.model.OrderResponse;
import com.marketplace.dispatch.model.OrderStatusUpdateRequest;
import com.marketplace.dispatch.model.SuggestedOrderResponse;
import com.marketplace.dispatch.service.DeliveryProgressService;
import com.marketplace.dispatch.service.DriverAvailabilityService;
import com.marketplace.dispatch.service.DriverResponseService;
import com.marketplace.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Driver app endpoints. The driver id in the path is resolved by the gateway
 * from the authenticated session.
 */
@RestController
@RequestMapping("/api/v1/drivers/{driverId}")
@RequiredArgsConstructor
public class DriverController {

    private final DriverResponseService responseService;
    private final DriverAvailabilityService availabilityService;
    private final DeliveryProgressService progressService;

    @GetMapping("/suggested-orders")
    public ResponseEntity<ApiResponse<List<SuggestedOrderResponse>>> suggestedOrders(
            @PathVariable("driverId") String driverId) {

        return ResponseEntity.ok(ApiResponse.ok(responseService.listSuggestedOrders(driverId)));
    }

    @PostMapping("/orders/{orderId}/accept")
    public ResponseEntity<ApiResponse<OrderResponse>> acceptOrder(
            @PathVariable("driverId") String driverId,
            @PathVariable("orderId") UUID orderId) {

        return ResponseEntity.ok(ApiResponse.ok(responseService.acceptOrder(orderId, driverId)));
    }

    @PostMapping("/orders/{orderId}/reject")
    public ResponseEntity<ApiResponse<OrderResponse>> rejectOrder(
            @PathVariable("driverId") String driverId,
            @PathVariable("orderId") UUID orderId) {

        return ResponseEntity.ok(ApiResponse.ok(responseService.rejectOrder(orderId, driverId)));
    }

    @PostMapping("/orders/{orderId}/status")
    public ResponseEntity<ApiResponse<OrderResponse>> updateOrderStatus(
            @PathVariable("driverId") String driverId,
            @PathVariable("orderId") UUID orderId,
            @Valid @RequestBody OrderStatusUpdateRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(progressService.advance(orderId, driverId, request.getStatus())));
    }

    @PostMapping("/online")
    public ResponseEntity<ApiResponse<DriverStatusResponse>> setOnline(
            @PathVariable("driverId") String driverId,
            @Valid @RequestBody OnlineStatusRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(availabilityService.setOnline(driverId, request.getOnline())));
    }

    @PostMapping("/location")
    public ResponseEntity<ApiResponse<DriverStatusResponse>> updateLocation(
            @PathVariable("driverId") String driverId,
            @Valid @RequestBody LocationUpdateRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(availabilityService.updateLocation(driverId, request)));
    }
}
