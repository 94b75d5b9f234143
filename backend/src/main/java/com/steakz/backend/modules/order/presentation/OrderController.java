package com.steakz.backend.modules.order.presentation;

import java.util.List;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.order.application.OrderService;
import com.steakz.backend.modules.order.presentation.dto.CreateOrderRequest;
import com.steakz.backend.modules.order.presentation.dto.OrderResponse;
import com.steakz.backend.modules.order.presentation.dto.UpdateOrderStatusRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderService orderService;
    private final CurrentActorProvider actorProvider;

    public OrderController(OrderService orderService, CurrentActorProvider actorProvider) {
        this.orderService = orderService;
        this.actorProvider = actorProvider;
    }

    @Operation(summary = "Place an order", description = "Creates an order in the caller's effective branch and takes the ordered quantities from stock.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order placed"),
            @ApiResponse(responseCode = "409", description = "Not enough stock, detail code `orders.insufficient_inventory`")
    })
    @PostMapping
    public ResponseEntity<OrderResponse> create(@Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(orderService.create(actorProvider.currentActor(), request));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> list(@RequestParam(name = "branchId", required = false) String branchId) {
        return ResponseEntity.ok(orderService.list(actorProvider.currentActor(), branchId));
    }

    @GetMapping("/branch/{branchId}")
    public ResponseEntity<List<OrderResponse>> listForBranch(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(orderService.listForBranch(actorProvider.currentActor(), branchId));
    }

    @Operation(summary = "Change order status", description = "Moves an order through the kitchen workflow. Only staff of the order's branch, or the owner, may do this.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "403", description = "Role or branch check failed"),
            @ApiResponse(responseCode = "404", description = "Unknown order"),
            @ApiResponse(responseCode = "409", description = "Order already completed or cancelled")
    })
    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable("orderId") Long orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request
    ) {
        return ResponseEntity.ok(orderService.updateStatus(actorProvider.currentActor(), orderId, request.status()));
    }
}
