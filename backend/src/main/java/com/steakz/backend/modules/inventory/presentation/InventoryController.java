package com.steakz.backend.modules.inventory.presentation;

import java.util.List;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.inventory.application.InventoryService;
import com.steakz.backend.modules.inventory.presentation.dto.CreateInventoryRequest;
import com.steakz.backend.modules.inventory.presentation.dto.CreateInventoryWithItemRequest;
import com.steakz.backend.modules.inventory.presentation.dto.InventoryItemResponse;
import com.steakz.backend.modules.inventory.presentation.dto.UpdateInventoryRequest;

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
@RequestMapping("/api/inventory")
public class InventoryController {

    private final InventoryService inventoryService;
    private final CurrentActorProvider actorProvider;

    public InventoryController(InventoryService inventoryService, CurrentActorProvider actorProvider) {
        this.inventoryService = inventoryService;
        this.actorProvider = actorProvider;
    }

    @GetMapping
    public ResponseEntity<List<InventoryItemResponse>> list(
            @RequestParam(name = "branchId", required = false) String branchId
    ) {
        return ResponseEntity.ok(inventoryService.list(actorProvider.currentActor(), branchId));
    }

    @GetMapping("/branch/{branchId}")
    public ResponseEntity<List<InventoryItemResponse>> listForBranch(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(inventoryService.listForBranch(actorProvider.currentActor(), branchId));
    }

    @PostMapping
    public ResponseEntity<InventoryItemResponse> create(@Valid @RequestBody CreateInventoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(inventoryService.create(actorProvider.currentActor(), request));
    }

    @PostMapping("/with-item")
    public ResponseEntity<InventoryItemResponse> createWithItem(@Valid @RequestBody CreateInventoryWithItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(inventoryService.createWithItem(actorProvider.currentActor(), request));
    }

    @Operation(summary = "Adjust stock", description = "Updates quantity and/or low-stock threshold of an inventory record in the caller's branch.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "403", description = "Role, category or branch check failed"),
            @ApiResponse(responseCode = "404", description = "Unknown inventory record")
    })
    @PatchMapping("/{inventoryItemId}")
    public ResponseEntity<InventoryItemResponse> update(
            @PathVariable("inventoryItemId") Long inventoryItemId,
            @Valid @RequestBody UpdateInventoryRequest request
    ) {
        return ResponseEntity.ok(inventoryService.update(actorProvider.currentActor(), inventoryItemId, request));
    }
}
