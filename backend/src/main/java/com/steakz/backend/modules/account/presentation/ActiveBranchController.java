package com.steakz.backend.modules.account.presentation;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.account.application.ActiveBranchService;
import com.steakz.backend.modules.account.presentation.dto.ActiveBranchResponse;
import com.steakz.backend.modules.account.presentation.dto.UpdateActiveBranchRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}/active-branch")
public class ActiveBranchController {

    private final ActiveBranchService activeBranchService;
    private final CurrentActorProvider actorProvider;

    public ActiveBranchController(ActiveBranchService activeBranchService, CurrentActorProvider actorProvider) {
        this.activeBranchService = activeBranchService;
        this.actorProvider = actorProvider;
    }

    @GetMapping
    public ResponseEntity<ActiveBranchResponse> get(@PathVariable("userId") Long userId) {
        return ResponseEntity.ok(activeBranchService.get(actorProvider.currentActor(), userId));
    }

    @Operation(summary = "Switch active branch", description = "Owner only, on its own account. Requests without an explicit branch are then scoped to this branch.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Active branch stored"),
            @ApiResponse(responseCode = "403", description = "Not the owner role, or not the caller's own account"),
            @ApiResponse(responseCode = "404", description = "Unknown branch")
    })
    @PatchMapping
    public ResponseEntity<ActiveBranchResponse> update(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody UpdateActiveBranchRequest request
    ) {
        return ResponseEntity.ok(activeBranchService.update(actorProvider.currentActor(), userId, request.branchId()));
    }
}
