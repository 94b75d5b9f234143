package com.steakz.backend.modules.branch.presentation;

import java.util.List;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.branch.application.BranchService;
import com.steakz.backend.modules.branch.presentation.dto.BranchAnalyticsResponse;
import com.steakz.backend.modules.branch.presentation.dto.BranchResponse;
import com.steakz.backend.modules.branch.presentation.dto.BranchSettingsResponse;
import com.steakz.backend.modules.branch.presentation.dto.SeedSampleResponse;
import com.steakz.backend.modules.branch.presentation.dto.UpdateBranchSettingsRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/branches")
public class BranchController {

    private final BranchService branchService;
    private final CurrentActorProvider actorProvider;

    public BranchController(BranchService branchService, CurrentActorProvider actorProvider) {
        this.branchService = branchService;
        this.actorProvider = actorProvider;
    }

    @GetMapping
    public ResponseEntity<List<BranchResponse>> list() {
        return ResponseEntity.ok(branchService.list(actorProvider.currentActor()));
    }

    @GetMapping("/{branchId}/analytics")
    public ResponseEntity<BranchAnalyticsResponse> analytics(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(branchService.analytics(actorProvider.currentActor(), branchId));
    }

    @GetMapping("/{branchId}/settings")
    public ResponseEntity<BranchSettingsResponse> settings(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(branchService.settings(actorProvider.currentActor(), branchId));
    }

    @PatchMapping("/{branchId}/settings")
    public ResponseEntity<BranchSettingsResponse> updateSettings(
            @PathVariable("branchId") String branchId,
            @Valid @RequestBody UpdateBranchSettingsRequest request
    ) {
        return ResponseEntity.ok(branchService.updateSettings(actorProvider.currentActor(), branchId, request));
    }

    @Operation(summary = "Seed sample branches", description = "Owner only. Creates the London, Paris and Madrid sample branches if they do not exist yet.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Per-branch created/skipped summary"),
            @ApiResponse(responseCode = "403", description = "Owner role required")
    })
    @PostMapping("/seed-sample")
    public ResponseEntity<SeedSampleResponse> seedSample() {
        return ResponseEntity.ok(branchService.seedSampleBranches(actorProvider.currentActor()));
    }
}
