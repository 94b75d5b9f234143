package com.steakz.backend.modules.staff.presentation;

import java.util.List;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.staff.application.StaffService;
import com.steakz.backend.modules.staff.presentation.dto.CreateStaffRequest;
import com.steakz.backend.modules.staff.presentation.dto.ResetPasswordRequest;
import com.steakz.backend.modules.staff.presentation.dto.StaffResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/staff")
public class StaffController {

    private final StaffService staffService;
    private final CurrentActorProvider actorProvider;

    public StaffController(StaffService staffService, CurrentActorProvider actorProvider) {
        this.staffService = staffService;
        this.actorProvider = actorProvider;
    }

    @GetMapping("/branch/{branchId}")
    public ResponseEntity<List<StaffResponse>> listForBranch(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(staffService.listForBranch(actorProvider.currentActor(), branchId));
    }

    @PostMapping
    public ResponseEntity<StaffResponse> create(@Valid @RequestBody CreateStaffRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(staffService.create(actorProvider.currentActor(), request));
    }

    @PostMapping("/{staffId}/reset-password")
    public ResponseEntity<Void> resetPassword(
            @PathVariable("staffId") Long staffId,
            @Valid @RequestBody ResetPasswordRequest request
    ) {
        staffService.resetPassword(actorProvider.currentActor(), staffId, request.newPassword());
        return ResponseEntity.noContent().build();
    }
}
