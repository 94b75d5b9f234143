package com.steakz.backend.modules.staff.presentation.dto;

import java.time.OffsetDateTime;

import com.steakz.backend.modules.auth.domain.AppUser;

public record StaffResponse(Long id, String email, String role, Long branchId, OffsetDateTime createdAt) {

    public static StaffResponse from(AppUser user) {
        return new StaffResponse(user.getId(), user.getEmail(), user.getRole().name(), user.getBranchId(), user.getCreatedAt());
    }
}
