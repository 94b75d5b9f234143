package com.steakz.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.steakz.backend.modules.auth.domain.AppUser;

public record UserProfileResponse(
        Long userId,
        String email,
        String role,
        Long homeBranchId,
        Long activeBranchId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getRole().name(),
                user.getBranchId(),
                user.getActiveBranchId(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
