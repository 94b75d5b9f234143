package com.steakz.backend.modules.staff.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateStaffRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128) String password,
        @NotBlank(message = "role is required") String role,
        @NotNull(message = "branchId is required") @Positive Long branchId
) {
}
