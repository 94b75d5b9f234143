package com.steakz.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "email is required") @Email String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128) String password,
        @NotNull(message = "branchId is required") @Positive Long branchId,
        String deviceId
) {
}
