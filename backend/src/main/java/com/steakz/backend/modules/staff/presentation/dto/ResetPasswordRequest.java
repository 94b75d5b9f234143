package com.steakz.backend.modules.staff.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "newPassword is required")
        @Size(min = 8, max = 128, message = "newPassword must be at least 8 characters") String newPassword
) {
}
