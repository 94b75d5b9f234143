package com.steakz.backend.modules.feedback.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateFeedbackRequest(
        String branchId,
        @NotNull(message = "rating is required") @Min(value = 1, message = "rating must be between 1 and 5")
        @Max(value = 5, message = "rating must be between 1 and 5") Integer rating,
        @NotBlank(message = "comment is required") @Size(max = 2000) String comment
) {
}
