package com.steakz.backend.modules.feedback.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReplyFeedbackRequest(@NotBlank(message = "reply is required") @Size(max = 2000) String reply) {
}
