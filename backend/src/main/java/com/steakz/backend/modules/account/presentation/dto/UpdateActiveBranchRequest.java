package com.steakz.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateActiveBranchRequest(@NotBlank(message = "branchId is required") String branchId) {
}
