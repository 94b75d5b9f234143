package com.steakz.backend.modules.account.presentation.dto;

import com.steakz.backend.modules.branch.domain.Branch;

public record ActiveBranchResponse(Long activeBranchId, BranchSummary activeBranch) {

    public static ActiveBranchResponse of(Long activeBranchId, Branch branch) {
        return new ActiveBranchResponse(activeBranchId, branch == null ? null : BranchSummary.from(branch));
    }

    public record BranchSummary(Long id, String name, String city, String country) {
        static BranchSummary from(Branch branch) {
            return new BranchSummary(branch.getId(), branch.getName(), branch.getCity(), branch.getCountry());
        }
    }
}
