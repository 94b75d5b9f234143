package com.steakz.backend.modules.branch.presentation.dto;

import java.util.List;

public record SeedSampleResponse(List<Entry> summary) {

    public record Entry(String name, String status, Long id) {
    }
}
