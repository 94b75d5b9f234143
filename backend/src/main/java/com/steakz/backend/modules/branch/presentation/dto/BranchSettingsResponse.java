package com.steakz.backend.modules.branch.presentation.dto;

import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.steakz.backend.modules.branch.domain.Branch;

public record BranchSettingsResponse(
        Long id,
        String name,
        String location,
        String country,
        String city,
        String address,
        String postalCode,
        String phone,
        String email,
        String timezone,
        Double latitude,
        Double longitude,
        @JsonFormat(pattern = "HH:mm") LocalTime openingTime,
        @JsonFormat(pattern = "HH:mm") LocalTime closingTime,
        List<String> holidays,
        OffsetDateTime updatedAt
) {
    public static BranchSettingsResponse from(Branch branch) {
        return new BranchSettingsResponse(
                branch.getId(),
                branch.getName(),
                branch.getLocation(),
                branch.getCountry(),
                branch.getCity(),
                branch.getAddress(),
                branch.getPostalCode(),
                branch.getPhone(),
                branch.getEmail(),
                branch.getTimezone(),
                branch.getLatitude(),
                branch.getLongitude(),
                branch.getOpeningTime(),
                branch.getClosingTime(),
                List.copyOf(branch.getHolidays()),
                branch.getUpdatedAt()
        );
    }
}
