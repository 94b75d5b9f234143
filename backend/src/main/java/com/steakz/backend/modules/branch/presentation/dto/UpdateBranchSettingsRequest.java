package com.steakz.backend.modules.branch.presentation.dto;

import java.time.LocalTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update: null fields are left untouched.
 */
public record UpdateBranchSettingsRequest(
        @Size(max = 64) String timezone,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude,
        @JsonFormat(pattern = "HH:mm") LocalTime openingTime,
        @JsonFormat(pattern = "HH:mm") LocalTime closingTime,
        @Size(max = 366) List<@Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "holidays must be yyyy-MM-dd") String> holidays,
        @Size(max = 80) String country,
        @Size(max = 80) String city,
        @Size(max = 255) String address,
        @Size(max = 20) String postalCode,
        @Size(max = 40) String phone,
        @Email @Size(max = 320) String email
) {
}
