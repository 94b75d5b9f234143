package com.steakz.backend.modules.reservation.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import com.fasterxml.jackson.annotation.JsonFormat;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateReservationRequest(
        String branchId,
        @NotNull(message = "date is required") LocalDate date,
        @NotNull(message = "time is required") @JsonFormat(pattern = "HH:mm") LocalTime time,
        @NotNull(message = "guests is required") @Min(1) @Max(50) Integer guests,
        @Size(max = 1000) String notes
) {
}
