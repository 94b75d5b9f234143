package com.steakz.backend.modules.reservation.presentation.dto;

import com.steakz.backend.modules.reservation.domain.ReservationStatus;

import jakarta.validation.constraints.NotNull;

public record UpdateReservationStatusRequest(@NotNull(message = "status is required") ReservationStatus status) {
}
