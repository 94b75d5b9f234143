package com.steakz.backend.modules.reservation.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.steakz.backend.modules.reservation.domain.Reservation;

public record ReservationResponse(
        Long id,
        Long branchId,
        Long userId,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm") LocalTime time,
        int guests,
        String status,
        String notes,
        OffsetDateTime createdAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getBranchId(),
                reservation.getUserId(),
                reservation.getDate(),
                reservation.getTime(),
                reservation.getGuests(),
                reservation.getStatus().name(),
                reservation.getNotes(),
                reservation.getCreatedAt()
        );
    }
}
