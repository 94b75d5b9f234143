package com.steakz.backend.modules.reservation.presentation;

import java.util.List;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.reservation.application.ReservationService;
import com.steakz.backend.modules.reservation.presentation.dto.CreateReservationRequest;
import com.steakz.backend.modules.reservation.presentation.dto.ReservationResponse;
import com.steakz.backend.modules.reservation.presentation.dto.UpdateReservationStatusRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reservations")
public class ReservationController {

    private final ReservationService reservationService;
    private final CurrentActorProvider actorProvider;

    public ReservationController(ReservationService reservationService, CurrentActorProvider actorProvider) {
        this.reservationService = reservationService;
        this.actorProvider = actorProvider;
    }

    @PostMapping
    public ResponseEntity<ReservationResponse> create(@Valid @RequestBody CreateReservationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(reservationService.create(actorProvider.currentActor(), request));
    }

    @GetMapping
    public ResponseEntity<List<ReservationResponse>> list(@RequestParam(name = "branchId", required = false) String branchId) {
        return ResponseEntity.ok(reservationService.list(actorProvider.currentActor(), branchId));
    }

    @GetMapping("/branch/{branchId}")
    public ResponseEntity<List<ReservationResponse>> listForBranch(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(reservationService.listForBranch(actorProvider.currentActor(), branchId));
    }

    @Operation(summary = "Change reservation status", description = "Confirms, seats, completes or cancels a reservation of the caller's branch.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "403", description = "Role, category or branch check failed"),
            @ApiResponse(responseCode = "404", description = "Unknown reservation")
    })
    @PatchMapping("/{reservationId}/status")
    public ResponseEntity<ReservationResponse> updateStatus(
            @PathVariable("reservationId") Long reservationId,
            @Valid @RequestBody UpdateReservationStatusRequest request
    ) {
        return ResponseEntity.ok(reservationService.updateStatus(actorProvider.currentActor(), reservationId, request.status()));
    }
}
