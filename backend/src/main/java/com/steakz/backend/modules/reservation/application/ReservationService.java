package com.steakz.backend.modules.reservation.application;

import java.util.List;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.steakz.backend.modules.reservation.domain.Reservation;
import com.steakz.backend.modules.reservation.domain.ReservationStatus;
import com.steakz.backend.modules.reservation.infrastructure.persistence.ReservationRepository;
import com.steakz.backend.modules.reservation.presentation.dto.CreateReservationRequest;
import com.steakz.backend.modules.reservation.presentation.dto.ReservationResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ReservationService {

    private final ReservationRepository reservationRepository;
    private final BranchRepository branchRepository;
    private final BranchAccessGuard accessGuard;

    public ReservationService(
            ReservationRepository reservationRepository,
            BranchRepository branchRepository,
            BranchAccessGuard accessGuard
    ) {
        this.reservationRepository = reservationRepository;
        this.branchRepository = branchRepository;
        this.accessGuard = accessGuard;
    }

    @Transactional
    public ReservationResponse create(Actor actor, CreateReservationRequest request) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.RESERVATION_CREATE, actor, request.branchId());
        if (!branchRepository.existsById(branchId)) {
            throw ProblemException.notFound("branch.not_found", "branch " + branchId + " does not exist");
        }
        String notes = request.notes() == null || request.notes().isBlank() ? null : request.notes().trim();
        Reservation reservation = new Reservation(
                actor.id(),
                branchId,
                request.date(),
                request.time(),
                request.guests(),
                notes
        );
        return ReservationResponse.from(reservationRepository.save(reservation));
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> list(Actor actor, String requestedBranchId) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.RESERVATION_LIST, actor, requestedBranchId);
        return findVisible(actor, branchId);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listForBranch(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.RESERVATION_LIST, actor, pathBranchId);
        return findVisible(actor, branchId);
    }

    @Transactional
    public ReservationResponse updateStatus(Actor actor, Long reservationId, ReservationStatus status) {
        accessGuard.authorizeResource(ProtectedOperation.RESERVATION_STATUS_UPDATE, actor,
                () -> reservationRepository.findBranchIdById(reservationId).orElseThrow(() -> notFound(reservationId)));

        Reservation reservation = reservationRepository.findById(reservationId).orElseThrow(() -> notFound(reservationId));
        reservation.setStatus(status);
        return ReservationResponse.from(reservation);
    }

    private List<ReservationResponse> findVisible(Actor actor, Long branchId) {
        List<Reservation> reservations = actor.hasRole(Role.CUSTOMER)
                ? reservationRepository.findByBranchIdAndUserIdOrderByDateAscTimeAsc(branchId, actor.id())
                : reservationRepository.findByBranchIdOrderByDateAscTimeAsc(branchId);
        return reservations.stream().map(ReservationResponse::from).toList();
    }

    private static ProblemException notFound(Long id) {
        return ProblemException.notFound("reservations.not_found", "reservation " + id + " not found");
    }
}
