package com.steakz.backend.modules.reservation.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.steakz.backend.modules.reservation.domain.Reservation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    List<Reservation> findByBranchIdOrderByDateAscTimeAsc(Long branchId);

    List<Reservation> findByBranchIdAndUserIdOrderByDateAscTimeAsc(Long branchId, Long userId);

    @Query("select r.branchId from Reservation r where r.id = :id")
    Optional<Long> findBranchIdById(@Param("id") Long id);

    long countByBranchId(Long branchId);
}
