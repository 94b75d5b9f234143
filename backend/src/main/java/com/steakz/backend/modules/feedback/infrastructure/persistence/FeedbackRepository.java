package com.steakz.backend.modules.feedback.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.steakz.backend.modules.feedback.domain.Feedback;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FeedbackRepository extends JpaRepository<Feedback, Long> {

    List<Feedback> findByBranchIdOrderByCreatedAtDescIdDesc(Long branchId);

    List<Feedback> findByBranchIdAndUserIdOrderByCreatedAtDescIdDesc(Long branchId, Long userId);

    @Query("select f.branchId from Feedback f where f.id = :id")
    Optional<Long> findBranchIdById(@Param("id") Long id);

    long countByBranchIdAndApprovedTrue(Long branchId);

    @Query("select avg(f.rating) from Feedback f where f.branchId = :branchId and f.approved = true")
    Double averageApprovedRating(@Param("branchId") Long branchId);
}
