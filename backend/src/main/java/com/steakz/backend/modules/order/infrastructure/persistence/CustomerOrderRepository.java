package com.steakz.backend.modules.order.infrastructure.persistence;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import com.steakz.backend.modules.order.domain.CustomerOrder;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomerOrderRepository extends JpaRepository<CustomerOrder, Long> {

    @EntityGraph(attributePaths = {"items", "items.menuItem"})
    List<CustomerOrder> findByBranchIdOrderByCreatedAtDescIdDesc(Long branchId);

    @EntityGraph(attributePaths = {"items", "items.menuItem"})
    List<CustomerOrder> findByBranchIdAndUserIdOrderByCreatedAtDescIdDesc(Long branchId, Long userId);

    @Query("select o.branchId from CustomerOrder o where o.id = :id")
    Optional<Long> findBranchIdById(@Param("id") Long id);

    long countByBranchId(Long branchId);

    @Query("select coalesce(sum(o.total), 0) from CustomerOrder o where o.branchId = :branchId")
    BigDecimal sumTotalByBranchId(@Param("branchId") Long branchId);
}
