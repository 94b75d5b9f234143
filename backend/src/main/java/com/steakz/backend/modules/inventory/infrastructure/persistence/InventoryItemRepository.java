package com.steakz.backend.modules.inventory.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.steakz.backend.modules.inventory.domain.InventoryItem;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InventoryItemRepository extends JpaRepository<InventoryItem, Long> {

    @EntityGraph(attributePaths = "menuItem")
    List<InventoryItem> findByBranchIdOrderByIdAsc(Long branchId);

    @Query("select i.branchId from InventoryItem i where i.id = :id")
    Optional<Long> findBranchIdById(@Param("id") Long id);

    boolean existsByMenuItemIdAndBranchId(Long menuItemId, Long branchId);

    @Query("select count(i) from InventoryItem i where i.branchId = :branchId and i.quantity < i.minQuantity")
    long countLowStock(@Param("branchId") Long branchId);

    /**
     * Decrements only when enough stock is left. Returns 0 when the row is missing or short.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update InventoryItem i
               set i.quantity = i.quantity - :amount,
                   i.updatedAt = :now
             where i.menuItem.id = :menuItemId
               and i.branchId = :branchId
               and i.quantity >= :amount
            """)
    int decrementIfAvailable(@Param("menuItemId") Long menuItemId,
                             @Param("branchId") Long branchId,
                             @Param("amount") int amount,
                             @Param("now") OffsetDateTime now);
}
