package com.steakz.backend.modules.menu.infrastructure.persistence;

import java.util.List;

import com.steakz.backend.modules.menu.domain.MenuItem;

import org.springframework.data.jpa.repository.JpaRepository;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    List<MenuItem> findByBranchIdOrderByNameAsc(Long branchId);
}
