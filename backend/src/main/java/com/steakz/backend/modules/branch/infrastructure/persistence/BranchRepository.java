package com.steakz.backend.modules.branch.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.steakz.backend.modules.branch.domain.Branch;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BranchRepository extends JpaRepository<Branch, Long> {

    List<Branch> findAllByOrderByNameAsc();

    Optional<Branch> findFirstByNameAndCity(String name, String city);
}
