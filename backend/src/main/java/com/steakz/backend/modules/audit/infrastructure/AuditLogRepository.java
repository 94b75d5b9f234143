package com.steakz.backend.modules.audit.infrastructure;

import java.util.List;

import com.steakz.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByActionTypeOrderByIdDesc(String actionType);
}
