package com.steakz.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.steakz.backend.global.web.RequestIdFilter;
import com.steakz.backend.modules.audit.domain.AuditLog;
import com.steakz.backend.modules.audit.infrastructure.AuditLogRepository;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String ACTIVE_BRANCH_CHANGED = "ACTIVE_BRANCH_CHANGED";
    public static final String STAFF_CREATED = "STAFF_CREATED";
    public static final String STAFF_PASSWORD_RESET = "STAFF_PASSWORD_RESET";
    public static final String BRANCH_SETTINGS_UPDATED = "BRANCH_SETTINGS_UPDATED";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog(
                command.actionType(),
                command.resourceType(),
                command.resourceKey(),
                OffsetDateTime.now(clock)
        );
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setBranchId(command.branchId());
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            Long actorUserId,
            Long branchId,
            Map<String, Object> detail
    ) {
    }
}
