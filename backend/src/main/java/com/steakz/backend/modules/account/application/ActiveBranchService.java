package com.steakz.backend.modules.account.application;

import java.util.HashMap;
import java.util.Map;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.BranchIdParser;
import com.steakz.backend.modules.access.domain.ParsedBranchId;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.account.presentation.dto.ActiveBranchResponse;
import com.steakz.backend.modules.audit.application.AuditLogService;
import com.steakz.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.steakz.backend.modules.branch.domain.Branch;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The owner's sticky branch selection. It is per-account state, read and written only by the
 * account itself; later requests without an explicit branch are scoped to it.
 */
@Service
public class ActiveBranchService {

    private static final Logger log = LoggerFactory.getLogger(ActiveBranchService.class);

    private final AppUserRepository appUserRepository;
    private final BranchRepository branchRepository;
    private final AuditLogService auditLogService;
    private final BranchAccessGuard accessGuard;

    public ActiveBranchService(
            AppUserRepository appUserRepository,
            BranchRepository branchRepository,
            AuditLogService auditLogService,
            BranchAccessGuard accessGuard
    ) {
        this.appUserRepository = appUserRepository;
        this.branchRepository = branchRepository;
        this.auditLogService = auditLogService;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public ActiveBranchResponse get(Actor actor, Long userId) {
        accessGuard.authorizeOperation(ProtectedOperation.ACTIVE_BRANCH_READ, actor);
        AppUser user = loadSelf(actor, userId);
        Long activeBranchId = user.getActiveBranchId();
        Branch branch = activeBranchId == null ? null : branchRepository.findById(activeBranchId).orElse(null);
        return ActiveBranchResponse.of(activeBranchId, branch);
    }

    @Transactional
    public ActiveBranchResponse update(Actor actor, Long userId, String requestedBranchId) {
        accessGuard.authorizeOperation(ProtectedOperation.ACTIVE_BRANCH_UPDATE, actor);
        AppUser user = loadSelf(actor, userId);

        ParsedBranchId parsed = BranchIdParser.parse(requestedBranchId);
        if (!parsed.isDefined()) {
            throw ProblemException.badRequest("account.branch_required", "a positive branchId is required");
        }
        Branch branch = branchRepository.findById(parsed.value())
                .orElseThrow(() -> ProblemException.notFound("branch.not_found", "branch " + parsed.value() + " does not exist"));

        Long previous = user.getActiveBranchId();
        user.setActiveBranchId(branch.getId());

        Map<String, Object> detail = new HashMap<>();
        detail.put("previousBranchId", previous);
        detail.put("activeBranchId", branch.getId());
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTIVE_BRANCH_CHANGED,
                "APP_USER",
                user.getId().toString(),
                actor.id(),
                branch.getId(),
                detail
        ));
        log.info("User {} switched active branch {} -> {}", user.getId(), previous, branch.getId());
        return ActiveBranchResponse.of(branch.getId(), branch);
    }

    private AppUser loadSelf(Actor actor, Long userId) {
        if (userId == null || !userId.equals(actor.id())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "account.not_self", "active branch can only be managed by its own account");
        }
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("account.not_found", "account no longer exists"));
    }
}
