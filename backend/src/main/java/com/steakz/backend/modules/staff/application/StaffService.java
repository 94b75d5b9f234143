package com.steakz.backend.modules.staff.application;

import java.time.Clock;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.audit.application.AuditLogService;
import com.steakz.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.steakz.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.steakz.backend.modules.staff.presentation.dto.CreateStaffRequest;
import com.steakz.backend.modules.staff.presentation.dto.StaffResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Staff accounts are ordinary {@link AppUser} rows with a staff role.
 */
@Service
public class StaffService {

    private static final Logger log = LoggerFactory.getLogger(StaffService.class);

    static final Set<Role> STAFF_ROLES = Arrays.stream(Role.values())
            .filter(Role::isStaff)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Role.class)));

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final BranchRepository branchRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditLogService auditLogService;
    private final BranchAccessGuard accessGuard;
    private final Clock clock;

    public StaffService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            BranchRepository branchRepository,
            PasswordEncoder passwordEncoder,
            AuditLogService auditLogService,
            BranchAccessGuard accessGuard,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.branchRepository = branchRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditLogService = auditLogService;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<StaffResponse> listForBranch(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.STAFF_LIST, actor, pathBranchId);
        return appUserRepository.findByBranchAndRoles(branchId, STAFF_ROLES).stream()
                .map(StaffResponse::from)
                .toList();
    }

    @Transactional
    public StaffResponse create(Actor actor, CreateStaffRequest request) {
        accessGuard.authorizeOperation(ProtectedOperation.STAFF_CREATE, actor);

        Role role = Role.fromCode(request.role())
                .filter(Role::isStaff)
                .orElseThrow(() -> ProblemException.badRequest("staff.invalid_role",
                        "role must be one of BRANCH_MANAGER, KITCHEN_STAFF, FRONT_STAFF"));
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("staff.email_taken", "an account with this email already exists");
        }
        if (!branchRepository.existsById(request.branchId())) {
            throw ProblemException.notFound("branch.not_found", "branch " + request.branchId() + " does not exist");
        }

        AppUser staff = appUserRepository.save(new AppUser(
                email,
                passwordEncoder.encode(request.password()),
                role,
                request.branchId()
        ));
        auditLogService.record(new AuditLogCommand(
                AuditLogService.STAFF_CREATED,
                "APP_USER",
                staff.getId().toString(),
                actor.id(),
                staff.getBranchId(),
                Map.of("role", role.name(), "email", email)
        ));
        log.info("Staff account {} ({}) created in branch {} by user {}", staff.getId(), role, staff.getBranchId(), actor.id());
        return StaffResponse.from(staff);
    }

    /**
     * Sets a new password and revokes the account's refresh sessions.
     */
    @Transactional
    public void resetPassword(Actor actor, Long staffId, String newPassword) {
        accessGuard.authorizeOperation(ProtectedOperation.STAFF_RESET_PASSWORD, actor);

        AppUser staff = appUserRepository.findById(staffId)
                .orElseThrow(() -> ProblemException.notFound("staff.not_found", "staff account " + staffId + " not found"));
        if (staff.getRole() == null || !staff.getRole().isStaff()) {
            throw ProblemException.badRequest("staff.not_staff", "account " + staffId + " is not a staff account");
        }

        staff.setPasswordHash(passwordEncoder.encode(newPassword));
        userSessionRepository.revokeAllForUser(staffId, OffsetDateTime.now(clock), "PASSWORD_RESET");
        auditLogService.record(new AuditLogCommand(
                AuditLogService.STAFF_PASSWORD_RESET,
                "APP_USER",
                staffId.toString(),
                actor.id(),
                staff.getBranchId(),
                Map.of()
        ));
        log.info("Password of staff account {} reset by user {}", staffId, actor.id());
    }
}
