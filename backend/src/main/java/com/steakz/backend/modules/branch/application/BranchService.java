package com.steakz.backend.modules.branch.application;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.audit.application.AuditLogService;
import com.steakz.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.steakz.backend.modules.branch.domain.Branch;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.steakz.backend.modules.branch.presentation.dto.BranchAnalyticsResponse;
import com.steakz.backend.modules.branch.presentation.dto.BranchResponse;
import com.steakz.backend.modules.branch.presentation.dto.BranchSettingsResponse;
import com.steakz.backend.modules.branch.presentation.dto.SeedSampleResponse;
import com.steakz.backend.modules.branch.presentation.dto.UpdateBranchSettingsRequest;
import com.steakz.backend.modules.feedback.infrastructure.persistence.FeedbackRepository;
import com.steakz.backend.modules.inventory.infrastructure.persistence.InventoryItemRepository;
import com.steakz.backend.modules.order.infrastructure.persistence.CustomerOrderRepository;
import com.steakz.backend.modules.reservation.infrastructure.persistence.ReservationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BranchService {

    private static final Logger log = LoggerFactory.getLogger(BranchService.class);

    private final BranchRepository branchRepository;
    private final CustomerOrderRepository orderRepository;
    private final ReservationRepository reservationRepository;
    private final FeedbackRepository feedbackRepository;
    private final InventoryItemRepository inventoryItemRepository;
    private final AuditLogService auditLogService;
    private final BranchAccessGuard accessGuard;

    public BranchService(
            BranchRepository branchRepository,
            CustomerOrderRepository orderRepository,
            ReservationRepository reservationRepository,
            FeedbackRepository feedbackRepository,
            InventoryItemRepository inventoryItemRepository,
            AuditLogService auditLogService,
            BranchAccessGuard accessGuard
    ) {
        this.branchRepository = branchRepository;
        this.orderRepository = orderRepository;
        this.reservationRepository = reservationRepository;
        this.feedbackRepository = feedbackRepository;
        this.inventoryItemRepository = inventoryItemRepository;
        this.auditLogService = auditLogService;
        this.accessGuard = accessGuard;
    }

    /**
     * Branch selector data: the owner sees every branch, everyone else only their home branch.
     */
    @Transactional(readOnly = true)
    public List<BranchResponse> list(Actor actor) {
        accessGuard.authorizeOperation(ProtectedOperation.BRANCH_LIST, actor);
        if (actor.isTopRole()) {
            return branchRepository.findAllByOrderByNameAsc().stream().map(BranchResponse::from).toList();
        }
        Long homeBranchId = accessGuard.authorizeBranchScope(ProtectedOperation.BRANCH_LIST, actor, (String) null);
        return branchRepository.findById(homeBranchId).map(BranchResponse::from).stream().toList();
    }

    @Transactional(readOnly = true)
    public BranchAnalyticsResponse analytics(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.BRANCH_ANALYTICS, actor, pathBranchId);
        requireBranch(branchId);

        BigDecimal revenue = orderRepository.sumTotalByBranchId(branchId);
        Double averageRating = feedbackRepository.averageApprovedRating(branchId);
        return new BranchAnalyticsResponse(
                branchId,
                new BranchAnalyticsResponse.Sales(orderRepository.countByBranchId(branchId), revenue == null ? BigDecimal.ZERO : revenue),
                new BranchAnalyticsResponse.Reservations(reservationRepository.countByBranchId(branchId)),
                new BranchAnalyticsResponse.FeedbackSummary(
                        feedbackRepository.countByBranchIdAndApprovedTrue(branchId),
                        averageRating == null ? 0.0 : averageRating
                ),
                new BranchAnalyticsResponse.Inventory(inventoryItemRepository.countLowStock(branchId))
        );
    }

    @Transactional(readOnly = true)
    public BranchSettingsResponse settings(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.BRANCH_SETTINGS_READ, actor, pathBranchId);
        return BranchSettingsResponse.from(requireBranch(branchId));
    }

    @Transactional
    public BranchSettingsResponse updateSettings(Actor actor, String pathBranchId, UpdateBranchSettingsRequest request) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.BRANCH_SETTINGS_UPDATE, actor, pathBranchId);
        Branch branch = requireBranch(branchId);

        Map<String, Object> changed = new LinkedHashMap<>();
        apply(request.timezone(), branch::setTimezone, "timezone", changed);
        apply(request.latitude(), branch::setLatitude, "latitude", changed);
        apply(request.longitude(), branch::setLongitude, "longitude", changed);
        apply(request.openingTime(), branch::setOpeningTime, "openingTime", changed);
        apply(request.closingTime(), branch::setClosingTime, "closingTime", changed);
        apply(request.holidays(), branch::setHolidays, "holidays", changed);
        apply(request.country(), branch::setCountry, "country", changed);
        apply(request.city(), branch::setCity, "city", changed);
        apply(request.address(), branch::setAddress, "address", changed);
        apply(request.postalCode(), branch::setPostalCode, "postalCode", changed);
        apply(request.phone(), branch::setPhone, "phone", changed);
        apply(request.email(), branch::setEmail, "email", changed);

        if (!changed.isEmpty()) {
            auditLogService.record(new AuditLogCommand(
                    AuditLogService.BRANCH_SETTINGS_UPDATED,
                    "BRANCH",
                    branchId.toString(),
                    actor.id(),
                    branchId,
                    Map.of("fields", List.copyOf(changed.keySet()))
            ));
        }
        return BranchSettingsResponse.from(branch);
    }

    /**
     * Creates the London, Paris and Madrid sample branches unless a branch with the same name and
     * city already exists.
     */
    @Transactional
    public SeedSampleResponse seedSampleBranches(Actor actor) {
        accessGuard.authorizeOperation(ProtectedOperation.BRANCH_SEED_SAMPLE, actor);

        List<SeedSampleResponse.Entry> summary = new ArrayList<>();
        for (SampleBranch sample : SampleBranch.values()) {
            Optional<Branch> existing = branchRepository.findFirstByNameAndCity(sample.branchName, sample.city);
            if (existing.isPresent()) {
                summary.add(new SeedSampleResponse.Entry(sample.branchName, "skipped", existing.get().getId()));
                continue;
            }
            Branch created = branchRepository.save(sample.toBranch());
            summary.add(new SeedSampleResponse.Entry(sample.branchName, "created", created.getId()));
        }
        log.info("Sample branches seeded by user {}: {}", actor.id(), summary);
        return new SeedSampleResponse(summary);
    }

    private Branch requireBranch(Long branchId) {
        return branchRepository.findById(branchId)
                .orElseThrow(() -> ProblemException.notFound("branch.not_found", "branch " + branchId + " does not exist"));
    }

    private static <T> void apply(T value, Consumer<T> setter, String field, Map<String, Object> changed) {
        if (value != null) {
            setter.accept(value);
            changed.put(field, value);
        }
    }

    private enum SampleBranch {
        LONDON("Steakz London", "London", "UK", "Europe/London", "10 Downing St", "SW1A 2AA",
                "+44 20 7946 0000", "london@steakz.example", 51.5034, -0.1276),
        PARIS("Steakz Paris", "Paris", "France", "Europe/Paris", "5 Avenue Anatole France", "75007",
                "+33 1 2345 6789", "paris@steakz.example", 48.8584, 2.2945),
        MADRID("Steakz Madrid", "Madrid", "Spain", "Europe/Madrid", "Plaza Mayor", "28012",
                "+34 91 123 4567", "madrid@steakz.example", 40.4168, -3.7038);

        private final String branchName;
        private final String city;
        private final String country;
        private final String timezone;
        private final String address;
        private final String postalCode;
        private final String phone;
        private final String email;
        private final double latitude;
        private final double longitude;

        SampleBranch(String branchName, String city, String country, String timezone, String address,
                     String postalCode, String phone, String email, double latitude, double longitude) {
            this.branchName = branchName;
            this.city = city;
            this.country = country;
            this.timezone = timezone;
            this.address = address;
            this.postalCode = postalCode;
            this.phone = phone;
            this.email = email;
            this.latitude = latitude;
            this.longitude = longitude;
        }

        Branch toBranch() {
            Branch branch = new Branch(branchName, city);
            branch.setCity(city);
            branch.setCountry(country);
            branch.setTimezone(timezone);
            branch.setAddress(address);
            branch.setPostalCode(postalCode);
            branch.setPhone(phone);
            branch.setEmail(email);
            branch.setLatitude(latitude);
            branch.setLongitude(longitude);
            branch.setOpeningTime(LocalTime.of(9, 0));
            branch.setClosingTime(LocalTime.of(22, 0));
            return branch;
        }
    }
}
