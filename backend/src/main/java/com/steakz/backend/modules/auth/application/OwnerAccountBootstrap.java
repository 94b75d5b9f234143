package com.steakz.backend.modules.auth.application;

import java.util.Locale;

import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.steakz.backend.modules.branch.domain.Branch;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the first owner account from configuration so a fresh installation can be administered.
 * Does nothing when the settings are blank or the account already exists.
 */
@Component
public class OwnerAccountBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OwnerAccountBootstrap.class);

    private final AppUserRepository appUserRepository;
    private final BranchRepository branchRepository;
    private final PasswordEncoder passwordEncoder;
    private final String ownerEmail;
    private final String ownerPassword;

    public OwnerAccountBootstrap(
            AppUserRepository appUserRepository,
            BranchRepository branchRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.bootstrap.owner-email:}") String ownerEmail,
            @Value("${app.bootstrap.owner-password:}") String ownerPassword
    ) {
        this.appUserRepository = appUserRepository;
        this.branchRepository = branchRepository;
        this.passwordEncoder = passwordEncoder;
        this.ownerEmail = ownerEmail;
        this.ownerPassword = ownerPassword;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (ownerEmail == null || ownerEmail.isBlank() || ownerPassword == null || ownerPassword.isBlank()) {
            return;
        }
        String email = ownerEmail.trim().toLowerCase(Locale.ROOT);
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            return;
        }
        if (ownerPassword.length() < 8) {
            log.warn("Owner bootstrap skipped: app.bootstrap.owner-password must be at least 8 characters");
            return;
        }
        Long homeBranchId = branchRepository.findAllByOrderByNameAsc().stream()
                .findFirst()
                .map(Branch::getId)
                .orElse(null);
        AppUser owner = appUserRepository.save(new AppUser(email, passwordEncoder.encode(ownerPassword), Role.OWNER_ADMIN, homeBranchId));
        log.info("Owner account {} created with home branch {}", owner.getId(), homeBranchId);
    }
}
