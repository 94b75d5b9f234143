package com.steakz.backend.modules.access.application;

import java.util.Optional;

import com.steakz.backend.global.security.JwtAuthenticationPrincipal;
import com.steakz.backend.global.security.SecurityUtils;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the {@link Actor} for the current request from the stored account, so a role change or
 * branch switch applies to the next request rather than when the access token expires.
 */
@Component
public class CurrentActorProvider {

    private static final Logger log = LoggerFactory.getLogger(CurrentActorProvider.class);

    private final AppUserRepository appUserRepository;

    public CurrentActorProvider(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    /**
     * Returns null when there is no authenticated principal or the account no longer exists;
     * the guard reports that as unauthenticated.
     */
    @Transactional(readOnly = true)
    public Actor currentActor() {
        Optional<JwtAuthenticationPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        if (principal.isEmpty() || principal.get().userId() == null) {
            return null;
        }
        Optional<AppUser> user = appUserRepository.findById(principal.get().userId());
        if (user.isEmpty()) {
            log.debug("Token subject {} has no account", principal.get().userId());
            return null;
        }
        if (Role.fromCode(principal.get().role()).isEmpty()) {
            log.debug("Unresolvable role claim '{}' for user {}", principal.get().role(), principal.get().userId());
            return toActor(user.get(), null);
        }
        return toActor(user.get(), user.get().getRole());
    }

    static Actor toActor(AppUser user, Role role) {
        return new Actor(user.getId(), role, user.getBranchId(), user.getActiveBranchId());
    }
}
