package com.steakz.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import com.steakz.backend.global.security.JwtAuthenticationPrincipal;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class CurrentActorProviderTest {

    @Mock
    private AppUserRepository appUserRepository;

    private CurrentActorProvider provider;

    @BeforeEach
    void setUp() {
        provider = new CurrentActorProvider(appUserRepository);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("a demoted account acts with its stored role while the old token is still valid")
    void storedRoleWinsOverTokenClaim() {
        authenticate(new JwtAuthenticationPrincipal(21L, "lead@steakz.test", "BRANCH_MANAGER"));
        AppUser demoted = user(21L, Role.FRONT_STAFF, 1L);
        demoted.setActiveBranchId(4L);
        when(appUserRepository.findById(21L)).thenReturn(Optional.of(demoted));

        Actor actor = provider.currentActor();

        assertThat(actor).isEqualTo(new Actor(21L, Role.FRONT_STAFF, 1L, 4L));
    }

    @Test
    void malformedRoleClaimYieldsActorWithoutRole() {
        authenticate(new JwtAuthenticationPrincipal(22L, "odd@steakz.test", "janitor"));
        when(appUserRepository.findById(22L)).thenReturn(Optional.of(user(22L, Role.CUSTOMER, 1L)));

        assertThat(provider.currentActor().role()).isNull();
    }

    @Test
    void missingPrincipalOrAccountYieldsNoActor() {
        assertThat(provider.currentActor()).isNull();

        authenticate(new JwtAuthenticationPrincipal(23L, "gone@steakz.test", "CUSTOMER"));
        when(appUserRepository.findById(23L)).thenReturn(Optional.empty());

        assertThat(provider.currentActor()).isNull();
    }

    private static void authenticate(JwtAuthenticationPrincipal principal) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, "token", List.of()));
    }

    private static AppUser user(Long id, Role role, Long branchId) {
        AppUser user = new AppUser("user" + id + "@steakz.test", "hash", role, branchId);
        ReflectionTestUtils.setField(user, "id", id);
        return user;
    }
}
