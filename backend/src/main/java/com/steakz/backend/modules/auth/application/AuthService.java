package com.steakz.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.auth.domain.AppUser;
import com.steakz.backend.modules.auth.domain.UserSession;
import com.steakz.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.steakz.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.steakz.backend.modules.auth.presentation.dto.LoginRequest;
import com.steakz.backend.modules.auth.presentation.dto.LoginResponse;
import com.steakz.backend.modules.auth.presentation.dto.LogoutRequest;
import com.steakz.backend.modules.auth.presentation.dto.RefreshRequest;
import com.steakz.backend.modules.auth.presentation.dto.SignupRequest;
import com.steakz.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.steakz.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final BranchRepository branchRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            BranchRepository branchRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.branchRepository = branchRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    /**
     * Self-service registration always yields a customer of the chosen branch.
     */
    @Transactional
    public LoginResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("auth.email_taken", "an account with this email already exists");
        }
        if (!branchRepository.existsById(request.branchId())) {
            throw ProblemException.notFound("branch.not_found", "branch " + request.branchId() + " does not exist");
        }
        AppUser user = appUserRepository.save(new AppUser(
                email,
                passwordEncoder.encode(request.password()),
                Role.CUSTOMER,
                request.branchId()
        ));
        log.info("Customer {} registered in branch {}", user.getId(), user.getBranchId());
        return startSession(user, normalizeDeviceId(request.deviceId()));
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        userSessionRepository.revokeExpiredSessions(user.getId(), OffsetDateTime.now(clock), REASON_EXPIRED);
        return startSession(user, normalizeDeviceId(request.deviceId()));
    }

    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(RefreshTokenHasher.hash(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.getRevokedAt() != null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (!session.getExpiresAt().isAfter(now)) {
            session.revoke(now, REASON_EXPIRED);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            session.revoke(now, REASON_DEVICE_MISMATCH);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_DEVICE_MISMATCH");
        }

        // one-time use: the presented token is retired before a new one is issued
        session.revoke(now, REASON_ROTATED);

        AppUser user = session.getUser();
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);
        return startSession(user, requestDeviceId != null ? requestDeviceId : sessionDeviceId);
    }

    /**
     * Unknown or already revoked tokens get the same response so token validity is not disclosed.
     */
    public void logout(LogoutRequest request) {
        userSessionRepository.revokeByRefreshTokenHash(
                RefreshTokenHasher.hash(request.refreshToken()),
                OffsetDateTime.now(clock),
                REASON_LOGOUT
        );
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(Long userId) {
        return appUserRepository.findById(userId)
                .map(UserProfileResponse::from)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "account no longer exists"));
    }

    private LoginResponse startSession(AppUser user, String deviceId) {
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(
                user.getId(), user.getEmail(), user.getRole().name(), refreshToken);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(RefreshTokenHasher.hash(refreshToken));
        session.setIssuedAt(tokens.issuedAt());
        session.setExpiresAt(tokens.issuedAt().plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);
        userSessionRepository.save(session);

        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > DEVICE_ID_MAX_LENGTH ? trimmed.substring(0, DEVICE_ID_MAX_LENGTH) : trimmed;
    }
}
