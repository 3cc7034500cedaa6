package com.cleanwater.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.error.RetryableProblemException;
import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.audit.application.AuditAction;
import com.cleanwater.backend.modules.audit.application.AuditActor;
import com.cleanwater.backend.modules.audit.application.AuditRecorder;
import com.cleanwater.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.cleanwater.backend.modules.auth.domain.UserAccount;
import com.cleanwater.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.cleanwater.backend.modules.auth.presentation.dto.LoginRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.LoginResponse;
import com.cleanwater.backend.modules.auth.presentation.dto.RefreshRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.RegisterRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.cleanwater.backend.modules.auth.presentation.dto.TwoFactorLoginRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.cleanwater.backend.modules.whitelist.application.EmailWhitelistMatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Registration, credential login with lockout, second-factor completion, token refresh and
 * bearer-token authentication.
 *
 * <p>Every credential, token or code failure surfaces as the same generic
 * {@link ProblemException#unauthorized()} so callers cannot tell which factor was wrong.
 * Failed attempts are persisted even though the call fails, hence
 * {@code noRollbackFor = ResponseStatusException.class}. Registration opts out of that so a
 * lost unique-constraint race rolls back instead of committing a rollback-only transaction.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String RESOURCE_TYPE = "user";
    private static final String DUMMY_PASSWORD = "timing-equalizer-Passw0rd";

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicy passwordPolicy;
    private final LoginLockoutPolicy lockoutPolicy;
    private final JwtTokenService jwtTokenService;
    private final TotpService totpService;
    private final EmailWhitelistMatcher emailWhitelistMatcher;
    private final AuditRecorder auditRecorder;
    private final Clock clock;
    private final String dummyPasswordHash;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder,
            PasswordPolicy passwordPolicy,
            LoginLockoutPolicy lockoutPolicy,
            JwtTokenService jwtTokenService,
            TotpService totpService,
            EmailWhitelistMatcher emailWhitelistMatcher,
            AuditRecorder auditRecorder,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
        this.passwordPolicy = passwordPolicy;
        this.lockoutPolicy = lockoutPolicy;
        this.jwtTokenService = jwtTokenService;
        this.totpService = totpService;
        this.emailWhitelistMatcher = emailWhitelistMatcher;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode(DUMMY_PASSWORD);
    }

    @Transactional
    public UserProfileResponse register(RegisterRequest request) {
        passwordPolicy.check(request.password());

        if (!emailWhitelistMatcher.isAllowed(request.email())) {
            auditRecorder.failure(AuditAction.USER_REGISTER, RESOURCE_TYPE, null, AuditActor.system(),
                    Map.of("username", request.username(), "reason", "email_not_whitelisted"));
            throw ProblemException.forbidden("auth.email_not_allowed",
                    "Email not authorized for registration. Please contact an administrator.");
        }
        if (userAccountRepository.existsByUsername(request.username())) {
            throw ProblemException.conflict("auth.username_taken", "Username already registered");
        }
        if (userAccountRepository.existsByEmail(request.email())) {
            throw ProblemException.conflict("auth.email_taken", "Email already registered");
        }

        UserAccount user = new UserAccount();
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        try {
            user = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // concurrent registration won the unique constraint
            throw ProblemException.conflict("auth.account_exists", "Username or email already registered");
        }

        log.info("Registered user {} awaiting role assignment", user.getId());
        auditRecorder.success(AuditAction.USER_REGISTER, RESOURCE_TYPE, user.getId(),
                AuditActor.of(user.getId(), user.getUsername()), Map.of("email", user.getEmail()));
        return UserProfileResponse.from(user);
    }

    public LoginResponse login(LoginRequest request) {
        Instant now = clock.instant();
        UserAccount user = userAccountRepository.findByUsername(request.username()).orElse(null);

        if (user == null) {
            passwordEncoder.matches(request.password(), dummyPasswordHash);
            auditRecorder.failure(AuditAction.USER_LOGIN, RESOURCE_TYPE, null, AuditActor.system(),
                    Map.of("username", request.username(), "reason", "unknown_user"));
            throw ProblemException.unauthorized();
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            registerFailure(user, now, "invalid_password");
            throw ProblemException.unauthorized();
        }

        if (lockoutPolicy.isLocked(user, now)) {
            long retryAfter = lockoutPolicy.remainingLockSeconds(user, now);
            auditRecorder.failure(AuditAction.USER_LOGIN, RESOURCE_TYPE, user.getId(), actorOf(user),
                    Map.of("reason", "account_locked"));
            throw RetryableProblemException.locked(retryAfter);
        }

        if (user.isTwoFactorEnabled()) {
            return LoginResponse.secondFactorRequired();
        }

        return LoginResponse.authenticated(completeLogin(user, now, false));
    }

    public TokenPairResponse completeTwoFactor(TwoFactorLoginRequest request) {
        Instant now = clock.instant();
        UserAccount user = userAccountRepository.findByUsername(request.username())
                .orElseThrow(ProblemException::unauthorized);

        if (!user.isTwoFactorEnabled() || lockoutPolicy.isLocked(user, now)) {
            throw ProblemException.unauthorized();
        }
        if (!totpService.verify(user.getTotpSecret(), request.code())) {
            registerFailure(user, now, "invalid_2fa_code");
            throw ProblemException.unauthorized();
        }
        return completeLogin(user, now, true);
    }

    public TokenPairResponse refresh(RefreshRequest request) {
        String username;
        try {
            username = jwtTokenService.verify(request.refreshToken(), TokenType.REFRESH);
        } catch (InvalidTokenException ex) {
            throw ProblemException.unauthorized();
        }
        UserAccount user = userAccountRepository.findByUsername(username)
                .orElseThrow(ProblemException::unauthorized);

        auditRecorder.success(AuditAction.TOKEN_REFRESH, RESOURCE_TYPE, user.getId(), actorOf(user), Map.of());
        return jwtTokenService.issueTokenPair(user.getUsername());
    }

    /**
     * Resolves a bearer access token to the stored identity it names.
     */
    @Transactional(readOnly = true)
    public AuthenticatedUser authenticate(String accessToken) {
        String username;
        try {
            username = jwtTokenService.verify(accessToken, TokenType.ACCESS);
        } catch (InvalidTokenException ex) {
            throw ProblemException.unauthorized();
        }
        UserAccount user = userAccountRepository.findByUsername(username)
                .orElseThrow(ProblemException::unauthorized);
        return new AuthenticatedUser(
                user.getId(),
                user.getUsername(),
                user.getRole(),
                user.getRegionId(),
                user.getHospitalId()
        );
    }

    /**
     * Tokens are stateless; the client discards them. Only the event is recorded.
     */
    public void logout(AuthenticatedUser user) {
        auditRecorder.success(AuditAction.USER_LOGOUT, RESOURCE_TYPE, user.userId(),
                AuditActor.of(user.userId(), user.username()), Map.of());
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(Long userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("auth.user_not_found", "User not found"));
        return UserProfileResponse.from(user);
    }

    private TokenPairResponse completeLogin(UserAccount user, Instant now, boolean viaSecondFactor) {
        lockoutPolicy.recordSuccess(user, now);
        userAccountRepository.save(user);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("twoFactor", viaSecondFactor);
        auditRecorder.success(AuditAction.USER_LOGIN, RESOURCE_TYPE, user.getId(), actorOf(user), detail);
        return jwtTokenService.issueTokenPair(user.getUsername());
    }

    private void registerFailure(UserAccount user, Instant now, String reason) {
        boolean locked = lockoutPolicy.recordFailure(user, now);
        userAccountRepository.save(user);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reason", reason);
        detail.put("failedAttempts", user.getFailedLoginAttempts());
        if (locked) {
            detail.put("lockedUntil", user.getLockedUntil().toString());
            log.warn("User {} locked after {} failed attempts", user.getId(), user.getFailedLoginAttempts());
        }
        auditRecorder.failure(AuditAction.USER_LOGIN, RESOURCE_TYPE, user.getId(), actorOf(user), detail);
    }

    private static AuditActor actorOf(UserAccount user) {
        return AuditActor.of(user.getId(), user.getUsername());
    }
}
