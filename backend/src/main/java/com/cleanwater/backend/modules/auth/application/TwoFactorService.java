package com.cleanwater.backend.modules.auth.application;

import java.util.Map;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.modules.audit.application.AuditAction;
import com.cleanwater.backend.modules.audit.application.AuditActor;
import com.cleanwater.backend.modules.audit.application.AuditRecorder;
import com.cleanwater.backend.modules.auth.domain.UserAccount;
import com.cleanwater.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.cleanwater.backend.modules.auth.infrastructure.totp.QrCodeRenderer;
import com.cleanwater.backend.modules.auth.presentation.dto.TwoFactorEnrollmentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Switches the second factor on and off. Enabling always issues a new secret and takes effect
 * immediately; disabling discards the stored secret.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class TwoFactorService {

    private static final Logger log = LoggerFactory.getLogger(TwoFactorService.class);
    private static final String RESOURCE_TYPE = "user";

    private final UserAccountRepository userAccountRepository;
    private final TotpService totpService;
    private final QrCodeRenderer qrCodeRenderer;
    private final AuditRecorder auditRecorder;

    public TwoFactorService(
            UserAccountRepository userAccountRepository,
            TotpService totpService,
            QrCodeRenderer qrCodeRenderer,
            AuditRecorder auditRecorder
    ) {
        this.userAccountRepository = userAccountRepository;
        this.totpService = totpService;
        this.qrCodeRenderer = qrCodeRenderer;
        this.auditRecorder = auditRecorder;
    }

    public TwoFactorEnrollmentResponse enable(Long userId) {
        UserAccount user = loadUser(userId);
        if (user.isTwoFactorEnabled()) {
            throw ProblemException.conflict("auth.2fa_already_enabled", "2FA is already enabled");
        }
        String secret = totpService.generateSecret();
        String provisioningUri = totpService.provisioningUri(secret, user.getUsername());
        String qrCode = qrCodeRenderer.renderDataUri(provisioningUri);
        user.enableTwoFactor(secret);
        userAccountRepository.save(user);

        log.info("2FA enabled for user {}", user.getId());
        auditRecorder.success(AuditAction.TWO_FACTOR_ENABLE, RESOURCE_TYPE, user.getId(),
                AuditActor.of(user.getId(), user.getUsername()), Map.of());
        return new TwoFactorEnrollmentResponse(secret, provisioningUri, qrCode);
    }

    public void disable(Long userId) {
        UserAccount user = loadUser(userId);
        if (!user.isTwoFactorEnabled()) {
            throw ProblemException.conflict("auth.2fa_not_enabled", "2FA is not enabled");
        }
        user.disableTwoFactor();
        userAccountRepository.save(user);

        log.info("2FA disabled for user {}", user.getId());
        auditRecorder.success(AuditAction.TWO_FACTOR_DISABLE, RESOURCE_TYPE, user.getId(),
                AuditActor.of(user.getId(), user.getUsername()), Map.of());
    }

    private UserAccount loadUser(Long userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(ProblemException::unauthorized);
    }
}
