package com.cleanwater.backend.modules.whitelist.application;

import java.util.List;
import java.util.Map;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.access.application.AccessScopeResolver;
import com.cleanwater.backend.modules.access.domain.AccessCapability;
import com.cleanwater.backend.modules.audit.application.AuditAction;
import com.cleanwater.backend.modules.audit.application.AuditActor;
import com.cleanwater.backend.modules.audit.application.AuditRecorder;
import com.cleanwater.backend.modules.whitelist.domain.AllowedEmail;
import com.cleanwater.backend.modules.whitelist.infrastructure.persistence.AllowedEmailRepository;
import com.cleanwater.backend.modules.whitelist.presentation.dto.AllowedEmailResponse;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AllowedEmailService {

    private static final String RESOURCE_TYPE = "allowed_email";

    private final AllowedEmailRepository allowedEmailRepository;
    private final AccessScopeResolver accessScopeResolver;
    private final AuditRecorder auditRecorder;

    public AllowedEmailService(
            AllowedEmailRepository allowedEmailRepository,
            AccessScopeResolver accessScopeResolver,
            AuditRecorder auditRecorder
    ) {
        this.allowedEmailRepository = allowedEmailRepository;
        this.accessScopeResolver = accessScopeResolver;
        this.auditRecorder = auditRecorder;
    }

    public AllowedEmailResponse add(AuthenticatedUser actor, String email) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_EMAIL_WHITELIST);
        String normalized = email == null ? "" : email.trim();
        if (normalized.isEmpty() || normalized.equals(AllowedEmail.DOMAIN_PREFIX)) {
            throw ProblemException.invalidInput("whitelist.invalid_entry", "Entry must be an email address or an @domain pattern");
        }
        if (allowedEmailRepository.existsByEmail(normalized)) {
            throw ProblemException.conflict("whitelist.duplicate_entry", "Email already in whitelist");
        }
        AllowedEmail saved;
        try {
            saved = allowedEmailRepository.saveAndFlush(new AllowedEmail(normalized, actor.userId()));
        } catch (DataIntegrityViolationException ex) {
            throw ProblemException.conflict("whitelist.duplicate_entry", "Email already in whitelist");
        }
        auditRecorder.success(AuditAction.ALLOWED_EMAIL_CREATE, RESOURCE_TYPE, saved.getId(),
                AuditActor.of(actor.userId(), actor.username()),
                Map.of("email", saved.getEmail(), "domainPattern", saved.isDomainPattern()));
        return AllowedEmailResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<AllowedEmailResponse> list(AuthenticatedUser actor) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_EMAIL_WHITELIST);
        return allowedEmailRepository.findAllByOrderByEmailAsc().stream()
                .map(AllowedEmailResponse::from)
                .toList();
    }

    public void delete(AuthenticatedUser actor, Long id) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_EMAIL_WHITELIST);
        AllowedEmail entry = allowedEmailRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound("whitelist.entry_not_found", "Allowed email not found"));
        allowedEmailRepository.delete(entry);
        auditRecorder.success(AuditAction.ALLOWED_EMAIL_DELETE, RESOURCE_TYPE, id,
                AuditActor.of(actor.userId(), actor.username()),
                Map.of("email", entry.getEmail()));
    }
}
