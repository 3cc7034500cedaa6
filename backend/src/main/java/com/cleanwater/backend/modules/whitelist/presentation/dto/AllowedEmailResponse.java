package com.cleanwater.backend.modules.whitelist.presentation.dto;

import java.time.OffsetDateTime;

import com.cleanwater.backend.modules.whitelist.domain.AllowedEmail;

public record AllowedEmailResponse(Long id, String email, boolean domainPattern, Long createdBy, OffsetDateTime createdAt) {

    public static AllowedEmailResponse from(AllowedEmail entry) {
        return new AllowedEmailResponse(
                entry.getId(),
                entry.getEmail(),
                entry.isDomainPattern(),
                entry.getCreatedByUserId(),
                entry.getCreatedAt()
        );
    }
}
