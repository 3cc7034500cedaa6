package com.cleanwater.backend.modules.access.presentation.dto;

import java.time.OffsetDateTime;

import com.cleanwater.backend.modules.auth.domain.UserAccount;

public record UserSummaryResponse(
        Long id,
        String username,
        String email,
        int role,
        String roleName,
        Long regionId,
        Long hospitalId,
        boolean twoFactorEnabled,
        OffsetDateTime lastLoginAt
) {

    public static UserSummaryResponse from(UserAccount user) {
        return new UserSummaryResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getRole().getCode(),
                user.getRole().name(),
                user.getRegionId(),
                user.getHospitalId(),
                user.isTwoFactorEnabled(),
                user.getLastLoginAt()
        );
    }
}
