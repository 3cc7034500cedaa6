package com.cleanwater.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.cleanwater.backend.modules.auth.domain.UserAccount;

public record UserProfileResponse(
        Long id,
        String username,
        String email,
        boolean twoFactorEnabled,
        int role,
        String roleName,
        Long regionId,
        Long hospitalId,
        OffsetDateTime createdAt,
        OffsetDateTime lastLoginAt
) {

    public static UserProfileResponse from(UserAccount user) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isTwoFactorEnabled(),
                user.getRole().getCode(),
                user.getRole().name(),
                user.getRegionId(),
                user.getHospitalId(),
                user.getCreatedAt(),
                user.getLastLoginAt()
        );
    }
}
