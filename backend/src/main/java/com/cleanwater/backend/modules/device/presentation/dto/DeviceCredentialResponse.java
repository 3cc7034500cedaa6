package com.cleanwater.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;

import com.cleanwater.backend.modules.device.domain.DeviceCredential;
import com.cleanwater.backend.modules.device.domain.DeviceCredentialStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code key} is present only in the response to creation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceCredentialResponse(
        Long id,
        String key,
        String sensorId,
        Long hospitalId,
        String description,
        boolean active,
        boolean validated,
        DeviceCredentialStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime lastUsedAt
) {

    public static DeviceCredentialResponse withSecret(DeviceCredential credential) {
        return of(credential, credential.getSecret());
    }

    public static DeviceCredentialResponse from(DeviceCredential credential) {
        return of(credential, null);
    }

    private static DeviceCredentialResponse of(DeviceCredential credential, String key) {
        return new DeviceCredentialResponse(
                credential.getId(),
                key,
                credential.getSensorId(),
                credential.getHospitalId(),
                credential.getDescription(),
                credential.isActive(),
                credential.isValidated(),
                credential.getStatus(),
                credential.getCreatedAt(),
                credential.getLastUsedAt()
        );
    }
}
