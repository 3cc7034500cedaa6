package com.cleanwater.backend.modules.device.domain;

public enum DeviceCredentialStatus {
    PENDING_VALIDATION,
    VALIDATED,
    REVOKED
}
