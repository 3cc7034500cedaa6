package com.cleanwater.backend.modules.access.domain;

public enum AccessCapability {
    READ_SCOPED_DATA,
    MANAGE_USERS,
    ASSIGN_USERS_WITHIN_REGION,
    MANAGE_DEVICE_CREDENTIALS,
    MANAGE_EMAIL_WHITELIST
}
