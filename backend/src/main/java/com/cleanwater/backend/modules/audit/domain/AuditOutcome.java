package com.cleanwater.backend.modules.audit.domain;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
