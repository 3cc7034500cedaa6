package com.cleanwater.backend.modules.audit.application;

/**
 * Who performed an audited action. Both fields are null for system actions.
 */
public record AuditActor(Long userId, String username) {

    private static final AuditActor SYSTEM = new AuditActor(null, null);

    public static AuditActor of(Long userId, String username) {
        return new AuditActor(userId, username);
    }

    public static AuditActor system() {
        return SYSTEM;
    }
}
