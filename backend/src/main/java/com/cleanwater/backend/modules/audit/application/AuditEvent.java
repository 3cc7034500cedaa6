package com.cleanwater.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.Map;

import com.cleanwater.backend.modules.audit.domain.AuditOutcome;

/**
 * Snapshot of one security event, taken at the moment it happened.
 * {@code actorUserId} and {@code actorUsername} are null for system-initiated events.
 */
public record AuditEvent(
        String action,
        String resourceType,
        String resourceId,
        Long actorUserId,
        String actorUsername,
        AuditOutcome outcome,
        Map<String, Object> detail,
        String ipAddress,
        String userAgent,
        String requestId,
        OffsetDateTime occurredAt
) {
}
