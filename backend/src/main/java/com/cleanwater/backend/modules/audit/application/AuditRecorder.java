package com.cleanwater.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.cleanwater.backend.global.web.RequestMetadata;
import com.cleanwater.backend.global.web.RequestMetadataAccessor;
import com.cleanwater.backend.modules.audit.domain.AuditOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point for security auditing. Recording only publishes an {@link AuditEvent}; the write
 * happens in {@link AuditEventListener} once the surrounding transaction has finished, so a
 * failing audit write can never roll back or abort the caller.
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final ApplicationEventPublisher eventPublisher;
    private final RequestMetadataAccessor requestMetadataAccessor;
    private final Clock clock;

    public AuditRecorder(
            ApplicationEventPublisher eventPublisher,
            RequestMetadataAccessor requestMetadataAccessor,
            Clock clock
    ) {
        this.eventPublisher = eventPublisher;
        this.requestMetadataAccessor = requestMetadataAccessor;
        this.clock = clock;
    }

    public void success(String action, String resourceType, Object resourceId, AuditActor actor, Map<String, ?> detail) {
        record(action, resourceType, resourceId, actor, AuditOutcome.SUCCESS, detail);
    }

    public void failure(String action, String resourceType, Object resourceId, AuditActor actor, Map<String, ?> detail) {
        record(action, resourceType, resourceId, actor, AuditOutcome.FAILURE, detail);
    }

    public void record(
            String action,
            String resourceType,
            Object resourceId,
            AuditActor actor,
            AuditOutcome outcome,
            Map<String, ?> detail
    ) {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(resourceType, "resourceType is required");
        Objects.requireNonNull(outcome, "outcome is required");
        try {
            RequestMetadata metadata = requestMetadataAccessor.current()
                    .orElse(new RequestMetadata(null, null, null));
            AuditActor effectiveActor = actor != null ? actor : AuditActor.system();
            AuditEvent event = new AuditEvent(
                    action,
                    resourceType,
                    resourceId == null ? null : resourceId.toString(),
                    effectiveActor.userId(),
                    effectiveActor.username(),
                    outcome,
                    detail == null || detail.isEmpty() ? null : new HashMap<>(detail),
                    metadata.clientIp(),
                    metadata.userAgent(),
                    metadata.requestId(),
                    OffsetDateTime.now(clock)
            );
            eventPublisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish audit event action={} resourceType={}", action, resourceType, ex);
        }
    }
}
