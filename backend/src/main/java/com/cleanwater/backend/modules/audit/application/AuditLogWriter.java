package com.cleanwater.backend.modules.audit.application;

import com.cleanwater.backend.modules.audit.domain.AuditLog;
import com.cleanwater.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogWriter {

    private final AuditLogRepository auditLogRepository;

    public AuditLogWriter(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void write(AuditEvent event) {
        AuditLog auditLog = new AuditLog();
        auditLog.setAction(event.action());
        auditLog.setResourceType(event.resourceType());
        auditLog.setResourceId(event.resourceId());
        auditLog.setActorUserId(event.actorUserId());
        auditLog.setActorUsername(event.actorUsername());
        auditLog.setOutcome(event.outcome());
        auditLog.setDetail(event.detail());
        auditLog.setIpAddress(event.ipAddress());
        auditLog.setUserAgent(event.userAgent());
        auditLog.setRequestId(event.requestId());
        auditLog.setCreatedAt(event.occurredAt());
        auditLogRepository.save(auditLog);
    }
}
