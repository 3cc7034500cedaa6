package com.cleanwater.backend.modules.audit.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Persists audit events after the primary transaction. Successful actions are written only
 * when their change committed; failures are written however the transaction ended, since a
 * failed operation usually rolls back. Outside a transaction the event is written at once.
 */
@Component
public class AuditEventListener {

    private static final Logger log = LoggerFactory.getLogger(AuditEventListener.class);

    private final AuditLogWriter auditLogWriter;

    public AuditEventListener(AuditLogWriter auditLogWriter) {
        this.auditLogWriter = auditLogWriter;
    }

    @TransactionalEventListener(
            phase = TransactionPhase.AFTER_COMMIT,
            fallbackExecution = true,
            condition = "#event.outcome() == T(com.cleanwater.backend.modules.audit.domain.AuditOutcome).SUCCESS"
    )
    public void onSuccess(AuditEvent event) {
        persist(event);
    }

    @TransactionalEventListener(
            phase = TransactionPhase.AFTER_COMPLETION,
            fallbackExecution = true,
            condition = "#event.outcome() == T(com.cleanwater.backend.modules.audit.domain.AuditOutcome).FAILURE"
    )
    public void onFailure(AuditEvent event) {
        persist(event);
    }

    void persist(AuditEvent event) {
        try {
            auditLogWriter.write(event);
        } catch (RuntimeException ex) {
            log.warn("Audit write failed action={} outcome={} resourceType={} resourceId={}",
                    event.action(), event.outcome(), event.resourceType(), event.resourceId(), ex);
        }
    }
}
