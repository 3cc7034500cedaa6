package com.cleanwater.backend.modules.audit.infrastructure;

import java.util.List;

import com.cleanwater.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByActionOrderByIdAsc(String action);
}
