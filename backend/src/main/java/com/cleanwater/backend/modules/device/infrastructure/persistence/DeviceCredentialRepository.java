package com.cleanwater.backend.modules.device.infrastructure.persistence;

import java.util.Optional;

import com.cleanwater.backend.modules.device.domain.DeviceCredential;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

public interface DeviceCredentialRepository
        extends JpaRepository<DeviceCredential, Long>, JpaSpecificationExecutor<DeviceCredential> {

    Optional<DeviceCredential> findBySecret(String secret);

    boolean existsBySensorId(String sensorId);
}
