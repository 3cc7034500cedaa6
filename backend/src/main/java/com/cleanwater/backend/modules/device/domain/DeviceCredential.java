package com.cleanwater.backend.modules.device.domain;

import java.time.OffsetDateTime;

import com.cleanwater.backend.global.jpa.AbstractTimestampedEntity;
import com.cleanwater.backend.modules.organization.domain.Hospital;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * API key of one sensor device.
 *
 * <p>Lifecycle: created unvalidated, validated by an administrator, revoked for good.
 * Revocation only clears {@code active}; nothing sets it back.
 */
@Entity
@Table(name = "api_keys")
public class DeviceCredential extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "key", nullable = false, unique = true, length = 255, updatable = false)
    private String secret;

    @Column(name = "sensor_id", nullable = false, unique = true, length = 100, updatable = false)
    private String sensorId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "hospital_id", nullable = false)
    private Hospital hospital;

    @Column(name = "description", length = 200)
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_validated", nullable = false)
    private boolean validated;

    @Column(name = "last_used")
    private OffsetDateTime lastUsedAt;

    protected DeviceCredential() {
    }

    public DeviceCredential(String secret, String sensorId, Hospital hospital, String description) {
        this.secret = secret;
        this.sensorId = sensorId;
        this.hospital = hospital;
        this.description = description;
    }

    public Long getId() {
        return id;
    }

    public String getSecret() {
        return secret;
    }

    public String getSensorId() {
        return sensorId;
    }

    public Hospital getHospital() {
        return hospital;
    }

    public Long getHospitalId() {
        return hospital == null ? null : hospital.getId();
    }

    public String getDescription() {
        return description;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isValidated() {
        return validated;
    }

    public OffsetDateTime getLastUsedAt() {
        return lastUsedAt;
    }

    public DeviceCredentialStatus getStatus() {
        if (!active) {
            return DeviceCredentialStatus.REVOKED;
        }
        return validated ? DeviceCredentialStatus.VALIDATED : DeviceCredentialStatus.PENDING_VALIDATION;
    }

    /**
     * @throws IllegalStateException if the credential was revoked
     */
    public void validate() {
        if (!active) {
            throw new IllegalStateException("Revoked credential cannot be validated");
        }
        this.validated = true;
    }

    public void revoke() {
        this.active = false;
    }

    public void markUsed(OffsetDateTime usedAt) {
        this.lastUsedAt = usedAt;
    }
}
