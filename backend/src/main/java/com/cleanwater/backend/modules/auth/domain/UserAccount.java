package com.cleanwater.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.cleanwater.backend.global.jpa.AbstractTimestampedEntity;
import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.access.domain.AccessRoleConverter;
import com.cleanwater.backend.modules.organization.domain.Hospital;
import com.cleanwater.backend.modules.organization.domain.Region;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Registered identity: credentials, lockout state, second factor, role and organizational assignment.
 * Never hard-deleted by the identity core.
 */
@Entity
@Table(name = "users")
public class UserAccount extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 100)
    private String email;

    @Column(name = "hashed_password", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "totp_secret", length = 255)
    private String totpSecret;

    @Column(name = "is_2fa_enabled", nullable = false)
    private boolean twoFactorEnabled;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "locked_until")
    private OffsetDateTime lockedUntil;

    @Column(name = "last_login")
    private OffsetDateTime lastLoginAt;

    @Convert(converter = AccessRoleConverter.class)
    @Column(name = "role", nullable = false)
    private AccessRole role = AccessRole.PENDING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "region_id")
    private Region region;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "hospital_id")
    private Hospital hospital;

    public Long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public String getTotpSecret() {
        return totpSecret;
    }

    public boolean isTwoFactorEnabled() {
        return twoFactorEnabled;
    }

    public void enableTwoFactor(String secret) {
        this.totpSecret = secret;
        this.twoFactorEnabled = true;
    }

    public void disableTwoFactor() {
        this.totpSecret = null;
        this.twoFactorEnabled = false;
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }

    public void setFailedLoginAttempts(int failedLoginAttempts) {
        this.failedLoginAttempts = failedLoginAttempts;
    }

    public OffsetDateTime getLockedUntil() {
        return lockedUntil;
    }

    public void setLockedUntil(OffsetDateTime lockedUntil) {
        this.lockedUntil = lockedUntil;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public void setLastLoginAt(OffsetDateTime lastLoginAt) {
        this.lastLoginAt = lastLoginAt;
    }

    public AccessRole getRole() {
        return role;
    }

    public void setRole(AccessRole role) {
        this.role = role;
    }

    public Region getRegion() {
        return region;
    }

    public Hospital getHospital() {
        return hospital;
    }

    /**
     * Replaces both assignment fields. Callers validate that the hospital lies in the region.
     */
    public void assignTo(Region region, Hospital hospital) {
        this.region = region;
        this.hospital = hospital;
    }

    public Long getRegionId() {
        return region == null ? null : region.getId();
    }

    public Long getHospitalId() {
        return hospital == null ? null : hospital.getId();
    }

    /**
     * Region the user is visible in: the direct assignment, else the region of the assigned hospital.
     */
    public Long getEffectiveRegionId() {
        if (region != null) {
            return region.getId();
        }
        return hospital == null ? null : hospital.getRegionId();
    }
}
