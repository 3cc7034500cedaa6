package com.cleanwater.backend.modules.access.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The four role tiers.
 *
 * <p>{@link #getCode()} is the persisted tier number and nothing else. It is not a privilege
 * ladder ({@code ADMIN} is tier 2 yet bypasses all scoping), so authorization never compares
 * codes; it asks {@link #getScopeLevel()} and {@link #has(AccessCapability)} instead.
 */
public enum AccessRole {

    PENDING(1, ScopeLevel.NONE, EnumSet.noneOf(AccessCapability.class)),
    ADMIN(2, ScopeLevel.GLOBAL, EnumSet.allOf(AccessCapability.class)),
    REGION_ADMIN(3, ScopeLevel.REGION, EnumSet.of(
            AccessCapability.READ_SCOPED_DATA,
            AccessCapability.ASSIGN_USERS_WITHIN_REGION)),
    HOSPITAL_USER(4, ScopeLevel.HOSPITAL, EnumSet.of(AccessCapability.READ_SCOPED_DATA));

    private final int code;
    private final ScopeLevel scopeLevel;
    private final Set<AccessCapability> capabilities;

    AccessRole(int code, ScopeLevel scopeLevel, Set<AccessCapability> capabilities) {
        this.code = code;
        this.scopeLevel = scopeLevel;
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public int getCode() {
        return code;
    }

    public ScopeLevel getScopeLevel() {
        return scopeLevel;
    }

    public Set<AccessCapability> getCapabilities() {
        return capabilities;
    }

    public boolean has(AccessCapability capability) {
        return capabilities.contains(capability);
    }

    public static AccessRole fromCode(int code) {
        return Arrays.stream(values())
                .filter(role -> role.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role code: " + code));
    }
}
