package com.cleanwater.backend.modules.access.domain;

/**
 * Data visibility granted to a role.
 */
public enum ScopeLevel {
    /** No restriction. */
    GLOBAL,
    /** Resources whose region equals the caller's region. */
    REGION,
    /** Resources whose hospital equals the caller's hospital. */
    HOSPITAL,
    /** No data access at all. */
    NONE
}
