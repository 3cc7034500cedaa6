package com.cleanwater.backend.global.security;

import com.cleanwater.backend.modules.access.domain.AccessRole;

/**
 * Principal placed in the security context once an access token has been verified
 * against a stored identity.
 */
public record AuthenticatedUser(Long userId, String username, AccessRole role, Long regionId, Long hospitalId) {
}
