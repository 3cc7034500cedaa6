package com.cleanwater.backend.global.security;

import com.cleanwater.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser user)) {
            throw ProblemException.unauthorized();
        }
        return user;
    }

    public static Long getCurrentUserId() {
        return getCurrentUser().userId();
    }
}
