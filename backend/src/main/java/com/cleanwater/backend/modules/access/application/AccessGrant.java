package com.cleanwater.backend.modules.access.application;

import java.util.Objects;

import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.access.domain.AccessScope;
import com.cleanwater.backend.modules.access.domain.ScopedResource;

import org.springframework.data.jpa.domain.Specification;

/**
 * Outcome of authorizing one caller for one operation: who is acting and which data the
 * operation may touch.
 */
public record AccessGrant(AuthenticatedUser caller, AccessScope scope) {

    public AccessGrant {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(scope, "scope");
    }

    public <T> Specification<T> filter(ScopedResource resource) {
        return scope.toSpecification(resource);
    }
}
