package com.cleanwater.backend.modules.access.domain;

import java.util.Objects;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import org.springframework.data.jpa.domain.Specification;

/**
 * Resolved data-visibility predicate of a caller.
 *
 * <p>The same predicate is offered in two forms: {@link #permits(Long, Long)} for a single
 * already-loaded resource and {@link #toSpecification(ScopedResource)} for repository queries.
 */
public record AccessScope(ScopeLevel level, Long regionId, Long hospitalId) {

    public AccessScope {
        Objects.requireNonNull(level, "level");
        if (level == ScopeLevel.REGION && regionId == null) {
            throw new IllegalArgumentException("REGION scope requires a region id");
        }
        if (level == ScopeLevel.HOSPITAL && hospitalId == null) {
            throw new IllegalArgumentException("HOSPITAL scope requires a hospital id");
        }
    }

    public static AccessScope unrestricted() {
        return new AccessScope(ScopeLevel.GLOBAL, null, null);
    }

    public static AccessScope region(long regionId) {
        return new AccessScope(ScopeLevel.REGION, regionId, null);
    }

    public static AccessScope hospital(long hospitalId) {
        return new AccessScope(ScopeLevel.HOSPITAL, null, hospitalId);
    }

    public static AccessScope denied() {
        return new AccessScope(ScopeLevel.NONE, null, null);
    }

    public boolean isUnrestricted() {
        return level == ScopeLevel.GLOBAL;
    }

    /**
     * @param resourceRegionId   region of the resource, directly or via its hospital; may be null
     * @param resourceHospitalId hospital of the resource; may be null
     */
    public boolean permits(Long resourceRegionId, Long resourceHospitalId) {
        return switch (level) {
            case GLOBAL -> true;
            case REGION -> regionId.equals(resourceRegionId);
            case HOSPITAL -> hospitalId.equals(resourceHospitalId);
            case NONE -> false;
        };
    }

    public <T> Specification<T> toSpecification(ScopedResource resource) {
        Objects.requireNonNull(resource, "resource");
        return switch (level) {
            case GLOBAL -> (root, query, cb) -> cb.conjunction();
            case REGION -> (root, query, cb) -> matchAny(root, cb, resource, regionId);
            case HOSPITAL -> (root, query, cb) -> cb.equal(resolve(root, resource.getHospitalPath()), hospitalId);
            case NONE -> (root, query, cb) -> cb.disjunction();
        };
    }

    private static Predicate matchAny(Root<?> root, CriteriaBuilder cb, ScopedResource resource, Long expected) {
        Predicate[] alternatives = resource.getRegionPaths().stream()
                .map(path -> cb.equal(resolve(root, path), expected))
                .toArray(Predicate[]::new);
        return alternatives.length == 1 ? alternatives[0] : cb.or(alternatives);
    }

    // left joins so an unset association excludes only its own alternative, not the row
    private static Path<Object> resolve(Root<?> root, String dottedPath) {
        String[] segments = dottedPath.split("\\.");
        From<?, ?> from = root;
        for (int i = 0; i < segments.length - 1; i++) {
            from = from.join(segments[i], JoinType.LEFT);
        }
        return from.get(segments[segments.length - 1]);
    }
}
