package com.cleanwater.backend.modules.access.application;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.access.domain.AccessCapability;
import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.access.domain.AccessScope;

import org.springframework.stereotype.Component;

/**
 * Maps a caller's role and assignment to the data-visibility predicate every scoped query uses.
 *
 * <table>
 *   <caption>resolution</caption>
 *   <tr><td>ADMIN</td><td>unrestricted</td></tr>
 *   <tr><td>REGION_ADMIN</td><td>own region; InvalidState without one</td></tr>
 *   <tr><td>HOSPITAL_USER</td><td>own hospital; InvalidState without one</td></tr>
 *   <tr><td>PENDING</td><td>Forbidden</td></tr>
 * </table>
 */
@Component
public class AccessScopeResolver {

    public AccessScope resolve(AccessRole role, Long regionId, Long hospitalId) {
        return switch (role.getScopeLevel()) {
            case GLOBAL -> AccessScope.unrestricted();
            case REGION -> {
                if (regionId == null) {
                    throw ProblemException.invalidState("access.region_assignment_required",
                            "Region admin must be assigned to a region");
                }
                yield AccessScope.region(regionId);
            }
            case HOSPITAL -> {
                if (hospitalId == null) {
                    throw ProblemException.invalidState("access.hospital_assignment_required",
                            "Hospital user must be assigned to a hospital");
                }
                yield AccessScope.hospital(hospitalId);
            }
            case NONE -> throw ProblemException.forbidden("access.pending_approval",
                    "Account is pending approval by an administrator");
        };
    }

    public AccessScope resolve(AuthenticatedUser caller) {
        return resolve(caller.role(), caller.regionId(), caller.hospitalId());
    }

    /**
     * Resolves the caller's scope, then checks the capability. A pending account is reported as
     * pending rather than as lacking the capability.
     */
    public AccessGrant authorize(AuthenticatedUser caller, AccessCapability capability) {
        AccessScope scope = resolve(caller);
        requireCapability(caller, capability);
        return new AccessGrant(caller, scope);
    }

    public void requireCapability(AuthenticatedUser caller, AccessCapability capability) {
        if (!caller.role().has(capability)) {
            throw ProblemException.forbidden("access.insufficient_role", "Insufficient permissions");
        }
    }
}
