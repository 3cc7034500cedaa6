package com.cleanwater.backend.support;

import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.auth.domain.UserAccount;
import com.cleanwater.backend.modules.organization.domain.Hospital;
import com.cleanwater.backend.modules.organization.domain.Region;

/**
 * In-memory regions, hospitals and users with ids already set.
 */
public final class OrganizationFixtures {

    private OrganizationFixtures() {
    }

    public static Region region(long id) {
        Region region = new Region();
        region.setName("Region " + id);
        region.setCode("R" + id);
        return EntityIds.withId(region, id);
    }

    public static Hospital hospital(long id, Region region) {
        Hospital hospital = new Hospital();
        hospital.setName("Hospital " + id);
        hospital.setCode("H" + id);
        hospital.setRegion(region);
        return EntityIds.withId(hospital, id);
    }

    public static UserAccount user(long id, String username, AccessRole role) {
        UserAccount user = new UserAccount();
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setPasswordHash("hash");
        user.setRole(role);
        return EntityIds.withId(user, id);
    }
}
