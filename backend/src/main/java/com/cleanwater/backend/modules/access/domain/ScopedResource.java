package com.cleanwater.backend.modules.access.domain;

import java.util.List;

/**
 * Resource kinds that can be narrowed by an {@link AccessScope}, with the entity attribute
 * paths that lead to their region and hospital.
 */
public enum ScopedResource {

    /** A user belongs to a region directly or through the hospital it is assigned to. */
    USER(List.of("region.id", "hospital.region.id"), "hospital.id"),
    HOSPITAL(List.of("region.id"), "id"),
    DEVICE_CREDENTIAL(List.of("hospital.region.id"), "hospital.id");

    private final List<String> regionPaths;
    private final String hospitalPath;

    ScopedResource(List<String> regionPaths, String hospitalPath) {
        this.regionPaths = regionPaths;
        this.hospitalPath = hospitalPath;
    }

    public List<String> getRegionPaths() {
        return regionPaths;
    }

    public String getHospitalPath() {
        return hospitalPath;
    }
}
