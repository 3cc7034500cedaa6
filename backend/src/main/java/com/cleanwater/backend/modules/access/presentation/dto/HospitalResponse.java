package com.cleanwater.backend.modules.access.presentation.dto;

import com.cleanwater.backend.modules.organization.domain.Hospital;

public record HospitalResponse(Long id, String name, String code, Long regionId, String address) {

    public static HospitalResponse from(Hospital hospital) {
        return new HospitalResponse(
                hospital.getId(),
                hospital.getName(),
                hospital.getCode(),
                hospital.getRegionId(),
                hospital.getAddress()
        );
    }
}
