package com.cleanwater.backend.modules.access.presentation;

import java.util.List;

import com.cleanwater.backend.global.security.SecurityUtils;
import com.cleanwater.backend.modules.access.application.UserAdministrationService;
import com.cleanwater.backend.modules.access.application.UserAdministrationService.UserFilter;
import com.cleanwater.backend.modules.access.presentation.dto.HospitalAssignmentRequest;
import com.cleanwater.backend.modules.access.presentation.dto.HospitalResponse;
import com.cleanwater.backend.modules.access.presentation.dto.UserSummaryResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/region")
public class RegionController {

    private final UserAdministrationService userAdministrationService;

    public RegionController(UserAdministrationService userAdministrationService) {
        this.userAdministrationService = userAdministrationService;
    }

    @GetMapping("/users")
    public ResponseEntity<List<UserSummaryResponse>> listUsers() {
        return ResponseEntity.ok(userAdministrationService.listUsers(SecurityUtils.getCurrentUser(), UserFilter.none()));
    }

    @GetMapping("/hospitals")
    public ResponseEntity<List<HospitalResponse>> listHospitals() {
        return ResponseEntity.ok(userAdministrationService.listHospitals(SecurityUtils.getCurrentUser(), null));
    }

    @PostMapping("/users/{userId}/assign-hospital")
    public ResponseEntity<UserSummaryResponse> assignHospital(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody HospitalAssignmentRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.assignHospital(
                SecurityUtils.getCurrentUser(), userId, request.hospitalId()));
    }
}
