package com.cleanwater.backend.modules.access.presentation;

import java.util.List;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.security.SecurityUtils;
import com.cleanwater.backend.modules.access.application.UserAdministrationService;
import com.cleanwater.backend.modules.access.application.UserAdministrationService.UserFilter;
import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.access.presentation.dto.HospitalResponse;
import com.cleanwater.backend.modules.access.presentation.dto.RoleUpdateRequest;
import com.cleanwater.backend.modules.access.presentation.dto.UserAssignmentRequest;
import com.cleanwater.backend.modules.access.presentation.dto.UserSummaryResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin")
public class AdminUserController {

    private final UserAdministrationService userAdministrationService;

    public AdminUserController(UserAdministrationService userAdministrationService) {
        this.userAdministrationService = userAdministrationService;
    }

    @GetMapping("/users")
    public ResponseEntity<List<UserSummaryResponse>> listUsers(
            @RequestParam(name = "role", required = false) Integer role,
            @RequestParam(name = "regionId", required = false) Long regionId,
            @RequestParam(name = "hospitalId", required = false) Long hospitalId
    ) {
        UserFilter filter = new UserFilter(role == null ? null : toRole(role), regionId, hospitalId);
        return ResponseEntity.ok(userAdministrationService.listUsers(SecurityUtils.getCurrentUser(), filter));
    }

    @PutMapping("/users/{userId}/role")
    public ResponseEntity<UserSummaryResponse> updateRole(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody RoleUpdateRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.updateRole(
                SecurityUtils.getCurrentUser(), userId, toRole(request.role())));
    }

    @PutMapping("/users/{userId}/assign")
    public ResponseEntity<UserSummaryResponse> assign(
            @PathVariable("userId") Long userId,
            @RequestBody UserAssignmentRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.assign(
                SecurityUtils.getCurrentUser(), userId, request.regionId(), request.hospitalId()));
    }

    @GetMapping("/hospitals")
    public ResponseEntity<List<HospitalResponse>> listHospitals(
            @RequestParam(name = "regionId", required = false) Long regionId
    ) {
        return ResponseEntity.ok(userAdministrationService.listHospitals(SecurityUtils.getCurrentUser(), regionId));
    }

    private static AccessRole toRole(int code) {
        try {
            return AccessRole.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalidInput("access.unknown_role", ex.getMessage());
        }
    }
}
