package com.cleanwater.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.access.presentation.dto.UserSummaryResponse;
import com.cleanwater.backend.modules.audit.application.AuditAction;
import com.cleanwater.backend.modules.audit.application.AuditRecorder;
import com.cleanwater.backend.modules.auth.domain.UserAccount;
import com.cleanwater.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.cleanwater.backend.modules.organization.domain.Hospital;
import com.cleanwater.backend.modules.organization.domain.Region;
import com.cleanwater.backend.modules.organization.infrastructure.persistence.HospitalRepository;
import com.cleanwater.backend.modules.organization.infrastructure.persistence.RegionRepository;
import com.cleanwater.backend.support.OrganizationFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class UserAdministrationServiceTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private RegionRepository regionRepository;

    @Mock
    private HospitalRepository hospitalRepository;

    @Mock
    private AuditRecorder auditRecorder;

    private UserAdministrationService service;

    private Region regionFive;
    private Region regionSeven;
    private Hospital hospitalInFive;
    private Hospital hospitalInSeven;

    private final AuthenticatedUser admin = new AuthenticatedUser(1L, "admin", AccessRole.ADMIN, null, null);
    private final AuthenticatedUser regionAdminFive =
            new AuthenticatedUser(2L, "ra5", AccessRole.REGION_ADMIN, 5L, null);

    @BeforeEach
    void setUp() {
        service = new UserAdministrationService(
                userAccountRepository,
                regionRepository,
                hospitalRepository,
                new AccessScopeResolver(),
                auditRecorder
        );
        regionFive = OrganizationFixtures.region(5L);
        regionSeven = OrganizationFixtures.region(7L);
        hospitalInFive = OrganizationFixtures.hospital(50L, regionFive);
        hospitalInSeven = OrganizationFixtures.hospital(70L, regionSeven);
    }

    @Test
    void adminPromotesPendingUser() {
        UserAccount target = OrganizationFixtures.user(10L, "newcomer", AccessRole.PENDING);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(target));

        UserSummaryResponse response = service.updateRole(admin, 10L, AccessRole.HOSPITAL_USER);

        assertThat(response.role()).isEqualTo(4);
        assertThat(target.getRole()).isEqualTo(AccessRole.HOSPITAL_USER);
        verify(auditRecorder).success(eq(AuditAction.ROLE_UPDATE), eq("user"), eq(10L), any(), anyMap());
    }

    @Test
    void adminCannotChangeOwnRole() {
        assertThatThrownBy(() -> service.updateRole(admin, 1L, AccessRole.PENDING))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("access.self_role_change");
                });
        verify(userAccountRepository, never()).findById(any());
    }

    @Test
    void regionAdminCannotChangeRoles() {
        assertThatThrownBy(() -> service.updateRole(regionAdminFive, 10L, AccessRole.ADMIN))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    void roleChangeOfMissingUserIsNotFound() {
        when(userAccountRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateRole(admin, 404L, AccessRole.ADMIN))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void assignRejectsHospitalOutsideRegion() {
        UserAccount target = OrganizationFixtures.user(10L, "u", AccessRole.HOSPITAL_USER);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(target));
        when(regionRepository.findById(5L)).thenReturn(Optional.of(regionFive));
        when(hospitalRepository.findWithRegionById(70L)).thenReturn(Optional.of(hospitalInSeven));

        assertThatThrownBy(() -> service.assign(admin, 10L, 5L, 70L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.hospital_region_mismatch"));
        assertThat(target.getHospitalId()).isNull();
    }

    @Test
    void assignReplacesBothFields() {
        UserAccount target = OrganizationFixtures.user(10L, "u", AccessRole.HOSPITAL_USER);
        target.assignTo(regionSeven, hospitalInSeven);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(target));
        when(regionRepository.findById(5L)).thenReturn(Optional.of(regionFive));

        UserSummaryResponse response = service.assign(admin, 10L, 5L, null);

        assertThat(response.regionId()).isEqualTo(5L);
        assertThat(response.hospitalId()).isNull();
    }

    @Test
    void assignToMissingRegionIsNotFound() {
        when(userAccountRepository.findById(10L))
                .thenReturn(Optional.of(OrganizationFixtures.user(10L, "u", AccessRole.HOSPITAL_USER)));
        when(regionRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.assign(admin, 10L, 99L, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void regionAdminCannotMoveUserFromAnotherRegion() {
        UserAccount target = OrganizationFixtures.user(10L, "u", AccessRole.HOSPITAL_USER);
        target.assignTo(regionSeven, hospitalInSeven);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(target));

        assertThatThrownBy(() -> service.assignHospital(regionAdminFive, 10L, 50L))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("access.user_outside_region");
                });
        assertThat(target.getHospitalId()).isEqualTo(70L);
    }

    @Test
    void regionAdminCannotAssignHospitalOfAnotherRegion() {
        UserAccount target = OrganizationFixtures.user(10L, "u", AccessRole.HOSPITAL_USER);
        target.assignTo(regionFive, null);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(target));
        when(hospitalRepository.findWithRegionById(70L)).thenReturn(Optional.of(hospitalInSeven));

        assertThatThrownBy(() -> service.assignHospital(regionAdminFive, 10L, 70L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.hospital_outside_region"));
    }

    @Test
    void regionAdminAssignsUserOfOwnRegion() {
        UserAccount target = OrganizationFixtures.user(10L, "u", AccessRole.HOSPITAL_USER);
        target.assignTo(regionFive, null);
        when(userAccountRepository.findById(10L)).thenReturn(Optional.of(target));
        when(hospitalRepository.findWithRegionById(50L)).thenReturn(Optional.of(hospitalInFive));

        UserSummaryResponse response = service.assignHospital(regionAdminFive, 10L, 50L);

        assertThat(response.hospitalId()).isEqualTo(50L);
        assertThat(response.regionId()).isEqualTo(5L);
        verify(userAccountRepository).save(target);
        verify(auditRecorder).success(eq(AuditAction.USER_ASSIGN), eq("user"), eq(10L), any(), anyMap());
    }

    @Test
    void hospitalUserCannotAssign() {
        AuthenticatedUser hospitalUser = new AuthenticatedUser(4L, "hu", AccessRole.HOSPITAL_USER, 5L, 50L);

        assertThatThrownBy(() -> service.assignHospital(hospitalUser, 10L, 50L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("access.insufficient_role"));
    }
}
