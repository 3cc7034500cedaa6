package com.cleanwater.backend.modules.access.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.access.domain.AccessCapability;
import com.cleanwater.backend.modules.access.domain.AccessRole;
import com.cleanwater.backend.modules.access.domain.AccessScope;
import com.cleanwater.backend.modules.access.domain.ScopeLevel;
import com.cleanwater.backend.modules.access.domain.ScopedResource;
import com.cleanwater.backend.modules.access.presentation.dto.HospitalResponse;
import com.cleanwater.backend.modules.access.presentation.dto.UserSummaryResponse;
import com.cleanwater.backend.modules.audit.application.AuditAction;
import com.cleanwater.backend.modules.audit.application.AuditActor;
import com.cleanwater.backend.modules.audit.application.AuditRecorder;
import com.cleanwater.backend.modules.auth.domain.UserAccount;
import com.cleanwater.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.cleanwater.backend.modules.organization.domain.Hospital;
import com.cleanwater.backend.modules.organization.domain.Region;
import com.cleanwater.backend.modules.organization.infrastructure.persistence.HospitalRepository;
import com.cleanwater.backend.modules.organization.infrastructure.persistence.RegionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Role changes, organizational assignment and scoped listings of identities and hospitals.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class UserAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(UserAdministrationService.class);
    private static final String RESOURCE_TYPE = "user";
    private static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "id");

    private final UserAccountRepository userAccountRepository;
    private final RegionRepository regionRepository;
    private final HospitalRepository hospitalRepository;
    private final AccessScopeResolver accessScopeResolver;
    private final AuditRecorder auditRecorder;

    public UserAdministrationService(
            UserAccountRepository userAccountRepository,
            RegionRepository regionRepository,
            HospitalRepository hospitalRepository,
            AccessScopeResolver accessScopeResolver,
            AuditRecorder auditRecorder
    ) {
        this.userAccountRepository = userAccountRepository;
        this.regionRepository = regionRepository;
        this.hospitalRepository = hospitalRepository;
        this.accessScopeResolver = accessScopeResolver;
        this.auditRecorder = auditRecorder;
    }

    public UserSummaryResponse updateRole(AuthenticatedUser actor, Long targetUserId, AccessRole newRole) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_USERS);
        if (Objects.equals(actor.userId(), targetUserId)) {
            throw ProblemException.invalidInput("access.self_role_change", "Cannot change your own role");
        }
        UserAccount target = loadUser(targetUserId);
        AccessRole oldRole = target.getRole();
        target.setRole(newRole);
        userAccountRepository.save(target);

        log.info("User {} role changed {} -> {} by {}", target.getId(), oldRole, newRole, actor.userId());
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("oldRole", oldRole.getCode());
        detail.put("newRole", newRole.getCode());
        auditRecorder.success(AuditAction.ROLE_UPDATE, RESOURCE_TYPE, target.getId(), actorOf(actor), detail);
        return UserSummaryResponse.from(target);
    }

    /**
     * Replaces both assignment fields. Either may be null; when both are given the hospital must
     * lie in the region.
     */
    public UserSummaryResponse assign(AuthenticatedUser actor, Long targetUserId, Long regionId, Long hospitalId) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_USERS);
        UserAccount target = loadUser(targetUserId);
        Region region = regionId == null ? null : regionRepository.findById(regionId)
                .orElseThrow(() -> ProblemException.notFound("organization.region_not_found", "Region not found"));
        Hospital hospital = hospitalId == null ? null : loadHospital(hospitalId);
        if (region != null && hospital != null && !hospital.belongsTo(region.getId())) {
            throw ProblemException.invalidInput("access.hospital_region_mismatch",
                    "Hospital does not belong to the specified region");
        }
        target.assignTo(region, hospital);
        userAccountRepository.save(target);

        auditRecorder.success(AuditAction.USER_ASSIGN, RESOURCE_TYPE, target.getId(), actorOf(actor),
                assignmentDetail(regionId, hospitalId));
        return UserSummaryResponse.from(target);
    }

    /**
     * Assigns a user to a hospital. A caller limited to one region may only move users of that
     * region, and only into hospitals of that region.
     */
    public UserSummaryResponse assignHospital(AuthenticatedUser actor, Long targetUserId, Long hospitalId) {
        AccessScope scope = accessScopeResolver.authorize(actor, AccessCapability.ASSIGN_USERS_WITHIN_REGION).scope();
        UserAccount target = loadUser(targetUserId);
        if (scope.level() == ScopeLevel.REGION && !scope.regionId().equals(target.getEffectiveRegionId())) {
            throw ProblemException.forbidden("access.user_outside_region", "Can only assign users within your region");
        }
        Hospital hospital = loadHospital(hospitalId);
        if (!scope.permits(hospital.getRegionId(), hospital.getId())) {
            throw ProblemException.forbidden("access.hospital_outside_region", "Hospital is not in your region");
        }
        target.assignTo(hospital.getRegion(), hospital);
        userAccountRepository.save(target);

        auditRecorder.success(AuditAction.USER_ASSIGN, RESOURCE_TYPE, target.getId(), actorOf(actor),
                assignmentDetail(hospital.getRegionId(), hospital.getId()));
        return UserSummaryResponse.from(target);
    }

    @Transactional(readOnly = true)
    public List<UserSummaryResponse> listUsers(AuthenticatedUser actor, UserFilter filter) {
        Specification<UserAccount> spec = accessScopeResolver.authorize(actor, AccessCapability.READ_SCOPED_DATA)
                .filter(ScopedResource.USER);
        if (filter.role() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("role"), filter.role()));
        }
        if (filter.regionId() != null) {
            spec = spec.and(AccessScope.region(filter.regionId()).toSpecification(ScopedResource.USER));
        }
        if (filter.hospitalId() != null) {
            spec = spec.and(AccessScope.hospital(filter.hospitalId()).toSpecification(ScopedResource.USER));
        }
        return userAccountRepository.findAll(spec, BY_ID).stream()
                .map(UserSummaryResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<HospitalResponse> listHospitals(AuthenticatedUser actor, Long regionId) {
        Specification<Hospital> spec = accessScopeResolver.authorize(actor, AccessCapability.READ_SCOPED_DATA)
                .filter(ScopedResource.HOSPITAL);
        if (regionId != null) {
            spec = spec.and(AccessScope.region(regionId).toSpecification(ScopedResource.HOSPITAL));
        }
        return hospitalRepository.findAll(spec, BY_ID).stream()
                .map(HospitalResponse::from)
                .toList();
    }

    private UserAccount loadUser(Long userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("access.user_not_found", "User not found"));
    }

    private Hospital loadHospital(Long hospitalId) {
        return hospitalRepository.findWithRegionById(hospitalId)
                .orElseThrow(() -> ProblemException.notFound("organization.hospital_not_found", "Hospital not found"));
    }

    private static Map<String, Object> assignmentDetail(Long regionId, Long hospitalId) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("regionId", regionId);
        detail.put("hospitalId", hospitalId);
        return detail;
    }

    private static AuditActor actorOf(AuthenticatedUser actor) {
        return AuditActor.of(actor.userId(), actor.username());
    }

    public record UserFilter(AccessRole role, Long regionId, Long hospitalId) {

        public static UserFilter none() {
            return new UserFilter(null, null, null);
        }
    }
}
