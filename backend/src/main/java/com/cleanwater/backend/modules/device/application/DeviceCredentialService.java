package com.cleanwater.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cleanwater.backend.global.error.ProblemException;
import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.modules.access.application.AccessScopeResolver;
import com.cleanwater.backend.modules.access.domain.AccessCapability;
import com.cleanwater.backend.modules.access.domain.ScopedResource;
import com.cleanwater.backend.modules.audit.application.AuditAction;
import com.cleanwater.backend.modules.audit.application.AuditActor;
import com.cleanwater.backend.modules.audit.application.AuditRecorder;
import com.cleanwater.backend.modules.device.domain.DeviceCredential;
import com.cleanwater.backend.modules.device.infrastructure.ApiKeyGenerator;
import com.cleanwater.backend.modules.device.infrastructure.persistence.DeviceCredentialRepository;
import com.cleanwater.backend.modules.device.presentation.dto.DeviceCredentialCreateRequest;
import com.cleanwater.backend.modules.device.presentation.dto.DeviceCredentialResponse;
import com.cleanwater.backend.modules.device.presentation.dto.HeartbeatResponse;
import com.cleanwater.backend.modules.organization.domain.Hospital;
import com.cleanwater.backend.modules.organization.infrastructure.persistence.HospitalRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Device API key lifecycle and device-side authorization.
 *
 * <p>A device is let in only while its key exists, is active and has been validated. Unknown and
 * revoked keys answer Unauthorized; a key still waiting for validation answers Forbidden.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class DeviceCredentialService {

    private static final Logger log = LoggerFactory.getLogger(DeviceCredentialService.class);
    private static final String RESOURCE_TYPE = "api_key";

    private final DeviceCredentialRepository deviceCredentialRepository;
    private final HospitalRepository hospitalRepository;
    private final ApiKeyGenerator apiKeyGenerator;
    private final AccessScopeResolver accessScopeResolver;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public DeviceCredentialService(
            DeviceCredentialRepository deviceCredentialRepository,
            HospitalRepository hospitalRepository,
            ApiKeyGenerator apiKeyGenerator,
            AccessScopeResolver accessScopeResolver,
            AuditRecorder auditRecorder,
            Clock clock
    ) {
        this.deviceCredentialRepository = deviceCredentialRepository;
        this.hospitalRepository = hospitalRepository;
        this.apiKeyGenerator = apiKeyGenerator;
        this.accessScopeResolver = accessScopeResolver;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
    }

    @Transactional
    public DeviceCredentialResponse create(AuthenticatedUser actor, DeviceCredentialCreateRequest request) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_DEVICE_CREDENTIALS);
        Hospital hospital = hospitalRepository.findById(request.hospitalId())
                .orElseThrow(() -> ProblemException.notFound("organization.hospital_not_found", "Hospital not found"));
        if (deviceCredentialRepository.existsBySensorId(request.sensorId())) {
            throw duplicateSensor(request.sensorId());
        }

        DeviceCredential credential = new DeviceCredential(
                apiKeyGenerator.generate(),
                request.sensorId(),
                hospital,
                request.description()
        );
        try {
            credential = deviceCredentialRepository.saveAndFlush(credential);
        } catch (DataIntegrityViolationException ex) {
            throw duplicateSensor(request.sensorId());
        }

        log.info("API key {} created for sensor {} at hospital {}", credential.getId(), credential.getSensorId(), hospital.getId());
        auditRecorder.success(AuditAction.API_KEY_CREATE, RESOURCE_TYPE, credential.getId(), actorOf(actor),
                detailOf(credential));
        return DeviceCredentialResponse.withSecret(credential);
    }

    public DeviceCredentialResponse validate(AuthenticatedUser actor, Long credentialId) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_DEVICE_CREDENTIALS);
        DeviceCredential credential = load(credentialId);
        if (!credential.isActive()) {
            throw ProblemException.conflict("device.api_key_revoked", "Revoked API key cannot be validated");
        }
        credential.validate();
        deviceCredentialRepository.save(credential);

        auditRecorder.success(AuditAction.API_KEY_VALIDATE, RESOURCE_TYPE, credential.getId(), actorOf(actor),
                detailOf(credential));
        return DeviceCredentialResponse.from(credential);
    }

    public void revoke(AuthenticatedUser actor, Long credentialId) {
        accessScopeResolver.requireCapability(actor, AccessCapability.MANAGE_DEVICE_CREDENTIALS);
        DeviceCredential credential = load(credentialId);
        credential.revoke();
        deviceCredentialRepository.save(credential);

        log.info("API key {} for sensor {} revoked", credential.getId(), credential.getSensorId());
        auditRecorder.success(AuditAction.API_KEY_REVOKE, RESOURCE_TYPE, credential.getId(), actorOf(actor),
                detailOf(credential));
    }

    @Transactional(readOnly = true)
    public List<DeviceCredentialResponse> list(AuthenticatedUser actor, Long hospitalId) {
        Specification<DeviceCredential> spec = accessScopeResolver.authorize(actor, AccessCapability.READ_SCOPED_DATA)
                .filter(ScopedResource.DEVICE_CREDENTIAL);
        if (hospitalId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("hospital").get("id"), hospitalId));
        }
        return deviceCredentialRepository.findAll(spec, Sort.by(Sort.Direction.ASC, "id")).stream()
                .map(DeviceCredentialResponse::from)
                .toList();
    }

    /**
     * Checks a presented secret. Does not touch {@code last_used}.
     */
    @Transactional(readOnly = true)
    public DeviceCredential authorizeDevice(String secret) {
        if (secret == null || secret.isBlank()) {
            throw ProblemException.unauthorized();
        }
        DeviceCredential credential = deviceCredentialRepository.findBySecret(secret)
                .orElseThrow(ProblemException::unauthorized);
        if (!credential.isActive()) {
            throw ProblemException.unauthorized();
        }
        if (!credential.isValidated()) {
            throw ProblemException.forbidden("device.api_key_pending_validation",
                    "API key is pending admin validation");
        }
        return credential;
    }

    public HeartbeatResponse heartbeat(String secret, String sensorId) {
        DeviceCredential credential = authorizeDevice(secret);
        if (!credential.getSensorId().equals(sensorId)) {
            throw ProblemException.forbidden("device.sensor_mismatch",
                    "Sensor ID mismatch. This API key is registered for sensor '" + credential.getSensorId() + "'");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        credential.markUsed(now);
        deviceCredentialRepository.save(credential);

        auditRecorder.success(AuditAction.SENSOR_HEARTBEAT, RESOURCE_TYPE, credential.getId(), AuditActor.system(),
                Map.of("sensorId", credential.getSensorId()));
        return new HeartbeatResponse(credential.getSensorId(), credential.getHospitalId(), now);
    }

    private DeviceCredential load(Long credentialId) {
        return deviceCredentialRepository.findById(credentialId)
                .orElseThrow(() -> ProblemException.notFound("device.api_key_not_found", "API key not found"));
    }

    private static ProblemException duplicateSensor(String sensorId) {
        return ProblemException.conflict("device.sensor_already_registered",
                "API key for sensor '" + sensorId + "' already exists");
    }

    private static Map<String, Object> detailOf(DeviceCredential credential) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("sensorId", credential.getSensorId());
        detail.put("hospitalId", credential.getHospitalId());
        detail.put("status", credential.getStatus().name());
        return detail;
    }

    private static AuditActor actorOf(AuthenticatedUser actor) {
        return AuditActor.of(actor.userId(), actor.username());
    }
}
