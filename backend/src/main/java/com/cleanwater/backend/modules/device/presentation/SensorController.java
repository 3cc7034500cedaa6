package com.cleanwater.backend.modules.device.presentation;

import com.cleanwater.backend.modules.device.application.DeviceCredentialService;
import com.cleanwater.backend.modules.device.presentation.dto.HeartbeatRequest;
import com.cleanwater.backend.modules.device.presentation.dto.HeartbeatResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sensors")
public class SensorController {

    static final String API_KEY_HEADER = "X-API-Key";

    private final DeviceCredentialService deviceCredentialService;

    public SensorController(DeviceCredentialService deviceCredentialService) {
        this.deviceCredentialService = deviceCredentialService;
    }

    @PostMapping("/heartbeat")
    public ResponseEntity<HeartbeatResponse> heartbeat(
            @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody HeartbeatRequest request
    ) {
        return ResponseEntity.ok(deviceCredentialService.heartbeat(apiKey, request.sensorId()));
    }
}
