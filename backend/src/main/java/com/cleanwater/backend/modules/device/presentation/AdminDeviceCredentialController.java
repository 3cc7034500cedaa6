package com.cleanwater.backend.modules.device.presentation;

import java.util.List;

import com.cleanwater.backend.global.security.SecurityUtils;
import com.cleanwater.backend.modules.device.application.DeviceCredentialService;
import com.cleanwater.backend.modules.device.presentation.dto.DeviceCredentialCreateRequest;
import com.cleanwater.backend.modules.device.presentation.dto.DeviceCredentialResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/api-keys")
public class AdminDeviceCredentialController {

    private final DeviceCredentialService deviceCredentialService;

    public AdminDeviceCredentialController(DeviceCredentialService deviceCredentialService) {
        this.deviceCredentialService = deviceCredentialService;
    }

    @PostMapping
    public ResponseEntity<DeviceCredentialResponse> create(@Valid @RequestBody DeviceCredentialCreateRequest request) {
        DeviceCredentialResponse response = deviceCredentialService.create(SecurityUtils.getCurrentUser(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<DeviceCredentialResponse>> list(
            @RequestParam(name = "hospitalId", required = false) Long hospitalId
    ) {
        return ResponseEntity.ok(deviceCredentialService.list(SecurityUtils.getCurrentUser(), hospitalId));
    }

    @PutMapping("/{id}/validate")
    public ResponseEntity<DeviceCredentialResponse> validate(@PathVariable("id") Long id) {
        return ResponseEntity.ok(deviceCredentialService.validate(SecurityUtils.getCurrentUser(), id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> revoke(@PathVariable("id") Long id) {
        deviceCredentialService.revoke(SecurityUtils.getCurrentUser(), id);
        return ResponseEntity.noContent().build();
    }
}
