package com.cleanwater.backend.modules.device.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DeviceCredentialCreateRequest(
        @NotBlank @Size(max = 100) String sensorId,
        @NotNull Long hospitalId,
        @Size(max = 200) String description
) {
}
