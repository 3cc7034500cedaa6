package com.cleanwater.backend.modules.device.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record HeartbeatRequest(@NotBlank String sensorId) {
}
