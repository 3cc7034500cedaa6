package com.cleanwater.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;

public record HeartbeatResponse(String sensorId, Long hospitalId, OffsetDateTime receivedAt) {
}
