package com.cleanwater.backend.modules.access.presentation.dto;

public record UserAssignmentRequest(Long regionId, Long hospitalId) {
}
