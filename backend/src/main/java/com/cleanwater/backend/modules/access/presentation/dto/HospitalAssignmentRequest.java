package com.cleanwater.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record HospitalAssignmentRequest(@NotNull Long hospitalId) {
}
