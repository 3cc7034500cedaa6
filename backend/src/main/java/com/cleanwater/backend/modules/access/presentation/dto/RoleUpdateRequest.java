package com.cleanwater.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * {@code role} is the tier number: 1 pending, 2 admin, 3 region admin, 4 hospital user.
 */
public record RoleUpdateRequest(@NotNull @Min(1) @Max(4) Integer role) {
}
