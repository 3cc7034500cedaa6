package com.cleanwater.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
