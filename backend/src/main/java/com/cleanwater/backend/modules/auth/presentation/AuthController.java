package com.cleanwater.backend.modules.auth.presentation;

import com.cleanwater.backend.global.security.AuthenticatedUser;
import com.cleanwater.backend.global.security.SecurityUtils;
import com.cleanwater.backend.modules.auth.application.AuthService;
import com.cleanwater.backend.modules.auth.application.TwoFactorService;
import com.cleanwater.backend.modules.auth.presentation.dto.LoginRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.LoginResponse;
import com.cleanwater.backend.modules.auth.presentation.dto.MessageResponse;
import com.cleanwater.backend.modules.auth.presentation.dto.RefreshRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.RegisterRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.cleanwater.backend.modules.auth.presentation.dto.TwoFactorEnrollmentResponse;
import com.cleanwater.backend.modules.auth.presentation.dto.TwoFactorLoginRequest;
import com.cleanwater.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;
    private final TwoFactorService twoFactorService;

    public AuthController(AuthService authService, TwoFactorService twoFactorService) {
        this.authService = authService;
        this.twoFactorService = twoFactorService;
    }

    @PostMapping("/register")
    public ResponseEntity<UserProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/verify-2fa")
    public ResponseEntity<TokenPairResponse> verifyTwoFactor(@Valid @RequestBody TwoFactorLoginRequest request) {
        return ResponseEntity.ok(authService.completeTwoFactor(request));
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout() {
        authService.logout(SecurityUtils.getCurrentUser());
        return ResponseEntity.ok(new MessageResponse("Successfully logged out"));
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/enable-2fa")
    public ResponseEntity<TwoFactorEnrollmentResponse> enableTwoFactor() {
        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        return ResponseEntity.ok(twoFactorService.enable(user.userId()));
    }

    @PostMapping("/disable-2fa")
    public ResponseEntity<MessageResponse> disableTwoFactor() {
        twoFactorService.disable(SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(new MessageResponse("2FA disabled successfully"));
    }
}
