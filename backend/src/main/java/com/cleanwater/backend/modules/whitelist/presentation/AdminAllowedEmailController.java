package com.cleanwater.backend.modules.whitelist.presentation;

import java.util.List;

import com.cleanwater.backend.global.security.SecurityUtils;
import com.cleanwater.backend.modules.whitelist.application.AllowedEmailService;
import com.cleanwater.backend.modules.whitelist.presentation.dto.AllowedEmailRequest;
import com.cleanwater.backend.modules.whitelist.presentation.dto.AllowedEmailResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/allowed-emails")
public class AdminAllowedEmailController {

    private final AllowedEmailService allowedEmailService;

    public AdminAllowedEmailController(AllowedEmailService allowedEmailService) {
        this.allowedEmailService = allowedEmailService;
    }

    @PostMapping
    public ResponseEntity<AllowedEmailResponse> add(@Valid @RequestBody AllowedEmailRequest request) {
        AllowedEmailResponse response = allowedEmailService.add(SecurityUtils.getCurrentUser(), request.email());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<AllowedEmailResponse>> list() {
        return ResponseEntity.ok(allowedEmailService.list(SecurityUtils.getCurrentUser()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        allowedEmailService.delete(SecurityUtils.getCurrentUser(), id);
        return ResponseEntity.noContent().build();
    }
}
