package com.creditmemo.api.controller;

import com.creditmemo.rules.ComplianceSettings;
import com.creditmemo.validation.ValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/config")
@RequiredArgsConstructor
@Tag(name = "Configuration", description = "Effective compliance settings")
public class ConfigController {

    private final ValidationService validationService;

    @GetMapping("/compliance")
    @Operation(summary = "Get the default compliance settings applied when a request has no overrides")
    public ResponseEntity<ComplianceSettings> getComplianceSettings() {
        return ResponseEntity.ok(validationService.defaultSettings());
    }
}
