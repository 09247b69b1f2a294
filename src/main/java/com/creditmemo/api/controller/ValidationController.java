package com.creditmemo.api.controller;

import com.creditmemo.api.dto.ComplianceSettingsRequest;
import com.creditmemo.api.dto.ValidateCreditMemosRequest;
import com.creditmemo.matrix.ApprovalMatrixFactory;
import com.creditmemo.matrix.ApprovalMatrixSet;
import com.creditmemo.matrix.PolicyCategory;
import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import com.creditmemo.rules.ComplianceSettings;
import com.creditmemo.rules.ReasonClassifier;
import com.creditmemo.validation.ValidationReport;
import com.creditmemo.validation.ValidationResultFilter;
import com.creditmemo.validation.ValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for credit memo validation.
 */
@RestController
@RequestMapping("/api/v1/validations")
@RequiredArgsConstructor
@Tag(name = "Validations", description = "Credit memo SOX validation API")
public class ValidationController {

    private final ValidationService validationService;
    private final ApprovalMatrixFactory approvalMatrixFactory;
    private final ReasonClassifier reasonClassifier;

    @PostMapping
    @Operation(summary = "Validate a batch of credit memos against the approval matrices")
    public ResponseEntity<ValidationReport> validate(
            @Valid @RequestBody ValidateCreditMemosRequest request,
            @Parameter(description = "Case-insensitive memo id substring", example = "CM10")
            @RequestParam(required = false) String memo,
            @Parameter(description = "SOX status to keep", example = "SOX Violation")
            @RequestParam(required = false) List<String> status,
            @Parameter(description = "Risk level to keep", example = "High")
            @RequestParam(required = false) List<String> risk) {

        ApprovalMatrixSet matrices = approvalMatrixFactory.fromTiers(request.getMatrices());
        ComplianceSettings settings = resolveSettings(request.getSettings());

        ValidationReport report = validationService.validate(request.getRecords(), matrices, settings);

        ValidationResultFilter filter = ValidationResultFilter.builder()
            .memo(memo)
            .statuses(status == null ? null : status.stream().map(SoxStatus::fromLabel).collect(Collectors.toSet()))
            .riskLevels(risk == null ? null : risk.stream().map(RiskLevel::fromLabel).collect(Collectors.toSet()))
            .build();
        if (!filter.isEmpty()) {
            report = report.toBuilder()
                .results(filter.apply(report.getResults()))
                .build();
        }
        return ResponseEntity.ok(report);
    }

    @PostMapping("/classify")
    @Operation(summary = "Classify a memo reason with the configured keywords")
    public ResponseEntity<Map<String, String>> classify(@RequestParam String reason) {
        PolicyCategory category = reasonClassifier.classify(reason, validationService.defaultSettings());
        return ResponseEntity.ok(Map.of(
            "reason", reason,
            "reasonClass", category.getLabel(),
            "matrix", category.getKey()
        ));
    }

    private ComplianceSettings resolveSettings(ComplianceSettingsRequest overrides) {
        ComplianceSettings defaults = validationService.defaultSettings();
        if (overrides == null) {
            return defaults;
        }
        ComplianceSettings.ComplianceSettingsBuilder builder = defaults.toBuilder();
        if (overrides.getSlaDays() != null) {
            builder.slaDays(overrides.getSlaDays());
        }
        if (overrides.getMissingLevelsForHigh() != null) {
            builder.missingLevelsForHigh(overrides.getMissingLevelsForHigh());
        }
        if (overrides.getKeywordsPromotional() != null) {
            builder.keywordsPromotional(overrides.getKeywordsPromotional());
        }
        if (overrides.getKeywordsContract() != null) {
            builder.keywordsContract(overrides.getKeywordsContract());
        }
        return builder.build();
    }
}
