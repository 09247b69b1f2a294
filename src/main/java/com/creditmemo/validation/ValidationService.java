package com.creditmemo.validation;

import com.creditmemo.config.ComplianceProperties;
import com.creditmemo.matrix.ApprovalMatrixSet;
import com.creditmemo.memo.CreditMemoRecord;
import com.creditmemo.memo.ValidatedCreditMemo;
import com.creditmemo.rules.ComplianceSettings;
import com.creditmemo.rules.CreditMemoRulesEngine;
import com.creditmemo.rules.DuplicateMemoDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Service for validating batches of credit memos.
 *
 * Validation flow:
 * 1. Flag duplicate memo ids across the whole batch
 * 2. Run the rules engine on every memo (optionally in parallel)
 * 3. Summarize the results
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidationService {

    private final CreditMemoRulesEngine rulesEngine;
    private final DuplicateMemoDetector duplicateMemoDetector;
    private final ComplianceProperties complianceProperties;

    public ComplianceSettings defaultSettings() {
        return complianceProperties.toSettings();
    }

    public ValidationReport validate(List<CreditMemoRecord> records, ApprovalMatrixSet matrices) {
        return validate(records, matrices, defaultSettings());
    }

    public ValidationReport validate(List<CreditMemoRecord> records, ApprovalMatrixSet matrices,
                                     ComplianceSettings settings) {
        String runId = UUID.randomUUID().toString();
        log.info("Validation run {} started for {} memos (sla={} days, high risk at {} missing levels)",
            runId, records.size(), settings.getSlaDays(), settings.getMissingLevelsForHigh());

        List<Boolean> duplicates = duplicateMemoDetector.detect(records);

        IntStream indexes = IntStream.range(0, records.size());
        if (complianceProperties.isParallel()) {
            indexes = indexes.parallel();
        }
        List<ValidatedCreditMemo> results = indexes
            .mapToObj(i -> new ValidatedCreditMemo(records.get(i),
                rulesEngine.evaluate(records.get(i), matrices, duplicates.get(i), settings)))
            .collect(Collectors.toList());

        ValidationSummary summary = ValidationSummary.of(results);
        log.info("Validation run {} finished: {} compliant, {} violations ({} high risk, {} medium risk)",
            runId, summary.getCompliant(), summary.getViolations(), summary.getHighRisk(), summary.getMediumRisk());

        return ValidationReport.builder()
            .runId(runId)
            .validatedAt(Instant.now())
            .settings(settings)
            .summary(summary)
            .results(results)
            .build();
    }
}
