package com.creditmemo.rules;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixSet;
import com.creditmemo.matrix.PolicyCategory;
import com.creditmemo.memo.CreditMemoRecord;
import com.creditmemo.memo.MemoFieldParser;
import com.creditmemo.memo.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Rules engine that validates a single credit memo.
 *
 * Evaluation order:
 * 1. Classify the reason into a policy category
 * 2. Resolve the required level from the category's matrix
 * 3. Resolve the approver's level from the designation
 * 4. Check approval compliance (tentative)
 * 5. Check the timeline (final verdict)
 * 6. Aggregate violation reasons
 * 7. Check separation of duties
 *
 * The engine reads only the record and the shared immutable matrices, so
 * memos can be evaluated concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditMemoRulesEngine {

    private final ReasonClassifier reasonClassifier;
    private final RequiredLevelResolver requiredLevelResolver;
    private final ApproverLevelResolver approverLevelResolver;
    private final ApprovalComplianceEvaluator approvalComplianceEvaluator;
    private final TimelineEvaluator timelineEvaluator;
    private final ViolationAggregator violationAggregator;
    private final SeparationOfDutiesRule separationOfDutiesRule;

    /**
     * Evaluate all rules against a credit memo.
     *
     * @param record    the memo to validate
     * @param matrices  approval matrices of the run
     * @param duplicate whether the memo id occurs more than once in the run
     * @param settings  thresholds and keywords of the run
     * @return the validation columns for the memo
     */
    public ValidationOutcome evaluate(CreditMemoRecord record, ApprovalMatrixSet matrices,
                                      boolean duplicate, ComplianceSettings settings) {
        PolicyCategory category = reasonClassifier.classify(record.getReason(), settings);
        Optional<ApprovalMatrix> matrix = matrices.forCategory(category);

        Optional<BigDecimal> amount = MemoFieldParser.parseAmount(record.getAmount());
        Optional<Integer> requiredLevel = requiredLevelResolver.resolve(amount, matrix);
        ApproverLevel approverLevel = approverLevelResolver.resolve(record.getApproverDesignation(), matrix);

        ApprovalCheck approvalCheck = approvalComplianceEvaluator.evaluate(
            amount, requiredLevel, approverLevel, record.getApproverDesignation(), settings);

        Optional<LocalDate> cmDate = MemoFieldParser.parseDate(record.getCmDate());
        Optional<LocalDate> approvalDate = MemoFieldParser.parseDate(record.getDateOfApproval());
        TimelineAssessment assessment = timelineEvaluator.evaluate(cmDate, approvalDate, approvalCheck, settings);

        ViolationBreakdown violations = violationAggregator.aggregate(assessment);
        boolean sodViolated = separationOfDutiesRule.isViolated(record.getCreatedBy(), record.getApprover());

        log.debug("Memo {} [{}]: required={}, approver={}, status={}, risk={}",
            record.getMemo(), category.getLabel(), requiredLevel.orElse(null), approverLevel,
            assessment.getSoxStatus().getLabel(), assessment.getRiskLevel());

        return ValidationOutcome.builder()
            .reasonClass(category)
            .requiredApprovalLevel(requiredLevel.orElse(null))
            .finalApproverLevel(approverLevel.toNullableLevel())
            .finalApprover(record.getApproverDesignation())
            .soxStatus(assessment.getSoxStatus())
            .riskLevel(assessment.getRiskLevel())
            .missingApprovals(assessment.getMissingApprovals())
            .violationReason(violations.getSummary())
            .violationCount(violations.getCount())
            .approvalTimelineBusinessDays(assessment.getBusinessDays())
            .timelineStatus(assessment.getTimelineStatus())
            .approvalSequence(assessment.getApprovalSequence())
            .designationLevelCheck(sodViolated ? ValidationOutcome.SOD_VIOLATION : ValidationOutcome.SOD_OK)
            .duplicateMemo(duplicate ? ValidationOutcome.YES : ValidationOutcome.NO)
            .build();
    }
}
