package com.creditmemo.rules;

import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Checks that approval preceded memo creation and that the memo was created
 * within the SLA, then settles the final SOX verdict.
 *
 * Approval after creation and an SLA breach replace whatever the approval
 * check concluded. Missing dates and an on-time approval only change a
 * verdict that was still pending.
 */
@Component
public class TimelineEvaluator {

    public static final String DATES_MISSING = "Dates Missing";
    public static final String APPROVAL_AFTER_CM = "Approval After CM";
    public static final String APPROVAL_AFTER_CM_VIOLATION = "Approval After CM (Violation)";
    public static final String ORDER_OK = "Order OK";
    public static final String SLA_VIOLATED = "SLA Violated";

    static final String DATES_MISSING_MESSAGE = "Timeline: Dates missing";
    static final String APPROVED_AFTER_CM_MESSAGE = "Approval Date: Approved after CM creation";

    public TimelineAssessment evaluate(Optional<LocalDate> cmDate, Optional<LocalDate> approvalDate,
                                       ApprovalCheck approvalCheck, ComplianceSettings settings) {
        if (cmDate.isEmpty() || approvalDate.isEmpty()) {
            TimelineAssessment.TimelineAssessmentBuilder result = TimelineAssessment.builder()
                .timelineStatus(DATES_MISSING)
                .approvalSequence(DATES_MISSING);
            if (approvalCheck.isCompliantSoFar()) {
                return violation(result, RiskLevel.HIGH, DATES_MISSING_MESSAGE);
            }
            return keep(result, approvalCheck);
        }

        LocalDate cm = cmDate.get();
        LocalDate approval = approvalDate.get();

        if (approval.isAfter(cm)) {
            TimelineAssessment.TimelineAssessmentBuilder result = TimelineAssessment.builder()
                .businessDays(BusinessDays.between(cm, approval))
                .timelineStatus(APPROVAL_AFTER_CM)
                .approvalSequence(APPROVAL_AFTER_CM_VIOLATION);
            return violation(result, RiskLevel.HIGH, APPROVED_AFTER_CM_MESSAGE);
        }

        int businessDays = BusinessDays.between(approval, cm);
        int slaDays = settings.getSlaDays();

        if (businessDays <= slaDays) {
            TimelineAssessment.TimelineAssessmentBuilder result = TimelineAssessment.builder()
                .businessDays(businessDays)
                .timelineStatus("Within " + slaDays + " days")
                .approvalSequence(ORDER_OK);
            if (approvalCheck.isCompliantSoFar()) {
                return result
                    .soxStatus(SoxStatus.COMPLIANT)
                    .riskLevel(RiskLevel.LOW)
                    .missingApprovals(approvalCheck.getMessage())
                    .build();
            }
            return keep(result, approvalCheck);
        }

        // An SLA breach overrides an earlier, possibly more severe, approval violation.
        TimelineAssessment.TimelineAssessmentBuilder result = TimelineAssessment.builder()
            .businessDays(businessDays)
            .timelineStatus("Over " + slaDays + " days")
            .approvalSequence(SLA_VIOLATED);
        return violation(result, RiskLevel.MEDIUM,
            String.format("Timeline: CM created %d days after SLA threshold", businessDays - slaDays));
    }

    private TimelineAssessment violation(TimelineAssessment.TimelineAssessmentBuilder result,
                                         RiskLevel riskLevel, String message) {
        return result
            .soxStatus(SoxStatus.VIOLATION)
            .riskLevel(riskLevel)
            .missingApprovals(message)
            .build();
    }

    private TimelineAssessment keep(TimelineAssessment.TimelineAssessmentBuilder result, ApprovalCheck approvalCheck) {
        return result
            .soxStatus(SoxStatus.VIOLATION)
            .riskLevel(approvalCheck.getRiskLevel())
            .missingApprovals(approvalCheck.getMessage())
            .build();
    }
}
