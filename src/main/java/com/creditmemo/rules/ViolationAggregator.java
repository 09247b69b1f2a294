package com.creditmemo.rules;

import com.creditmemo.memo.SoxStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the violation reasons of a memo from its final verdict.
 *
 * At most one reason comes from the Missing Approvals message and at most
 * one from the approval sequence, in that order.
 */
@Component
public class ViolationAggregator {

    public ViolationBreakdown aggregate(TimelineAssessment assessment) {
        List<String> reasons = new ArrayList<>();
        if (assessment.getSoxStatus() != SoxStatus.VIOLATION) {
            return ViolationBreakdown.of(reasons);
        }

        String missingApprovals = assessment.getMissingApprovals();
        if (missingApprovals != null && !missingApprovals.isEmpty() && !"None".equals(missingApprovals)) {
            if (missingApprovals.contains("Level")) {
                reasons.add("Missing Approval: " + missingApprovals);
            } else if (missingApprovals.contains("Timeline")) {
                reasons.add("SLA Breach: " + missingApprovals);
            } else {
                reasons.add("Approval Issue: " + missingApprovals);
            }
        }

        String sequence = assessment.getApprovalSequence();
        if (sequence != null) {
            if (sequence.contains(TimelineEvaluator.SLA_VIOLATED)) {
                reasons.add("SLA Exceeded: " + assessment.getTimelineStatus());
            } else if (sequence.contains(TimelineEvaluator.APPROVAL_AFTER_CM)) {
                reasons.add("Approval After CM Creation");
            }
        }
        return ViolationBreakdown.of(reasons);
    }
}
