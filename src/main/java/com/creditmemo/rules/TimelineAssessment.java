package com.creditmemo.rules;

import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Final verdict of a memo once the approval timeline has been checked.
 */
@Value
@Builder
public class TimelineAssessment {

    /**
     * Business days between the two dates; null when either date is missing.
     */
    Integer businessDays;
    String timelineStatus;
    String approvalSequence;

    SoxStatus soxStatus;
    RiskLevel riskLevel;
    String missingApprovals;
}
