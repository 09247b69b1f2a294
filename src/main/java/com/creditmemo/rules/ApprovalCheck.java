package com.creditmemo.rules;

import com.creditmemo.memo.RiskLevel;
import lombok.Value;

/**
 * Tentative outcome of the approval-level check, before the timeline is considered.
 */
@Value
public class ApprovalCheck {

    public enum State {
        /**
         * Approver level is sufficient; the timeline decides the verdict.
         */
        PENDING,

        /**
         * Approval already fails policy.
         */
        VIOLATION
    }

    State state;
    RiskLevel riskLevel;
    String message;

    public static ApprovalCheck pending() {
        return new ApprovalCheck(State.PENDING, null, "None");
    }

    public static ApprovalCheck violation(RiskLevel riskLevel, String message) {
        return new ApprovalCheck(State.VIOLATION, riskLevel, message);
    }

    public boolean isCompliantSoFar() {
        return state == State.PENDING;
    }
}
