package com.creditmemo.memo;

import com.creditmemo.matrix.PolicyCategory;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Columns appended to a credit memo by validation. Column names match the
 * audit workbook consumed by the export and reporting layers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Reason Class", "Required Approval Level", "Final Approver Level", "Final Approver",
    "SOX Status", "Risk Level", "Missing Approvals", "Violation Reason", "Violation Count",
    "Approval Timeline (Business Days)", "Timeline Status", "Approval Sequence",
    "Designation Level Check", "Duplicate Memo"})
public class ValidationOutcome {

    public static final String NONE = "None";
    public static final String YES = "Yes";
    public static final String NO = "No";
    public static final String SOD_OK = "OK";
    public static final String SOD_VIOLATION = "Violation";

    @JsonProperty("Reason Class")
    private PolicyCategory reasonClass;

    @JsonProperty("Required Approval Level")
    private Integer requiredApprovalLevel;

    @JsonProperty("Final Approver Level")
    private Integer finalApproverLevel;

    @JsonProperty("Final Approver")
    private String finalApprover;

    @JsonProperty("SOX Status")
    private SoxStatus soxStatus;

    @JsonProperty("Risk Level")
    private RiskLevel riskLevel;

    @JsonProperty("Missing Approvals")
    private String missingApprovals;

    @JsonProperty("Violation Reason")
    private String violationReason;

    @JsonProperty("Violation Count")
    private int violationCount;

    @JsonProperty("Approval Timeline (Business Days)")
    private Integer approvalTimelineBusinessDays;

    @JsonProperty("Timeline Status")
    private String timelineStatus;

    @JsonProperty("Approval Sequence")
    private String approvalSequence;

    /**
     * Separation-of-duties result: "Violation" when creator and approver are the same person.
     */
    @JsonProperty("Designation Level Check")
    private String designationLevelCheck;

    @JsonProperty("Duplicate Memo")
    private String duplicateMemo;

    @JsonIgnore
    public boolean isCompliant() {
        return soxStatus == SoxStatus.COMPLIANT;
    }
}
