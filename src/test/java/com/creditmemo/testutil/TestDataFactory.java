package com.creditmemo.testutil;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;
import com.creditmemo.matrix.ApprovalMatrixSet;
import com.creditmemo.matrix.PolicyCategory;
import com.creditmemo.memo.CreditMemoRecord;
import com.creditmemo.rules.ApprovalComplianceEvaluator;
import com.creditmemo.rules.ApproverLevelResolver;
import com.creditmemo.rules.CreditMemoRulesEngine;
import com.creditmemo.rules.ReasonClassifier;
import com.creditmemo.rules.RequiredLevelResolver;
import com.creditmemo.rules.SeparationOfDutiesRule;
import com.creditmemo.rules.TimelineEvaluator;
import com.creditmemo.rules.ViolationAggregator;
import com.creditmemo.rules.designation.ExactDesignationMatch;
import com.creditmemo.rules.designation.ForwardSubstringMatch;
import com.creditmemo.rules.designation.ReverseSubstringMatch;

import java.util.List;

public class TestDataFactory {

    /**
     * Contract: Sales Manager up to 10,000, Finance Manager up to 100,000, CFO above.
     */
    public static ApprovalMatrix contractMatrix() {
        return ApprovalMatrix.of(PolicyCategory.CONTRACT,
            ApprovalMatrixEntry.unbounded(3, "CFO"),
            ApprovalMatrixEntry.of(2, "Finance Manager", "100000"),
            ApprovalMatrixEntry.of(1, "Sales Manager", "10000"));
    }

    /**
     * Promotional: Marketing Manager up to 5,000, Marketing Director up to 50,000, VP Marketing above.
     */
    public static ApprovalMatrix promotionalMatrix() {
        return ApprovalMatrix.of(PolicyCategory.PROMOTIONAL,
            ApprovalMatrixEntry.of(1, "Marketing Manager", "5000"),
            ApprovalMatrixEntry.of(2, "Marketing Director", "50000"),
            ApprovalMatrixEntry.unbounded(3, "VP Marketing"));
    }

    public static ApprovalMatrix otherMatrix() {
        return ApprovalMatrix.of(PolicyCategory.OTHER,
            ApprovalMatrixEntry.of(1, "Credit Analyst", "2500"),
            ApprovalMatrixEntry.of(2, "Credit Manager", "25000"),
            ApprovalMatrixEntry.unbounded(3, "Controller"));
    }

    public static ApprovalMatrixSet allMatrices() {
        return ApprovalMatrixSet.of(contractMatrix(), promotionalMatrix(), otherMatrix());
    }

    /**
     * A contract memo for 50,000 approved by a Finance Manager three business days
     * before creation, created and approved by different people.
     */
    public static CreditMemoRecord.CreditMemoRecordBuilder compliantContractMemo(String memo) {
        return CreditMemoRecord.builder()
            .memo(memo)
            .customerName("Acme Retail")
            .cmDate("2024-01-05")
            .createdBy("John Smith")
            .amount("50000")
            .reason("Contract price adjustment")
            .dateOfApproval("2024-01-02")
            .approver("Jane Doe")
            .approverDesignation("Finance Manager");
    }

    public static CreditMemoRulesEngine rulesEngine() {
        return new CreditMemoRulesEngine(
            new ReasonClassifier(),
            new RequiredLevelResolver(),
            approverLevelResolver(),
            new ApprovalComplianceEvaluator(),
            new TimelineEvaluator(),
            new ViolationAggregator(),
            new SeparationOfDutiesRule());
    }

    public static ApproverLevelResolver approverLevelResolver() {
        return new ApproverLevelResolver(List.of(
            new ExactDesignationMatch(),
            new ForwardSubstringMatch(),
            new ReverseSubstringMatch()));
    }
}
