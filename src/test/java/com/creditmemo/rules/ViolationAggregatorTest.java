package com.creditmemo.rules;

import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViolationAggregatorTest {

    private final ViolationAggregator aggregator = new ViolationAggregator();

    @Test
    void testCompliantMemoHasNoViolations() {
        ViolationBreakdown breakdown = aggregator.aggregate(assessment(SoxStatus.COMPLIANT,
            "None", "Within 5 days", "Order OK"));

        assertEquals(0, breakdown.getCount());
        assertEquals("None", breakdown.getSummary());
    }

    @Test
    void testMissingLevelMessage() {
        ViolationBreakdown breakdown = aggregator.aggregate(assessment(SoxStatus.VIOLATION,
            "Level 2–3 Missing", "Within 5 days", "Order OK"));

        assertEquals(List.of("Missing Approval: Level 2–3 Missing"), breakdown.getReasons());
        assertEquals(1, breakdown.getCount());
    }

    @Test
    void testSlaBreachContributesTwoReasons() {
        ViolationBreakdown breakdown = aggregator.aggregate(assessment(SoxStatus.VIOLATION,
            "Timeline: CM created 3 days after SLA threshold", "Over 5 days", "SLA Violated"));

        assertEquals(2, breakdown.getCount());
        assertEquals("SLA Breach: Timeline: CM created 3 days after SLA threshold | SLA Exceeded: Over 5 days",
            breakdown.getSummary());
    }

    @Test
    void testApprovalAfterCreation() {
        ViolationBreakdown breakdown = aggregator.aggregate(assessment(SoxStatus.VIOLATION,
            "Approval Date: Approved after CM creation", "Approval After CM", "Approval After CM (Violation)"));

        assertEquals(List.of(
            "Approval Issue: Approval Date: Approved after CM creation",
            "Approval After CM Creation"), breakdown.getReasons());
    }

    @Test
    void testDatesMissingIsSlaBreach() {
        ViolationBreakdown breakdown = aggregator.aggregate(assessment(SoxStatus.VIOLATION,
            "Timeline: Dates missing", "Dates Missing", "Dates Missing"));

        assertEquals("SLA Breach: Timeline: Dates missing", breakdown.getSummary());
    }

    @Test
    void testOtherIssuesArePrefixedAsApprovalIssue() {
        ViolationBreakdown breakdown = aggregator.aggregate(assessment(SoxStatus.VIOLATION,
            "Designation 'Regional Manager' not found in matrix", "Within 5 days", "Order OK"));

        assertEquals("Approval Issue: Designation 'Regional Manager' not found in matrix", breakdown.getSummary());
    }

    private TimelineAssessment assessment(SoxStatus status, String missingApprovals,
                                          String timelineStatus, String sequence) {
        return TimelineAssessment.builder()
            .soxStatus(status)
            .riskLevel(status == SoxStatus.COMPLIANT ? RiskLevel.LOW : RiskLevel.HIGH)
            .missingApprovals(missingApprovals)
            .timelineStatus(timelineStatus)
            .approvalSequence(sequence)
            .build();
    }
}
