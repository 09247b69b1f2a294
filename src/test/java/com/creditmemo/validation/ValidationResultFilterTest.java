package com.creditmemo.validation;

import com.creditmemo.memo.CreditMemoRecord;
import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import com.creditmemo.memo.ValidatedCreditMemo;
import com.creditmemo.memo.ValidationOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultFilterTest {

    private final List<ValidatedCreditMemo> results = List.of(
        result("CM-1001", SoxStatus.COMPLIANT, RiskLevel.LOW),
        result("CM-1002", SoxStatus.VIOLATION, RiskLevel.HIGH),
        result("CM-2001", SoxStatus.VIOLATION, RiskLevel.MEDIUM));

    @Test
    void testEmptyFilterKeepsEverything() {
        assertSame(results, ValidationResultFilter.none().apply(results));
    }

    @Test
    void testMemoSubstringIsCaseInsensitive() {
        List<ValidatedCreditMemo> filtered = ValidationResultFilter.builder().memo("cm-10").build().apply(results);

        assertEquals(2, filtered.size());
    }

    @Test
    void testStatusAndRiskCombine() {
        List<ValidatedCreditMemo> filtered = ValidationResultFilter.builder()
            .statuses(Set.of(SoxStatus.VIOLATION))
            .riskLevels(Set.of(RiskLevel.MEDIUM))
            .build()
            .apply(results);

        assertEquals(1, filtered.size());
        assertEquals("CM-2001", filtered.get(0).getRecord().getMemo());
    }

    private ValidatedCreditMemo result(String memo, SoxStatus status, RiskLevel risk) {
        return new ValidatedCreditMemo(
            CreditMemoRecord.builder().memo(memo).build(),
            ValidationOutcome.builder().soxStatus(status).riskLevel(risk).build());
    }
}
