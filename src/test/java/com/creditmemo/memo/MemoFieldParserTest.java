package com.creditmemo.memo;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MemoFieldParserTest {

    @Test
    void testAmountWithThousandsSeparators() {
        assertEquals(0, new BigDecimal("125000.50").compareTo(MemoFieldParser.parseAmount("125,000.50").orElseThrow()));
        assertEquals(0, new BigDecimal("-42").compareTo(MemoFieldParser.parseAmount(" -42 ").orElseThrow()));
    }

    @Test
    void testUnparseableAmountIsMissing() {
        assertTrue(MemoFieldParser.parseAmount(null).isEmpty());
        assertTrue(MemoFieldParser.parseAmount("").isEmpty());
        assertTrue(MemoFieldParser.parseAmount("TBD").isEmpty());
        assertTrue(MemoFieldParser.parseAmount("NaN").isEmpty());
    }

    @Test
    void testSupportedDateLayouts() {
        LocalDate expected = LocalDate.of(2024, 1, 5);

        assertEquals(Optional.of(expected), MemoFieldParser.parseDate("2024-01-05"));
        assertEquals(Optional.of(expected), MemoFieldParser.parseDate("2024-01-05 00:00:00"));
        assertEquals(Optional.of(expected), MemoFieldParser.parseDate("2024-01-05T09:30:00"));
        assertEquals(Optional.of(expected), MemoFieldParser.parseDate("1/5/2024"));
        assertEquals(Optional.of(expected), MemoFieldParser.parseDate("05-Jan-2024"));
        assertEquals(Optional.of(expected), MemoFieldParser.parseDate("Jan 5, 2024"));
    }

    @Test
    void testUnparseableDateIsMissing() {
        assertTrue(MemoFieldParser.parseDate(null).isEmpty());
        assertTrue(MemoFieldParser.parseDate(" ").isEmpty());
        assertTrue(MemoFieldParser.parseDate("pending").isEmpty());
        assertTrue(MemoFieldParser.parseDate("2024-13-40").isEmpty());
    }

    @Test
    void testImpossibleCalendarDateIsMissing() {
        assertTrue(MemoFieldParser.parseDate("2/30/2024").isEmpty());
        assertTrue(MemoFieldParser.parseDate("31-Apr-2024").isEmpty());
        assertTrue(MemoFieldParser.parseDate("2023/02/29").isEmpty());
        assertEquals(Optional.of(LocalDate.of(2024, 2, 29)), MemoFieldParser.parseDate("2/29/2024"));
    }

    @Test
    void testOffsetDateTimeKeepsWrittenDate() {
        assertEquals(Optional.of(LocalDate.of(2024, 1, 5)), MemoFieldParser.parseDate("2024-01-05T00:00:00Z"));
        assertEquals(Optional.of(LocalDate.of(2024, 1, 5)), MemoFieldParser.parseDate("2024-01-05T23:15:00-05:00"));
    }
}
