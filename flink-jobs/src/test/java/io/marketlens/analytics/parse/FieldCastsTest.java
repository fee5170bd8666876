package io.marketlens.analytics.parse;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FieldCastsTest {

    @Test
    void scientificNotationIsAccepted() {
        assertEquals(0, new BigDecimal("12500").compareTo(FieldCasts.decimal("12.5e3")));
        assertEquals(0, new BigDecimal("12500").compareTo(FieldCasts.decimal("1.25E+4")));
    }

    @Test
    void malformedOrBlankDecimalIsZero() {
        assertEquals(BigDecimal.ZERO, FieldCasts.decimal("12,50"));
        assertEquals(BigDecimal.ZERO, FieldCasts.decimal("abc"));
        assertEquals(BigDecimal.ZERO, FieldCasts.decimal("  "));
        assertEquals(BigDecimal.ZERO, FieldCasts.decimal(null));
        assertNull(FieldCasts.nullableDecimal("n/a"));
    }

    @Test
    void decimalIsClampedToAllowedRange() {
        assertEquals(BigDecimal.ZERO, FieldCasts.decimal("-5.00"));
        assertEquals(FieldCasts.MAX_AMOUNT, FieldCasts.decimal("1e12"));
        assertEquals(0, new BigDecimal("150.75").compareTo(FieldCasts.decimal(" 150.75 ")));
    }

    @Test
    void microsAreConvertedToUnits() {
        assertEquals(0, new BigDecimal("12.345678").compareTo(FieldCasts.micros("12345678")));
        assertEquals(BigDecimal.ZERO, FieldCasts.micros("garbage"));
    }

    @Test
    void integersRejectFractionsAndClampToBounds() {
        assertEquals(42L, FieldCasts.integer("42"));
        assertEquals(0L, FieldCasts.integer("4.2"));
        assertEquals(0L, FieldCasts.integer("-3"));
        assertEquals(FieldCasts.MAX_COUNT, FieldCasts.integer("99999999999999999999"));
        assertEquals(Long.valueOf(FieldCasts.MAX_COUNT), FieldCasts.nullableInteger("99999999999999999999"));
        assertEquals(0L, FieldCasts.integer("-99999999999999999999"));
        assertNull(FieldCasts.nullableInteger(""));
    }

    @Test
    void datesNeedValidCalendarPrefix() {
        assertEquals(LocalDate.of(2024, 3, 5), FieldCasts.date("2024-03-05"));
        assertEquals(LocalDate.of(2024, 3, 5), FieldCasts.date("2024-03-05T10:00:00Z"));
        assertNull(FieldCasts.date("not-a-date"));
        assertNull(FieldCasts.date("2024-02-30"));
        assertNull(FieldCasts.date("05/03/2024"));
    }

    @Test
    void timestampsAcceptOffsetsLocalTimesAndDates() {
        assertEquals(Instant.parse("2024-03-05T08:00:00Z"), FieldCasts.timestamp("2024-03-05T10:00:00+02:00"));
        assertEquals(Instant.parse("2024-03-05T10:00:00Z"), FieldCasts.timestamp("2024-03-05T10:00:00"));
        assertEquals(Instant.parse("2024-03-05T00:00:00Z"), FieldCasts.timestamp("2024-03-05"));
        assertNull(FieldCasts.timestamp("yesterday"));
    }

    @Test
    void currencyIsUpperCasedOrDefaulted() {
        assertEquals("EUR", FieldCasts.currency("eur"));
        assertEquals("USD", FieldCasts.currency("euro"));
        assertEquals("USD", FieldCasts.currency(null));
    }
}
