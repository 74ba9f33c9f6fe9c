package com.jonathantong.WalShift.service;

import com.jonathantong.WalShift.model.TemporalType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalValueConverterTest {

    private static final LocalDateTime NOV_14_2023 = LocalDateTime.parse("2023-11-14T22:13:20");

    private final TemporalValueConverter converter = new TemporalValueConverter();

    @Test
    void microsecondValueInPlausibleRange_isReadAsMicroseconds() {
        Object converted = converter.convert(1_700_000_000_000_000L, TemporalType.TIMESTAMP);

        assertThat(converted).isEqualTo(NOV_14_2023);
    }

    @Test
    void valueOutsideMicrosecondRange_isReadAsMilliseconds() {
        // As microseconds this is January 1970
        Object converted = converter.convert(1_700_000_000_000L, TemporalType.TIMESTAMP);

        assertThat(converted).isEqualTo(NOV_14_2023);
    }

    @Test
    void microsecondPrecisionIsKept() {
        Object converted = converter.convert(1_700_000_000_123_456L, TemporalType.TIMESTAMP);

        assertThat(converted).isEqualTo(NOV_14_2023.plusNanos(123_456_000L));
    }

    @Test
    void timestampWithTimeZone_isBoundAsUtcOffset() {
        Object converted = converter.convert(1_700_000_000_000_000L, TemporalType.TIMESTAMPTZ);

        assertThat(converted).isEqualTo(OffsetDateTime.of(NOV_14_2023, ZoneOffset.UTC));
    }

    @Test
    void dateColumn_receivesUtcCalendarDay() {
        Object converted = converter.convert(1_700_000_000_000L, TemporalType.DATE);

        assertThat(converted).isEqualTo(LocalDate.of(2023, 11, 14));
    }

    @Test
    void wallClockValue_doesNotDependOnJvmTimeZone() {
        TimeZone original = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("Asia/Kolkata"));

            assertThat(converter.convert(1_700_000_000_000_000L, TemporalType.TIMESTAMP)).isEqualTo(NOV_14_2023);
            assertThat(converter.convert(1_700_000_000_000_000L, TemporalType.DATE))
                    .isEqualTo(LocalDate.of(2023, 11, 14));
        } finally {
            TimeZone.setDefault(original);
        }
    }

    @Test
    void zero_isPassedThroughUnchanged() {
        assertThat(converter.convert(0L, TemporalType.TIMESTAMP)).isEqualTo(0L);
        assertThat(converter.convert(0, TemporalType.DATE)).isEqualTo(0);
    }

    @Test
    void text_isPassedThroughUnchanged() {
        String iso = "2026-02-16T21:04:46.955Z";

        assertThat(converter.convert(iso, TemporalType.TIMESTAMP)).isSameAs(iso);
    }

    @Test
    void null_staysNull() {
        assertThat(converter.convert(null, TemporalType.TIMESTAMPTZ)).isNull();
    }

    @Test
    void yearRangeBoundsAreInclusive() {
        long startOf2000 = Instant.parse("2000-01-01T00:00:00Z").getEpochSecond() * 1_000_000L;
        long endOf2100 = Instant.parse("2100-12-31T23:59:59Z").getEpochSecond() * 1_000_000L;

        assertThat(converter.convert(startOf2000, TemporalType.TIMESTAMP))
                .isEqualTo(LocalDateTime.parse("2000-01-01T00:00:00"));
        assertThat(converter.convert(endOf2100, TemporalType.TIMESTAMP))
                .isEqualTo(LocalDateTime.parse("2100-12-31T23:59:59"));
    }

    @Test
    void justBefore2000AsMicroseconds_fallsBackToMilliseconds() {
        long endOf1999 = Instant.parse("1999-12-31T23:59:59Z").getEpochSecond() * 1_000_000L;

        assertThat(converter.convert(endOf1999, TemporalType.TIMESTAMPTZ))
                .isEqualTo(Instant.ofEpochMilli(endOf1999).atOffset(ZoneOffset.UTC));
    }

    @Test
    void floatingPointValues_areTruncatedBeforeInterpretation() {
        Object converted = converter.convert(1.7e15, TemporalType.TIMESTAMP);

        assertThat(converted).isEqualTo(NOV_14_2023);
    }
}
