package com.jonathantong.WalShift.service;

import com.jonathantong.WalShift.model.TemporalType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Normalizes values bound for timestamp/date columns.
 * <p>
 * With time.precision.mode=isostring Debezium emits ISO-8601 text, which PostgreSQL
 * parses natively, so text passes through. Numeric values are epoch offsets of
 * unknown unit: they are read as microseconds when that lands in [2000, 2100],
 * otherwise as milliseconds. Zero is the unset/epoch sentinel and is left alone.
 * <p>
 * Converted values are java.time types pinned to UTC, so the JVM's default zone
 * never shifts what is written.
 */
@Component
public class TemporalValueConverter {

    static final int MIN_PLAUSIBLE_YEAR = 2000;
    static final int MAX_PLAUSIBLE_YEAR = 2100;

    public Object convert(Object value, TemporalType type) {
        if (!(value instanceof Number)) {
            return value;
        }

        long epoch = ((Number) value).longValue();
        if (epoch == 0) {
            return value;
        }

        Instant asMicros = Instant.ofEpochSecond(
                Math.floorDiv(epoch, 1_000_000L),
                Math.floorMod(epoch, 1_000_000L) * 1_000L);
        Instant instant = isPlausible(asMicros) ? asMicros : Instant.ofEpochMilli(epoch);
        return toColumnValue(instant, type);
    }

    private static Object toColumnValue(Instant instant, TemporalType type) {
        switch (type) {
            case TIMESTAMPTZ:
                return instant.atOffset(ZoneOffset.UTC);
            case DATE:
                return LocalDate.ofInstant(instant, ZoneOffset.UTC);
            case TIMESTAMP:
            default:
                // Debezium's epoch values carry the wall-clock reading as if it were UTC
                return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
    }

    private boolean isPlausible(Instant instant) {
        int year = instant.atZone(ZoneOffset.UTC).getYear();
        return year >= MIN_PLAUSIBLE_YEAR && year <= MAX_PLAUSIBLE_YEAR;
    }
}
