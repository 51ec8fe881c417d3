package com.hybridorm.core;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * An immutable point in wall-clock time used for {@code datetime} casts.
 * <p>
 * Values are stored on entities in the canonical {@link #CANONICAL_PATTERN} form and
 * decoded back into a {@code Moment} on read. Sub-second precision is dropped when
 * formatting, so two moments that format identically round-trip as equal. Zoned and
 * offset values, and {@link #now()}, are expressed as UTC wall time.
 */
public final class Moment implements Comparable<Moment> {
    public static final String CANONICAL_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";
    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern(CANONICAL_PATTERN);
    private static final DateTimeFormatter SQL_STYLE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSS][.SSS]");

    private static final List<Function<String, LocalDateTime>> PARSERS = List.of(
            LocalDateTime::parse,
            text -> OffsetDateTime.parse(text).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime(),
            text -> LocalDateTime.parse(text, SQL_STYLE),
            text -> LocalDate.parse(text).atStartOfDay());

    private final LocalDateTime value;

    private Moment(LocalDateTime value) {
        this.value = Objects.requireNonNull(value, "value").truncatedTo(ChronoUnit.SECONDS);
    }

    public static Moment of(LocalDateTime value) {
        return new Moment(value);
    }

    public static Moment of(int year, int month, int day, int hour, int minute, int second) {
        return new Moment(LocalDateTime.of(year, month, day, hour, minute, second));
    }

    /**
     * Current wall time in UTC, matching how offset values are normalized.
     */
    public static Moment now() {
        return new Moment(LocalDateTime.now(ZoneOffset.UTC));
    }

    /**
     * Parses ISO-8601 local or offset date-times, SQL style {@code yyyy-MM-dd HH:mm:ss}
     * and bare dates. Offset values are normalized to UTC wall time.
     *
     * @throws DateTimeParseException if none of the accepted shapes match
     */
    public static Moment parse(String text) {
        String trimmed = text.trim();
        DateTimeParseException failure = null;
        for (Function<String, LocalDateTime> parser : PARSERS) {
            try {
                return new Moment(parser.apply(trimmed));
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw failure;
    }

    /**
     * Converts any supported temporal representation into a Moment.
     *
     * @return the converted value, or {@code null} when {@code value} is not a temporal type
     * @throws DateTimeParseException for strings that cannot be parsed
     */
    public static Moment from(Object value) {
        if (value instanceof Moment) {
            return (Moment) value;
        }
        if (value instanceof LocalDateTime) {
            return new Moment((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return new Moment(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof OffsetDateTime) {
            return new Moment(((OffsetDateTime) value).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof ZonedDateTime) {
            return new Moment(((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof Instant) {
            return new Moment(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
        }
        if (value instanceof Date) {
            return new Moment(LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC));
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        return null;
    }

    /**
     * True for the native types {@link #from(Object)} accepts without parsing.
     */
    public static boolean isTemporal(Object value) {
        return value instanceof Moment
                || value instanceof LocalDateTime
                || value instanceof LocalDate
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof Instant
                || value instanceof Date;
    }

    public String format() {
        return CANONICAL.format(value);
    }

    public String format(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).format(value);
    }

    public LocalDateTime toLocalDateTime() {
        return value;
    }

    public Instant toInstant(ZoneId zone) {
        return value.atZone(zone).toInstant();
    }

    public int getYear() {
        return value.getYear();
    }

    public int getMonth() {
        return value.getMonthValue();
    }

    public int getDay() {
        return value.getDayOfMonth();
    }

    public int getHour() {
        return value.getHour();
    }

    public int getMinute() {
        return value.getMinute();
    }

    public int getSecond() {
        return value.getSecond();
    }

    public boolean isBefore(Moment other) {
        return value.isBefore(other.value);
    }

    public boolean isAfter(Moment other) {
        return value.isAfter(other.value);
    }

    @Override
    public int compareTo(Moment other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Moment)) return false;
        return value.equals(((Moment) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
