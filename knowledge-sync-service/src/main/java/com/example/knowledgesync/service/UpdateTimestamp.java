package com.example.knowledgesync.service;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A remote last-modified timestamp that may or may not carry a UTC offset.
 *
 * Accepts ISO-8601 date-times with 'T' or space separator, optional fraction and an optional
 * offset written as Z, +HH:MM or +HHMM (the Jira format, e.g. 2024-01-01T10:00:00.000+0000).
 */
public final class UpdateTimestamp implements Comparable<UpdateTimestamp> {

    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");

    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private final LocalDateTime localDateTime;
    private final ZoneOffset offset;

    private UpdateTimestamp(LocalDateTime localDateTime, ZoneOffset offset) {
        this.localDateTime = localDateTime;
        this.offset = offset;
    }

    /**
     * @throws DateTimeParseException if the value is null, blank or not a supported date-time
     */
    public static UpdateTimestamp parse(String value) {
        if (value == null || value.isBlank()) {
            throw new DateTimeParseException("Timestamp is empty", String.valueOf(value), 0);
        }
        String normalized = COMPACT_OFFSET.matcher(value.trim()).replaceFirst("$1:$2");

        TemporalAccessor parsed = FORMATTER.parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return new UpdateTimestamp(offsetDateTime.toLocalDateTime(), offsetDateTime.getOffset());
        }
        return new UpdateTimestamp((LocalDateTime) parsed, null);
    }

    public static Optional<UpdateTimestamp> tryParse(String value) {
        try {
            return Optional.of(parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public boolean hasOffset() {
        return offset != null;
    }

    /**
     * Wall-clock value with any offset dropped.
     */
    public LocalDateTime toLocalDateTime() {
        return localDateTime;
    }

    public Optional<OffsetDateTime> toOffsetDateTime() {
        return hasOffset() ? Optional.of(localDateTime.atOffset(offset)) : Optional.empty();
    }

    /**
     * Offset-aware values compare as instants. When only one side carries an offset
     * it is dropped and both compare as naive wall-clock values.
     */
    @Override
    public int compareTo(UpdateTimestamp other) {
        if (hasOffset() && other.hasOffset()) {
            return toOffsetDateTime().orElseThrow().toInstant()
                    .compareTo(other.toOffsetDateTime().orElseThrow().toInstant());
        }
        return localDateTime.compareTo(other.localDateTime);
    }

    public boolean isAfter(UpdateTimestamp other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return hasOffset() ? localDateTime.atOffset(offset).toString() : localDateTime.toString();
    }
}
