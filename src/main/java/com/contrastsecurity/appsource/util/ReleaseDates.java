package com.contrastsecurity.appsource.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps as they appear in catalogs and release feeds.
 *
 * The canonical form is the GitHub API format, {@code 2022-05-25T03:39:23Z}. Older
 * catalogs also use bare dates ({@code 2022-05-25}) and timestamps without an offset;
 * both are read as UTC.
 */
public final class ReleaseDates {
    private static final DateTimeFormatter CANONICAL =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private ReleaseDates() {
        // Utility class - prevent instantiation
    }

    /**
     * Parse a catalog or feed timestamp.
     *
     * @throws DateTimeParseException if the value is null or in no supported format
     */
    public static Instant parse(String value) {
        if (value == null) {
            throw new DateTimeParseException("Missing date", "", 0);
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            // fall through to the offset-less forms
        }
        try {
            return LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            // fall through to a bare date
        }
        return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    /**
     * Format an instant in the canonical form, truncated to whole seconds.
     */
    public static String format(Instant instant) {
        return CANONICAL.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static String now() {
        return format(Instant.now());
    }

    /**
     * @return true if {@code candidate} is strictly later than {@code current}
     */
    public static boolean isAfter(String candidate, String current) {
        return parse(candidate).isAfter(parse(current));
    }
}
