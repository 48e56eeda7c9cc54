package bbt.tao.reclaim.time;

import bbt.tao.reclaim.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the textual forms of a {@link TimeExpression}.
 * <p>
 * Priority: explicit offset or {@code Z} suffix, then {@code YYYY-MM-DD[(T| )HH[:mm[:ss[.SSS]]]]},
 * then a small set of permissive fallback layouts. Anything else is rejected.
 */
@Slf4j
@Component
public class TimeExpressionParser {

    private static final Pattern HAS_OFFSET = Pattern.compile("([zZ]|[+-]\\d{2}:\\d{2})$");
    private static final Pattern LOCAL_DATE_TIME = Pattern.compile(
            "^(\\d{4})-(\\d{2})-(\\d{2})(?:[T\\s](\\d{2})(?::(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,3}))?)?)?)?$");

    private static final List<DateTimeFormatter> ABSOLUTE_FALLBACKS = List.of(
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.RFC_1123_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .appendPattern("uuuu-MM-dd'T'HH:mm[:ss][.SSS]xx")
                    .toFormatter(Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT)
    );

    private static final List<DateTimeFormatter> LOCAL_FALLBACKS = List.of(
            localPattern("uuuu/M/d[ H:mm[:ss]]"),
            localPattern("M/d/uuuu[ H:mm[:ss]]")
    );

    public TimeExpression parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidInputException("Date/time value must not be empty.");
        }
        String trimmed = raw.trim();

        if (HAS_OFFSET.matcher(trimmed).find()) {
            return new TimeExpression.AbsoluteDateTime(parseAbsolute(trimmed, raw));
        }

        Matcher matcher = LOCAL_DATE_TIME.matcher(trimmed);
        if (matcher.matches()) {
            return new TimeExpression.LocalDateTimeExpression(toCalendarFields(matcher, raw));
        }

        return parseFallback(trimmed, raw);
    }

    private Instant parseAbsolute(String trimmed, String raw) {
        String normalized = trimmed;
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }
        if (normalized.endsWith("z")) {
            normalized = normalized.substring(0, normalized.length() - 1) + 'Z';
        }
        try {
            return OffsetDateTime.parse(normalized).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Invalid date format: \"" + raw + "\"", e);
        }
    }

    private CalendarFields toCalendarFields(Matcher matcher, String raw) {
        int year = Integer.parseInt(matcher.group(1));
        int month = checkRange("month", matcher.group(2), 1, 12, raw);
        int day = checkRange("day", matcher.group(3), 1, 31, raw);
        int hour = optionalField("hour", matcher.group(4), 23, raw);
        int minute = optionalField("minute", matcher.group(5), 59, raw);
        int second = optionalField("second", matcher.group(6), 59, raw);
        int millisecond = 0;
        if (matcher.group(7) != null) {
            String padded = (matcher.group(7) + "00").substring(0, 3);
            millisecond = Integer.parseInt(padded);
        }

        CalendarFields fields = new CalendarFields(year, month, day, hour, minute, second, millisecond);
        try {
            // LocalDateTime.of refuses components that would roll over, e.g. February 30
            fields.toLocalDateTime();
        } catch (DateTimeException e) {
            throw new InvalidInputException("Invalid date/time \"" + raw + "\": " + e.getMessage(), e);
        }
        return fields;
    }

    private int optionalField(String name, String value, int max, String raw) {
        return value == null ? 0 : checkRange(name, value, 0, max, raw);
    }

    private int checkRange(String name, String value, int min, int max, String raw) {
        int parsed = Integer.parseInt(value);
        if (parsed < min || parsed > max) {
            throw new InvalidInputException(String.format(
                    "Invalid %s \"%s\" in \"%s\" (expected %d-%d).", name, value, raw, min, max));
        }
        return parsed;
    }

    private TimeExpression parseFallback(String trimmed, String raw) {
        for (DateTimeFormatter formatter : ABSOLUTE_FALLBACKS) {
            try {
                return new TimeExpression.AbsoluteDateTime(ZonedDateTime.parse(trimmed, formatter).toInstant());
            } catch (DateTimeParseException e) {
                log.trace("Layout {} rejected '{}': {}", formatter, trimmed, e.getMessage());
            }
        }
        for (DateTimeFormatter formatter : LOCAL_FALLBACKS) {
            try {
                LocalDateTime local = LocalDateTime.parse(trimmed, formatter);
                return new TimeExpression.LocalDateTimeExpression(CalendarFields.of(local));
            } catch (DateTimeParseException e) {
                log.trace("Layout {} rejected '{}': {}", formatter, trimmed, e.getMessage());
            }
        }
        log.debug("No date/time layout matched '{}'", trimmed);
        throw new InvalidInputException("Invalid date format: \"" + raw + "\"");
    }

    private static DateTimeFormatter localPattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
                .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
                .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
