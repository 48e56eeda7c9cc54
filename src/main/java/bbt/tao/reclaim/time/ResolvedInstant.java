package bbt.tao.reclaim.time;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

public record ResolvedInstant(Instant instant) {

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    public ResolvedInstant {
        instant = instant.truncatedTo(ChronoUnit.MILLIS);
    }

    public static ResolvedInstant of(Instant instant) {
        return new ResolvedInstant(instant);
    }

    public ResolvedInstant plusMinutes(long minutes) {
        return new ResolvedInstant(instant.plus(minutes, ChronoUnit.MINUTES));
    }

    public ResolvedInstant plusDays(long days) {
        return new ResolvedInstant(instant.plus(days, ChronoUnit.DAYS));
    }

    @JsonValue
    public String iso() {
        return CANONICAL.format(instant);
    }

    @Override
    public String toString() {
        return iso();
    }
}
