package bbt.tao.reclaim.time;

import bbt.tao.reclaim.exception.InvalidTimezoneException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns offset-less wall-clock components into an absolute instant for a given zone.
 * <p>
 * The zone's offset is not looked up from transition rules directly. Instead a handful of candidate
 * offsets is probed around a first UTC guess (the guess itself and one hour either side of the first
 * correction), every candidate instant is rendered back to wall-clock time in the zone, and the
 * candidate whose rendering matches the requested components wins:
 * <ul>
 *     <li>several matches (fall-back overlap): the earliest instant,</li>
 *     <li>no match (spring-forward gap): the nearest rendering at or after the requested time,
 *     otherwise the closest one.</li>
 * </ul>
 * The one-hour probe window covers ordinary DST shifts; historical transitions larger than an hour
 * would need a wider window.
 */
@Slf4j
@Component
public class ZonedTimeConverter {

    private static final long ONE_HOUR_MILLIS = 3_600_000L;

    private record Candidate(long epochMillis, CalendarFields wallClock) {

        long naiveMillis() {
            return wallClock.toNaiveEpochMillis();
        }
    }

    public ZoneId zoneOf(String timeZone) {
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException(timeZone, e);
        }
    }

    public Instant toInstant(CalendarFields desired, ZoneId zone) {
        long guess = desired.toNaiveEpochMillis();

        Set<Long> offsets = new LinkedHashSet<>();
        long firstOffset = offsetAt(guess, zone);
        offsets.add(firstOffset);
        long corrected = guess - firstOffset;
        offsets.add(offsetAt(corrected, zone));
        offsets.add(offsetAt(corrected + ONE_HOUR_MILLIS, zone));
        offsets.add(offsetAt(corrected - ONE_HOUR_MILLIS, zone));

        List<Candidate> candidates = new ArrayList<>(offsets.size());
        for (long offset : offsets) {
            long epochMillis = guess - offset;
            candidates.add(new Candidate(epochMillis, render(epochMillis, zone)));
        }

        Optional<Candidate> exact = candidates.stream()
                .filter(candidate -> candidate.wallClock().equals(desired))
                .min(Comparator.comparingLong(Candidate::epochMillis));
        if (exact.isPresent()) {
            return Instant.ofEpochMilli(exact.get().epochMillis());
        }

        long desiredNaive = desired.toNaiveEpochMillis();
        Candidate chosen = candidates.stream()
                .filter(candidate -> candidate.naiveMillis() >= desiredNaive)
                .min(Comparator.comparingLong((Candidate candidate) -> candidate.naiveMillis() - desiredNaive)
                        .thenComparingLong(Candidate::epochMillis))
                .orElseGet(() -> candidates.stream()
                        .min(Comparator.comparingLong(candidate -> Math.abs(candidate.naiveMillis() - desiredNaive)))
                        .orElseThrow());

        log.debug("Local time {} does not exist in {}; using {} instead", desired.toLocalDateTime(), zone, chosen.wallClock().toLocalDateTime());
        return Instant.ofEpochMilli(chosen.epochMillis());
    }

    /**
     * Wall-clock rendering of an instant minus the instant itself, i.e. the zone's UTC offset there.
     */
    private long offsetAt(long epochMillis, ZoneId zone) {
        return render(epochMillis, zone).toNaiveEpochMillis() - epochMillis;
    }

    private CalendarFields render(long epochMillis, ZoneId zone) {
        return CalendarFields.of(LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), zone));
    }
}
