package bbt.tao.reclaim.time;

import bbt.tao.reclaim.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Resolves caller supplied date/time values into absolute instants.
 * <p>
 * Offset-carrying values are taken as-is and ignore the {@link ResolutionContext}. Local values are
 * interpreted in the first timezone the context yields. Day counts are a fixed shift of
 * {@code N x 24h} from now: unlike the string path this does not follow DST, so the wall-clock time
 * can move by an hour when a transition is crossed.
 */
@Slf4j
@Component
public class LocalTimeResolver {

    private final TimeExpressionParser parser;
    private final ZonedTimeConverter converter;
    private final Clock clock;

    public LocalTimeResolver(TimeExpressionParser parser, ZonedTimeConverter converter, Clock clock) {
        this.parser = parser;
        this.converter = converter;
        this.clock = clock;
    }

    public ResolvedInstant resolve(TimeInput input, ResolutionContext context) {
        if (input == null) {
            throw new InvalidInputException("A date/time value is required.");
        }
        if (input.isRelativeDays()) {
            return resolve(new TimeExpression.RelativeDays(input.days()), context);
        }
        return resolve(input.text(), context);
    }

    public ResolvedInstant resolve(String expression, ResolutionContext context) {
        return resolve(parser.parse(expression), context);
    }

    public ResolvedInstant resolve(TimeExpression expression, ResolutionContext context) {
        if (expression instanceof TimeExpression.AbsoluteDateTime absolute) {
            return ResolvedInstant.of(absolute.instant());
        }
        if (expression instanceof TimeExpression.RelativeDays relative) {
            return resolveRelativeDays(relative.days());
        }
        if (expression instanceof TimeExpression.LocalDateTimeExpression local) {
            return resolveLocal(local.fields(), context);
        }
        throw new IllegalArgumentException("Unsupported time expression: " + expression);
    }

    public ResolvedInstant resolveRelativeDays(int days) {
        Instant now = clock.instant();
        if (days <= 0) {
            log.warn("Received non-positive number of days '{}' for a date field, using current time.", days);
            return ResolvedInstant.of(now);
        }
        return ResolvedInstant.of(now).plusDays(days);
    }

    private ResolvedInstant resolveLocal(CalendarFields fields, ResolutionContext context) {
        String timeZone = context == null ? null : context.timeZone().orElse(null);
        ZoneId zone = timeZone != null ? converter.zoneOf(timeZone) : clock.getZone();
        Instant instant = converter.toInstant(fields, zone);
        log.debug("Resolved local time {} in {} to {}", fields.toLocalDateTime(), zone, instant);
        return ResolvedInstant.of(instant);
    }
}
