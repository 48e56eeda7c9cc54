package bbt.tao.reclaim.normalize;

import bbt.tao.reclaim.dto.reclaim.AccountDefaults;
import bbt.tao.reclaim.dto.reclaim.TaskInputData;
import bbt.tao.reclaim.exception.ChunkSizeConflictException;
import bbt.tao.reclaim.exception.InvalidInputException;
import bbt.tao.reclaim.time.LocalTimeResolver;
import bbt.tao.reclaim.time.ResolutionContext;
import bbt.tao.reclaim.time.ResolvedInstant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static bbt.tao.reclaim.normalize.ChunkDurations.requirePositive;
import static bbt.tao.reclaim.normalize.ChunkDurations.toChunks;

/**
 * Turns caller supplied task fields into a Reclaim payload.
 * <ol>
 *     <li>minute fields become chunk counts (exact multiples of 15 only),</li>
 *     <li>{@code lockChunkSizeToDuration} pins both chunk bounds to the total,</li>
 *     <li>create flows fill gaps from the account defaults,</li>
 *     <li>bounds are capped at the total and a max below the min is raised to the min,</li>
 *     <li>deadline, snooze and start time go through {@link LocalTimeResolver},</li>
 *     <li>create flows without a deadline get a computed due date,</li>
 *     <li>enumerations are canonicalized.</li>
 * </ol>
 * Nothing is partially applied: either the whole field set normalizes or an exception is thrown.
 */
@Slf4j
@Component
public class TaskFieldNormalizer {

    private static final int DEFAULT_DUE_IN_DAYS = 1;

    private final LocalTimeResolver timeResolver;

    public TaskFieldNormalizer(LocalTimeResolver timeResolver) {
        this.timeResolver = timeResolver;
    }

    public NormalizedTask normalize(RawTaskFields raw,
                                    AccountDefaults accountDefaults,
                                    ResolutionContext context,
                                    TaskFlow flow) {
        AccountDefaults defaults = accountDefaults == null ? AccountDefaults.NONE : accountDefaults;
        boolean creating = flow.injectsDefaults();

        String title = raw.title() == null ? null : raw.title().trim();
        if ((creating && title == null) || (title != null && title.isEmpty())) {
            throw new InvalidInputException("Title cannot be empty.");
        }

        // chunk conversion
        Integer minFromMinutes = toChunks(raw.minDurationMinutes(), "minDurationMinutes");
        Integer maxFromMinutes = toChunks(raw.maxDurationMinutes(), "maxDurationMinutes");
        if (minFromMinutes != null && maxFromMinutes != null && minFromMinutes > maxFromMinutes) {
            throw new ChunkSizeConflictException(minFromMinutes, maxFromMinutes);
        }
        Integer total = firstNonNull(toChunks(raw.durationMinutes(), "durationMinutes"),
                requirePositive(raw.timeChunksRequired(), "timeChunksRequired"));
        Integer min = firstNonNull(minFromMinutes, requirePositive(raw.minChunkSize(), "minChunkSize"));
        Integer max = firstNonNull(maxFromMinutes, requirePositive(raw.maxChunkSize(), "maxChunkSize"));

        if (Boolean.TRUE.equals(raw.lockChunkSizeToDuration())) {
            if (total == null) {
                throw new InvalidInputException("lockChunkSizeToDuration requires timeChunksRequired or durationMinutes.");
            }
            min = total;
            max = total;
        }

        String category = TaskEnumCanonicalizer.category(raw.eventCategory());
        String subType = TaskEnumCanonicalizer.subType(raw.eventSubType(), category);
        String priority = TaskEnumCanonicalizer.priority(raw.priority());
        Boolean onDeck = raw.onDeck();
        Boolean alwaysPrivate = raw.alwaysPrivate();
        String timeSchemeId = blankToNull(raw.timeSchemeId());

        if (creating) {
            if (category == null) {
                category = subType != null
                        ? TaskEnumCanonicalizer.categoryForSubType(subType)
                        : TaskEnumCanonicalizer.category(defaults.eventCategory());
            }
            if (subType == null) {
                subType = TaskEnumCanonicalizer.subType(defaults.eventSubType(), category);
            }
            priority = firstNonNull(priority, TaskEnumCanonicalizer.priority(defaults.priority()));
            onDeck = firstNonNull(onDeck, defaults.onDeck());
            alwaysPrivate = firstNonNull(alwaysPrivate, defaults.alwaysPrivate());
            timeSchemeId = firstNonNull(timeSchemeId, blankToNull(defaults.timeSchemeId()));

            total = firstNonNull(total, positiveOrNull(defaults.timeChunksRequired()), larger(min, max), 1);
            min = firstNonNull(min, positiveOrNull(defaults.minChunkSize()), 1);
            max = firstNonNull(max, positiveOrNull(defaults.maxChunkSize()), total);
        }

        if (total != null) {
            min = min == null ? null : Math.min(min, total);
            max = max == null ? null : Math.min(max, total);
        }
        if (min != null && max != null && min > max) {
            log.debug("Raising maxChunkSize {} to minChunkSize {}", max, min);
            max = min;
        }

        ResolvedInstant startTime = null;
        if (raw.startTime() != null) {
            startTime = timeResolver.resolve(raw.startTime(), context);
        } else if (flow == TaskFlow.CREATE_AT_TIME) {
            throw new InvalidInputException("startTime is required to create a task at an explicit time.");
        }
        ResolvedInstant due = raw.deadline() == null ? null : timeResolver.resolve(raw.deadline(), context);
        ResolvedInstant snoozeUntil = raw.snoozeUntil() == null ? null : timeResolver.resolve(raw.snoozeUntil(), context);

        if (due == null && creating) {
            due = defaultDue(flow, startTime, total, defaults);
        }

        TaskInputData payload = TaskInputData.builder()
                .title(title)
                .notes(raw.notes())
                .eventCategory(category)
                .eventSubType(subType)
                .priority(priority)
                .timeChunksRequired(total)
                .minChunkSize(min)
                .maxChunkSize(max)
                .onDeck(onDeck)
                .alwaysPrivate(alwaysPrivate)
                .timeSchemeId(timeSchemeId)
                .status(TaskEnumCanonicalizer.status(raw.status()))
                .due(due)
                .snoozeUntil(snoozeUntil)
                .eventColor(TaskEnumCanonicalizer.color(raw.eventColor()))
                .build();

        log.debug("Normalized {} fields: {}", flow, payload);
        return new NormalizedTask(payload, startTime);
    }

    private ResolvedInstant defaultDue(TaskFlow flow, ResolvedInstant startTime, Integer total, AccountDefaults defaults) {
        int dueInDays = defaults.dueInDays() != null && defaults.dueInDays() > 0 ? defaults.dueInDays() : DEFAULT_DUE_IN_DAYS;
        if (flow == TaskFlow.CREATE_AT_TIME) {
            if (total != null) {
                return startTime.plusMinutes(ChunkDurations.toMinutes(total));
            }
            return startTime.plusDays(dueInDays);
        }
        return timeResolver.resolveRelativeDays(dueInDays);
    }

    private static Integer larger(Integer a, Integer b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.max(a, b);
    }

    private static Integer positiveOrNull(Integer value) {
        return value != null && value > 0 ? value : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
