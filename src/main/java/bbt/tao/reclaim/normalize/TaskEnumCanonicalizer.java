package bbt.tao.reclaim.normalize;

import bbt.tao.reclaim.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps free-form enumeration values onto the tags the Reclaim API accepts.
 * <p>
 * Each enumeration has a table of canonical tags and a table of aliases consulted on a miss. Input is
 * trimmed, upper-cased and has runs of spaces or hyphens replaced by {@code _} before lookup.
 * Unknown values fall back to a default instead of failing, except for {@code status}.
 * <table>
 *     <tr><th>field</th><th>fallback</th></tr>
 *     <tr><td>category</td><td>{@code WORK}</td></tr>
 *     <tr><td>priority</td><td>{@code P3}</td></tr>
 *     <tr><td>sub-category</td><td>{@code FOCUS} for work, {@code OTHER_PERSONAL} for personal</td></tr>
 *     <tr><td>color</td><td>none, the calendar's own color is kept</td></tr>
 * </table>
 */
@Slf4j
public final class TaskEnumCanonicalizer {

    public static final String WORK = "WORK";
    public static final String PERSONAL = "PERSONAL";
    public static final String DEFAULT_PRIORITY = "P3";
    public static final String DEFAULT_WORK_SUB_TYPE = "FOCUS";
    public static final String DEFAULT_PERSONAL_SUB_TYPE = "OTHER_PERSONAL";

    private static final Map<String, String> CATEGORIES = identity(WORK, PERSONAL);
    private static final Map<String, String> CATEGORY_ALIASES = Map.of(
            "JOB", WORK,
            "OFFICE", WORK,
            "BUSINESS", WORK,
            "HOME", PERSONAL,
            "LIFE", PERSONAL,
            "PRIVATE", PERSONAL
    );

    private static final Map<String, String> PRIORITIES = identity("P1", "P2", "P3", "P4");
    private static final Map<String, String> PRIORITY_ALIASES = Map.ofEntries(
            Map.entry("1", "P1"),
            Map.entry("2", "P2"),
            Map.entry("3", "P3"),
            Map.entry("4", "P4"),
            Map.entry("CRITICAL", "P1"),
            Map.entry("URGENT", "P1"),
            Map.entry("HIGHEST", "P1"),
            Map.entry("HIGH", "P2"),
            Map.entry("MEDIUM", "P3"),
            Map.entry("NORMAL", "P3"),
            Map.entry("DEFAULT", "P3"),
            Map.entry("LOW", "P4"),
            Map.entry("LOWEST", "P4")
    );

    private static final Map<String, String> SUB_TYPES = identity(
            "ONE_ON_ONE", "STAFF_MEETING", "OP_MEETING", "EXTERNAL", "IDEATION", "FOCUS", "PRODUCTIVITY",
            "TRAVEL", "FLIGHT", "TRAIN", "VACATION", "HEALTH", "ERRAND", "OTHER_PERSONAL");
    private static final Map<String, String> SUB_TYPE_ALIASES = Map.ofEntries(
            Map.entry("MEETING", "STAFF_MEETING"),
            Map.entry("TEAM_MEETING", "STAFF_MEETING"),
            Map.entry("STANDUP", "STAFF_MEETING"),
            Map.entry("1:1", "ONE_ON_ONE"),
            Map.entry("1_ON_1", "ONE_ON_ONE"),
            Map.entry("ONE_ON_ONES", "ONE_ON_ONE"),
            Map.entry("OPS_MEETING", "OP_MEETING"),
            Map.entry("OPERATIONS", "OP_MEETING"),
            Map.entry("CLIENT", "EXTERNAL"),
            Map.entry("CUSTOMER", "EXTERNAL"),
            Map.entry("DEEP_WORK", "FOCUS"),
            Map.entry("HEADS_DOWN", "FOCUS"),
            Map.entry("BRAINSTORM", "IDEATION"),
            Map.entry("PERSONAL", "OTHER_PERSONAL"),
            Map.entry("DOCTOR", "HEALTH"),
            Map.entry("MEDICAL", "HEALTH"),
            Map.entry("PTO", "VACATION"),
            Map.entry("OOO", "VACATION"),
            Map.entry("ERRANDS", "ERRAND")
    );
    private static final Set<String> PERSONAL_SUB_TYPES = Set.of("VACATION", "HEALTH", "ERRAND", "OTHER_PERSONAL");

    private static final Map<String, String> COLORS = identity(
            "LAVENDER", "SAGE", "GRAPE", "FLAMINGO", "BANANA", "TANGERINE",
            "PEACOCK", "GRAPHITE", "BLUEBERRY", "BASIL", "TOMATO");
    private static final Map<String, String> COLOR_ALIASES = Map.ofEntries(
            Map.entry("PURPLE", "GRAPE"),
            Map.entry("LIGHT_PURPLE", "LAVENDER"),
            Map.entry("LIGHT_GREEN", "SAGE"),
            Map.entry("GREEN", "BASIL"),
            Map.entry("RED", "TOMATO"),
            Map.entry("PINK", "FLAMINGO"),
            Map.entry("YELLOW", "BANANA"),
            Map.entry("ORANGE", "TANGERINE"),
            Map.entry("TEAL", "PEACOCK"),
            Map.entry("BLUE", "BLUEBERRY"),
            Map.entry("GRAY", "GRAPHITE"),
            Map.entry("GREY", "GRAPHITE")
    );

    private static final Map<String, String> STATUSES = identity(
            "NEW", "SCHEDULED", "IN_PROGRESS", "COMPLETE", "CANCELLED", "ARCHIVED");
    private static final Map<String, String> STATUS_ALIASES = Map.of("CANCELED", "CANCELLED");

    private TaskEnumCanonicalizer() {
    }

    public static String category(String value) {
        return lookup(value, CATEGORIES, CATEGORY_ALIASES, token -> fallback("eventCategory", value, WORK));
    }

    public static String priority(String value) {
        return lookup(value, PRIORITIES, PRIORITY_ALIASES, token -> fallback("priority", value, DEFAULT_PRIORITY));
    }

    /**
     * @param category canonical category the fallback is conditioned on, may be {@code null}
     */
    public static String subType(String value, String category) {
        return lookup(value, SUB_TYPES, SUB_TYPE_ALIASES,
                token -> fallback("eventSubType", value, defaultSubType(category)));
    }

    public static String color(String value) {
        return lookup(value, COLORS, COLOR_ALIASES, token -> fallback("eventColor", value, null));
    }

    public static String status(String value) {
        return lookup(value, STATUSES, STATUS_ALIASES, token -> {
            throw new InvalidInputException("Unknown status \"" + value + "\". Expected one of " + STATUSES.keySet() + ".");
        });
    }

    /**
     * Personal sub-categories imply {@code PERSONAL}, everything else {@code WORK}.
     */
    public static String categoryForSubType(String canonicalSubType) {
        return PERSONAL_SUB_TYPES.contains(canonicalSubType) ? PERSONAL : WORK;
    }

    public static String defaultSubType(String category) {
        return PERSONAL.equals(category) ? DEFAULT_PERSONAL_SUB_TYPE : DEFAULT_WORK_SUB_TYPE;
    }

    static String token(String value) {
        return value.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }

    private static String lookup(String value,
                                 Map<String, String> primary,
                                 Map<String, String> aliases,
                                 Function<String, String> onMiss) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String token = token(value);
        String canonical = primary.get(token);
        if (canonical == null) {
            canonical = aliases.get(token);
        }
        return canonical != null ? canonical : onMiss.apply(token);
    }

    private static String fallback(String field, String value, String replacement) {
        log.warn("Unrecognized {} '{}', using {}", field, value, replacement == null ? "no value" : replacement);
        return replacement;
    }

    private static Map<String, String> identity(String... tags) {
        return List.of(tags).stream().collect(Collectors.toUnmodifiableMap(Function.identity(), Function.identity()));
    }
}
