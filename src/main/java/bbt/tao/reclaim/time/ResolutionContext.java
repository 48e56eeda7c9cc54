package bbt.tao.reclaim.time;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Ordered timezone sources used to disambiguate offset-less local times:
 * explicit per-call value, configured default, account timezone, machine timezone.
 * The first populated source wins; sources are never merged.
 */
public record ResolutionContext(
        String explicitTimeZone,
        String defaultTimeZone,
        String accountTimeZone,
        String systemTimeZone
) {

    public static ResolutionContext explicit(String timeZone) {
        return new ResolutionContext(timeZone, null, null, null);
    }

    public Optional<String> timeZone() {
        return Stream.of(explicitTimeZone, defaultTimeZone, accountTimeZone, systemTimeZone)
                .filter(value -> value != null && !value.isBlank())
                .map(String::trim)
                .findFirst();
    }

    public boolean needsAccountTimeZone() {
        return isBlank(explicitTimeZone) && isBlank(defaultTimeZone);
    }

    public ResolutionContext withAccountTimeZone(String timeZone) {
        return new ResolutionContext(explicitTimeZone, defaultTimeZone, timeZone, systemTimeZone);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
