package io.ragweave.core.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/// Parsing of duration settings.
///
/// Accepts ISO-8601 durations (`PT2S`, `PT1M30S`) and plain millisecond counts
/// (`2000`).
public final class Durations {

    private Durations() {}

    /// Parses a duration setting.
    ///
    /// @param value ISO-8601 duration or non-negative millisecond count, not null
    /// @return parsed duration, never null
    /// @throws IllegalArgumentException if the value is neither form or negative
    public static Duration parse(String value) {
        String trimmed = value.trim();
        Duration duration;
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            duration = Duration.ofMillis(Long.parseLong(trimmed));
        } else {
            try {
                duration = Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                        "Invalid duration '" + value + "': expected ISO-8601 (e.g. PT2S) or milliseconds", e);
            }
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration must not be negative: " + value);
        }
        return duration;
    }

    /// Converts a millisecond count.
    ///
    /// @param millis non-negative milliseconds
    /// @return duration, never null
    public static Duration ofMillis(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + millis);
        }
        return Duration.ofMillis(millis);
    }
}
