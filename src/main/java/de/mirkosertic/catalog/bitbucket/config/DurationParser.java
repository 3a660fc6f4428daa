package de.mirkosertic.catalog.bitbucket.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;

/**
 * Reads durations written either as ISO-8601 strings ({@code PT30M}) or as
 * maps such as {@code {minutes: 30}}.
 */
final class DurationParser {

    private static final Set<String> UNITS = Set.of("days", "hours", "minutes", "seconds", "milliseconds");

    private DurationParser() {
    }

    static Duration parse(final Object value, final String path) {
        if (value instanceof Map<?, ?> map) {
            return fromMap(map, path);
        }
        try {
            return Duration.parse(value.toString());
        } catch (final DateTimeParseException e) {
            throw new ConfigurationException("Invalid duration at '" + path + "': " + value, e);
        }
    }

    private static Duration fromMap(final Map<?, ?> map, final String path) {
        if (map.isEmpty()) {
            throw new ConfigurationException("Empty duration at '" + path + "'");
        }
        Duration result = Duration.ZERO;
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final String unit = String.valueOf(entry.getKey());
            if (!UNITS.contains(unit)) {
                throw new ConfigurationException("Unknown duration unit '" + unit + "' at '" + path
                        + "', expected one of " + UNITS);
            }
            if (!(entry.getValue() instanceof Number amount)) {
                throw new ConfigurationException("Duration amount at '" + path + "." + unit + "' must be a number");
            }
            result = result.plus(switch (unit) {
                case "days" -> Duration.ofDays(amount.longValue());
                case "hours" -> Duration.ofHours(amount.longValue());
                case "minutes" -> Duration.ofMinutes(amount.longValue());
                case "seconds" -> Duration.ofSeconds(amount.longValue());
                default -> Duration.ofMillis(amount.longValue());
            });
        }
        return result;
    }
}
