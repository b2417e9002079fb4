package work.yamlcli.engine.shared;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations for step timeouts and launcher settings: {@code 250ms}, {@code 30s},
 * {@code 1.5m}, {@code 2h}. A bare number is milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(amount.multiply(BigDecimal.valueOf(multiplier)).longValue()));
    }

    /**
     * Accepts either a number of milliseconds or a duration string.
     */
    public static Optional<Duration> fromValue(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            if (number.doubleValue() < 0) {
                throw new IllegalArgumentException("Duration must not be negative: " + raw);
            }
            return Optional.of(Duration.ofMillis(number.longValue()));
        }
        return parse(String.valueOf(raw));
    }
}
