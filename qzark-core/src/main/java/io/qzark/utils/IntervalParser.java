package io.qzark.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Parses task interval specs into {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "90"</li>
 *   <li>Compact units: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable pairs: "5 minutes", "2 hours", "1 day 3 hours"</li>
 * </ul>
 * The result is always positive.
 */
public final class IntervalParser {
    private static final long MINUTE_SECONDS = ChronoUnit.MINUTES.getDuration().toSeconds();
    private static final long HOUR_SECONDS = ChronoUnit.HOURS.getDuration().toSeconds();
    private static final long DAY_SECONDS = ChronoUnit.DAYS.getDuration().toSeconds();
    private static final long WEEK_SECONDS = ChronoUnit.WEEKS.getDuration().toSeconds();

    private IntervalParser() {
    }

    public static Duration parseSeconds(long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("interval seconds must be positive: " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            try {
                return parseSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            Duration d;
            try {
                long n = Long.parseLong(digits);
                d = switch (u) {
                    case 's' -> Duration.ofSeconds(n);
                    case 'm' -> Duration.ofMinutes(n);
                    case 'h' -> Duration.ofHours(n);
                    case 'd' -> Duration.ofDays(n);
                    case 'w' -> Duration.ofDays(Math.multiplyExact(7L, n));
                    default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
                };
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new IllegalArgumentException("Interval out of range: " + input, ex);
            }
            return requirePositive(d, input);
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = accumulate(totalSeconds, n, WEEK_SECONDS, input);
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds = accumulate(totalSeconds, n, DAY_SECONDS, input);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = accumulate(totalSeconds, n, HOUR_SECONDS, input);
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = accumulate(totalSeconds, n, MINUTE_SECONDS, input);
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = accumulate(totalSeconds, n, 1L, input);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return requirePositive(Duration.ofSeconds(totalSeconds), input);
    }

    private static long accumulate(long total, long n, long unitSeconds, String input) {
        try {
            return Math.addExact(total, Math.multiplyExact(n, unitSeconds));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Interval out of range: " + input, ex);
        }
    }

    private static Duration requirePositive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }
}
