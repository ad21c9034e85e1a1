package com.healthrelay.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DurationParser {
    private static final Pattern UNIT_SEGMENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
    private static final Pattern WHOLE_SECONDS = Pattern.compile("\\d+");

    private DurationParser() {
    }

    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        String value = text.trim();
        if (value.charAt(0) == 'P' || value.charAt(0) == 'p') {
            try {
                return Duration.parse(value.toUpperCase(Locale.ROOT));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
        }
        if (WHOLE_SECONDS.matcher(value).matches()) {
            try {
                return Duration.ofSeconds(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
        }

        Matcher matcher = UNIT_SEGMENT.matcher(value);
        Duration total = Duration.ZERO;
        int position = 0;
        while (position < value.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }
            try {
                total = total.plus(segment(new BigDecimal(matcher.group(1)), matcher.group(2)));
                total.toNanos();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
            position = matcher.end();
        }
        return total;
    }

    private static Duration segment(BigDecimal amount, String unit) {
        BigDecimal nanosPerUnit = switch (unit) {
            case "ns" -> BigDecimal.ONE;
            case "us", "µs" -> BigDecimal.valueOf(1_000L);
            case "ms" -> BigDecimal.valueOf(1_000_000L);
            case "s" -> BigDecimal.valueOf(1_000_000_000L);
            case "m" -> BigDecimal.valueOf(60_000_000_000L);
            case "h" -> BigDecimal.valueOf(3_600_000_000_000L);
            default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
        // sub-nanosecond fractions are truncated; anything past Long.MAX_VALUE nanos throws
        return Duration.ofNanos(amount.multiply(nanosPerUnit).setScale(0, RoundingMode.DOWN).longValueExact());
    }
}
