package com.libragraph.drivereport.formats.normalize;

import com.libragraph.drivereport.types.HealthStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the value side of labeled report fields. Each returns null when the value
 * cannot be read; nothing here guesses.
 */
final class FieldValues {

    /** Verdict and optional percentage read from a health value. */
    record HealthReading(HealthStatus status, Integer score) {
    }

    private static final Pattern PERCENT = Pattern.compile("(\\d{1,3})\\s*%");
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\s*(\\d{1,3})\\s*$");
    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private static final Set<String> FAIL_WORDS = Set.of("failed", "fail", "failing", "bad", "critical");
    private static final Set<String> WARN_WORDS = Set.of("warning", "warn", "fair", "degraded", "caution");
    private static final Set<String> PASS_WORDS = Set.of(
            "ok", "good", "passed", "pass", "excellent", "healthy", "perfect");

    private static final Pattern TEMPERATURE = Pattern.compile(
            "(-?\\d+(?:[.,]\\d+)?)\\s*(?:Â)?(?:°|º|deg(?:rees)?)?\\s*(celsius|fahrenheit|[CF])?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DAYS = Pattern.compile("(\\d[\\d,]*)\\s*days?", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOURS = Pattern.compile("(\\d[\\d,]*)\\s*(?:hours?|hrs?|h)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUPED_INTEGER = Pattern.compile("^\\s*(\\d{1,3}(?:[,\\s]\\d{3})+|\\d+)\\s*$");

    private static final Pattern BYTES = Pattern.compile("(\\d[\\d,.\\s]*)\\s*bytes", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIZE = Pattern.compile(
            "(\\d[\\d,]*(?:\\.\\d+)?)\\s*([KMGTP])(i?)B\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern FIRST_INTEGER = Pattern.compile("\\d[\\d,]*");

    private FieldValues() {
    }

    /**
     * A percentage gives the score and verdict (above 95 PASS, 90 to 95 WARN, below 90 FAIL);
     * otherwise the verdict vocabulary decides.
     */
    static HealthReading health(String value) {
        if (value == null || value.isBlank()) {
            return new HealthReading(HealthStatus.UNKNOWN, null);
        }
        Matcher percent = PERCENT.matcher(value);
        Matcher bare = BARE_NUMBER.matcher(value);
        Integer score = null;
        if (percent.find()) {
            score = Integer.parseInt(percent.group(1));
        } else if (bare.matches()) {
            score = Integer.parseInt(bare.group(1));
        }
        if (score != null && score <= 100) {
            return new HealthReading(verdictForScore(score), score);
        }
        return new HealthReading(verdict(value), null);
    }

    static HealthStatus verdictForScore(int score) {
        if (score > 95) return HealthStatus.PASS;
        if (score >= 90) return HealthStatus.WARN;
        return HealthStatus.FAIL;
    }

    /**
     * Maps dialect verdict words; failing words take precedence over warning and passing ones.
     */
    static HealthStatus verdict(String value) {
        if (value == null) {
            return HealthStatus.UNKNOWN;
        }
        boolean warn = false;
        boolean pass = false;
        Matcher words = WORD.matcher(value.toLowerCase(Locale.ROOT));
        while (words.find()) {
            String word = words.group();
            if (FAIL_WORDS.contains(word)) return HealthStatus.FAIL;
            warn |= WARN_WORDS.contains(word);
            pass |= PASS_WORDS.contains(word);
        }
        if (warn) return HealthStatus.WARN;
        if (pass) return HealthStatus.PASS;
        return HealthStatus.UNKNOWN;
    }

    /** Degrees Celsius; Fahrenheit values are converted, rounding half up. Out-of-range values are null. */
    static Integer temperatureCelsius(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = TEMPERATURE.matcher(value);
        if (!m.find()) {
            return null;
        }
        BigDecimal degrees = new BigDecimal(m.group(1).replace(',', '.'));
        String unit = m.group(2);
        if (unit != null && Character.toUpperCase(unit.charAt(0)) == 'F') {
            degrees = degrees.subtract(BigDecimal.valueOf(32))
                    .multiply(BigDecimal.valueOf(5))
                    .divide(BigDecimal.valueOf(9), 6, RoundingMode.HALF_UP);
        }
        try {
            return degrees.setScale(0, RoundingMode.HALF_UP).intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Accepts "N days, M hours", "N hours", "N h" and bare numbers (hours). Null when a count
     * does not fit a long.
     */
    static Long powerOnHours(String value) {
        if (value == null) {
            return null;
        }
        Matcher days = DAYS.matcher(value);
        Matcher hours = HOURS.matcher(value);
        boolean hasDays = days.find();
        boolean hasHours = hours.find();
        if (hasDays || hasHours) {
            Long dayCount = hasDays ? digits(days.group(1)) : Long.valueOf(0);
            Long hourCount = hasHours ? digits(hours.group(1)) : Long.valueOf(0);
            if (dayCount == null || hourCount == null) {
                return null;
            }
            try {
                return Math.addExact(Math.multiplyExact(dayCount, 24L), hourCount);
            } catch (ArithmeticException e) {
                return null;
            }
        }
        Matcher bare = GROUPED_INTEGER.matcher(value);
        return bare.matches() ? digits(bare.group(1)) : null;
    }

    /**
     * Capacity in bytes; an explicit byte count wins over decimal (KB, MB...) or binary
     * (KiB, MiB...) units. Returns 0 when the value states no capacity or one that does not
     * fit a long.
     */
    static long capacityBytes(String value) {
        if (value == null) {
            return 0;
        }
        Matcher bytes = BYTES.matcher(value);
        if (bytes.find()) {
            Long count = digits(bytes.group(1));
            if (count != null) {
                return count;
            }
            if (!bytes.group(1).replaceAll("[^0-9]", "").isEmpty()) {
                return 0;
            }
        }
        Matcher size = SIZE.matcher(value);
        if (size.find()) {
            BigDecimal amount = new BigDecimal(size.group(1).replace(",", ""));
            int exponent = "KMGTP".indexOf(Character.toUpperCase(size.group(2).charAt(0))) + 1;
            BigDecimal base = size.group(3).isEmpty() ? BigDecimal.valueOf(1000) : BigDecimal.valueOf(1024);
            try {
                return amount.multiply(base.pow(exponent)).setScale(0, RoundingMode.HALF_UP).longValueExact();
            } catch (ArithmeticException e) {
                return 0;
            }
        }
        return 0;
    }

    /** First integer in the value, thousands separators allowed. */
    static Long count(String value) {
        if (value == null) {
            return null;
        }
        Matcher m = FIRST_INTEGER.matcher(value);
        return m.find() ? digits(m.group()) : null;
    }

    /** Digits of a grouped number, or null when there are none or they do not fit a long. */
    private static Long digits(String grouped) {
        String digits = grouped.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
