package com.lyshra.open.flow.core.engine.trigger.schedule;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Five-field cron expression: {@code minute hour day-of-month month day-of-week}.
 *
 * <p>Each field accepts {@code *}, numbers, ranges ({@code 1-5}), steps ({@code *}{@code /15},
 * {@code 10-40/10}) and comma separated lists of those. Months and week days accept
 * three-letter names; Sunday is {@code 0} or {@code 7}. The macros {@code @yearly},
 * {@code @annually}, {@code @monthly}, {@code @weekly}, {@code @daily}, {@code @midnight} and
 * {@code @hourly} are accepted. When both day fields are restricted a day matches if either
 * one does.</p>
 */
@EqualsAndHashCode(of = "expression")
public final class CronExpression {

    private static final int SEARCH_YEARS = 5;

    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private static final List<String> MONTH_NAMES = List.of(
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC");
    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    @Getter
    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], 0, 59, null, "minute");
        this.hours = parseField(fields[1], 0, 23, null, "hour");
        this.daysOfMonth = parseField(fields[2], 1, 31, null, "day-of-month");
        this.months = parseField(fields[3], 1, 12, MONTH_NAMES, "month");
        BitSet days = parseField(fields[4], 0, 7, DAY_NAMES, "day-of-week");
        if (days.get(7)) {
            days.set(0);
            days.clear(7);
        }
        this.daysOfWeek = days;
        this.dayOfMonthRestricted = !fields[2].startsWith("*");
        this.dayOfWeekRestricted = !fields[4].startsWith("*");
    }

    /**
     * @throws IllegalArgumentException when the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression must not be blank");
        }
        String trimmed = expression.trim();
        String normalized = trimmed.startsWith("@")
                ? MACROS.get(trimmed.toLowerCase(Locale.ROOT))
                : trimmed;
        if (normalized == null) {
            throw new IllegalArgumentException("unknown cron macro [" + trimmed + "]");
        }
        String[] fields = normalized.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("cron expression [" + trimmed + "] must have 5 fields, found " + fields.length);
        }
        return new CronExpression(trimmed, fields);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Whether the minute containing {@code time} is a fire time. */
    public boolean matches(ZonedDateTime time) {
        return minutes.get(time.getMinute())
                && hours.get(time.getHour())
                && months.get(time.getMonthValue())
                && dayMatches(time);
    }

    /** First fire time strictly after {@code time}, at minute precision. */
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime time) {
        ZonedDateTime candidate = time.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime limit = candidate.plusYears(SEARCH_YEARS);
        while (candidate.isBefore(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
            } else if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
            } else if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            } else if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
            } else {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean dayMatches(ZonedDateTime time) {
        boolean dayOfMonth = daysOfMonth.get(time.getDayOfMonth());
        boolean dayOfWeek = daysOfWeek.get(time.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return dayOfMonth || dayOfWeek;
        }
        return dayOfMonth && dayOfWeek;
    }

    private static BitSet parseField(String field, int min, int max, List<String> names, String fieldName) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(fieldName, field, "empty list element");
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), fieldName, field);
                if (step <= 0) {
                    throw invalid(fieldName, field, "step must be positive");
                }
            }
            int start;
            int end;
            if (range.equals("*")) {
                start = min;
                end = max;
            } else {
                int dash = range.indexOf('-');
                if (dash >= 0) {
                    start = parseValue(range.substring(0, dash), names, min, fieldName, field);
                    end = parseValue(range.substring(dash + 1), names, min, fieldName, field);
                } else {
                    start = parseValue(range, names, min, fieldName, field);
                    end = slash >= 0 ? max : start;
                }
            }
            if (start < min || end > max || start > end) {
                throw invalid(fieldName, field, "values must lie within " + min + "-" + max);
            }
            for (int value = start; value <= end; value += step) {
                bits.set(value);
            }
        }
        return bits;
    }

    private static int parseValue(String token, List<String> names, int min, String fieldName, String field) {
        if (names != null) {
            int index = names.indexOf(token.toUpperCase(Locale.ROOT));
            if (index >= 0) {
                // month names start at 1, day names at 0
                return index + min;
            }
        }
        return parseNumber(token, fieldName, field);
    }

    private static int parseNumber(String token, String fieldName, String field) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw invalid(fieldName, field, "[" + token + "] is not a number");
        }
    }

    private static IllegalArgumentException invalid(String fieldName, String field, String reason) {
        return new IllegalArgumentException("invalid " + fieldName + " field [" + field + "]: " + reason);
    }

    @Override
    public String toString() {
        return expression;
    }
}
