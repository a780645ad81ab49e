package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.BusinessHours;
import com.vidnyan.qguard.domain.query.TimeRange;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bounds how far back and how wide a query may look, plus its result limit and business-hours window.
 */
public class TimeframeRule implements ValidationRule {

    public static final String NAME = "timeframe_validation";

    static final int PRIORITY = 55;

    private static final Pattern DAYS = Pattern.compile("(\\d+)_days?_ago");
    private static final Pattern WEEKS = Pattern.compile("(\\d+)_weeks?_ago");
    private static final Pattern MONTHS = Pattern.compile("(\\d+)_months?_ago");

    // stands in for an unset instant; always too old
    private static final Instant UNSET = Instant.parse("0001-01-01T00:00:00Z");

    private final Config config;
    private final Clock clock;

    public TimeframeRule(Config config, Clock clock) {
        this.config = config != null ? config : Config.defaults();
        this.clock = clock;
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Timeframe validation").query(query);

        String timeframe = query.timeframe();
        if (Values.isSet(timeframe)) {
            if (!Values.containsIgnoreCase(config.allowedTimeframes(), timeframe)) {
                result.error(String.format("Timeframe '%s' is not in allowed list", timeframe));
            }
            if (daysBack(timeframe) > config.maxDaysBack()) {
                result.error(String.format("Timeframe '%s' exceeds maximum allowed days back (%d)",
                        timeframe, config.maxDaysBack()));
            }
        }

        if (query.timeRange() != null) {
            checkTimeRange(query.timeRange()).ifPresent(result::error);
        }

        int limit = query.limit();
        if (limit != 0) {
            if (limit > config.maxLimit()) {
                result.error(String.format("Limit %d exceeds maximum allowed limit of %d", limit, config.maxLimit()));
            }
            if (limit < config.minLimit()) {
                result.error(String.format("Limit %d is below minimum allowed limit of %d", limit, config.minLimit()));
            }
        }

        if (query.businessHours() != null) {
            checkBusinessHours(query.businessHours()).ifPresent(result::error);
        }

        if (result.hasErrors()) {
            result.recommend(
                    "Use allowed timeframe values from the configuration",
                    String.format("Keep timeframes within %d days back", config.maxDaysBack()),
                    String.format("Use limits between %d and %d", config.minLimit(), config.maxLimit()),
                    "Ensure time ranges are valid and within allowed bounds");
        }
        return result.build();
    }

    /**
     * Number of days a named timeframe reaches back; 0 when it cannot be determined.
     * Counts too large for an int saturate at {@link Integer#MAX_VALUE}.
     */
    static int daysBack(String timeframe) {
        Matcher days = DAYS.matcher(timeframe);
        if (days.find()) {
            return scaledDays(days.group(1), 1);
        }
        Matcher weeks = WEEKS.matcher(timeframe);
        if (weeks.find()) {
            return scaledDays(weeks.group(1), 7);
        }
        Matcher months = MONTHS.matcher(timeframe);
        if (months.find()) {
            return scaledDays(months.group(1), 30);
        }
        return switch (timeframe.toLowerCase(Locale.ROOT)) {
            case "today", "yesterday", "1_hour_ago", "2_hours_ago", "3_hours_ago", "6_hours_ago", "12_hours_ago" -> 1;
            default -> 0;
        };
    }

    private static int scaledDays(String digits, int daysPerUnit) {
        try {
            long days = Math.multiplyExact(Long.parseLong(digits), (long) daysPerUnit);
            return (int) Math.min(days, Integer.MAX_VALUE);
        } catch (NumberFormatException | ArithmeticException e) {
            // more digits than a long holds, or the product overflows
            return Integer.MAX_VALUE;
        }
    }

    /**
     * Only the first failing condition is reported.
     */
    private Optional<String> checkTimeRange(TimeRange range) {
        Instant start = range.start() != null ? range.start() : UNSET;
        Instant end = range.end() != null ? range.end() : UNSET;

        if (start.isAfter(end)) {
            return Optional.of(String.format("time range start (%s) is after end (%s)", start, end));
        }
        Instant now = clock.instant();
        Duration maxDuration = Duration.ofDays(config.maxDaysBack());
        if (start.isBefore(now.minus(maxDuration))) {
            return Optional.of(String.format("time range start (%s) is more than %d days in the past",
                    start, config.maxDaysBack()));
        }
        if (start.isAfter(now) || end.isAfter(now)) {
            return Optional.of("time range cannot be in the future");
        }
        Duration duration = Duration.between(start, end);
        if (duration.compareTo(maxDuration) > 0) {
            return Optional.of(String.format("time range duration (%s) exceeds maximum allowed duration (%s)",
                    duration, maxDuration));
        }
        return Optional.empty();
    }

    private static Optional<String> checkBusinessHours(BusinessHours hours) {
        if (hours.startHour() < 0 || hours.startHour() > 23) {
            return Optional.of(String.format("business hours start hour (%d) must be between 0 and 23",
                    hours.startHour()));
        }
        if (hours.endHour() < 0 || hours.endHour() > 23) {
            return Optional.of(String.format("business hours end hour (%d) must be between 0 and 23",
                    hours.endHour()));
        }
        if (hours.startHour() == hours.endHour()) {
            return Optional.of("business hours start and end hours cannot be the same");
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String description() {
        return "Validates timeframe limits and constraints for audit queries";
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    public record Config(
        Boolean enabled,
        Integer maxDaysBack,
        Integer maxLimit,
        Integer minLimit,
        List<String> allowedTimeframes
    ) {
        public static final List<String> DEFAULT_TIMEFRAMES = List.of(
                "today", "yesterday", "1_hour_ago", "2_hours_ago", "3_hours_ago",
                "6_hours_ago", "12_hours_ago", "1_day_ago", "2_days_ago", "3_days_ago",
                "7_days_ago", "14_days_ago", "30_days_ago", "60_days_ago", "90_days_ago");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            maxDaysBack = Values.or(maxDaysBack, 90);
            maxLimit = Values.or(maxLimit, 1000);
            minLimit = Values.or(minLimit, 1);
            allowedTimeframes = Values.listOr(allowedTimeframes, DEFAULT_TIMEFRAMES);
            Values.requireNonNegative(maxDaysBack, "max-days-back");
            if (minLimit > maxLimit) {
                throw new IllegalArgumentException(
                        "min-limit " + minLimit + " must not exceed max-limit " + maxLimit);
            }
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null);
        }
    }
}
