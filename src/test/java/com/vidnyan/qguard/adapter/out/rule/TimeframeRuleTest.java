package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.BusinessHours;
import com.vidnyan.qguard.domain.query.TimeRange;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeframeRuleTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    private final TimeframeRule rule = new TimeframeRule(null, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void validate_ShouldAcceptAllowedTimeframe() {
        ValidationResult result = rule.validate(AuditQuery.builder().timeframe("7_days_ago").limit(100).build());

        assertTrue(result.valid());
        assertEquals(Severity.WARNING, rule.severity());
    }

    @Test
    void validate_ShouldRejectTimeframeBeyondMaxDaysBack() {
        ValidationResult result = rule.validate(AuditQuery.builder().timeframe("120_days_ago").build());

        assertEquals(List.of(
                "Timeframe '120_days_ago' is not in allowed list",
                "Timeframe '120_days_ago' exceeds maximum allowed days back (90)"), result.errors());
        assertTrue(result.recommendations().contains("Keep timeframes within 90 days back"));
    }

    @Test
    void daysBack_ShouldConvertWeeksAndMonths() {
        assertEquals(14, TimeframeRule.daysBack("2_weeks_ago"));
        assertEquals(90, TimeframeRule.daysBack("3_months_ago"));
        assertEquals(1, TimeframeRule.daysBack("1_day_ago"));
        assertEquals(1, TimeframeRule.daysBack("today"));
        assertEquals(0, TimeframeRule.daysBack("last_week"));
    }

    @Test
    void daysBack_ShouldSaturateOversizedCounts() {
        assertEquals(Integer.MAX_VALUE, TimeframeRule.daysBack("99999999999_days_ago"));
        assertEquals(Integer.MAX_VALUE, TimeframeRule.daysBack("99999999999999999999_days_ago"));
        assertEquals(Integer.MAX_VALUE, TimeframeRule.daysBack("1000000000_weeks_ago"));
        assertEquals(Integer.MAX_VALUE, TimeframeRule.daysBack("100000000_months_ago"));
    }

    @Test
    void validate_ShouldKeepCheckingAfterOversizedTimeframe() {
        // Arrange
        AuditQuery query = AuditQuery.builder().timeframe("1000000000_weeks_ago").limit(5000).build();

        // Act
        ValidationResult result = rule.validate(query);

        // Assert
        assertEquals(List.of(
                "Timeframe '1000000000_weeks_ago' is not in allowed list",
                "Timeframe '1000000000_weeks_ago' exceeds maximum allowed days back (90)",
                "Limit 5000 exceeds maximum allowed limit of 1000"), result.errors());
    }

    @Test
    void validate_ShouldBoundLimit() {
        ValidationResult tooLarge = rule.validate(AuditQuery.builder().limit(5000).build());
        ValidationResult negative = rule.validate(AuditQuery.builder().limit(-5).build());
        ValidationResult unset = rule.validate(AuditQuery.builder().limit(0).build());

        assertEquals(List.of("Limit 5000 exceeds maximum allowed limit of 1000"), tooLarge.errors());
        assertEquals(List.of("Limit -5 is below minimum allowed limit of 1"), negative.errors());
        assertTrue(unset.valid());
    }

    @Test
    void validate_ShouldAcceptRecentTimeRange() {
        TimeRange range = new TimeRange(NOW.minus(Duration.ofDays(3)), NOW.minus(Duration.ofHours(1)));

        assertTrue(rule.validate(AuditQuery.builder().timeRange(range).build()).valid());
    }

    @Test
    void validate_ShouldRejectReversedTimeRange() {
        TimeRange range = new TimeRange(NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofDays(2)));

        ValidationResult result = rule.validate(AuditQuery.builder().timeRange(range).build());

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).contains("is after end"));
    }

    @Test
    void validate_ShouldRejectTimeRangeStartingTooLongAgo() {
        TimeRange range = new TimeRange(NOW.minus(Duration.ofDays(100)), NOW.minus(Duration.ofDays(95)));

        ValidationResult result = rule.validate(AuditQuery.builder().timeRange(range).build());

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).endsWith("is more than 90 days in the past"));
    }

    @Test
    void validate_ShouldRejectFutureTimeRange() {
        TimeRange range = new TimeRange(NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(1)));

        ValidationResult result = rule.validate(AuditQuery.builder().timeRange(range).build());

        assertEquals(List.of("time range cannot be in the future"), result.errors());
    }

    @Test
    void validate_ShouldTreatMissingStartAsTooOld() {
        TimeRange range = new TimeRange(null, NOW.minus(Duration.ofDays(1)));

        ValidationResult result = rule.validate(AuditQuery.builder().timeRange(range).build());

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).endsWith("is more than 90 days in the past"));
    }

    @Test
    void validate_ShouldCheckBusinessHours() {
        ValidationResult same = rule.validate(AuditQuery.builder()
                .businessHours(new BusinessHours(false, 9, 9, "UTC")).build());
        ValidationResult outOfRange = rule.validate(AuditQuery.builder()
                .businessHours(new BusinessHours(true, 25, 17, "UTC")).build());
        ValidationResult overnight = rule.validate(AuditQuery.builder()
                .businessHours(new BusinessHours(true, 22, 6, "UTC")).build());

        assertEquals(List.of("business hours start and end hours cannot be the same"), same.errors());
        assertEquals(List.of("business hours start hour (25) must be between 0 and 23"), outOfRange.errors());
        assertTrue(overnight.valid());
    }

    @Test
    void config_ShouldRejectInvertedLimits() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimeframeRule.Config(null, null, 10, 50, null));
    }
}
