package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AnalysisConfig;
import com.vidnyan.qguard.domain.query.AnalysisConfig.StatisticalAnalysis;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.StringOrList;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdvancedAnalysisRuleTest {

    private final AdvancedAnalysisRule rule = new AdvancedAnalysisRule(new AdvancedAnalysisRule.Config(true,
            List.of("apt_reconnaissance_detection", "anomaly_detection", "threat_hunting"),
            List.of("1_hour", "24_hours"),
            List.of("timestamp", "user"),
            List.of("asc", "desc"),
            null, null));

    private static ValidationResult validate(AdvancedAnalysisRule rule, AnalysisConfig analysis) {
        return rule.validate(AuditQuery.builder().logSource("kube-apiserver").analysis(analysis).build());
    }

    private static AnalysisConfig analysis(String type, String phase) {
        return new AnalysisConfig(type, phase, false, null, 0, null, null, null, null);
    }

    @Test
    void validate_ShouldSkipQueriesWithoutAnalysis() {
        assertTrue(rule.validate(AuditQuery.builder().build()).valid());
    }

    @Test
    void validate_ShouldRequireKillChainPhaseForAptTypes() {
        ValidationResult result = validate(rule, analysis("apt_reconnaissance_detection", null));

        assertFalse(result.valid());
        assertEquals(List.of("Kill chain phase is required for APT analysis type 'apt_reconnaissance_detection'"),
                result.errors());
        assertEquals(4, result.recommendations().size());
    }

    @Test
    void validate_ShouldAcceptAptTypeWithKnownPhase() {
        assertTrue(validate(rule, analysis("apt_reconnaissance_detection", "reconnaissance")).valid());
    }

    @Test
    void validate_ShouldRejectUnknownKillChainPhase() {
        ValidationResult result = validate(rule, analysis("threat_hunting", "coffee_break"));

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Invalid kill chain phase 'coffee_break'"));
    }

    @Test
    void validate_ShouldRequireType() {
        assertEquals(List.of("Analysis type is required"), validate(rule, analysis(null, null)).errors());
    }

    @Test
    void validate_ShouldRejectEveryTypeWhenNoneConfigured() {
        AdvancedAnalysisRule unconfigured = new AdvancedAnalysisRule(null);

        ValidationResult result = validate(unconfigured, analysis("anomaly_detection", null));

        assertEquals(List.of("Invalid analysis type 'anomaly_detection'. Allowed types: "), result.errors());
    }

    @Test
    void validate_ShouldWarnWhenStatisticalTypeHasNoParameters() {
        ValidationResult result = validate(rule, analysis("anomaly_detection", null));

        assertTrue(result.valid());
        assertEquals(List.of("Statistical analysis parameters recommended for analysis type 'anomaly_detection'"),
                result.warnings());
    }

    @Test
    void validate_ShouldRangeCheckStatisticalParameters() {
        // Arrange
        StatisticalAnalysis stats = new StatisticalAnalysis(20.0, 0.3, 5, "1_day");
        AnalysisConfig analysis = new AnalysisConfig("anomaly_detection", null, false, stats, 0, null, null, null, null);

        // Act
        ValidationResult result = validate(rule, analysis);

        // Assert
        assertEquals(4, result.errors().size());
        assertEquals("Pattern deviation threshold must be between 0.1 and 10.0, got 20.00", result.errors().get(0));
        assertEquals("Confidence interval must be between 0.5 and 0.99, got 0.30", result.errors().get(1));
        assertEquals("Sample size minimum must be at least 10, got 5", result.errors().get(2));
        assertTrue(result.errors().get(3).startsWith("Invalid baseline window '1_day'"));
    }

    @Test
    void validate_ShouldCheckThresholdWindowAndSorting() {
        AnalysisConfig analysis = new AnalysisConfig("threat_hunting", null, false, null, 11, "3_hours",
                StringOrList.of("user", "verb", "resource", "namespace", "source_ip", "user_agent"),
                "priority", "sideways");

        ValidationResult result = validate(rule, analysis);

        assertEquals(5, result.errors().size());
        assertEquals("Threshold must be between 1 and 10, got 11", result.errors().get(0));
        assertEquals("Invalid time window '3_hours'. Allowed windows: 1_hour, 24_hours", result.errors().get(1));
        assertEquals("Invalid sort field 'priority'. Allowed fields: timestamp, user", result.errors().get(2));
        assertEquals("Invalid sort order 'sideways'. Allowed orders: asc, desc", result.errors().get(3));
        assertEquals("Too many group by fields. Maximum allowed: 5, got: 6", result.errors().get(4));
    }
}
