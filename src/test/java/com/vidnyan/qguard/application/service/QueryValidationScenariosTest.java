package com.vidnyan.qguard.application.service;

import com.vidnyan.qguard.adapter.out.rule.AdvancedAnalysisRule;
import com.vidnyan.qguard.adapter.out.rule.BehavioralAnalyticsRule;
import com.vidnyan.qguard.adapter.out.rule.ComplianceRule;
import com.vidnyan.qguard.adapter.out.rule.ComprehensiveInputRule;
import com.vidnyan.qguard.adapter.out.rule.FieldValuesRule;
import com.vidnyan.qguard.adapter.out.rule.ForbiddenPatternsRule;
import com.vidnyan.qguard.adapter.out.rule.MultiSourceRule;
import com.vidnyan.qguard.adapter.out.rule.PerformanceRule;
import com.vidnyan.qguard.adapter.out.rule.RequiredFieldsRule;
import com.vidnyan.qguard.adapter.out.rule.SanitizationRule;
import com.vidnyan.qguard.adapter.out.rule.TimeframeRule;
import com.vidnyan.qguard.adapter.out.rule.WhitelistRule;
import com.vidnyan.qguard.domain.constraint.ConstraintChecker;
import com.vidnyan.qguard.domain.cost.CostModel;
import com.vidnyan.qguard.domain.query.AnalysisConfig;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.MultiSourceConfig;
import com.vidnyan.qguard.domain.query.StringOrList;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the full rule set with default settings.
 */
class QueryValidationScenariosTest {

    private final QueryValidationService service = new QueryValidationService(defaultRules());

    private static List<ValidationRule> defaultRules() {
        AdvancedAnalysisRule.Config analysis = new AdvancedAnalysisRule.Config(true,
                List.of("apt_reconnaissance_detection", "anomaly_detection", "threat_hunting"),
                List.of("1_hour", "24_hours"), List.of("timestamp"), List.of("asc", "desc"), null, null);
        return List.of(
                new WhitelistRule(null),
                new ForbiddenPatternsRule(null),
                new RequiredFieldsRule(null),
                new SanitizationRule(null),
                new FieldValuesRule(null),
                new TimeframeRule(null, Clock.systemUTC()),
                new ComprehensiveInputRule(null),
                new AdvancedAnalysisRule(analysis),
                new MultiSourceRule(null),
                new BehavioralAnalyticsRule(null, new ConstraintChecker()),
                new ComplianceRule(null),
                new PerformanceRule(null, new CostModel()));
    }

    private static AuditQuery.AuditQueryBuilder ordinaryQuery() {
        return AuditQuery.builder()
                .logSource("kube-apiserver")
                .verb(StringOrList.of("get"))
                .resource(StringOrList.of("pods"))
                .timeframe("7_days_ago")
                .limit(20);
    }

    @Test
    void ordinaryWhitelistedQuery_ShouldPass() {
        ValidationResult result = service.validate(ordinaryQuery().build());

        assertTrue(result.valid(), () -> "unexpected errors: " + result.errors());
        assertEquals(Severity.INFO, result.severity(), () -> "unexpected warnings: " + result.warnings());
        assertEquals("Query validation passed", result.message());
        assertEquals(8, result.details().get("total_rules_applied"));
        assertEquals(List.of("advanced_analysis_validation", "multi_source_validation",
                "behavioral_analytics_validation", "compliance_validation"), result.details().get("skipped_rules"));
        assertEquals(List.of("whitelist_validation", "required_fields_validation", "comprehensive_input_validation",
                "sanitization_validation", "forbidden_patterns_validation", "field_values_validation",
                "timeframe_validation", "performance_validation"), result.details().get("evaluation_order"));
        assertTrue(result.recommendations().isEmpty());
    }

    @Test
    void privilegedUserPattern_ShouldFailForbiddenPatterns() {
        ValidationResult result = service.validate(ordinaryQuery().userPattern("system:admin").build());

        assertFalse(result.valid());
        assertTrue(failedRules(result).contains(ForbiddenPatternsRule.NAME));
        assertTrue(result.errors().contains(
                "Field 'user_pattern' contains forbidden pattern 'system:admin': system:admin"));
        assertTrue(result.recommendations().contains("Remove forbidden patterns from query parameters"));
    }

    @Test
    void aptAnalysisWithoutKillChainPhase_ShouldFailAdvancedAnalysis() {
        AnalysisConfig analysis = new AnalysisConfig("apt_reconnaissance_detection", null, false, null,
                0, null, null, null, null);

        ValidationResult result = service.validate(ordinaryQuery().analysis(analysis).build());

        assertFalse(result.valid());
        assertTrue(failedRules(result).contains(AdvancedAnalysisRule.NAME));
        assertTrue(result.errors().contains(
                "Kill chain phase is required for APT analysis type 'apt_reconnaissance_detection'"));
    }

    @Test
    void duplicateCorrelationSource_ShouldFailMultiSource() {
        MultiSourceConfig multiSource = new MultiSourceConfig("kube-apiserver",
                List.of("oauth-server", "kube-apiserver"), "5_minutes", List.of("user"), "inner");

        ValidationResult result = service.validate(ordinaryQuery().multiSource(multiSource).build());

        assertFalse(result.valid());
        assertTrue(failedRules(result).contains(MultiSourceRule.NAME));
        assertTrue(result.errors().contains(
                "Duplicate source 'kube-apiserver' at index 1. Each source can only be used once"));
    }

    @Test
    void oversizedRawLimit_ShouldFailPerformance() {
        ValidationResult result = service.validate(ordinaryQuery().limit(20000).build());

        assertFalse(result.valid());
        assertTrue(failedRules(result).contains(PerformanceRule.NAME));
        assertTrue(result.errors().contains("Raw result limit 20000 exceeds maximum 10000"));
        // overlapping rules each report the same limit problem in their own words
        assertTrue(result.errors().contains("Limit 20000 exceeds maximum allowed limit of 1000"));
        assertTrue(result.errors().contains("Result limit 20000 exceeds maximum allowed limit of 50"));
    }

    @Test
    void validate_ShouldBeIdempotentApartFromTimestamps() {
        AuditQuery query = ordinaryQuery().userPattern("system:admin").limit(20000).build();

        ValidationResult first = service.validate(query);
        ValidationResult second = service.validate(query);

        assertEquals(first.valid(), second.valid());
        assertEquals(first.severity(), second.severity());
        assertEquals(first.message(), second.message());
        assertEquals(first.errors(), second.errors());
        assertEquals(first.warnings(), second.warnings());
        assertEquals(first.recommendations(), second.recommendations());
        assertEquals(first.details().get("failed_rules"), second.details().get("failed_rules"));
    }

    @SuppressWarnings("unchecked")
    private static List<String> failedRules(ValidationResult result) {
        return (List<String>) result.details().get("failed_rules");
    }
}
