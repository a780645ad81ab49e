package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.constraint.ConstraintChecker;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig.AnomalyDetection;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig.RiskScoring;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BehavioralAnalyticsRuleTest {

    private final BehavioralAnalyticsRule rule = new BehavioralAnalyticsRule(null, new ConstraintChecker());

    private ValidationResult validate(BehavioralAnalysisConfig behavioral) {
        return rule.validate(AuditQuery.builder().logSource("kube-apiserver").behavioralAnalysis(behavioral).build());
    }

    @Test
    void validate_ShouldSkipQueriesWithoutBehavioralBlock() {
        assertTrue(rule.validate(AuditQuery.builder().build()).valid());
    }

    @Test
    void validate_ShouldAcceptWellTunedConfiguration() {
        BehavioralAnalysisConfig config = new BehavioralAnalysisConfig(true, true, null,
                new AnomalyDetection("z_score", 0, 0, 3.0), "30_days", "7_days");

        ValidationResult result = validate(config);

        assertTrue(result.valid(), () -> "unexpected errors: " + result.errors());
        assertEquals(Severity.INFO, result.severity(), () -> "unexpected warnings: " + result.warnings());
        assertEquals(10 + 15 + 10 + 25, result.details().get("behavioral_performance_score"));
        assertEquals(100, result.details().get("max_performance_score"));
    }

    @Test
    void validate_ShouldRequireProfilingForRiskScoring() {
        BehavioralAnalysisConfig config = new BehavioralAnalysisConfig(false, false,
                new RiskScoring(true, "weighted_sum", List.of("privilege_level"), null), null, null, null);

        ValidationResult result = validate(config);

        assertEquals(List.of("Risk scoring requires user profiling to be enabled"), result.errors());
        assertTrue(result.warnings().contains(
                "User profiling is disabled. Consider enabling for better behavioral insights"));
        assertEquals(5, result.recommendations().size());
    }

    @Test
    void validate_ShouldCheckBaselineAndLearningPeriods() {
        BehavioralAnalyticsRule strict = new BehavioralAnalyticsRule(
                new BehavioralAnalyticsRule.Config(null, null, null, 30, null, null, null, null), new ConstraintChecker());

        ValidationResult shortWindow = strict.validate(AuditQuery.builder().behavioralAnalysis(
                new BehavioralAnalysisConfig(true, true, null, null, "14_days", "7_days")).build());
        ValidationResult unknown = validate(new BehavioralAnalysisConfig(true, true, null, null, "1_day", "2_weeks"));

        assertEquals(List.of("baseline window too short. Minimum: 30 days"), shortWindow.errors());
        assertEquals(2, unknown.errors().size());
        assertTrue(unknown.errors().get(0).startsWith("Invalid baseline window '1_day'"));
        assertTrue(unknown.errors().get(1).startsWith("Invalid learning period '2_weeks'"));
    }

    @Test
    void validate_ShouldCheckRiskFactorsAndAlgorithm() {
        RiskScoring risk = new RiskScoring(true, "neural_net", List.of("privilege_level", "shoe_size"), null);

        ValidationResult result = validate(new BehavioralAnalysisConfig(true, false, risk, null, "30_days", "7_days"));

        assertEquals(2, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Invalid risk scoring algorithm 'neural_net'"));
        assertTrue(result.errors().get(1).startsWith("Invalid risk factor 'shoe_size' at index 1."));
    }

    @Test
    void checkWeightingScheme_ShouldStopAtFirstProblem() {
        Map<String, Double> outOfRange = new LinkedHashMap<>();
        outOfRange.put("privilege_level", 1.2);
        outOfRange.put("timing_anomaly", -0.5);
        Map<String, Double> lowTotal = new LinkedHashMap<>();
        lowTotal.put("privilege_level", 0.5);
        lowTotal.put("timing_anomaly", 0.3);
        Map<String, Double> balanced = new LinkedHashMap<>();
        balanced.put("privilege_level", 0.6);
        balanced.put("timing_anomaly", 0.4);

        assertEquals(Optional.of("weighting scheme cannot be empty"),
                BehavioralAnalyticsRule.checkWeightingScheme(Map.of()));
        assertEquals(Optional.of("weight for factor 'privilege_level' must be between 0.0 and 1.0, got 1.200"),
                BehavioralAnalyticsRule.checkWeightingScheme(outOfRange));
        assertEquals(Optional.of("total weight must sum to approximately 1.0, got 0.800"),
                BehavioralAnalyticsRule.checkWeightingScheme(lowTotal));
        assertEquals(Optional.empty(), BehavioralAnalyticsRule.checkWeightingScheme(balanced));
    }

    @Test
    void validate_ShouldRangeCheckAnomalyParameters() {
        AnomalyDetection anomaly = new AnomalyDetection("threshold_based", 1.5, -0.1, 20.0);

        ValidationResult result = validate(new BehavioralAnalysisConfig(true, true, null, anomaly, "30_days", "7_days"));

        assertEquals(List.of(
                "Contamination must be between 0.0 and 1.0, got 1.500",
                "Sensitivity must be between 0.0 and 1.0, got -0.100",
                "Anomaly threshold must be between 0.1 and 10.0, got 20.000"), result.errors());
    }

    @Test
    void validate_ShouldWarnAboutExpensiveFeatureMix() {
        // Arrange: every feature on, ml risk scoring and isolation forest
        BehavioralAnalysisConfig config = new BehavioralAnalysisConfig(true, true,
                new RiskScoring(true, "ml_based", List.of("privilege_level", "timing_anomaly", "access_pattern"), null),
                new AnomalyDetection("isolation_forest", 0.1, 0, 0),
                "30_days", "7_days");

        // Act
        ValidationResult result = validate(config);

        // Assert
        assertTrue(result.valid());
        assertEquals(111, BehavioralAnalyticsRule.performanceScore(config));
        assertTrue(result.warnings().contains(
                "High performance impact score 111. Consider simplifying behavioral analysis configuration"));
        assertTrue(result.warnings().contains("All behavioral analysis features enabled may impact query performance"));
        assertTrue(result.warnings().contains(
                "ML-based risk scoring with isolation forest may be computationally intensive"));
    }

    @Test
    void performanceScore_ShouldWeighAnomalyAlgorithm() {
        BehavioralAnalysisConfig isolation = new BehavioralAnalysisConfig(false, false, null,
                new AnomalyDetection("isolation_forest", 0, 0, 0), null, null);
        BehavioralAnalysisConfig mlBased = new BehavioralAnalysisConfig(false, false, null,
                new AnomalyDetection("ml_based", 0, 0, 0), null, null);
        BehavioralAnalysisConfig zScore = new BehavioralAnalysisConfig(false, false, null,
                new AnomalyDetection("z_score", 0, 0, 0), null, null);

        assertEquals(45, BehavioralAnalyticsRule.performanceScore(isolation));
        assertEquals(55, BehavioralAnalyticsRule.performanceScore(mlBased));
        assertEquals(35, BehavioralAnalyticsRule.performanceScore(zScore));
    }
}
