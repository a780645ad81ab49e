package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.constraint.ConstraintChecker;
import com.vidnyan.qguard.domain.constraint.ConstraintViolation;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig.AnomalyDetection;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig.RiskScoring;
import com.vidnyan.qguard.domain.rule.RuleCondition;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validates the behavioral analysis block: profiling, baseline and learning windows,
 * risk scoring, anomaly detection, feature dependencies and a performance budget.
 */
@Slf4j
public class BehavioralAnalyticsRule implements ValidationRule {

    public static final String NAME = "behavioral_analytics_validation";

    static final int PRIORITY = 30;

    private static final RuleCondition CONDITION =
            RuleCondition.present("behavioral_analysis", AuditQuery::behavioralAnalysis);

    static final List<String> BASELINE_WINDOWS = List.of("7_days", "14_days", "30_days", "60_days", "90_days");
    static final List<String> LEARNING_PERIODS = List.of("1_day", "3_days", "7_days", "14_days", "30_days");
    static final List<String> RISK_ALGORITHMS = List.of("weighted_sum", "composite", "ml_based");
    static final List<String> ANOMALY_ALGORITHMS = List.of("isolation_forest", "z_score", "statistical", "threshold_based");

    private static final Map<String, Integer> BASELINE_DAYS = Map.of(
            "7_days", 7,
            "14_days", 14,
            "30_days", 30,
            "60_days", 60,
            "90_days", 90);

    private final Config config;
    private final ConstraintChecker constraintChecker;

    public BehavioralAnalyticsRule(Config config, ConstraintChecker constraintChecker) {
        this.config = config != null ? config : Config.defaults();
        this.constraintChecker = constraintChecker;
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Behavioral analytics validation").query(query);
        BehavioralAnalysisConfig behavioral = query.behavioralAnalysis();
        if (behavioral == null) {
            return result.build();
        }

        checkProfiling(behavioral, result);
        checkBaseline(behavioral, result);
        if (behavioral.riskScoring() != null) {
            checkRiskScoring(behavioral.riskScoring(), result);
        }
        if (behavioral.anomalyDetection() != null) {
            checkAnomalyDetection(behavioral.anomalyDetection(), result);
        }
        for (ConstraintViolation violation : constraintChecker.check(behavioral)) {
            log.debug("Constraint {} violated: {}", violation.constraint(), violation.message());
            if (violation.isError()) {
                result.error(violation.message());
            } else {
                result.warning(violation.message());
            }
        }
        checkPerformance(behavioral, result);

        if (result.hasErrors()) {
            result.recommend(
                    "Review behavioral analytics configuration",
                    "Ensure user profiling is enabled when using risk scoring",
                    "Verify baseline window is specified for anomaly detection",
                    "Check risk scoring parameters are within valid ranges",
                    "Validate anomaly detection algorithm parameters");
        }
        return result.build();
    }

    private static void checkProfiling(BehavioralAnalysisConfig behavioral, ValidationResult.Builder result) {
        if (!behavioral.userProfiling()) {
            result.warning("User profiling is disabled. Consider enabling for better behavioral insights");
            return;
        }
        if (!Values.isSet(behavioral.baselineWindow())) {
            result.warning("Baseline window not specified. Default baseline period will be used");
        }
        if (!Values.isSet(behavioral.learningPeriod())) {
            result.warning("Learning period not specified. Default learning period will be used");
        }
    }

    private void checkBaseline(BehavioralAnalysisConfig behavioral, ValidationResult.Builder result) {
        String window = behavioral.baselineWindow();
        if (Values.isSet(window)) {
            if (!BASELINE_WINDOWS.contains(window)) {
                result.error(String.format("Invalid baseline window '%s'. Allowed windows: %s",
                        window, String.join(", ", BASELINE_WINDOWS)));
            }
            Integer days = BASELINE_DAYS.get(window);
            if (days != null && days < config.minBaselineDays()) {
                result.error(String.format("baseline window too short. Minimum: %d days", config.minBaselineDays()));
            } else if (days != null && days > config.maxBaselineDays()) {
                result.error(String.format("baseline window too long. Maximum: %d days", config.maxBaselineDays()));
            }
        }

        String learning = behavioral.learningPeriod();
        if (Values.isSet(learning) && !LEARNING_PERIODS.contains(learning)) {
            result.error(String.format("Invalid learning period '%s'. Allowed periods: %s",
                    learning, String.join(", ", LEARNING_PERIODS)));
        }
    }

    private void checkRiskScoring(RiskScoring risk, ValidationResult.Builder result) {
        if (Values.isSet(risk.algorithm()) && !RISK_ALGORITHMS.contains(risk.algorithm())) {
            result.error(String.format("Invalid risk scoring algorithm '%s'. Allowed algorithms: %s",
                    risk.algorithm(), String.join(", ", RISK_ALGORITHMS)));
        }

        List<String> factors = risk.riskFactors();
        if (factors.size() > config.maxRiskFactors()) {
            result.error(String.format("Too many risk factors. Maximum allowed: %d, got: %d",
                    config.maxRiskFactors(), factors.size()));
        }
        for (int i = 0; i < factors.size(); i++) {
            if (!config.allowedRiskFactors().contains(factors.get(i))) {
                result.error(String.format("Invalid risk factor '%s' at index %d. Allowed factors: %s",
                        factors.get(i), i, String.join(", ", config.allowedRiskFactors())));
            }
        }

        if (risk.weightingScheme() != null) {
            checkWeightingScheme(risk.weightingScheme()).ifPresent(result::error);
        }
    }

    /**
     * Stops at the first problem. A missing weight counts as 0.
     */
    static Optional<String> checkWeightingScheme(Map<String, Double> scheme) {
        if (scheme.isEmpty()) {
            return Optional.of("weighting scheme cannot be empty");
        }
        double total = 0.0;
        for (Map.Entry<String, Double> entry : scheme.entrySet()) {
            double weight = entry.getValue() != null ? entry.getValue() : 0.0;
            if (weight < 0.0 || weight > 1.0) {
                return Optional.of(String.format(Locale.ROOT,
                        "weight for factor '%s' must be between 0.0 and 1.0, got %.3f", entry.getKey(), weight));
            }
            total += weight;
        }
        if (total < 0.95 || total > 1.05) {
            return Optional.of(String.format(Locale.ROOT, "total weight must sum to approximately 1.0, got %.3f", total));
        }
        return Optional.empty();
    }

    private void checkAnomalyDetection(AnomalyDetection anomaly, ValidationResult.Builder result) {
        if (Values.isSet(anomaly.algorithm()) && !ANOMALY_ALGORITHMS.contains(anomaly.algorithm())) {
            result.error(String.format("Invalid anomaly detection algorithm '%s'. Allowed algorithms: %s",
                    anomaly.algorithm(), String.join(", ", ANOMALY_ALGORITHMS)));
        }
        // zero means unset for all three parameters
        if (anomaly.contamination() < 0.0 || anomaly.contamination() > 1.0) {
            result.error(String.format(Locale.ROOT, "Contamination must be between 0.0 and 1.0, got %.3f",
                    anomaly.contamination()));
        }
        if (anomaly.sensitivity() < 0.0 || anomaly.sensitivity() > 1.0) {
            result.error(String.format(Locale.ROOT, "Sensitivity must be between 0.0 and 1.0, got %.3f",
                    anomaly.sensitivity()));
        }
        double threshold = anomaly.threshold();
        if (threshold != 0.0 && (threshold < config.minAnomalyThreshold() || threshold > config.maxAnomalyThreshold())) {
            result.error(String.format(Locale.ROOT, "Anomaly threshold must be between %.1f and %.1f, got %.3f",
                    config.minAnomalyThreshold(), config.maxAnomalyThreshold(), threshold));
        }
    }

    private void checkPerformance(BehavioralAnalysisConfig behavioral, ValidationResult.Builder result) {
        int score = performanceScore(behavioral);
        if (score > config.maxPerformanceScore()) {
            result.warning(String.format(
                    "High performance impact score %d. Consider simplifying behavioral analysis configuration", score));
        }
        result.detail("behavioral_performance_score", score);
        result.detail("max_performance_score", config.maxPerformanceScore());

        if (behavioral.userProfiling() && behavioral.baselineComparison()
                && behavioral.riskScoring() != null && behavioral.anomalyDetection() != null) {
            result.warning("All behavioral analysis features enabled may impact query performance");
        }
    }

    static int performanceScore(BehavioralAnalysisConfig behavioral) {
        int score = 10;
        if (behavioral.userProfiling()) {
            score += 15;
        }
        if (behavioral.baselineComparison()) {
            score += 10;
        }
        if (behavioral.riskScoringEnabled()) {
            score += 20;
            if ("ml_based".equals(behavioral.riskScoring().algorithm())) {
                score += 15;
            }
            score += behavioral.riskScoring().riskFactors().size() * 2;
        }
        if (behavioral.anomalyDetection() != null) {
            score += 25;
            String algorithm = behavioral.anomalyDetection().algorithm();
            if ("isolation_forest".equals(algorithm)) {
                score += 10;
            } else if ("ml_based".equals(algorithm)) {
                score += 20;
            }
        }
        return score;
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
    public Optional<RuleCondition> condition() {
        return Optional.of(CONDITION);
    }

    @Override
    public String description() {
        return "Validates behavioral analytics configuration including user profiling, risk scoring, "
                + "and anomaly detection parameters";
    }

    @Override
    public Severity severity() {
        return Severity.CRITICAL;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    public record Config(
        Boolean enabled,
        List<String> allowedRiskFactors,
        Integer maxRiskFactors,
        Integer minBaselineDays,
        Integer maxBaselineDays,
        Double minAnomalyThreshold,
        Double maxAnomalyThreshold,
        Integer maxPerformanceScore
    ) {
        public static final List<String> DEFAULT_RISK_FACTORS = List.of(
                "privilege_level", "resource_sensitivity", "timing_anomaly", "access_pattern",
                "frequency_deviation", "location_anomaly", "user_agent_change", "authentication_method",
                "session_duration", "data_volume", "network_pattern", "command_pattern");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            allowedRiskFactors = Values.listOr(allowedRiskFactors, DEFAULT_RISK_FACTORS);
            maxRiskFactors = Values.or(maxRiskFactors, 10);
            minBaselineDays = Values.or(minBaselineDays, 7);
            maxBaselineDays = Values.or(maxBaselineDays, 90);
            minAnomalyThreshold = Values.or(minAnomalyThreshold, 0.1);
            maxAnomalyThreshold = Values.or(maxAnomalyThreshold, 10.0);
            maxPerformanceScore = Values.or(maxPerformanceScore, 100);
            if (minBaselineDays > maxBaselineDays) {
                throw new IllegalArgumentException("min-baseline-days must not exceed max-baseline-days");
            }
            if (minAnomalyThreshold > maxAnomalyThreshold) {
                throw new IllegalArgumentException("min-anomaly-threshold must not exceed max-anomaly-threshold");
            }
            Values.requireNonNegative(maxRiskFactors, "max-risk-factors");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null, null, null);
        }
    }
}
