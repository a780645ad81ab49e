package com.vidnyan.qguard.domain.constraint;

import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig.AnomalyDetection;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates "feature A requires feature B" implications across the optional
 * behavioral analysis sub-blocks. Each implication is checked independently.
 * Structural implications yield errors; algorithm tuning checks only ever warn.
 */
public final class ConstraintChecker {

    public List<ConstraintViolation> check(BehavioralAnalysisConfig config) {
        List<ConstraintViolation> violations = new ArrayList<>();
        if (config == null) {
            return violations;
        }
        checkDependencies(config, violations);
        if (config.anomalyDetection() != null) {
            checkAlgorithmTuning(config.anomalyDetection(), violations);
        }
        return violations;
    }

    private void checkDependencies(BehavioralAnalysisConfig config, List<ConstraintViolation> violations) {
        if (config.riskScoringEnabled() && !config.userProfiling()) {
            violations.add(ConstraintViolation.error("risk_scoring_requires_profiling",
                    "Risk scoring requires user profiling to be enabled"));
        }

        if (config.anomalyDetection() != null && !config.baselineComparison() && !config.userProfiling()) {
            violations.add(ConstraintViolation.warning("anomaly_detection_context",
                    "Anomaly detection works best with baseline comparison or user profiling enabled"));
        }

        if (config.baselineComparison() && isBlank(config.baselineWindow())) {
            violations.add(ConstraintViolation.error("baseline_comparison_requires_window",
                    "Baseline comparison requires baseline_window to be specified"));
        }

        if (config.riskScoring() != null && config.anomalyDetection() != null
                && "ml_based".equals(config.riskScoring().algorithm())
                && "isolation_forest".equals(config.anomalyDetection().algorithm())) {
            violations.add(ConstraintViolation.warning("ml_risk_with_isolation_forest",
                    "ML-based risk scoring with isolation forest may be computationally intensive"));
        }
    }

    private void checkAlgorithmTuning(AnomalyDetection anomaly, List<ConstraintViolation> violations) {
        String algorithm = anomaly.algorithm() == null ? "" : anomaly.algorithm();
        switch (algorithm) {
            case "isolation_forest" -> {
                if (anomaly.contamination() > 0.3) {
                    violations.add(ConstraintViolation.warning("isolation_forest_contamination",
                            "High contamination value for isolation forest may reduce detection accuracy"));
                }
            }
            case "z_score" -> {
                if (anomaly.threshold() != 0.0 && (anomaly.threshold() < 2.0 || anomaly.threshold() > 4.0)) {
                    violations.add(ConstraintViolation.warning("z_score_threshold",
                            "Z-score threshold typically works best between 2.0 and 4.0"));
                }
            }
            case "statistical" -> {
                if (anomaly.sensitivity() == 0.0) {
                    violations.add(ConstraintViolation.warning("statistical_sensitivity",
                            "Statistical anomaly detection typically requires sensitivity to be specified"));
                }
            }
            default -> {
                // no tuning guidance for other algorithms
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
