package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User behaviour analytics block: profiling, baselines, risk scoring and anomaly detection.
 */
public record BehavioralAnalysisConfig(
    @JsonProperty("user_profiling") boolean userProfiling,
    @JsonProperty("baseline_comparison") boolean baselineComparison,
    @JsonProperty("risk_scoring") RiskScoring riskScoring,
    @JsonProperty("anomaly_detection") AnomalyDetection anomalyDetection,
    @JsonProperty("baseline_window") String baselineWindow,
    @JsonProperty("learning_period") String learningPeriod
) {

    public boolean riskScoringEnabled() {
        return riskScoring != null && riskScoring.enabled();
    }

    public record RiskScoring(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("risk_factors") List<String> riskFactors,
        @JsonProperty("weighting_scheme") Map<String, Double> weightingScheme
    ) {
        public RiskScoring {
            riskFactors = QueryLists.compact(riskFactors);
            // null means "no scheme", an empty map is a scheme with no weights
            weightingScheme = weightingScheme != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(weightingScheme))
                    : null;
        }
    }

    /**
     * Zero for contamination, sensitivity or threshold means "not specified".
     */
    public record AnomalyDetection(
        @JsonProperty("algorithm") String algorithm,
        @JsonProperty("contamination") double contamination,
        @JsonProperty("sensitivity") double sensitivity,
        @JsonProperty("threshold") double threshold
    ) {}
}
