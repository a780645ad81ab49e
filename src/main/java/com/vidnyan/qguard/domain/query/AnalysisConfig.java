package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advanced analysis block (APT detection, statistical and correlation analyses).
 */
public record AnalysisConfig(
    @JsonProperty("type") String type,
    @JsonProperty("kill_chain_phase") String killChainPhase,
    @JsonProperty("multi_stage_correlation") boolean multiStageCorrelation,
    @JsonProperty("statistical_analysis") StatisticalAnalysis statisticalAnalysis,
    @JsonProperty("threshold") int threshold,
    @JsonProperty("time_window") String timeWindow,
    @JsonProperty("group_by") StringOrList groupBy,
    @JsonProperty("sort_by") String sortBy,
    @JsonProperty("sort_order") String sortOrder
) {
    public AnalysisConfig {
        groupBy = groupBy != null ? groupBy : StringOrList.empty();
    }

    /**
     * Statistical tuning parameters. Zero or empty means "not specified".
     */
    public record StatisticalAnalysis(
        @JsonProperty("pattern_deviation_threshold") double patternDeviationThreshold,
        @JsonProperty("confidence_interval") double confidenceInterval,
        @JsonProperty("sample_size_minimum") int sampleSizeMinimum,
        @JsonProperty("baseline_window") String baselineWindow
    ) {}
}
