package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.cost.ComplexityScore;
import com.vidnyan.qguard.domain.cost.CostModel;
import com.vidnyan.qguard.domain.cost.PerformanceTier;
import com.vidnyan.qguard.domain.cost.ResourceEstimate;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;

/**
 * Admits a query only if its projected cost stays within the configured budget.
 * Each metric, result-set size and source count included, is checked on its own;
 * above three quarters of a limit is a warning.
 */
@Slf4j
public class PerformanceRule implements ValidationRule {

    public static final String NAME = "performance_validation";

    static final int PRIORITY = 10;

    private final Config config;
    private final CostModel costModel;

    public PerformanceRule(Config config, CostModel costModel) {
        this.config = config != null ? config : Config.defaults();
        this.costModel = costModel;
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Performance validation").query(query);

        ComplexityScore score = costModel.score(query);
        ResourceEstimate estimate = costModel.estimate(query, score);
        int total = score.total();
        PerformanceTier tier = PerformanceTier.of(total, config.maxComplexityScore());
        log.debug("Query complexity {} ({}), breakdown {}", total, tier.label(), score.breakdown());

        admit(total, config.maxComplexityScore(), result,
                String.format("Query complexity score %d exceeds maximum allowed %d", total, config.maxComplexityScore()),
                String.format("High query complexity score %d may impact performance", total));
        admit(estimate.memoryMb(), config.maxMemoryMb(), result,
                String.format("Estimated memory usage %d MB exceeds limit %d MB", estimate.memoryMb(), config.maxMemoryMb()),
                String.format("High estimated memory usage %d MB", estimate.memoryMb()));
        admit(estimate.cpuPercent(), config.maxCpuPercent(), result,
                String.format("Estimated CPU usage %d%% exceeds limit %d%%", estimate.cpuPercent(), config.maxCpuPercent()),
                String.format("High estimated CPU usage %d%%", estimate.cpuPercent()));
        admit(estimate.executionSeconds(), config.maxExecutionSeconds(), result,
                String.format("Estimated execution time %d seconds exceeds limit %d seconds",
                        estimate.executionSeconds(), config.maxExecutionSeconds()),
                String.format("Long estimated execution time %d seconds", estimate.executionSeconds()));

        int limit = query.limit() == 0 ? config.defaultLimit() : query.limit();
        boolean aggregated = query.usesAggregation();
        int resultCap = aggregated ? config.maxAggregatedResults() : config.maxRawResults();
        String kind = aggregated ? "Aggregated" : "Raw";
        admit(limit, resultCap, result,
                String.format("%s result limit %d exceeds maximum %d", kind, limit, resultCap),
                String.format("%s result limit %d is close to maximum %d", kind, limit, resultCap));

        int concurrent = query.concurrentSources();
        admit(concurrent, config.maxConcurrentSources(), result,
                String.format("Concurrent sources %d exceeds limit %d", concurrent, config.maxConcurrentSources()),
                String.format("Concurrent sources %d is close to limit %d", concurrent, config.maxConcurrentSources()));

        recommend(query, tier, result);
        if (result.hasErrors()) {
            result.recommend(
                    "Reduce query complexity to improve performance",
                    "Consider limiting result set size",
                    "Optimize time range and filtering criteria",
                    "Use more specific log sources and patterns");
        }

        result.detail("query_complexity_score", total)
                .detail("complexity_breakdown", score.breakdown())
                .detail("max_complexity_allowed", config.maxComplexityScore())
                .detail("performance_tier", tier.label())
                .detail("estimated_memory_mb", estimate.memoryMb())
                .detail("estimated_cpu_percent", estimate.cpuPercent())
                .detail("estimated_execution_seconds", estimate.executionSeconds())
                .detail("uses_aggregation", aggregated)
                .detail("effective_limit", limit)
                .detail("concurrent_sources", concurrent);
        return result.build();
    }

    private static void admit(int value, int max, ValidationResult.Builder result, String error, String warning) {
        if (value > max) {
            result.error(error);
        } else if (value > max * 3 / 4) {
            result.warning(warning);
        }
    }

    private static void recommend(AuditQuery query, PerformanceTier tier, ValidationResult.Builder result) {
        switch (tier) {
            case HIGH -> result.recommend(
                    "Consider breaking down complex queries into simpler parts",
                    "Use more specific time ranges to reduce data volume",
                    "Limit result set size for initial analysis",
                    "Consider running during off-peak hours");
            case MEDIUM -> result.recommend(
                    "Monitor query execution time",
                    "Consider caching results for repeated queries");
            case LOW -> result.recommend("Query should execute efficiently");
        }

        if (query.multiSource() != null && query.multiSource().secondarySources().size() > 2) {
            result.recommend("Consider reducing number of correlated sources for better performance");
        }
        if (query.analysis() != null && query.analysis().statisticalAnalysis() != null) {
            result.recommend("Statistical analysis may benefit from larger baseline periods");
        }
        if (query.behavioralAnalysis() != null && query.behavioralAnalysis().userProfiling()
                && query.behavioralAnalysis().anomalyDetection() != null) {
            result.recommend("Combined behavioral analysis features may impact performance");
        }
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
        return "Validates query performance, complexity limits, and resource usage to ensure efficient execution";
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
        Integer maxComplexityScore,
        Integer maxMemoryMb,
        Integer maxCpuPercent,
        Integer maxExecutionSeconds,
        Integer maxRawResults,
        Integer maxAggregatedResults,
        Integer maxConcurrentSources,
        Integer defaultLimit
    ) {
        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            maxComplexityScore = Values.or(maxComplexityScore, 100);
            maxMemoryMb = Values.or(maxMemoryMb, 1024);
            maxCpuPercent = Values.or(maxCpuPercent, 50);
            maxExecutionSeconds = Values.or(maxExecutionSeconds, 300);
            maxRawResults = Values.or(maxRawResults, 10000);
            maxAggregatedResults = Values.or(maxAggregatedResults, 1000);
            maxConcurrentSources = Values.or(maxConcurrentSources, 5);
            defaultLimit = Values.or(defaultLimit, 20);
            Values.requireNonNegative(maxComplexityScore, "max-complexity-score");
            Values.requireNonNegative(maxMemoryMb, "max-memory-mb");
            Values.requireNonNegative(maxCpuPercent, "max-cpu-percent");
            Values.requireNonNegative(maxExecutionSeconds, "max-execution-seconds");
            Values.requireNonNegative(maxRawResults, "max-raw-results");
            Values.requireNonNegative(maxAggregatedResults, "max-aggregated-results");
            Values.requireNonNegative(maxConcurrentSources, "max-concurrent-sources");
            Values.requireNonNegative(defaultLimit, "default-limit");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null, null, null, null);
        }
    }
}
