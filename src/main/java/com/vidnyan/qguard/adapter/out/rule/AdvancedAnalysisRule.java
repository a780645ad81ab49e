package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AnalysisConfig;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.RuleCondition;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Validates the {@code analysis} block: type, kill-chain phase, statistical parameters,
 * threshold, time window and grouping/sorting.
 * <p>
 * The allowed analysis types, time windows and sort settings have no built-in values
 * and must come from configuration; with an empty list every value is rejected.
 */
public class AdvancedAnalysisRule implements ValidationRule {

    public static final String NAME = "advanced_analysis_validation";

    static final int PRIORITY = 50;

    private static final RuleCondition CONDITION =
            RuleCondition.present("analysis", AuditQuery::analysis);

    static final List<String> APT_TYPES = List.of(
            "apt_reconnaissance_detection",
            "apt_lateral_movement_detection",
            "apt_data_exfiltration_detection",
            "privilege_escalation_detection",
            "persistence_mechanism_detection",
            "defense_evasion_detection",
            "credential_harvesting_detection",
            "supply_chain_attack_detection",
            "living_off_the_land_detection",
            "c2_communication_detection");

    static final List<String> STATISTICAL_TYPES = List.of(
            "statistical_analysis",
            "anomaly_detection",
            "behavioral_analysis",
            "correlation_analysis",
            "temporal_pattern_analysis");

    // Lockheed Martin kill chain followed by MITRE ATT&CK tactics
    static final List<String> KILL_CHAIN_PHASES = List.of(
            "reconnaissance", "weaponization", "delivery", "exploitation", "installation",
            "command_control", "actions_objectives", "initial_access", "execution", "persistence",
            "privilege_escalation", "defense_evasion", "credential_access", "discovery",
            "lateral_movement", "collection", "command_and_control", "exfiltration", "impact");

    static final List<String> BASELINE_WINDOWS = List.of("7_days", "14_days", "30_days", "60_days", "90_days");

    private static final int MIN_THRESHOLD = 1;

    private final Config config;

    public AdvancedAnalysisRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Advanced analysis validation").query(query);
        AnalysisConfig analysis = query.analysis();
        if (analysis == null) {
            return result.build();
        }

        checkType(analysis, result);
        if (Values.isSet(analysis.killChainPhase()) && !KILL_CHAIN_PHASES.contains(analysis.killChainPhase())) {
            result.error(String.format("Invalid kill chain phase '%s'. Allowed phases: %s",
                    analysis.killChainPhase(), String.join(", ", KILL_CHAIN_PHASES)));
        }
        if (analysis.statisticalAnalysis() != null) {
            checkStatistics(analysis.statisticalAnalysis(), result);
        }
        if (analysis.threshold() != 0
                && (analysis.threshold() < MIN_THRESHOLD || analysis.threshold() > config.maxThresholdValue())) {
            result.error(String.format("Threshold must be between %d and %d, got %d",
                    MIN_THRESHOLD, config.maxThresholdValue(), analysis.threshold()));
        }
        if (Values.isSet(analysis.timeWindow()) && !config.allowedTimeWindows().contains(analysis.timeWindow())) {
            result.error(String.format("Invalid time window '%s'. Allowed windows: %s",
                    analysis.timeWindow(), String.join(", ", config.allowedTimeWindows())));
        }
        checkGroupingAndSorting(analysis, result);

        if (result.hasErrors()) {
            result.recommend(
                    "Review advanced analysis configuration",
                    "Ensure all required fields are present for the analysis type",
                    "Verify statistical analysis parameters are within valid ranges",
                    "Check kill chain phase requirements for APT analysis types");
        }
        return result.build();
    }

    private void checkType(AnalysisConfig analysis, ValidationResult.Builder result) {
        String type = analysis.type();
        if (!Values.isSet(type)) {
            result.error("Analysis type is required");
            return;
        }
        if (!config.allowedAnalysisTypes().contains(type)) {
            result.error(String.format("Invalid analysis type '%s'. Allowed types: %s",
                    type, String.join(", ", config.allowedAnalysisTypes())));
            return;
        }
        if (APT_TYPES.contains(type) && !Values.isSet(analysis.killChainPhase())) {
            result.error(String.format("Kill chain phase is required for APT analysis type '%s'", type));
        }
        if (STATISTICAL_TYPES.contains(type) && analysis.statisticalAnalysis() == null) {
            result.warning(String.format("Statistical analysis parameters recommended for analysis type '%s'", type));
        }
    }

    /**
     * Zero or empty parameters are treated as unset and skipped.
     */
    private static void checkStatistics(AnalysisConfig.StatisticalAnalysis stats, ValidationResult.Builder result) {
        double deviation = stats.patternDeviationThreshold();
        if (deviation != 0 && (deviation < 0.1 || deviation > 10.0)) {
            result.error(String.format(Locale.ROOT,
                    "Pattern deviation threshold must be between 0.1 and 10.0, got %.2f", deviation));
        }
        double confidence = stats.confidenceInterval();
        if (confidence != 0 && (confidence < 0.5 || confidence > 0.99)) {
            result.error(String.format(Locale.ROOT,
                    "Confidence interval must be between 0.5 and 0.99, got %.2f", confidence));
        }
        if (stats.sampleSizeMinimum() != 0 && stats.sampleSizeMinimum() < 10) {
            result.error(String.format("Sample size minimum must be at least 10, got %d", stats.sampleSizeMinimum()));
        }
        if (Values.isSet(stats.baselineWindow()) && !BASELINE_WINDOWS.contains(stats.baselineWindow())) {
            result.error(String.format("Invalid baseline window '%s'. Allowed windows: %s",
                    stats.baselineWindow(), String.join(", ", BASELINE_WINDOWS)));
        }
    }

    private void checkGroupingAndSorting(AnalysisConfig analysis, ValidationResult.Builder result) {
        if (Values.isSet(analysis.sortBy()) && !config.allowedSortFields().contains(analysis.sortBy())) {
            result.error(String.format("Invalid sort field '%s'. Allowed fields: %s",
                    analysis.sortBy(), String.join(", ", config.allowedSortFields())));
        }
        if (Values.isSet(analysis.sortOrder()) && !config.allowedSortOrders().contains(analysis.sortOrder())) {
            result.error(String.format("Invalid sort order '%s'. Allowed orders: %s",
                    analysis.sortOrder(), String.join(", ", config.allowedSortOrders())));
        }
        // a scalar group_by is a single field and never exceeds the cap
        if (!analysis.groupBy().isEmpty() && analysis.groupBy().isList()
                && analysis.groupBy().size() > config.maxGroupByFields()) {
            result.error(String.format("Too many group by fields. Maximum allowed: %d, got: %d",
                    config.maxGroupByFields(), analysis.groupBy().size()));
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
    public Optional<RuleCondition> condition() {
        return Optional.of(CONDITION);
    }

    @Override
    public String description() {
        return "Validates advanced analysis configuration including APT detection, kill chain phases, "
                + "and statistical analysis parameters";
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
        List<String> allowedAnalysisTypes,
        List<String> allowedTimeWindows,
        List<String> allowedSortFields,
        List<String> allowedSortOrders,
        Integer maxThresholdValue,
        Integer maxGroupByFields
    ) {
        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            allowedAnalysisTypes = Values.listOr(allowedAnalysisTypes, List.of());
            allowedTimeWindows = Values.listOr(allowedTimeWindows, List.of());
            allowedSortFields = Values.listOr(allowedSortFields, List.of());
            allowedSortOrders = Values.listOr(allowedSortOrders, List.of());
            maxThresholdValue = Values.or(maxThresholdValue, 10);
            maxGroupByFields = Values.or(maxGroupByFields, 5);
            if (maxThresholdValue < MIN_THRESHOLD) {
                throw new IllegalArgumentException("max-threshold-value must be at least " + MIN_THRESHOLD);
            }
            Values.requireNonNegative(maxGroupByFields, "max-group-by-fields");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null, null);
        }
    }
}
