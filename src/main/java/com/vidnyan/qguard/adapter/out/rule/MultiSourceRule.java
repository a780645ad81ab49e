package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.MultiSourceConfig;
import com.vidnyan.qguard.domain.rule.RuleCondition;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates cross-source correlation: the sources involved, the correlation window,
 * fields and join, and an overall correlation complexity budget.
 */
public class MultiSourceRule implements ValidationRule {

    public static final String NAME = "multi_source_validation";

    static final int PRIORITY = 40;

    private static final RuleCondition CONDITION =
            RuleCondition.present("multi_source", AuditQuery::multiSource);

    static final List<String> VALID_SOURCES = WhitelistRule.Config.DEFAULT_LOG_SOURCES;

    static final List<List<String>> PERFORMANCE_COMBINATIONS = List.of(
            List.of("node-auditd", "kube-apiserver", "oauth-server"),              // high volume
            List.of("kube-apiserver", "openshift-apiserver", "oauth-apiserver"));  // API heavy

    static final List<String> LARGE_WINDOWS = List.of("12_hours", "24_hours");
    static final List<String> JOIN_TYPES = List.of("inner", "left", "right", "full");
    static final List<String> EXPENSIVE_JOINS = List.of("full", "right");

    /**
     * Fields each source is known to carry. Sources absent from this map are not checked.
     */
    static final Map<String, List<String>> SOURCE_FIELDS = Map.of(
            "kube-apiserver", List.of("user", "source_ip", "user_agent", "timestamp", "namespace",
                    "resource", "verb", "response_status", "request_id"),
            "openshift-apiserver", List.of("user", "source_ip", "user_agent", "timestamp", "namespace",
                    "resource", "verb", "response_status", "request_id"),
            "oauth-server", List.of("user", "source_ip", "user_agent", "timestamp", "session_id",
                    "response_status"),
            "oauth-apiserver", List.of("user", "source_ip", "user_agent", "timestamp", "namespace",
                    "resource", "verb", "response_status", "session_id"),
            "node-auditd", List.of("user", "source_ip", "timestamp"));

    private static final Map<String, Integer> WINDOW_COMPLEXITY = Map.of(
            "1_minute", 1,
            "5_minutes", 2,
            "15_minutes", 3,
            "30_minutes", 4,
            "1_hour", 5,
            "2_hours", 7,
            "4_hours", 10,
            "6_hours", 12,
            "12_hours", 15,
            "24_hours", 20);
    private static final int DEFAULT_WINDOW_COMPLEXITY = 5;

    private static final Map<String, Integer> JOIN_COMPLEXITY = Map.of(
            "inner", 1,
            "left", 2,
            "right", 3,
            "full", 5);
    private static final int DEFAULT_JOIN_COMPLEXITY = 2;

    private final Config config;

    public MultiSourceRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Multi-source validation").query(query);
        MultiSourceConfig multiSource = query.multiSource();
        if (multiSource == null) {
            return result.build();
        }

        checkPrimarySource(multiSource, result);
        checkSecondarySources(multiSource, result);
        checkPerformanceCombinations(multiSource, result);
        checkCorrelationWindow(multiSource, result);
        checkCorrelationFields(multiSource, result);
        checkJoinType(multiSource, result);
        checkComplexity(multiSource, result);

        if (result.hasErrors()) {
            result.recommend(
                    "Review multi-source correlation configuration",
                    "Ensure all log sources are valid and compatible",
                    "Verify correlation fields are supported across all sources",
                    "Check correlation window is within allowed limits",
                    "Consider reducing query complexity for better performance");
        }
        return result.build();
    }

    private void checkPrimarySource(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        String primary = multiSource.primarySource();
        if (!Values.isSet(primary)) {
            result.error("Primary source is required for multi-source correlation");
        } else if (!VALID_SOURCES.contains(primary)) {
            result.error(String.format("Invalid primary source '%s'. Valid sources: %s",
                    primary, String.join(", ", VALID_SOURCES)));
        }
    }

    private void checkSecondarySources(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        List<String> secondaries = multiSource.secondarySources();
        if (secondaries.isEmpty()) {
            result.error("At least one secondary source is required for multi-source correlation");
            return;
        }
        if (multiSource.sourceCount() > config.maxSources()) {
            result.error(String.format("Too many sources for correlation. Maximum allowed: %d, got: %d",
                    config.maxSources(), multiSource.sourceCount()));
        }

        Set<String> seen = new HashSet<>();
        seen.add(multiSource.primarySource());
        for (int i = 0; i < secondaries.size(); i++) {
            String source = secondaries.get(i);
            if (!VALID_SOURCES.contains(source)) {
                result.error(String.format("Invalid secondary source '%s' at index %d. Valid sources: %s",
                        source, i, String.join(", ", VALID_SOURCES)));
            } else if (!seen.add(source)) {
                result.error(String.format("Duplicate source '%s' at index %d. Each source can only be used once",
                        source, i));
            }
        }
    }

    private static void checkPerformanceCombinations(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        Set<String> sources = new HashSet<>(allSources(multiSource));
        for (List<String> combination : PERFORMANCE_COMBINATIONS) {
            if (sources.containsAll(combination)) {
                result.warning(String.format("Source combination [%s] may impact query performance",
                        String.join(" ", combination)));
            }
        }
    }

    private void checkCorrelationWindow(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        String window = multiSource.correlationWindow();
        if (!Values.isSet(window)) {
            result.warning("No correlation window specified, using default");
            return;
        }
        if (!config.allowedCorrelationWindows().contains(window)) {
            result.error(String.format("Invalid correlation window '%s'. Allowed windows: %s",
                    window, String.join(", ", config.allowedCorrelationWindows())));
        }
        if (LARGE_WINDOWS.contains(window)) {
            result.warning(String.format("Large correlation window '%s' may impact query performance", window));
        }
    }

    private void checkCorrelationFields(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        List<String> fields = multiSource.correlationFields();
        if (fields.isEmpty()) {
            result.warning("No correlation fields specified, using default correlation");
            return;
        }
        if (fields.size() > config.maxCorrelationFields()) {
            result.error(String.format("Too many correlation fields. Maximum allowed: %d, got: %d",
                    config.maxCorrelationFields(), fields.size()));
        }

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < fields.size(); i++) {
            String field = fields.get(i);
            if (!config.allowedCorrelationFields().contains(field)) {
                result.error(String.format("Invalid correlation field '%s' at index %d. Valid fields: %s",
                        field, i, String.join(", ", config.allowedCorrelationFields())));
            } else if (!seen.add(field)) {
                result.error(String.format("Duplicate correlation field '%s' at index %d", field, i));
            }
        }

        List<String> sources = allSources(multiSource);
        for (String field : fields) {
            List<String> missing = sources.stream()
                    .filter(SOURCE_FIELDS::containsKey)
                    .filter(source -> !SOURCE_FIELDS.get(source).contains(field))
                    .toList();
            if (!missing.isEmpty()) {
                result.warning(String.format("Correlation field '%s' may not be available in sources: %s",
                        field, String.join(", ", missing)));
            }
        }
    }

    private static void checkJoinType(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        String join = multiSource.joinType();
        if (!Values.isSet(join)) {
            return;
        }
        if (!JOIN_TYPES.contains(join)) {
            result.error(String.format("Invalid join type '%s'. Allowed types: %s",
                    join, String.join(", ", JOIN_TYPES)));
        }
        if (EXPENSIVE_JOINS.contains(join)) {
            result.warning(String.format("Join type '%s' may impact query performance", join));
        }
    }

    private void checkComplexity(MultiSourceConfig multiSource, ValidationResult.Builder result) {
        int complexity = correlationComplexity(multiSource);
        int max = config.maxCorrelationComplexity();
        if (complexity > max) {
            result.error(String.format("Correlation complexity score %d exceeds maximum allowed %d", complexity, max));
        } else if (complexity > max * 3 / 4) {
            result.warning(String.format("High correlation complexity score %d may impact performance", complexity));
        }
        result.detail("correlation_complexity_score", complexity);
        result.detail("max_complexity_allowed", max);
    }

    static int correlationComplexity(MultiSourceConfig multiSource) {
        int complexity = multiSource.secondarySources().size() * 10;
        complexity += multiSource.correlationFields().size() * 5;
        complexity += WINDOW_COMPLEXITY.getOrDefault(
                multiSource.correlationWindow() == null ? "" : multiSource.correlationWindow(),
                DEFAULT_WINDOW_COMPLEXITY);
        complexity += JOIN_COMPLEXITY.getOrDefault(
                multiSource.joinType() == null ? "" : multiSource.joinType(),
                DEFAULT_JOIN_COMPLEXITY);
        return complexity;
    }

    private static List<String> allSources(MultiSourceConfig multiSource) {
        List<String> sources = new ArrayList<>();
        if (multiSource.primarySource() != null) {
            sources.add(multiSource.primarySource());
        }
        sources.addAll(multiSource.secondarySources());
        return sources;
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
        return "Validates multi-source correlation configuration including source compatibility, "
                + "correlation fields, and complexity limits";
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
        Integer maxSources,
        List<String> allowedCorrelationWindows,
        Integer maxCorrelationFields,
        List<String> allowedCorrelationFields,
        Integer maxCorrelationComplexity
    ) {
        public static final List<String> DEFAULT_WINDOWS = List.of(
                "1_minute", "5_minutes", "10_minutes", "15_minutes", "30_minutes",
                "1_hour", "2_hours", "4_hours", "6_hours", "12_hours", "24_hours");
        public static final List<String> DEFAULT_CORRELATION_FIELDS = List.of(
                "user", "source_ip", "user_agent", "session_id", "request_id",
                "timestamp", "namespace", "resource", "verb", "response_status");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            maxSources = Values.or(maxSources, 5);
            allowedCorrelationWindows = Values.listOr(allowedCorrelationWindows, DEFAULT_WINDOWS);
            maxCorrelationFields = Values.or(maxCorrelationFields, 10);
            allowedCorrelationFields = Values.listOr(allowedCorrelationFields, DEFAULT_CORRELATION_FIELDS);
            maxCorrelationComplexity = Values.or(maxCorrelationComplexity, 100);
            if (maxSources < 2) {
                throw new IllegalArgumentException("max-sources must allow at least two sources, got " + maxSources);
            }
            Values.requireNonNegative(maxCorrelationFields, "max-correlation-fields");
            Values.requireNonNegative(maxCorrelationComplexity, "max-correlation-complexity");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null);
        }
    }
}
