package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.StringOrList;
import com.vidnyan.qguard.domain.rule.PatternMatcher;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Screens every free-text value of a query against a deny-list, plus
 * fixed lists of dangerous request URIs, namespaces, users and resource names.
 */
public class ForbiddenPatternsRule implements ValidationRule {

    public static final String NAME = "forbidden_patterns_validation";

    static final int PRIORITY = 70;

    static final List<String> DANGEROUS_URI_PATTERNS = List.of(
            "/api/v1/namespaces/.*/finalize",
            "/api/v1/namespaces/.*/status",
            "/api/v1/nodes/.*/proxy",
            "/api/v1/nodes/.*/status",
            "/api/v1/pods/.*/exec",
            "/api/v1/pods/.*/attach",
            "/api/v1/pods/.*/portforward",
            "/api/v1/pods/.*/log",
            "/api/v1/pods/.*/proxy",
            "/api/v1/services/.*/proxy");

    static final List<String> DANGEROUS_NAMESPACE_PATTERNS = List.of(
            "kube-system", "openshift-.*", "default", "kube-public", "kube-node-lease",
            "security", "prod.*", "production");

    static final List<String> DANGEROUS_USER_PATTERNS = List.of(
            "system:admin", "system:masters", "cluster-admin", "admin");

    static final List<String> DANGEROUS_RESOURCE_PATTERNS = DANGEROUS_NAMESPACE_PATTERNS.subList(0, 5);

    private final Config config;

    public ForbiddenPatternsRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Forbidden patterns validation")
                .query(query);

        checkStringFields(query, result);
        checkListFields(query, result);
        checkDangerous("Request URI", query.requestUriPattern(), DANGEROUS_URI_PATTERNS, result);
        checkDangerous("Namespace", query.namespacePattern(), DANGEROUS_NAMESPACE_PATTERNS, result);
        checkDangerous("User", query.userPattern(), DANGEROUS_USER_PATTERNS, result);
        checkDangerous("Resource name", query.resourceNamePattern(), DANGEROUS_RESOURCE_PATTERNS, result);

        if (result.hasErrors()) {
            result.recommend(
                    "Remove forbidden patterns from query parameters",
                    "Avoid dangerous command patterns and system access",
                    "Use safe, non-privileged patterns only",
                    "Review query for potential security risks");
        }
        return result.build();
    }

    private void checkStringFields(AuditQuery query, ValidationResult.Builder result) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("log_source", query.logSource());
        fields.put("timeframe", query.timeframe());
        fields.put("resource_name_pattern", query.resourceNamePattern());
        fields.put("user_pattern", query.userPattern());
        fields.put("namespace_pattern", query.namespacePattern());
        fields.put("request_uri_pattern", query.requestUriPattern());
        fields.put("auth_decision", query.authDecision());
        fields.put("sort_by", query.sortBy());
        fields.put("sort_order", query.sortOrder());
        fields.put("subresource", query.subresource());
        fields.put("request_object_filter", query.requestObjectFilter());
        fields.put("authorization_reason_pattern", query.authorizationReasonPattern());
        fields.put("response_message_pattern", query.responseMessagePattern());
        fields.put("missing_annotation", query.missingAnnotation());

        fields.forEach((field, value) -> {
            if (Values.isSet(value)) {
                screen(value, pattern -> String.format("Field '%s' contains forbidden pattern '%s': %s",
                        field, pattern, value), result);
            }
        });
    }

    private void checkListFields(AuditQuery query, ValidationResult.Builder result) {
        Map<String, StringOrList> fields = new LinkedHashMap<>();
        fields.put("verb", query.verb());
        fields.put("resource", query.resource());
        fields.put("namespace", query.namespace());
        fields.put("user", query.user());
        fields.put("response_status", query.responseStatus());
        fields.put("source_ip", query.sourceIp());
        fields.put("group_by", query.groupBy());

        fields.forEach((field, value) -> {
            if (value.isEmpty()) {
                return;
            }
            for (String item : value.values()) {
                screen(item, pattern -> String.format("Field '%s' contains forbidden pattern '%s': %s",
                        field, pattern, item), result);
            }
        });

        for (String user : query.excludeUsers()) {
            screen(user, pattern -> String.format("Exclude user contains forbidden pattern '%s': %s",
                    pattern, user), result);
        }
        for (String resource : query.excludeResources()) {
            screen(resource, pattern -> String.format("Exclude resource contains forbidden pattern '%s': %s",
                    pattern, resource), result);
        }
    }

    private void screen(String value, Function<String, String> message,
                        ValidationResult.Builder result) {
        for (String pattern : config.forbiddenPatterns()) {
            if (PatternMatcher.matches(value, pattern)) {
                result.error(message.apply(pattern));
            }
        }
    }

    private void checkDangerous(String label, String value, List<String> patterns, ValidationResult.Builder result) {
        if (!Values.isSet(value)) {
            return;
        }
        for (String pattern : patterns) {
            if (PatternMatcher.matches(value, pattern)) {
                result.error(String.format("%s pattern contains dangerous pattern '%s': %s", label, pattern, value));
            }
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
        return "Validates that query does not contain forbidden patterns or dangerous commands";
    }

    @Override
    public Severity severity() {
        return Severity.CRITICAL;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    public record Config(Boolean enabled, List<String> forbiddenPatterns) {
        public static final List<String> DEFAULT_FORBIDDEN_PATTERNS = List.of(
                "rm -rf", "delete --all", "system:admin", "cluster-admin");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            forbiddenPatterns = Values.listOr(forbiddenPatterns, DEFAULT_FORBIDDEN_PATTERNS);
        }

        public static Config defaults() {
            return new Config(null, null);
        }
    }
}
