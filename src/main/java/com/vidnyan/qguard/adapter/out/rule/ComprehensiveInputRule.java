package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.StringOrList;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Single-pass input validation: mandatory fields, character safety, security
 * patterns, allowed values and basic result-size limits.
 * <p>
 * Overlaps with the narrower rules on purpose; both report when both are enabled.
 */
public class ComprehensiveInputRule implements ValidationRule {

    public static final String NAME = "comprehensive_input_validation";

    static final int PRIORITY = 85;

    private final Config config;
    private final Pattern validRegex;
    private final Pattern validIp;

    public ComprehensiveInputRule(Config config) {
        this.config = config != null ? config : Config.defaults();
        this.validRegex = SanitizationRule.compile(this.config.validRegexPattern());
        this.validIp = SanitizationRule.compile(this.config.validIpPattern());
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Input validation").query(query);

        for (String field : config.mandatoryFields()) {
            if (!RequiredFieldsRule.isPresent(query, field)) {
                result.error(String.format("Required field '%s' is missing or empty", field));
            }
        }
        checkCharacters(query, result);
        checkSecurityPatterns(query, result);
        checkFieldValues(query, result);
        checkLimits(query, result);

        if (result.hasErrors()) {
            result.recommend(
                    "Fix all validation errors before proceeding",
                    "Review query parameters for compliance with security policies");
        }

        Map<String, Object> sections = new LinkedHashMap<>();
        sections.put("required_fields_checked", config.mandatoryFields().size());
        sections.put("character_validation_applied", true);
        sections.put("security_patterns_checked", config.securityPatterns().size());
        sections.put("field_values_validated", true);
        sections.put("performance_limits_applied", true);
        result.detail("validation_sections", sections);

        return result.build();
    }

    private void checkCharacters(AuditQuery query, ValidationResult.Builder result) {
        stringFields(query).forEach((field, value) -> {
            if (!Values.isSet(value)) {
                return;
            }
            if (value.length() > config.maxPatternLength()) {
                result.error(String.format("Field '%s' exceeds maximum length of %d characters",
                        field, config.maxPatternLength()));
            }
            for (String ch : config.forbiddenChars()) {
                if (value.contains(ch)) {
                    result.error(String.format("Field '%s' contains forbidden character '%s'", field, ch));
                }
            }
            if (field.endsWith("_pattern") && validRegex != null && !validRegex.matcher(value).matches()) {
                result.warning(String.format("Field '%s' does not match recommended pattern format", field));
            }
            if (field.contains("ip") && validIp != null && !validIp.matcher(value).matches()) {
                result.warning(String.format("Field '%s' does not appear to be a valid IP address", field));
            }
        });
    }

    private void checkSecurityPatterns(AuditQuery query, ValidationResult.Builder result) {
        Map<String, String> fields = stringFields(query);
        joined(fields, "verb", query.verb());
        joined(fields, "resource", query.resource());
        joined(fields, "namespace", query.namespace());
        joined(fields, "user", query.user());
        joined(fields, "response_status", query.responseStatus());
        joined(fields, "source_ip", query.sourceIp());
        joined(fields, "group_by", query.groupBy());
        if (!query.excludeUsers().isEmpty()) {
            fields.put("exclude_users", String.join(" ", query.excludeUsers()));
        }
        if (!query.excludeResources().isEmpty()) {
            fields.put("exclude_resources", String.join(" ", query.excludeResources()));
        }

        fields.forEach((field, value) -> {
            if (!Values.isSet(value)) {
                return;
            }
            String lower = value.toLowerCase(Locale.ROOT);
            for (String pattern : config.securityPatterns()) {
                if (lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                    result.error(String.format("Field '%s' contains forbidden security pattern: %s", field, pattern));
                }
            }
        });
    }

    private void checkFieldValues(AuditQuery query, ValidationResult.Builder result) {
        if (Values.isSet(query.logSource()) && !config.allowedLogSources().contains(query.logSource())) {
            result.error(String.format("Log source '%s' is not in allowed list", query.logSource()));
        }
        checkAllowed("verb", query.verb(), config.allowedVerbs(), result);
        checkAllowed("resource", query.resource(), config.allowedResources(), result);
        if (Values.isSet(query.authDecision()) && !config.allowedAuthDecisions().contains(query.authDecision())) {
            result.error(String.format("Auth decision '%s' is not in allowed list", query.authDecision()));
        }
        checkAllowed("response_status", query.responseStatus(), config.allowedResponseStatus(), result);
    }

    private void checkLimits(AuditQuery query, ValidationResult.Builder result) {
        if (query.limit() > config.maxResultLimit()) {
            result.error(String.format("Result limit %d exceeds maximum allowed limit of %d",
                    query.limit(), config.maxResultLimit()));
        }
        checkArraySize("exclude_users", query.excludeUsers().size(), result);
        checkArraySize("exclude_resources", query.excludeResources().size(), result);
        if (Values.isSet(query.timeframe()) && !config.allowedTimeframes().contains(query.timeframe())) {
            result.error(String.format("Timeframe '%s' is not in allowed list", query.timeframe()));
        }
    }

    private void checkAllowed(String field, StringOrList value, List<String> allowed, ValidationResult.Builder result) {
        if (value.isEmpty()) {
            return;
        }
        for (String item : value.values()) {
            if (!allowed.contains(item)) {
                result.error(String.format("Value '%s' in field '%s' is not in allowed list", item, field));
            }
        }
    }

    private void checkArraySize(String field, int size, ValidationResult.Builder result) {
        if (size > config.maxArrayElements()) {
            result.error(String.format("Array field '%s' has %d elements, exceeds maximum of %d",
                    field, size, config.maxArrayElements()));
        }
    }

    private static Map<String, String> stringFields(AuditQuery query) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("log_source", query.logSource());
        fields.put("timeframe", query.timeframe());
        fields.put("subresource", query.subresource());
        fields.put("auth_decision", query.authDecision());
        fields.put("resource_name_pattern", query.resourceNamePattern());
        fields.put("user_pattern", query.userPattern());
        fields.put("namespace_pattern", query.namespacePattern());
        fields.put("request_uri_pattern", query.requestUriPattern());
        fields.put("authorization_reason_pattern", query.authorizationReasonPattern());
        fields.put("response_message_pattern", query.responseMessagePattern());
        fields.put("missing_annotation", query.missingAnnotation());
        fields.put("request_object_filter", query.requestObjectFilter());
        fields.put("sort_by", query.sortBy());
        fields.put("sort_order", query.sortOrder());
        return fields;
    }

    private static void joined(Map<String, String> fields, String name, StringOrList value) {
        if (!value.isEmpty()) {
            fields.put(name, String.join(" ", value.values()));
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
        return "Comprehensive input validation covering required fields, character safety, "
                + "security patterns, field values, and performance limits";
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
        List<String> mandatoryFields,
        Integer maxPatternLength,
        List<String> forbiddenChars,
        String validRegexPattern,
        String validIpPattern,
        List<String> securityPatterns,
        List<String> allowedLogSources,
        List<String> allowedVerbs,
        List<String> allowedResources,
        List<String> allowedAuthDecisions,
        List<String> allowedResponseStatus,
        Integer maxResultLimit,
        Integer maxArrayElements,
        List<String> allowedTimeframes
    ) {
        public static final List<String> DEFAULT_FORBIDDEN_CHARS = List.of(
                "<", ">", "&", "\"", "'", "`", "|", ";", "$");
        public static final List<String> DEFAULT_SECURITY_PATTERNS = List.of(
                "system:admin", "system:masters", "cluster-admin", "delete --all", "delete --force",
                "privileged: true", "hostNetwork: true", "runAsUser: 0");
        public static final List<String> DEFAULT_VERBS = List.of(
                "get", "list", "create", "update", "patch", "delete", "watch", "impersonate");
        public static final List<String> DEFAULT_RESOURCES = List.of(
                "pods", "services", "deployments", "configmaps", "secrets", "namespaces",
                "serviceaccounts", "roles", "rolebindings", "clusterroles", "clusterrolebindings",
                "customresourcedefinitions", "persistentvolumeclaims", "networkpolicies",
                "events", "nodes", "routes", "builds", "imagestreams", "projects",
                "users", "groups", "oauthclients", "securitycontextconstraints");
        public static final List<String> DEFAULT_TIMEFRAMES = List.of(
                "today", "yesterday", "1_hour_ago", "6_hours_ago", "12_hours_ago",
                "1_day_ago", "3_days_ago", "7_days_ago", "30_days_ago", "90_days_ago");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            mandatoryFields = Values.listOr(mandatoryFields, List.of("log_source"));
            maxPatternLength = Values.or(maxPatternLength, 500);
            forbiddenChars = Values.listOr(forbiddenChars, DEFAULT_FORBIDDEN_CHARS);
            validRegexPattern = Values.or(validRegexPattern, SanitizationRule.Config.DEFAULT_VALID_REGEX);
            validIpPattern = Values.or(validIpPattern, SanitizationRule.Config.DEFAULT_VALID_IP);
            securityPatterns = Values.listOr(securityPatterns, DEFAULT_SECURITY_PATTERNS);
            allowedLogSources = Values.listOr(allowedLogSources, WhitelistRule.Config.DEFAULT_LOG_SOURCES);
            allowedVerbs = Values.listOr(allowedVerbs, DEFAULT_VERBS);
            allowedResources = Values.listOr(allowedResources, DEFAULT_RESOURCES);
            allowedAuthDecisions = Values.listOr(allowedAuthDecisions, FieldValuesRule.Config.DEFAULT_AUTH_DECISIONS);
            allowedResponseStatus = Values.listOr(allowedResponseStatus, FieldValuesRule.Config.DEFAULT_STATUS_CODES);
            maxResultLimit = Values.or(maxResultLimit, 50);
            maxArrayElements = Values.or(maxArrayElements, 15);
            allowedTimeframes = Values.listOr(allowedTimeframes, DEFAULT_TIMEFRAMES);
            Values.requireNonNegative(maxPatternLength, "max-pattern-length");
            Values.requireNonNegative(maxResultLimit, "max-result-limit");
            Values.requireNonNegative(maxArrayElements, "max-array-elements");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null, null, null, null, null, null, null,
                    null, null, null);
        }
    }
}
