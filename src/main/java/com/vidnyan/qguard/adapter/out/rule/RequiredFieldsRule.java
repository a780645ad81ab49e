package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.List;

/**
 * Requires the configured fields to carry a value. Unknown field names are reported as missing.
 */
public class RequiredFieldsRule implements ValidationRule {

    public static final String NAME = "required_fields_validation";

    static final int PRIORITY = 90;

    private final Config config;

    public RequiredFieldsRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Required fields validation").query(query);

        for (String field : config.requiredFields()) {
            if (!isPresent(query, field)) {
                result.error(String.format("Required field '%s' is missing or empty", field));
            }
        }

        if (result.hasErrors()) {
            result.recommend(
                    "Provide all required fields for the query",
                    "Check the configuration for the list of required fields");
        }
        return result.build();
    }

    static boolean isPresent(AuditQuery query, String field) {
        return switch (field) {
            case "log_source" -> !Values.isBlank(query.logSource());
            case "verb" -> !query.verb().isEmpty();
            case "resource" -> !query.resource().isEmpty();
            case "namespace" -> !query.namespace().isEmpty();
            case "user" -> !query.user().isEmpty();
            case "timeframe" -> Values.isSet(query.timeframe());
            case "limit" -> query.limit() > 0;
            case "response_status" -> !query.responseStatus().isEmpty();
            case "source_ip" -> !query.sourceIp().isEmpty();
            case "group_by" -> !query.groupBy().isEmpty();
            case "sort_by" -> Values.isSet(query.sortBy());
            case "sort_order" -> Values.isSet(query.sortOrder());
            case "subresource" -> Values.isSet(query.subresource());
            case "auth_decision" -> Values.isSet(query.authDecision());
            case "resource_name_pattern" -> Values.isSet(query.resourceNamePattern());
            case "user_pattern" -> Values.isSet(query.userPattern());
            case "namespace_pattern" -> Values.isSet(query.namespacePattern());
            case "request_uri_pattern" -> Values.isSet(query.requestUriPattern());
            case "authorization_reason_pattern" -> Values.isSet(query.authorizationReasonPattern());
            case "response_message_pattern" -> Values.isSet(query.responseMessagePattern());
            case "missing_annotation" -> Values.isSet(query.missingAnnotation());
            case "request_object_filter" -> Values.isSet(query.requestObjectFilter());
            default -> false;
        };
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
        return "Validates that all required fields are present and non-empty";
    }

    @Override
    public Severity severity() {
        return Severity.CRITICAL;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    public record Config(Boolean enabled, List<String> requiredFields) {
        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            requiredFields = Values.listOr(requiredFields, List.of("log_source"));
        }

        public static Config defaults() {
            return new Config(null, null);
        }
    }
}
