package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.StringOrList;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.List;

/**
 * Exact-match enum checks for auth decisions and response status codes.
 */
public class FieldValuesRule implements ValidationRule {

    public static final String NAME = "field_values_validation";

    static final int PRIORITY = 60;

    private final Config config;

    public FieldValuesRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Field values validation").query(query);

        if (Values.isSet(query.authDecision()) && !config.allowedAuthDecisions().contains(query.authDecision())) {
            result.error(String.format("Invalid auth_decision '%s'. Allowed decisions: %s",
                    query.authDecision(), String.join(", ", config.allowedAuthDecisions())));
        }
        checkResponseStatus(query.responseStatus(), result);

        if (result.hasErrors()) {
            result.recommend(
                    "Use only allowed values for enum fields",
                    "Check auth_decision values against allowed list",
                    "Verify business hours presets are supported",
                    "Ensure response status codes are valid");
        }
        return result.build();
    }

    private void checkResponseStatus(StringOrList status, ValidationResult.Builder result) {
        if (status.isEmpty()) {
            return;
        }
        String allowed = String.join(", ", config.allowedStatusCodes());
        String format = status.isList()
                ? "Invalid response_status '%s' in array. Allowed status codes: %s"
                : "Invalid response_status '%s'. Allowed status codes: %s";
        for (String code : status.values()) {
            if (!config.allowedStatusCodes().contains(code)) {
                result.error(String.format(format, code, allowed));
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
        return "Validates specific field values against allowed lists from configuration";
    }

    @Override
    public Severity severity() {
        return Severity.CRITICAL;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    public record Config(Boolean enabled, List<String> allowedAuthDecisions, List<String> allowedStatusCodes) {
        public static final List<String> DEFAULT_AUTH_DECISIONS = List.of("allow", "error", "forbid");
        public static final List<String> DEFAULT_STATUS_CODES = List.of(
                "200", "201", "204", "400", "401", "403", "404", "409", "422", "500", "502", "503", "504");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            allowedAuthDecisions = Values.listOr(allowedAuthDecisions, DEFAULT_AUTH_DECISIONS);
            allowedStatusCodes = Values.listOr(allowedStatusCodes, DEFAULT_STATUS_CODES);
        }

        public static Config defaults() {
            return new Config(null, null, null);
        }
    }
}
