package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.StringOrList;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Accepts only whitelisted log sources, verbs and resources.
 * Comparison is case-insensitive; each disallowed element is its own error.
 */
@Slf4j
public class WhitelistRule implements ValidationRule {

    public static final String NAME = "whitelist_validation";

    static final int PRIORITY = 95;

    private final Config config;

    public WhitelistRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Whitelist validation").query(query);

        if (Values.isSet(query.logSource())
                && !Values.containsIgnoreCase(config.allowedLogSources(), query.logSource())) {
            result.error(String.format("Log source '%s' is not in allowed whitelist", query.logSource()));
        }
        checkElements("Verb", query.verb(), config.allowedVerbs(), result);
        checkElements("Resource", query.resource(), config.allowedResources(), result);

        if (result.hasErrors()) {
            result.recommend(
                    "Use only allowed log sources, verbs, and resources from the whitelist",
                    "Check the configuration for the complete list of allowed values");
        }
        return result.build();
    }

    private void checkElements(String label, StringOrList field, List<String> allowed,
                               ValidationResult.Builder result) {
        if (field.isEmpty()) {
            return;
        }
        for (String value : field.values()) {
            if (!Values.containsIgnoreCase(allowed, value)) {
                log.debug("{} '{}' rejected by whitelist", label, value);
                result.error(String.format("%s '%s' is not in allowed whitelist", label, value));
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
        return "Validates that log sources, verbs, and resources are in the allowed whitelist";
    }

    @Override
    public Severity severity() {
        return Severity.CRITICAL;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    /**
     * Allow-lists. A missing list falls back to the built-in defaults.
     */
    public record Config(
        Boolean enabled,
        List<String> allowedLogSources,
        List<String> allowedVerbs,
        List<String> allowedResources
    ) {
        public static final List<String> DEFAULT_LOG_SOURCES = List.of(
                "kube-apiserver", "openshift-apiserver", "oauth-server", "oauth-apiserver", "node-auditd");
        public static final List<String> DEFAULT_VERBS = List.of(
                "get", "list", "create", "update", "patch", "delete", "watch");
        public static final List<String> DEFAULT_RESOURCES = List.of(
                "pods", "services", "deployments", "configmaps", "secrets", "namespaces");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            allowedLogSources = Values.listOr(allowedLogSources, DEFAULT_LOG_SOURCES);
            allowedVerbs = Values.listOr(allowedVerbs, DEFAULT_VERBS);
            allowedResources = Values.listOr(allowedResources, DEFAULT_RESOURCES);
        }

        public static Config defaults() {
            return new Config(null, null, null, null);
        }
    }
}
