package com.vidnyan.qguard.domain.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vidnyan.qguard.domain.query.AuditQuery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one rule, or of the whole pipeline, for one query.
 * Validity and severity are derived from the error and warning lists at build time.
 */
public record ValidationResult(
    boolean valid,
    String ruleName,
    Severity severity,
    String message,
    List<String> errors,
    List<String> warnings,
    List<String> recommendations,
    Map<String, Object> details,
    Instant timestamp,
    @JsonIgnore AuditQuery query
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Create a failed result carrying a single error.
     */
    public static ValidationResult failure(String ruleName, String message, String error, AuditQuery query) {
        return builder(ruleName, message)
                .query(query)
                .error(error)
                .message(message)
                .build();
    }

    /**
     * Start a result for the given rule. {@code subject} prefixes the derived message,
     * e.g. "Whitelist validation" becomes "Whitelist validation passed".
     */
    public static Builder builder(String ruleName, String subject) {
        return new Builder(ruleName, subject);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public static class Builder {
        private final String ruleName;
        private final String subject;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> recommendations = new ArrayList<>();
        private final Map<String, Object> details = new LinkedHashMap<>();
        private AuditQuery query;
        private String message;

        private Builder(String ruleName, String subject) {
            this.ruleName = ruleName;
            this.subject = subject;
        }

        public Builder query(AuditQuery query) { this.query = query; return this; }
        public Builder error(String error) { this.errors.add(error); return this; }
        public Builder errors(List<String> errors) { this.errors.addAll(errors); return this; }
        public Builder warning(String warning) { this.warnings.add(warning); return this; }
        public Builder warnings(List<String> warnings) { this.warnings.addAll(warnings); return this; }
        public Builder detail(String key, Object value) { this.details.put(key, value); return this; }

        public Builder recommend(String... recommendations) {
            this.recommendations.addAll(List.of(recommendations));
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations.addAll(recommendations);
            return this;
        }

        /**
         * Override the derived message.
         */
        public Builder message(String message) { this.message = message; return this; }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }

        public ValidationResult build() {
            boolean valid = errors.isEmpty();
            Severity severity = !valid ? Severity.CRITICAL
                    : !warnings.isEmpty() ? Severity.WARNING
                    : Severity.INFO;
            String text = message != null ? message : subject + switch (severity) {
                case CRITICAL -> " failed";
                case WARNING -> " passed with warnings";
                case INFO -> " passed";
            };
            return new ValidationResult(valid, ruleName, severity, text, errors, warnings,
                    recommendations, details, Instant.now(), query);
        }
    }
}
