package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Guards against injection through free-text fields: forbidden characters,
 * overlong patterns and malformed IP, namespace and resource values.
 */
public class SanitizationRule implements ValidationRule {

    public static final String NAME = "sanitization_validation";

    static final int PRIORITY = 80;

    private final Config config;
    private final Pattern validRegex;
    private final Pattern validIp;
    private final Pattern validNamespace;
    private final Pattern validResource;

    public SanitizationRule(Config config) {
        this.config = config != null ? config : Config.defaults();
        this.validRegex = compile(this.config.validRegexPattern());
        this.validIp = compile(this.config.validIpPattern());
        this.validNamespace = compile(this.config.validNamespacePattern());
        this.validResource = compile(this.config.validResourcePattern());
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Input sanitization validation").query(query);

        checkForbiddenChars(query, result);
        checkPatternLengths(query, result);

        Stream.of(query.resourceNamePattern(), query.userPattern(), query.namespacePattern(),
                        query.requestUriPattern(), query.authorizationReasonPattern(), query.responseMessagePattern())
                .filter(Values::isSet)
                .filter(pattern -> !fullMatch(validRegex, pattern))
                .forEach(pattern -> result.error("Invalid regex pattern: " + pattern));

        if (!query.sourceIp().isEmpty()) {
            query.sourceIp().values().stream()
                    .filter(ip -> !fullMatch(validIp, ip))
                    .forEach(ip -> result.error("Invalid IP address: " + ip));
        }
        if (Values.isSet(query.namespacePattern()) && !fullMatch(validNamespace, query.namespacePattern())) {
            result.error("Invalid namespace pattern: " + query.namespacePattern());
        }
        if (Values.isSet(query.resourceNamePattern()) && !fullMatch(validResource, query.resourceNamePattern())) {
            result.error("Invalid resource pattern: " + query.resourceNamePattern());
        }

        if (result.hasErrors()) {
            result.recommend(
                    "Remove forbidden characters from patterns",
                    "Use only alphanumeric characters, hyphens, and underscores",
                    "Keep patterns within length limits",
                    "Use valid regex patterns only");
        }
        return result.build();
    }

    private void checkForbiddenChars(AuditQuery query, ValidationResult.Builder result) {
        Stream.of(query.resourceNamePattern(), query.userPattern(), query.namespacePattern(),
                        query.requestUriPattern(), query.authorizationReasonPattern(),
                        query.responseMessagePattern(), query.missingAnnotation(), query.requestObjectFilter())
                .filter(Values::isSet)
                .forEach(pattern -> forbiddenIn(pattern).forEach(ch ->
                        result.error(String.format("Pattern contains forbidden character '%s': %s", ch, pattern))));

        for (String user : query.excludeUsers()) {
            forbiddenIn(user).forEach(ch ->
                    result.error(String.format("Exclude user contains forbidden character '%s': %s", ch, user)));
        }
        for (String resource : query.excludeResources()) {
            forbiddenIn(resource).forEach(ch ->
                    result.error(String.format("Exclude resource contains forbidden character '%s': %s", ch, resource)));
        }
    }

    private void checkPatternLengths(AuditQuery query, ValidationResult.Builder result) {
        Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("resource_name_pattern", query.resourceNamePattern());
        patterns.put("user_pattern", query.userPattern());
        patterns.put("namespace_pattern", query.namespacePattern());
        patterns.put("request_uri_pattern", query.requestUriPattern());

        patterns.forEach((name, pattern) -> {
            if (Values.isSet(pattern) && pattern.length() > config.maxPatternLength()) {
                result.error(String.format("Pattern '%s' exceeds maximum length of %d characters",
                        name, config.maxPatternLength()));
            }
        });
    }

    private List<String> forbiddenIn(String value) {
        return config.forbiddenChars().stream().filter(value::contains).toList();
    }

    private static boolean fullMatch(Pattern pattern, String value) {
        return pattern == null || pattern.matcher(value).matches();
    }

    static Pattern compile(String regex) {
        if (Values.isBlank(regex)) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid sanitization pattern: " + regex, e);
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
        return "Validates input sanitization to prevent injection attacks";
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
     * A blank validity pattern disables that particular check.
     */
    public record Config(
        Boolean enabled,
        Integer maxPatternLength,
        String validRegexPattern,
        String validIpPattern,
        String validNamespacePattern,
        String validResourcePattern,
        List<String> forbiddenChars
    ) {
        public static final String DEFAULT_VALID_REGEX = "^[a-zA-Z0-9\\-_\\*\\.\\?\\+\\[\\]\\{\\}\\(\\)\\|\\\\/\\s]+$";
        public static final String DEFAULT_VALID_IP =
                "^((25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$";
        public static final String DEFAULT_VALID_NAMESPACE = "^[a-z0-9]([a-z0-9\\-]*[a-z0-9])?$";
        public static final String DEFAULT_VALID_RESOURCE = "^[a-z]([a-z0-9\\-]*[a-z0-9])?$";
        public static final List<String> DEFAULT_FORBIDDEN_CHARS = List.of(
                "<", ">", "&", "\"", "'", "`", "|", ";", "$", "(", ")", "{", "}", "[", "]",
                "\\", "/", "!", "@", "#", "%", "^", "*", "+", "=", "~");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            maxPatternLength = Values.or(maxPatternLength, 500);
            validRegexPattern = Values.or(validRegexPattern, DEFAULT_VALID_REGEX);
            validIpPattern = Values.or(validIpPattern, DEFAULT_VALID_IP);
            validNamespacePattern = Values.or(validNamespacePattern, DEFAULT_VALID_NAMESPACE);
            validResourcePattern = Values.or(validResourcePattern, DEFAULT_VALID_RESOURCE);
            forbiddenChars = Values.listOr(forbiddenChars, DEFAULT_FORBIDDEN_CHARS);
            Values.requireNonNegative(maxPatternLength, "max-pattern-length");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null, null);
        }
    }
}
