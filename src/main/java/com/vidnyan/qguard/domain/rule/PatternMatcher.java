package com.vidnyan.qguard.domain.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Three-mode comparison used to screen free-text query values.
 * <p>
 * Modes are tried in order and the first hit wins:
 * <ol>
 *   <li>case-insensitive equality</li>
 *   <li>case-insensitive regex search, only when the pattern contains {@code .*} or {@code \}</li>
 *   <li>case-insensitive substring containment</li>
 * </ol>
 * A pattern that fails to compile is not a match in mode 2; mode 3 is still tried.
 */
@Slf4j
public final class PatternMatcher {

    private PatternMatcher() {
    }

    public static boolean matches(String value, String pattern) {
        if (value == null || pattern == null) {
            return false;
        }
        if (value.equalsIgnoreCase(pattern)) {
            return true;
        }
        if (looksLikeRegex(pattern) && regexFind(value, pattern)) {
            return true;
        }
        return value.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
    }

    static boolean looksLikeRegex(String pattern) {
        return pattern.contains(".*") || pattern.contains("\\");
    }

    private static boolean regexFind(String value, String pattern) {
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    .matcher(value)
                    .find();
        } catch (PatternSyntaxException e) {
            log.debug("Pattern '{}' is not a valid regex: {}", pattern, e.getDescription());
            return false;
        }
    }
}
