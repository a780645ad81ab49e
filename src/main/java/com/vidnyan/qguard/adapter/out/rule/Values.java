package com.vidnyan.qguard.adapter.out.rule;

import java.util.List;

/**
 * Small helpers shared by the rule implementations.
 */
final class Values {

    private Values() {
    }

    static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static boolean containsIgnoreCase(List<String> allowed, String value) {
        return allowed.stream().anyMatch(candidate -> candidate.equalsIgnoreCase(value));
    }

    /**
     * Null-safe immutable copy, falling back to the given defaults.
     */
    static <T> List<T> listOr(List<T> value, List<T> defaults) {
        return value != null ? List.copyOf(value) : defaults;
    }

    static <T> T or(T value, T defaults) {
        return value != null ? value : defaults;
    }

    static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }
}
