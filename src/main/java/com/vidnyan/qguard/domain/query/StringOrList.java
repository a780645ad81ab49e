package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A query field that holds either one string or an ordered list of strings.
 * Consumers read it through {@link #values()} and never branch on the shape.
 */
public record StringOrList(Kind kind, List<String> values) {

    public enum Kind {
        SCALAR,
        LIST
    }

    private static final StringOrList EMPTY = new StringOrList(Kind.LIST, List.of());

    public StringOrList {
        kind = kind != null ? kind : Kind.LIST;
        values = values != null
                ? values.stream().filter(Objects::nonNull).toList()
                : List.of();
    }

    public static StringOrList empty() {
        return EMPTY;
    }

    public static StringOrList of(String value) {
        return value == null ? EMPTY : new StringOrList(Kind.SCALAR, List.of(value));
    }

    public static StringOrList of(String... values) {
        return new StringOrList(Kind.LIST, List.of(values));
    }

    public static StringOrList of(List<String> values) {
        return values == null ? EMPTY : new StringOrList(Kind.LIST, values);
    }

    /**
     * Accepts a JSON string, a JSON array or a bare number (status codes are often sent unquoted).
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static StringOrList fromJson(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof Collection<?> items) {
            return new StringOrList(Kind.LIST, items.stream()
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .toList());
        }
        return new StringOrList(Kind.SCALAR, List.of(String.valueOf(raw)));
    }

    @JsonValue
    public Object toJson() {
        return kind == Kind.SCALAR && values.size() == 1 ? values.get(0) : values;
    }

    public boolean isList() {
        return kind == Kind.LIST;
    }

    /**
     * True when no value carries any non-blank text.
     */
    public boolean isEmpty() {
        return values.stream().allMatch(String::isBlank);
    }

    public int size() {
        return values.size();
    }
}
