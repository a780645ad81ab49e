package com.vidnyan.qguard.domain.query;

import java.util.List;
import java.util.Objects;

/**
 * Normalisation for list fields of a query. JSON {@code null} elements are dropped.
 */
final class QueryLists {

    private QueryLists() {
    }

    static List<String> compact(List<String> values) {
        return values != null
                ? values.stream().filter(Objects::nonNull).toList()
                : List.of();
    }
}
