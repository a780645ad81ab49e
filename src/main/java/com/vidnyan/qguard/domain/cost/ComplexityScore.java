package com.vidnyan.qguard.domain.cost;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complexity score of a query, broken down by contributing dimension.
 */
public record ComplexityScore(
    int base,
    int source,
    int fields,
    int timeRange,
    int patterns,
    int analysis,
    int multiSource,
    int behavioral,
    int compliance
) {

    public int total() {
        return base + source + fields + timeRange + patterns + analysis + multiSource + behavioral + compliance;
    }

    /**
     * Named contributions, in summation order, for diagnostic output.
     */
    public Map<String, Integer> breakdown() {
        Map<String, Integer> parts = new LinkedHashMap<>();
        parts.put("base", base);
        parts.put("source", source);
        parts.put("fields", fields);
        parts.put("time_range", timeRange);
        parts.put("patterns", patterns);
        parts.put("analysis", analysis);
        parts.put("multi_source", multiSource);
        parts.put("behavioral", behavioral);
        parts.put("compliance", compliance);
        return parts;
    }
}
