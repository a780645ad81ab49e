package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Correlation of one primary log source with one or more secondary sources.
 */
public record MultiSourceConfig(
    @JsonProperty("primary_source") String primarySource,
    @JsonProperty("secondary_sources") List<String> secondarySources,
    @JsonProperty("correlation_window") String correlationWindow,
    @JsonProperty("correlation_fields") List<String> correlationFields,
    @JsonProperty("join_type") String joinType
) {
    public MultiSourceConfig {
        secondarySources = QueryLists.compact(secondarySources);
        correlationFields = QueryLists.compact(correlationFields);
    }

    /**
     * Primary plus secondary sources, in declaration order.
     */
    public int sourceCount() {
        return 1 + secondarySources.size();
    }
}
