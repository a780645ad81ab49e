package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Explicit time window of a query.
 */
public record TimeRange(
    @JsonProperty("start") Instant start,
    @JsonProperty("end") Instant end
) {}
