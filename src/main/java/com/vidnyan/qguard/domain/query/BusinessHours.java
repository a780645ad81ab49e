package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Restricts matching events to (or outside of) a daily hour window.
 */
public record BusinessHours(
    @JsonProperty("outside_only") boolean outsideOnly,
    @JsonProperty("start_hour") int startHour,
    @JsonProperty("end_hour") int endHour,
    @JsonProperty("timezone") String timezone
) {}
