package com.vidnyan.qguard.domain.cost;

/**
 * Projected resource consumption derived from a complexity score.
 */
public record ResourceEstimate(
    int memoryMb,
    int cpuPercent,
    int executionSeconds
) {}
