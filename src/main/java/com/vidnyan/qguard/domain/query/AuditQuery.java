package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Structured audit-log query produced upstream and validated before execution.
 * Zero, blank and null values mean "not specified".
 */
@Builder(toBuilder = true)
public record AuditQuery(
    @JsonProperty("log_source") String logSource,
    @JsonProperty("verb") StringOrList verb,
    @JsonProperty("resource") StringOrList resource,
    @JsonProperty("namespace") StringOrList namespace,
    @JsonProperty("user") StringOrList user,
    @JsonProperty("timeframe") String timeframe,
    @JsonProperty("limit") int limit,
    @JsonProperty("response_status") StringOrList responseStatus,
    @JsonProperty("exclude_users") List<String> excludeUsers,
    @JsonProperty("resource_name_pattern") String resourceNamePattern,
    @JsonProperty("user_pattern") String userPattern,
    @JsonProperty("namespace_pattern") String namespacePattern,
    @JsonProperty("request_uri_pattern") String requestUriPattern,
    @JsonProperty("auth_decision") String authDecision,
    @JsonProperty("source_ip") StringOrList sourceIp,
    @JsonProperty("correlation_fields") List<String> correlationFields,
    @JsonProperty("group_by") StringOrList groupBy,
    @JsonProperty("sort_by") String sortBy,
    @JsonProperty("sort_order") String sortOrder,
    @JsonProperty("subresource") String subresource,
    @JsonProperty("include_changes") boolean includeChanges,
    @JsonProperty("time_range") TimeRange timeRange,
    @JsonProperty("business_hours") BusinessHours businessHours,
    @JsonProperty("request_object_filter") String requestObjectFilter,
    @JsonProperty("exclude_resources") List<String> excludeResources,
    @JsonProperty("authorization_reason_pattern") String authorizationReasonPattern,
    @JsonProperty("response_message_pattern") String responseMessagePattern,
    @JsonProperty("missing_annotation") String missingAnnotation,
    @JsonProperty("multi_source") MultiSourceConfig multiSource,
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("behavioral_analysis") BehavioralAnalysisConfig behavioralAnalysis,
    @JsonProperty("compliance_framework") ComplianceFrameworkConfig complianceFramework
) {
    public AuditQuery {
        verb = orEmpty(verb);
        resource = orEmpty(resource);
        namespace = orEmpty(namespace);
        user = orEmpty(user);
        responseStatus = orEmpty(responseStatus);
        sourceIp = orEmpty(sourceIp);
        groupBy = orEmpty(groupBy);
        excludeUsers = QueryLists.compact(excludeUsers);
        excludeResources = QueryLists.compact(excludeResources);
        correlationFields = QueryLists.compact(correlationFields);
    }

    /**
     * True when results are grouped, either directly or through an analysis block.
     */
    public boolean usesAggregation() {
        return !groupBy.isEmpty() || analysis != null;
    }

    /**
     * Number of log sources read concurrently.
     */
    public int concurrentSources() {
        return multiSource != null ? multiSource.sourceCount() : 1;
    }

    private static StringOrList orEmpty(StringOrList value) {
        return value != null ? value : StringOrList.empty();
    }
}
