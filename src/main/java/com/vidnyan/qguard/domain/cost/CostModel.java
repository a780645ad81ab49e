package com.vidnyan.qguard.domain.cost;

import com.vidnyan.qguard.domain.query.AnalysisConfig;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.BehavioralAnalysisConfig;
import com.vidnyan.qguard.domain.query.ComplianceFrameworkConfig;
import com.vidnyan.qguard.domain.query.MultiSourceConfig;
import com.vidnyan.qguard.domain.query.StringOrList;

import java.util.Map;
import java.util.stream.Stream;

/**
 * Converts the shape of a query into a complexity score and resource estimates.
 * Stateless; all weights are fixed tables.
 */
public final class CostModel {

    static final int BASE_COMPLEXITY = 10;

    private static final Map<String, Integer> SOURCE_COST = Map.of(
            "kube-apiserver", 15,       // high volume, complex processing
            "openshift-apiserver", 12,
            "oauth-server", 8,
            "oauth-apiserver", 10,
            "node-auditd", 20           // very high volume
    );
    private static final int DEFAULT_SOURCE_COST = 10;

    private static final Map<String, Integer> TIMEFRAME_COST = Map.ofEntries(
            Map.entry("1_hour_ago", 1),
            Map.entry("today", 2),
            Map.entry("6_hours_ago", 3),
            Map.entry("yesterday", 4),
            Map.entry("12_hours_ago", 5),
            Map.entry("24_hours_ago", 8),
            Map.entry("7_days_ago", 15),
            Map.entry("last_week", 15),
            Map.entry("14_days_ago", 25),
            Map.entry("30_days_ago", 40),
            Map.entry("last_month", 40),
            Map.entry("60_days_ago", 60),
            Map.entry("90_days_ago", 80)
    );
    private static final int CUSTOM_RANGE_COST = 20;
    private static final int UNKNOWN_TIMEFRAME_COST = 5;

    private static final Map<String, Integer> ANALYSIS_TYPE_COST = Map.ofEntries(
            Map.entry("anomaly_detection", 30),
            Map.entry("correlation", 25),
            Map.entry("apt_reconnaissance_detection", 40),
            Map.entry("lateral_movement_detection", 35),
            Map.entry("behavioral_analysis", 45),
            Map.entry("user_behavior_anomaly_detection", 50),
            Map.entry("cross_source_correlation", 60),
            Map.entry("timeline_reconstruction", 40),
            Map.entry("rbac_violation_privilege_escalation_analysis", 35),
            Map.entry("oauth_token_manipulation_investigation", 30)
    );
    private static final int DEFAULT_ANALYSIS_TYPE_COST = 20;

    private static final Map<String, Integer> CORRELATION_WINDOW_COST = Map.of(
            "1_minute", 2,
            "5_minutes", 5,
            "15_minutes", 10,
            "30_minutes", 15,
            "1_hour", 20,
            "6_hours", 40,
            "24_hours", 80
    );
    private static final int DEFAULT_WINDOW_COST = 15;

    private static final Map<String, Integer> JOIN_COST = Map.of(
            "inner", 5,
            "left", 10,
            "right", 15,
            "full", 25
    );

    /**
     * Compute the full score breakdown for a query.
     */
    public ComplexityScore score(AuditQuery query) {
        return new ComplexityScore(
                BASE_COMPLEXITY,
                sourceCost(query.logSource()),
                fieldCost(query),
                timeRangeCost(query),
                patternCost(query),
                query.analysis() != null ? analysisCost(query.analysis()) : 0,
                query.multiSource() != null ? multiSourceCost(query.multiSource()) : 0,
                query.behavioralAnalysis() != null ? behavioralCost(query.behavioralAnalysis()) : 0,
                query.complianceFramework() != null ? complianceCost(query.complianceFramework()) : 0
        );
    }

    /**
     * Derive memory, CPU and execution time projections from a score.
     */
    public ResourceEstimate estimate(AuditQuery query, ComplexityScore score) {
        int total = score.total();
        int secondarySources = query.multiSource() != null
                ? query.multiSource().secondarySources().size()
                : 0;

        int memory = 50 + total * 2;
        if (query.analysis() != null) {
            memory += 100;
        }
        if (query.multiSource() != null) {
            memory += secondarySources * 50;
        }
        if (query.behavioralAnalysis() != null) {
            memory += 150;
        }

        int cpu = 10 + total / 3;
        if (query.analysis() != null) {
            cpu += 25;
        }
        if (query.multiSource() != null) {
            cpu += 20;
        }
        cpu = Math.min(cpu, 100);

        int seconds = 5 + total / 10;
        if (query.analysis() != null && query.analysis().statisticalAnalysis() != null) {
            seconds += 60;
        }
        if (query.multiSource() != null) {
            seconds += secondarySources * 15;
        }

        return new ResourceEstimate(memory, cpu, seconds);
    }

    int sourceCost(String logSource) {
        return SOURCE_COST.getOrDefault(logSource == null ? "" : logSource, DEFAULT_SOURCE_COST);
    }

    int fieldCost(AuditQuery query) {
        int cost = Stream.of(query.verb(), query.resource(), query.namespace(), query.user(),
                        query.responseStatus(), query.sourceIp(), query.groupBy())
                .mapToInt(CostModel::stringOrListCost)
                .sum();

        cost += query.excludeUsers().size() * 2;
        cost += query.excludeResources().size() * 2;

        // regex processing on free-text patterns is the expensive part
        cost += (int) Stream.of(query.userPattern(), query.namespacePattern(), query.resourceNamePattern(),
                        query.requestUriPattern(), query.authorizationReasonPattern(),
                        query.responseMessagePattern())
                .filter(CostModel::isSet)
                .count() * 8;

        if (isSet(query.sortBy())) {
            cost += 5;
        }
        return cost;
    }

    int timeRangeCost(AuditQuery query) {
        Integer named = query.timeframe() != null ? TIMEFRAME_COST.get(query.timeframe()) : null;
        if (named != null) {
            return named;
        }
        if (query.timeRange() != null) {
            return CUSTOM_RANGE_COST;
        }
        return isSet(query.timeframe()) ? UNKNOWN_TIMEFRAME_COST : 0;
    }

    int patternCost(AuditQuery query) {
        int cost = 0;
        if (query.includeChanges()) {
            cost += 25;
        }
        if (isSet(query.requestObjectFilter())) {
            cost += 15;
        }
        return cost;
    }

    int analysisCost(AnalysisConfig analysis) {
        int cost = 20;
        cost += ANALYSIS_TYPE_COST.getOrDefault(analysis.type() == null ? "" : analysis.type(),
                DEFAULT_ANALYSIS_TYPE_COST);
        if (analysis.statisticalAnalysis() != null) {
            cost += 25;
        }
        if (analysis.multiStageCorrelation()) {
            cost += 20;
        }
        if (!analysis.groupBy().isEmpty()) {
            cost += analysis.groupBy().size() * 5;
        }
        return cost;
    }

    /**
     * Grows super-linearly with the number of correlated sources.
     */
    int multiSourceCost(MultiSourceConfig multiSource) {
        int cost = 30;
        cost += (int) Math.round(Math.pow(multiSource.sourceCount(), 1.5) * 10);
        cost += multiSource.correlationFields().size() * 8;
        cost += CORRELATION_WINDOW_COST.getOrDefault(
                multiSource.correlationWindow() == null ? "" : multiSource.correlationWindow(),
                DEFAULT_WINDOW_COST);
        cost += JOIN_COST.getOrDefault(multiSource.joinType() == null ? "" : multiSource.joinType(), 0);
        return cost;
    }

    int behavioralCost(BehavioralAnalysisConfig behavioral) {
        int cost = 20;
        if (behavioral.userProfiling()) {
            cost += 15;
        }
        if (behavioral.baselineComparison()) {
            cost += 25;
        }
        if (behavioral.riskScoringEnabled()) {
            BehavioralAnalysisConfig.RiskScoring risk = behavioral.riskScoring();
            cost += 35 + risk.riskFactors().size() * 5;
            if ("ml_based".equals(risk.algorithm())) {
                cost += 40;
            }
        }
        if (behavioral.anomalyDetection() != null) {
            cost += 45;
            if ("isolation_forest".equals(behavioral.anomalyDetection().algorithm())) {
                cost += 25;
            }
        }
        return cost;
    }

    int complianceCost(ComplianceFrameworkConfig compliance) {
        int cost = 10;
        cost += compliance.standards().size() * 8;
        cost += compliance.controls().size() * 5;
        if (compliance.evidenceRequested()) {
            cost += 20;
        }
        return cost;
    }

    private static int stringOrListCost(StringOrList field) {
        if (field.isEmpty()) {
            return 0;
        }
        return field.isList() ? field.size() * 2 : 3;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
