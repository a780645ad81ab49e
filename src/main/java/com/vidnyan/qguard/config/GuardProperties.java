package com.vidnyan.qguard.config;

import com.vidnyan.qguard.adapter.out.rule.AdvancedAnalysisRule;
import com.vidnyan.qguard.adapter.out.rule.BehavioralAnalyticsRule;
import com.vidnyan.qguard.adapter.out.rule.ComplianceRule;
import com.vidnyan.qguard.adapter.out.rule.ComprehensiveInputRule;
import com.vidnyan.qguard.adapter.out.rule.FieldValuesRule;
import com.vidnyan.qguard.adapter.out.rule.ForbiddenPatternsRule;
import com.vidnyan.qguard.adapter.out.rule.MultiSourceRule;
import com.vidnyan.qguard.adapter.out.rule.PerformanceRule;
import com.vidnyan.qguard.adapter.out.rule.RequiredFieldsRule;
import com.vidnyan.qguard.adapter.out.rule.SanitizationRule;
import com.vidnyan.qguard.adapter.out.rule.TimeframeRule;
import com.vidnyan.qguard.adapter.out.rule.WhitelistRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-rule settings, bound from {@code guard.rules.*}.
 * Sections left out of application.yml stay null and the rule falls back to its built-in defaults;
 * keys left out of a section fall back inside the rule's config record.
 */
@Data
@Component
@ConfigurationProperties(prefix = "guard.rules")
public class GuardProperties {

    private WhitelistRule.Config whitelist;

    private ForbiddenPatternsRule.Config forbiddenPatterns;

    private RequiredFieldsRule.Config requiredFields;

    private SanitizationRule.Config sanitization;

    private FieldValuesRule.Config fieldValues;

    private TimeframeRule.Config timeframe;

    private ComprehensiveInputRule.Config comprehensiveInput;

    private AdvancedAnalysisRule.Config advancedAnalysis;

    private MultiSourceRule.Config multiSource;

    private BehavioralAnalyticsRule.Config behavioralAnalytics;

    private ComplianceRule.Config compliance;

    private PerformanceRule.Config performance;
}
