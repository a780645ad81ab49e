package com.vidnyan.qguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
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
import com.vidnyan.qguard.domain.constraint.ConstraintChecker;
import com.vidnyan.qguard.domain.cost.CostModel;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration for the guard pipeline.
 * Rules are registered in the order the orchestrator runs them.
 */
@Slf4j
@Configuration
public class GuardConfiguration {

    /**
     * ObjectMapper for query JSON. Unknown properties are ignored so newer
     * producers can add fields without breaking validation.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CostModel costModel() {
        return new CostModel();
    }

    @Bean
    public ConstraintChecker constraintChecker() {
        return new ConstraintChecker();
    }

    @Bean
    @Order(1)
    public WhitelistRule whitelistRule(GuardProperties properties) {
        return new WhitelistRule(properties.getWhitelist());
    }

    @Bean
    @Order(2)
    public ForbiddenPatternsRule forbiddenPatternsRule(GuardProperties properties) {
        return new ForbiddenPatternsRule(properties.getForbiddenPatterns());
    }

    @Bean
    @Order(3)
    public RequiredFieldsRule requiredFieldsRule(GuardProperties properties) {
        return new RequiredFieldsRule(properties.getRequiredFields());
    }

    @Bean
    @Order(4)
    public SanitizationRule sanitizationRule(GuardProperties properties) {
        return new SanitizationRule(properties.getSanitization());
    }

    @Bean
    @Order(5)
    public FieldValuesRule fieldValuesRule(GuardProperties properties) {
        return new FieldValuesRule(properties.getFieldValues());
    }

    @Bean
    @Order(6)
    public TimeframeRule timeframeRule(GuardProperties properties, Clock clock) {
        return new TimeframeRule(properties.getTimeframe(), clock);
    }

    @Bean
    @Order(7)
    public ComprehensiveInputRule comprehensiveInputRule(GuardProperties properties) {
        return new ComprehensiveInputRule(properties.getComprehensiveInput());
    }

    @Bean
    @Order(8)
    public AdvancedAnalysisRule advancedAnalysisRule(GuardProperties properties) {
        return new AdvancedAnalysisRule(properties.getAdvancedAnalysis());
    }

    @Bean
    @Order(9)
    public MultiSourceRule multiSourceRule(GuardProperties properties) {
        return new MultiSourceRule(properties.getMultiSource());
    }

    @Bean
    @Order(10)
    public BehavioralAnalyticsRule behavioralAnalyticsRule(GuardProperties properties,
                                                           ConstraintChecker constraintChecker) {
        return new BehavioralAnalyticsRule(properties.getBehavioralAnalytics(), constraintChecker);
    }

    @Bean
    @Order(11)
    public ComplianceRule complianceRule(GuardProperties properties) {
        return new ComplianceRule(properties.getCompliance());
    }

    @Bean
    @Order(12)
    public PerformanceRule performanceRule(GuardProperties properties, CostModel costModel) {
        return new PerformanceRule(properties.getPerformance(), costModel);
    }

    /**
     * Log registered rules on startup.
     */
    @Bean
    public String logRules(List<ValidationRule> rules) {
        log.info("Registered {} validation rules:", rules.size());
        for (ValidationRule rule : rules) {
            log.info("  - {} ({}){}", rule.name(), rule.severity().label(), rule.enabled() ? "" : " [disabled]");
        }
        return "rules-logged";
    }
}
