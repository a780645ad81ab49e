package com.vidnyan.qguard;

import com.vidnyan.qguard.config.GuardProperties;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class QueryGuardApplicationTest {

    @Autowired
    private List<ValidationRule> rules;

    @Autowired
    private GuardProperties properties;

    @Test
    void contextLoads_ShouldRegisterRulesInExecutionOrder() {
        List<String> names = rules.stream().map(ValidationRule::name).toList();

        assertEquals(List.of(
                "whitelist_validation",
                "forbidden_patterns_validation",
                "required_fields_validation",
                "sanitization_validation",
                "field_values_validation",
                "timeframe_validation",
                "comprehensive_input_validation",
                "advanced_analysis_validation",
                "multi_source_validation",
                "behavioral_analytics_validation",
                "compliance_validation",
                "performance_validation"), names);
    }

    @Test
    void properties_ShouldBindRuleSettingsFromApplicationYml() {
        assertTrue(properties.getAdvancedAnalysis().allowedAnalysisTypes().contains("apt_reconnaissance_detection"));
        assertTrue(properties.getAdvancedAnalysis().allowedSortOrders().contains("desc"));
        assertEquals(100, properties.getPerformance().maxComplexityScore());
        assertTrue(properties.getWhitelist().allowedVerbs().contains("watch"));
    }
}
