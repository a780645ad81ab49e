package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.MultiSourceConfig;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MultiSourceRuleTest {

    private final MultiSourceRule rule = new MultiSourceRule(null);

    private ValidationResult validate(MultiSourceConfig multiSource) {
        return rule.validate(AuditQuery.builder().logSource("kube-apiserver").multiSource(multiSource).build());
    }

    @Test
    void validate_ShouldAcceptSimpleCorrelation() {
        MultiSourceConfig config = new MultiSourceConfig("kube-apiserver", List.of("openshift-apiserver"),
                "5_minutes", List.of("user"), "inner");

        ValidationResult result = validate(config);

        assertTrue(result.valid(), () -> "unexpected errors: " + result.errors());
        assertEquals(Severity.INFO, result.severity());
        assertEquals(18, result.details().get("correlation_complexity_score"));
        assertEquals(100, result.details().get("max_complexity_allowed"));
    }

    @Test
    void validate_ShouldRejectDuplicateSourceIncludingPrimary() {
        MultiSourceConfig config = new MultiSourceConfig("kube-apiserver", List.of("oauth-server", "kube-apiserver"),
                "5_minutes", List.of("user"), "inner");

        ValidationResult result = validate(config);

        assertFalse(result.valid());
        assertEquals(List.of("Duplicate source 'kube-apiserver' at index 1. Each source can only be used once"),
                result.errors());
        assertEquals(5, result.recommendations().size());
    }

    @Test
    void validate_ShouldRequirePrimaryAndSecondarySources() {
        ValidationResult result = validate(new MultiSourceConfig(null, List.of(), "5_minutes", List.of("user"), null));

        assertEquals(List.of(
                "Primary source is required for multi-source correlation",
                "At least one secondary source is required for multi-source correlation"), result.errors());
    }

    @Test
    void validate_ShouldRejectUnknownSourcesAndTooManySources() {
        MultiSourceRule strict = new MultiSourceRule(new MultiSourceRule.Config(null, 2, null, null, null, null));
        MultiSourceConfig config = new MultiSourceConfig("kube-apiserver", List.of("splunk", "oauth-server"),
                "5_minutes", List.of("user"), "inner");

        ValidationResult result = strict.validate(AuditQuery.builder().multiSource(config).build());

        assertEquals(2, result.errors().size());
        assertEquals("Too many sources for correlation. Maximum allowed: 2, got: 3", result.errors().get(0));
        assertTrue(result.errors().get(1).startsWith("Invalid secondary source 'splunk' at index 0."));
    }

    @Test
    void validate_ShouldWarnAboutCostlyShapes() {
        // Arrange: heavy source combination, large window, expensive join, missing field in some sources
        MultiSourceConfig config = new MultiSourceConfig("node-auditd", List.of("kube-apiserver", "oauth-server"),
                "24_hours", List.of("session_id"), "full");

        // Act
        ValidationResult result = validate(config);

        // Assert
        assertTrue(result.valid());
        assertTrue(result.warnings().contains(
                "Source combination [node-auditd kube-apiserver oauth-server] may impact query performance"));
        assertTrue(result.warnings().contains("Large correlation window '24_hours' may impact query performance"));
        assertTrue(result.warnings().contains("Join type 'full' may impact query performance"));
        assertTrue(result.warnings().contains(
                "Correlation field 'session_id' may not be available in sources: node-auditd, kube-apiserver"));
    }

    @Test
    void validate_ShouldWarnWhenWindowAndFieldsAreMissing() {
        ValidationResult result = validate(new MultiSourceConfig("kube-apiserver", List.of("oauth-server"),
                null, null, null));

        assertTrue(result.valid());
        assertEquals(List.of(
                "No correlation window specified, using default",
                "No correlation fields specified, using default correlation"), result.warnings());
    }

    @Test
    void validate_ShouldRejectDuplicateAndUnknownCorrelationFields() {
        ValidationResult result = validate(new MultiSourceConfig("kube-apiserver", List.of("openshift-apiserver"),
                "5_minutes", List.of("user", "pod_ip", "user"), "cross"));

        assertEquals(3, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Invalid correlation field 'pod_ip' at index 1."));
        assertEquals("Duplicate correlation field 'user' at index 2", result.errors().get(1));
        assertEquals("Invalid join type 'cross'. Allowed types: inner, left, right, full", result.errors().get(2));
    }

    @Test
    void correlationComplexity_ShouldGrowWithSecondarySources() {
        List<String> pool = List.of("oauth-server", "openshift-apiserver", "oauth-apiserver", "node-auditd");
        int previous = 0;
        for (int n = 1; n <= pool.size(); n++) {
            int complexity = MultiSourceRule.correlationComplexity(new MultiSourceConfig("kube-apiserver",
                    pool.subList(0, n), "1_hour", List.of("user", "source_ip"), "left"));
            assertTrue(complexity > previous);
            previous = complexity;
        }
        // 4 secondaries * 10 + 2 fields * 5 + 1_hour 5 + left 2
        assertEquals(57, previous);
    }

    @Test
    void validate_ShouldWarnNearComplexityCeiling() {
        MultiSourceRule tight = new MultiSourceRule(new MultiSourceRule.Config(null, null, null, null, null, 20));

        ValidationResult near = tight.validate(AuditQuery.builder().multiSource(new MultiSourceConfig(
                "kube-apiserver", List.of("openshift-apiserver"), "5_minutes", List.of("user"), "inner")).build());
        ValidationResult over = tight.validate(AuditQuery.builder().multiSource(new MultiSourceConfig(
                "kube-apiserver", List.of("openshift-apiserver"), "24_hours", List.of("user"), "inner")).build());

        assertEquals(List.of("High correlation complexity score 18 may impact performance"), near.warnings());
        assertTrue(over.errors().contains("Correlation complexity score 36 exceeds maximum allowed 20"));
    }

    @Test
    void config_ShouldRequireAtLeastTwoSources() {
        assertThrows(IllegalArgumentException.class,
                () -> new MultiSourceRule.Config(null, 1, null, null, null, null));
    }
}
