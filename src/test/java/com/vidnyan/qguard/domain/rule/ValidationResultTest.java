package com.vidnyan.qguard.domain.rule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    void build_ShouldDeriveValidityAndSeverityFromErrorsAndWarnings() {
        ValidationResult clean = ValidationResult.builder("r", "Sample validation").build();
        ValidationResult warned = ValidationResult.builder("r", "Sample validation").warning("careful").build();
        ValidationResult failed = ValidationResult.builder("r", "Sample validation")
                .warning("careful")
                .error("broken")
                .build();

        assertTrue(clean.valid());
        assertEquals(Severity.INFO, clean.severity());
        assertEquals("Sample validation passed", clean.message());

        assertTrue(warned.valid());
        assertEquals(Severity.WARNING, warned.severity());
        assertEquals("Sample validation passed with warnings", warned.message());

        assertFalse(failed.valid());
        assertEquals(Severity.CRITICAL, failed.severity());
        assertEquals("Sample validation failed", failed.message());
    }

    @Test
    void build_ShouldKeepInsertionOrderAndFreezeCollections() {
        ValidationResult result = ValidationResult.builder("r", "Sample validation")
                .error("first")
                .errors(List.of("second", "third"))
                .recommend("fix it", "then retry")
                .detail("b", 2)
                .detail("a", 1)
                .build();

        assertEquals(List.of("first", "second", "third"), result.errors());
        assertEquals(List.of("fix it", "then retry"), result.recommendations());
        assertEquals(List.of("b", "a"), List.copyOf(result.details().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> result.errors().add("fourth"));
        assertThrows(UnsupportedOperationException.class, () -> result.details().put("c", 3));
        assertNotNull(result.timestamp());
    }

    @Test
    void failure_ShouldCarrySingleErrorAndExplicitMessage() {
        ValidationResult result = ValidationResult.failure("null_query_validation",
                "Query cannot be nil", "query is required", null);

        assertFalse(result.valid());
        assertEquals("null_query_validation", result.ruleName());
        assertEquals("Query cannot be nil", result.message());
        assertEquals(List.of("query is required"), result.errors());
        assertNull(result.query());
    }

    @Test
    void severityLabel_ShouldBeLowerCase() {
        assertEquals("info", Severity.INFO.label());
        assertEquals("warning", Severity.WARNING.label());
        assertEquals("critical", Severity.CRITICAL.label());
    }
}
