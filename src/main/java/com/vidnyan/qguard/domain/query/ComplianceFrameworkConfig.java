package com.vidnyan.qguard.domain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Regulatory framework the query must support (SOX, PCI-DSS, GDPR and friends).
 */
public record ComplianceFrameworkConfig(
    @JsonProperty("standards") List<String> standards,
    @JsonProperty("controls") List<String> controls,
    @JsonProperty("reporting") Reporting reporting,
    @JsonProperty("audit_trail") boolean auditTrail,
    @JsonProperty("violation_threshold") int violationThreshold,
    @JsonProperty("evidence_collection") boolean evidenceCollection
) {
    public ComplianceFrameworkConfig {
        standards = QueryLists.compact(standards);
        controls = QueryLists.compact(controls);
    }

    /**
     * Evidence is requested either through the reporting block or the top-level flag.
     */
    public boolean evidenceRequested() {
        return evidenceCollection || (reporting != null && reporting.includeEvidence());
    }

    public record Reporting(
        @JsonProperty("format") String format,
        @JsonProperty("include_evidence") boolean includeEvidence,
        @JsonProperty("retention_period") String retentionPeriod,
        @JsonProperty("digital_signature") boolean digitalSignature
    ) {}
}
