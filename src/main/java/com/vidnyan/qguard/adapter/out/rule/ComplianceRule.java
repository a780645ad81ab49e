package com.vidnyan.qguard.adapter.out.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.query.ComplianceFrameworkConfig;
import com.vidnyan.qguard.domain.query.ComplianceFrameworkConfig.Reporting;
import com.vidnyan.qguard.domain.rule.RuleCondition;
import com.vidnyan.qguard.domain.rule.Severity;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a compliance framework request against the standards and controls it names.
 * Most findings are advisory; only malformed standards, controls and reporting formats fail the query.
 */
public class ComplianceRule implements ValidationRule {

    public static final String NAME = "compliance_validation";

    static final int PRIORITY = 20;

    private static final RuleCondition CONDITION =
            RuleCondition.present("compliance_framework", AuditQuery::complianceFramework);

    static final List<String> REPORTING_FORMATS = List.of("detailed", "summary", "executive", "technical");
    static final List<String> COMPREHENSIVE_LOGGING_STANDARDS = List.of("SOX", "HIPAA", "FedRAMP", "ISO27001");
    static final List<String> REQUIRED_AUDIT_FIELDS = List.of(
            "timestamp", "user", "source_ip", "action", "resource", "outcome", "request_id");

    private static final Map<String, Integer> TIMEFRAME_DAYS = Map.of(
            "today", 1,
            "yesterday", 2,
            "7_days_ago", 7,
            "14_days_ago", 14,
            "30_days_ago", 30,
            "60_days_ago", 60,
            "90_days_ago", 90,
            "last_week", 7,
            "last_month", 30);
    private static final int DEFAULT_TIMEFRAME_DAYS = 30;

    private static final Map<String, Integer> RETENTION_DAYS = Map.of(
            "SOX", 2555,        // ~7 years
            "PCI-DSS", 365,
            "GDPR", 1095,
            "HIPAA", 2190,      // ~6 years
            "ISO27001", 365,
            "NIST", 1095,
            "CIS", 365,
            "FedRAMP", 1095);
    private static final int DEFAULT_RETENTION_DAYS = 365;

    private static final Map<String, List<String>> CONTROL_STANDARDS = Map.of(
            "access_logging", List.of("SOX", "PCI-DSS", "GDPR", "HIPAA", "ISO27001", "NIST", "CIS", "FedRAMP"),
            "data_protection", List.of("PCI-DSS", "GDPR", "HIPAA", "ISO27001", "NIST"),
            "authentication_monitoring", List.of("PCI-DSS", "HIPAA", "ISO27001", "NIST", "FedRAMP"),
            "privilege_management", List.of("SOX", "PCI-DSS", "ISO27001", "NIST", "CIS", "FedRAMP"),
            "audit_trail", List.of("SOX", "GDPR", "HIPAA", "ISO27001", "NIST", "FedRAMP"),
            "change_management", List.of("SOX", "ISO27001", "NIST", "CIS", "FedRAMP"),
            "incident_response", List.of("ISO27001", "NIST", "CIS", "FedRAMP"),
            "vulnerability_management", List.of("PCI-DSS", "ISO27001", "NIST", "CIS", "FedRAMP"),
            "configuration_management", List.of("ISO27001", "NIST", "CIS", "FedRAMP"),
            "business_continuity", List.of("ISO27001", "NIST", "FedRAMP"));

    /**
     * What a standard expects of a query beyond its generic checks.
     * A zero {@code retentionLimitDays} means no retention ceiling is checked.
     */
    record StandardRequirements(
        String label,
        List<String> controls,
        int retentionLimitDays,
        String retentionWarning,
        String recommendation
    ) {}

    static final Map<String, StandardRequirements> STANDARD_REQUIREMENTS = Map.of(
            "SOX", new StandardRequirements("SOX",
                    List.of("access_logging", "change_management", "audit_trail"),
                    2555, "Query timeframe may exceed SOX 7-year retention requirement", null),
            "PCI-DSS", new StandardRequirements("PCI-DSS",
                    List.of("access_logging", "authentication_monitoring", "data_protection"),
                    365, "Query timeframe may exceed PCI-DSS 1-year retention requirement", null),
            "GDPR", new StandardRequirements("GDPR",
                    List.of("data_protection", "access_logging", "audit_trail"),
                    0, null, "GDPR requires data minimization - ensure query scope is necessary and proportionate"),
            "HIPAA", new StandardRequirements("HIPAA",
                    List.of("access_logging", "audit_trail", "data_protection", "authentication_monitoring"),
                    2190, "Query timeframe may exceed HIPAA 6-year retention requirement", null),
            "ISO27001", new StandardRequirements("ISO 27001",
                    List.of("access_logging", "incident_response", "vulnerability_management",
                            "configuration_management"),
                    0, null, null),
            "NIST", new StandardRequirements("NIST",
                    List.of("access_logging", "incident_response", "vulnerability_management", "audit_trail"),
                    0, null, null),
            "CIS", new StandardRequirements("CIS",
                    List.of("access_logging", "configuration_management", "vulnerability_management"),
                    0, null, null),
            "FedRAMP", new StandardRequirements("FedRAMP",
                    List.of("access_logging", "audit_trail", "incident_response", "configuration_management",
                            "vulnerability_management"),
                    0, null, "FedRAMP requires continuous monitoring - ensure audit queries support ongoing compliance"));

    private final Config config;

    public ComplianceRule(Config config) {
        this.config = config != null ? config : Config.defaults();
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        ValidationResult.Builder result = ValidationResult.builder(NAME, "Compliance validation").query(query);
        ComplianceFrameworkConfig compliance = query.complianceFramework();
        if (compliance == null) {
            return result.build();
        }

        int days = timeframeDays(query.timeframe());
        checkStandards(compliance, result);
        checkControls(compliance, result);
        checkRetention(compliance, days, result);
        checkEvidence(compliance, result);
        checkAuditTrail(compliance, result);
        checkReporting(compliance, result);
        for (String standard : compliance.standards()) {
            StandardRequirements requirements = STANDARD_REQUIREMENTS.get(standard);
            if (requirements != null) {
                checkStandardRequirements(requirements, compliance, days, result);
            }
        }

        if (result.hasErrors()) {
            result.recommend(
                    "Review compliance framework configuration",
                    "Ensure all required standards are supported",
                    "Verify evidence fields meet compliance requirements",
                    "Check retention periods comply with regulations",
                    "Validate audit trail completeness");
        }
        return result.build();
    }

    private void checkStandards(ComplianceFrameworkConfig compliance, ValidationResult.Builder result) {
        List<String> standards = compliance.standards();
        if (standards.isEmpty()) {
            result.error("At least one compliance standard must be specified");
            return;
        }
        if (standards.size() > config.maxStandards()) {
            result.error(String.format("Too many compliance standards. Maximum allowed: %d, got: %d",
                    config.maxStandards(), standards.size()));
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < standards.size(); i++) {
            String standard = standards.get(i);
            if (!config.allowedStandards().contains(standard)) {
                result.error(String.format("Invalid compliance standard '%s' at index %d. Allowed standards: %s",
                        standard, i, String.join(", ", config.allowedStandards())));
            } else if (!seen.add(standard)) {
                result.error(String.format("Duplicate compliance standard '%s' at index %d", standard, i));
            }
        }
    }

    private void checkControls(ComplianceFrameworkConfig compliance, ValidationResult.Builder result) {
        List<String> controls = compliance.controls();
        if (controls.isEmpty()) {
            result.warning("No compliance controls specified");
            return;
        }
        if (controls.size() > config.maxControls()) {
            result.error(String.format("Too many compliance controls. Maximum allowed: %d, got: %d",
                    config.maxControls(), controls.size()));
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < controls.size(); i++) {
            String control = controls.get(i);
            if (!config.allowedControls().contains(control)) {
                result.error(String.format("Invalid compliance control '%s' at index %d. Allowed controls: %s",
                        control, i, String.join(", ", config.allowedControls())));
            } else if (!seen.add(control)) {
                result.error(String.format("Duplicate compliance control '%s' at index %d", control, i));
            }
        }

        for (String control : controls) {
            List<String> applicable = CONTROL_STANDARDS.get(control);
            if (applicable != null && compliance.standards().stream().noneMatch(applicable::contains)) {
                result.warning(String.format("Control '%s' may not be directly applicable to standards: %s",
                        control, String.join(", ", compliance.standards())));
            }
        }
    }

    private void checkRetention(ComplianceFrameworkConfig compliance, int days, ValidationResult.Builder result) {
        if (days > config.minRetentionDays()) {
            result.warning(String.format("Query timeframe %d days exceeds minimum retention requirement %d days",
                    days, config.minRetentionDays()));
        }
        for (String standard : compliance.standards()) {
            int retention = RETENTION_DAYS.getOrDefault(standard, DEFAULT_RETENTION_DAYS);
            if (days > retention) {
                result.warning(String.format("Query timeframe %d days may not meet %s retention requirement %d days",
                        days, standard, retention));
            }
        }
    }

    private void checkEvidence(ComplianceFrameworkConfig compliance, ValidationResult.Builder result) {
        if (compliance.reporting() == null) {
            result.warning("No reporting configuration specified. Evidence collection recommended for compliance");
        } else if (!compliance.reporting().includeEvidence()) {
            result.warning("Evidence collection is disabled but may be required for compliance");
        }
        result.detail("required_evidence_fields", config.requiredEvidenceFields());
    }

    private void checkAuditTrail(ComplianceFrameworkConfig compliance, ValidationResult.Builder result) {
        if (config.maxAuditGapHours() > 0) {
            result.detail("max_audit_gap_hours", config.maxAuditGapHours());
            result.warning(String.format("Ensure audit trail has no gaps exceeding %d hours", config.maxAuditGapHours()));
        }
        result.detail("required_audit_fields", REQUIRED_AUDIT_FIELDS);
        for (String standard : compliance.standards()) {
            if (COMPREHENSIVE_LOGGING_STANDARDS.contains(standard)) {
                result.recommend(String.format("Standard %s requires comprehensive audit logging", standard));
            }
        }
    }

    private static void checkReporting(ComplianceFrameworkConfig compliance, ValidationResult.Builder result) {
        Reporting reporting = compliance.reporting();
        if (reporting == null) {
            result.warning("No reporting configuration specified");
            return;
        }
        if (Values.isSet(reporting.format()) && !REPORTING_FORMATS.contains(reporting.format())) {
            result.error(String.format("Invalid reporting format '%s'. Allowed formats: %s",
                    reporting.format(), String.join(", ", REPORTING_FORMATS)));
        }
        if (reporting.includeEvidence()) {
            result.recommend("Evidence collection enabled - ensure adequate storage and retention");
        }
        for (String standard : compliance.standards()) {
            switch (standard) {
                case "SOX" -> {
                    if (!"detailed".equals(reporting.format())) {
                        result.warning("SOX compliance typically requires detailed reporting format");
                    }
                }
                case "PCI-DSS" -> {
                    if (!reporting.includeEvidence()) {
                        result.warning("PCI-DSS compliance typically requires evidence collection");
                    }
                }
                case "GDPR" -> result.recommend(
                        "GDPR requires data subject rights - ensure reports support data subject requests");
                case "HIPAA" -> {
                    if (!reporting.includeEvidence()) {
                        result.warning("HIPAA compliance typically requires comprehensive evidence collection");
                    }
                }
                default -> {
                    // no reporting expectations for the remaining standards
                }
            }
        }
    }

    private static void checkStandardRequirements(StandardRequirements requirements,
                                                  ComplianceFrameworkConfig compliance, int days,
                                                  ValidationResult.Builder result) {
        for (String control : requirements.controls()) {
            if (!compliance.controls().contains(control)) {
                result.warning(String.format("%s compliance typically requires '%s' control",
                        requirements.label(), control));
            }
        }
        if (requirements.retentionLimitDays() > 0 && days > requirements.retentionLimitDays()) {
            result.warning(requirements.retentionWarning());
        }
        if (requirements.recommendation() != null) {
            result.recommend(requirements.recommendation());
        }
    }

    /**
     * Rough reach of a named timeframe; anything unrecognised counts as a month.
     */
    static int timeframeDays(String timeframe) {
        return TIMEFRAME_DAYS.getOrDefault(timeframe == null ? "" : timeframe, DEFAULT_TIMEFRAME_DAYS);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public Optional<RuleCondition> condition() {
        return Optional.of(CONDITION);
    }

    @Override
    public String description() {
        return "Validates compliance framework requirements including standards, controls, retention, "
                + "and evidence collection";
    }

    @Override
    public Severity severity() {
        return Severity.CRITICAL;
    }

    @Override
    public boolean enabled() {
        return config.enabled();
    }

    public record Config(
        Boolean enabled,
        List<String> allowedStandards,
        List<String> allowedControls,
        Integer maxStandards,
        Integer maxControls,
        Integer minRetentionDays,
        Integer maxAuditGapHours,
        List<String> requiredEvidenceFields
    ) {
        public static final List<String> DEFAULT_STANDARDS = List.of(
                "SOX", "PCI-DSS", "GDPR", "HIPAA", "ISO27001", "NIST", "CIS", "FedRAMP");
        public static final List<String> DEFAULT_CONTROLS = List.of(
                "access_logging", "data_protection", "authentication_monitoring",
                "privilege_management", "audit_trail", "change_management",
                "incident_response", "vulnerability_management", "configuration_management",
                "business_continuity");
        public static final List<String> DEFAULT_EVIDENCE_FIELDS = List.of(
                "timestamp", "user", "action", "resource", "outcome");

        public Config {
            enabled = Values.or(enabled, Boolean.TRUE);
            allowedStandards = Values.listOr(allowedStandards, DEFAULT_STANDARDS);
            allowedControls = Values.listOr(allowedControls, DEFAULT_CONTROLS);
            maxStandards = Values.or(maxStandards, 5);
            maxControls = Values.or(maxControls, 10);
            minRetentionDays = Values.or(minRetentionDays, 365);
            maxAuditGapHours = Values.or(maxAuditGapHours, 24);
            requiredEvidenceFields = Values.listOr(requiredEvidenceFields, DEFAULT_EVIDENCE_FIELDS);
            Values.requireNonNegative(maxStandards, "max-standards");
            Values.requireNonNegative(maxControls, "max-controls");
            Values.requireNonNegative(minRetentionDays, "min-retention-days");
            Values.requireNonNegative(maxAuditGapHours, "max-audit-gap-hours");
        }

        public static Config defaults() {
            return new Config(null, null, null, null, null, null, null, null);
        }
    }
}
