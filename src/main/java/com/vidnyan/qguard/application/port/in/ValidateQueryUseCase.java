package com.vidnyan.qguard.application.port.in;

import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Primary use case: decide whether a candidate query may run.
 * This is the main entry point to the application.
 */
public interface ValidateQueryUseCase {

    /**
     * Run every enabled rule over the query and merge the outcomes.
     * @param query candidate query, may be null
     * @return aggregate result; never null and never thrown through
     */
    ValidationResult validate(AuditQuery query);

    /**
     * Registered rule counts, the evaluation order and the run conditions.
     */
    RuleStats stats();

    /**
     * @param evaluationOrder enabled rule names, highest priority first
     * @param conditions rule name to the query block it requires, for conditional rules only
     */
    record RuleStats(
        int totalRules,
        int enabledRules,
        int conditionalRules,
        List<String> evaluationOrder,
        Map<String, String> conditions
    ) {}
}
