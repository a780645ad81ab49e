package com.vidnyan.qguard.domain.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;

import java.util.Optional;

/**
 * A single pre-execution check over a candidate query.
 * Implementations are pure: configuration is bound at construction and
 * every call builds a fresh result, so one instance serves any number of threads.
 */
public interface ValidationRule {

    /**
     * Validate the query. Must not throw for any well-formed query.
     */
    ValidationResult validate(AuditQuery query);

    /**
     * Stable rule name used in results and configuration.
     */
    String name();

    String description();

    /**
     * Nominal severity of this rule's failures.
     */
    Severity severity();

    default boolean enabled() {
        return true;
    }

    /**
     * Evaluation priority; higher runs earlier. Equal priorities keep registration order.
     */
    default int priority() {
        return 0;
    }

    /**
     * Precondition for running at all. Without one the rule runs on every query.
     */
    default Optional<RuleCondition> condition() {
        return Optional.empty();
    }
}
