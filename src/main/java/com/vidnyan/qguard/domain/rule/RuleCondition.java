package com.vidnyan.qguard.domain.rule;

import com.vidnyan.qguard.domain.query.AuditQuery;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Precondition deciding whether a rule has anything to check on a query.
 * {@code field} names the query block the condition looks at.
 */
public record RuleCondition(String field, Predicate<AuditQuery> test) {

    /**
     * Applies only when the given block of the query is present.
     */
    public static RuleCondition present(String field, Function<AuditQuery, ?> block) {
        return new RuleCondition(field, query -> block.apply(query) != null);
    }

    public boolean appliesTo(AuditQuery query) {
        return test.test(query);
    }
}
