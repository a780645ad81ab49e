package com.vidnyan.qguard.application.service;

import com.vidnyan.qguard.application.port.in.ValidateQueryUseCase;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.RuleCondition;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the registered rules over a query and folds their results into one verdict.
 * <p>
 * Enabled rules run by descending priority, ties in registration order. A rule whose
 * condition does not hold is skipped; every other rule runs, and a failing rule never
 * stops the ones after it.
 */
@Slf4j
@Service
public class QueryValidationService implements ValidateQueryUseCase {

    public static final String AGGREGATE_RULE = "comprehensive_query_validation";
    public static final String NULL_QUERY_RULE = "null_query_validation";

    private final List<ValidationRule> rules;
    private final List<ValidationRule> evaluationOrder;

    public QueryValidationService(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
        List<ValidationRule> ordered = new ArrayList<>(this.rules.stream().filter(ValidationRule::enabled).toList());
        ordered.sort(Comparator.comparingInt(ValidationRule::priority).reversed());
        this.evaluationOrder = List.copyOf(ordered);
        log.info("Rule evaluation order: {}", names(evaluationOrder));
    }

    @Override
    public ValidationResult validate(AuditQuery query) {
        if (query == null) {
            log.warn("Rejecting null query");
            return ValidationResult.failure(NULL_QUERY_RULE, "Query cannot be nil", "query is required", null);
        }

        log.info("Validating query against {} rules (log_source={})", evaluationOrder.size(), query.logSource());
        long started = System.nanoTime();

        Map<String, ValidationResult> ruleResults = new LinkedHashMap<>();
        Map<String, Long> ruleMicros = new LinkedHashMap<>();
        List<String> skippedRules = new ArrayList<>();
        List<String> failedRules = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        ValidationResult.Builder aggregate = ValidationResult.builder(AGGREGATE_RULE, "Query validation")
                .query(query);

        for (ValidationRule rule : evaluationOrder) {
            Optional<RuleCondition> condition = rule.condition();
            if (condition.isPresent() && !condition.get().appliesTo(query)) {
                log.debug("  Skipping {}: no {} block", rule.name(), condition.get().field());
                skippedRules.add(rule.name());
                continue;
            }

            long ruleStarted = System.nanoTime();
            ValidationResult result = runRule(rule, query);
            ruleMicros.put(rule.name(), TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - ruleStarted));
            ruleResults.put(rule.name(), result);
            aggregate.errors(result.errors()).warnings(result.warnings());
            recommendations.addAll(result.recommendations());

            if (!result.valid()) {
                failedRules.add(rule.name());
            }
            log.debug("  {} -> {} ({} errors, {} warnings)",
                    rule.name(), result.severity().label(), result.errors().size(), result.warnings().size());
        }

        if (aggregate.hasErrors()) {
            aggregate.recommendations(recommendations);
        }

        ValidationResult result = aggregate
                .detail("rule_results", Collections.unmodifiableMap(ruleResults))
                .detail("evaluation_order", List.copyOf(ruleResults.keySet()))
                .detail("skipped_rules", List.copyOf(skippedRules))
                .detail("total_rules_applied", ruleResults.size())
                .detail("failed_rules", List.copyOf(failedRules))
                .detail("rule_evaluation_micros", Collections.unmodifiableMap(ruleMicros))
                .detail("evaluation_time_ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
                .build();

        log.info("Validation complete: {} ({} errors, {} warnings, failed rules: {})",
                result.message(), result.errors().size(), result.warnings().size(), failedRules);
        return result;
    }

    @Override
    public RuleStats stats() {
        Map<String, String> conditions = new LinkedHashMap<>();
        for (ValidationRule rule : rules) {
            rule.condition().ifPresent(condition -> conditions.put(rule.name(), condition.field()));
        }
        return new RuleStats(rules.size(), evaluationOrder.size(), conditions.size(),
                names(evaluationOrder), Collections.unmodifiableMap(conditions));
    }

    private ValidationResult runRule(ValidationRule rule, AuditQuery query) {
        try {
            return rule.validate(query);
        } catch (RuntimeException e) {
            log.error("Error evaluating rule {}: {}", rule.name(), e.getMessage(), e);
            return ValidationResult.failure(rule.name(), "Rule execution failed",
                    "Rule " + rule.name() + " failed: " + e.getMessage(), query);
        }
    }

    private static List<String> names(List<ValidationRule> rules) {
        return rules.stream().map(ValidationRule::name).toList();
    }
}
