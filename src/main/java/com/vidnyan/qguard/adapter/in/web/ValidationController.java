package com.vidnyan.qguard.adapter.in.web;

import com.vidnyan.qguard.adapter.out.query.QueryReadException;
import com.vidnyan.qguard.application.port.in.ValidateQueryUseCase;
import com.vidnyan.qguard.application.port.out.QueryReader;
import com.vidnyan.qguard.domain.rule.RuleCondition;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import com.vidnyan.qguard.domain.rule.ValidationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for validating queries before they are executed.
 */
@Slf4j
@RestController
@RequestMapping("/api/validate")
@RequiredArgsConstructor
public class ValidationController {

    private final ValidateQueryUseCase validateQueryUseCase;
    private final QueryReader queryReader;
    private final List<ValidationRule> rules;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValidationResult validate(@RequestBody String body) {
        log.info("Received validation request ({} bytes)", body.length());
        return validateQueryUseCase.validate(queryReader.parse(body));
    }

    @GetMapping("/rules")
    public RulesResponse rules() {
        ValidateQueryUseCase.RuleStats stats = validateQueryUseCase.stats();
        List<RuleInfo> infos = rules.stream()
                .map(rule -> new RuleInfo(rule.name(), rule.description(), rule.severity().label(), rule.enabled(),
                        rule.priority(), rule.condition().map(RuleCondition::field).orElse(null)))
                .toList();
        return new RulesResponse(stats.totalRules(), stats.enabledRules(), stats.conditionalRules(),
                stats.evaluationOrder(), stats.conditions(), infos);
    }

    @ExceptionHandler(QueryReadException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadable(QueryReadException e) {
        log.warn("Rejected unreadable query: {}", e.getMessage());
        return new ErrorResponse(e.getMessage());
    }

    public record RuleInfo(
        String name,
        String description,
        String severity,
        boolean enabled,
        int priority,
        String requiresField
    ) {}

    public record RulesResponse(
        int totalRules,
        int enabledRules,
        int conditionalRules,
        List<String> evaluationOrder,
        Map<String, String> conditions,
        List<RuleInfo> rules
    ) {}

    public record ErrorResponse(String error) {}
}
