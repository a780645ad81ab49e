package com.vidnyan.qguard.adapter.in.cli;

import com.vidnyan.qguard.application.port.in.ValidateQueryUseCase;
import com.vidnyan.qguard.application.port.out.QueryReader;
import com.vidnyan.qguard.domain.query.AuditQuery;
import com.vidnyan.qguard.domain.rule.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI Runner for validating a single query file.
 * Runs when guard.validate.path property is set; exits 0 when the query may run, 1 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationCliRunner implements CommandLineRunner {

    private final ValidateQueryUseCase validateQueryUseCase;
    private final QueryReader queryReader;
    private final ConfigurableApplicationContext context;

    @Value("${guard.validate.path:}")
    private String queryPath;

    @Override
    public void run(String... args) {
        if (queryPath == null || queryPath.isBlank()) {
            log.info("No query path specified. Set guard.validate.path property.");
            return;
        }

        int exitCode = 1;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                 Query Guard - Pre-flight check               ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Query: {}", truncatePath(queryPath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AuditQuery query = queryReader.read(Path.of(queryPath));
            ValidationResult result = validateQueryUseCase.validate(query);
            printResult(result);
            exitCode = result.valid() ? 0 : 1;
        } catch (RuntimeException e) {
            log.error("Validation aborted: {}", e.getMessage());
        }

        int code = exitCode;
        System.exit(SpringApplication.exit(context, () -> code));
    }

    private void printResult(ValidationResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" VALIDATION RESULT");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Verdict:        {}", result.valid() ? "ALLOWED" : "REJECTED");
        log.info(" Severity:       {}", result.severity().label());
        log.info(" Rules applied:  {}", result.details().get("total_rules_applied"));
        log.info(" Failed rules:   {}", result.details().get("failed_rules"));
        log.info("───────────────────────────────────────────────────────────────");

        printSection(" ERRORS:", result.errors());
        printSection(" WARNINGS:", result.warnings());
        printSection(" RECOMMENDATIONS:", result.recommendations());

        Object nested = result.details().get("rule_results");
        if (nested instanceof Map<?, ?> ruleResults
                && ruleResults.get("performance_validation") instanceof ValidationResult performance) {
            log.info("");
            log.info(" Complexity score: {} (tier {})",
                    performance.details().get("query_complexity_score"),
                    performance.details().get("performance_tier"));
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" {}", result.message());
    }

    private void printSection(String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        log.info("");
        log.info(title);
        for (String line : lines) {
            log.info("   - {}", line);
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
