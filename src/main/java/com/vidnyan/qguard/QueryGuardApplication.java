package com.vidnyan.qguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Query Guard - pre-execution validation for structured audit-log queries.
 *
 * Runs every configured rule over a candidate query and reports whether it is
 * safe to execute, with the cost estimate that backs the decision.
 */
@SpringBootApplication
public class QueryGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryGuardApplication.class, args);
    }
}
