package ai.codereview.report;

import ai.codereview.model.Finding;
import ai.codereview.model.ReviewReport;
import ai.codereview.model.ReviewSummary;
import ai.codereview.model.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ReportFixtures {

    static final Instant START = Instant.parse("2024-05-01T12:00:00Z");
    static final Instant END = START.plusMillis(12_345);

    private ReportFixtures() {
    }

    static Finding finding(String file, int line, Severity severity, String category, String message, String suggestion) {
        return new Finding(line, severity, category, message, suggestion, file, START.plusSeconds(1));
    }

    static ReviewReport report(Map<String, Map<String, List<Finding>>> fileResults) {
        return new ReviewReport(17, "acme/shop", START, END,
                ReviewSummary.compute(fileResults, Duration.between(START, END)), fileResults);
    }

    static ReviewReport sample() {
        Map<String, Map<String, List<Finding>>> results = new LinkedHashMap<>();
        results.put("src/auth.py", Map.of(
                "Security", List.of(
                        finding("src/auth.py", 9, Severity.CRITICAL, "sql_injection", "Query built from user input", "Use bound parameters"),
                        finding("src/auth.py", 15, Severity.HIGH, "secrets", "Hardcoded password", "")),
                "Style", List.of(
                        finding("src/auth.py", 3, Severity.LOW, "naming", "Function name is not snake_case", "Rename it"))));
        return report(results);
    }

    static ReviewReport withManyMinorFindings(int count) {
        List<Finding> findings = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            findings.add(finding("app.js", i, Severity.INFO, "missing_docstring", "Missing JSDoc " + i, ""));
        }
        Map<String, Map<String, List<Finding>>> results = new LinkedHashMap<>();
        results.put("app.js", Map.of("Documentation", findings));
        return report(results);
    }
}
