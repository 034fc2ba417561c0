package ai.codereview.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.codereview.model.Finding;
import ai.codereview.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class FindingParserTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final FindingParser parser = new FindingParser(new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void parsesIssuesWrappedInProse() {
        String response = """
                Here is my review:
                ```json
                {"issues": [
                  {"line_number": 9, "severity": "critical", "category": "sql_injection",
                   "message": "Query built from user input", "suggestion": "Use bound parameters"},
                  {"line_number": "14-16", "severity": "LOW", "message": "Magic number"}
                ]}
                ```
                Let me know if you need more.""";

        List<Finding> findings = parser.parse(response, "auth.py");

        assertThat(findings).hasSize(2);
        Finding first = findings.get(0);
        assertThat(first.lineNumber()).isEqualTo(9);
        assertThat(first.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(first.category()).isEqualTo("sql_injection");
        assertThat(first.suggestion()).isEqualTo("Use bound parameters");
        assertThat(first.filePath()).isEqualTo("auth.py");
        assertThat(first.timestamp()).isEqualTo(NOW);
        Finding second = findings.get(1);
        assertThat(second.lineNumber()).isEqualTo(14);
        assertThat(second.category()).isEqualTo(Finding.DEFAULT_CATEGORY);
        assertThat(second.suggestion()).isEmpty();
    }

    @Test
    void unknownSeverityAndMissingLineFallBack() {
        List<Finding> findings = parser.parse(
                "{\"issues\":[{\"severity\":\"urgent\",\"line_number\":\"n/a\",\"message\":\"m\"}]}", "a.js");

        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(finding.lineNumber()).isZero();
        });
    }

    @Test
    void keepsCompoundCategoriesIntact() {
        List<Finding> findings = parser.parse(
                "{\"issues\":[{\"line_number\":3,\"severity\":\"HIGH\",\"category\":\"complexity|database\",\"message\":\"N+1\"}]}",
                "repo.py");

        assertThat(findings.get(0).category()).isEqualTo("complexity|database");
    }

    @Test
    void missingIssuesMeansNoFindings() {
        assertThat(parser.parse("{\"summary\": \"looks good\"}", "a.py")).isEmpty();
        assertThat(parser.parse("{\"issues\": []}", "a.py")).isEmpty();
    }

    @Test
    void rejectsResponsesWithoutJsonObject() {
        assertThatThrownBy(() -> parser.parse("No problems found.", "a.py"))
                .isInstanceOf(MalformedAgentOutputException.class);
        assertThatThrownBy(() -> parser.parse("   ", "a.py"))
                .isInstanceOf(MalformedAgentOutputException.class);
        assertThatThrownBy(() -> parser.parse("{\"issues\": [", "a.py"))
                .isInstanceOf(MalformedAgentOutputException.class);
        assertThatThrownBy(() -> parser.parse("{\"issues\": {\"line_number\": 1}}", "a.py"))
                .isInstanceOf(MalformedAgentOutputException.class)
                .hasMessageContaining("array");
    }

    @Test
    void malformedOutputIsRetryable() {
        assertThatThrownBy(() -> parser.parse("{ not json }", "a.py"))
                .isInstanceOfSatisfying(MalformedAgentOutputException.class,
                        ex -> assertThat(ex.isRetryable()).isTrue());
    }
}
