package ai.codereview.agent;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codereview.model.Finding;
import ai.codereview.model.Severity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FindingFilterTest {

    private static Finding finding(int line, Severity severity, String message) {
        return finding(line, severity, "general", message);
    }

    private static Finding finding(int line, Severity severity, String category, String message) {
        return new Finding(line, severity, category, message, "", "a.py", Instant.EPOCH);
    }

    @Test
    void removesDuplicatesAndSortsBySeverity() {
        List<Finding> filtered = new FindingFilter().apply(List.of(
                finding(4, Severity.LOW, "unused import"),
                finding(2, Severity.CRITICAL, "hardcoded password"),
                finding(4, Severity.LOW, "unused import"),
                finding(7, Severity.HIGH, "unbounded loop"),
                finding(1, Severity.LOW, "long line")));

        assertThat(filtered).extracting(Finding::message)
                .containsExactly("hardcoded password", "unbounded loop", "unused import", "long line");
    }

    @Test
    void capsNumberOfFindings() {
        List<Finding> many = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            many.add(finding(i, i == 29 ? Severity.CRITICAL : Severity.INFO, "issue " + i));
        }

        List<Finding> filtered = new FindingFilter().apply(many);

        assertThat(filtered).hasSize(FindingFilter.DEFAULT_LIMIT);
        assertThat(filtered.get(0).message()).isEqualTo("issue 29");
    }

    @Test
    void handlesEmptyInput() {
        assertThat(new FindingFilter(5).apply(List.of())).isEmpty();
        assertThat(new FindingFilter(5).apply(null)).isEmpty();
    }

    @Test
    void securityKeepsSameMessageOnDifferentLines() {
        List<Finding> filtered = AgentProfile.SECURITY.findingFilter().apply(List.of(
                finding(3, Severity.HIGH, "sql_injection", "query built from input"),
                finding(3, Severity.HIGH, "injection", "query built from input"),
                finding(9, Severity.HIGH, "sql_injection", "query built from input")));

        assertThat(filtered).extracting(Finding::lineNumber).containsExactly(3, 9);
    }

    @Test
    void performanceDeduplicatesOnCategoryAndMessagePrefix() {
        List<Finding> many = new ArrayList<>();
        many.add(finding(5, Severity.MEDIUM, "complexity", "Nested loop over orders and items is quadratic"));
        many.add(finding(5, Severity.HIGH, "complexity", "Nested loop over orders and items; use a map"));
        many.add(finding(5, Severity.MEDIUM, "database", "Nested loop over orders and items is quadratic"));
        for (int i = 0; i < 20; i++) {
            many.add(finding(100 + i, Severity.LOW, "memory", "buffer copied " + i));
        }

        List<Finding> filtered = AgentProfile.PERFORMANCE.findingFilter().apply(many);

        assertThat(filtered).hasSize(15);
        assertThat(filtered.subList(0, 2)).extracting(Finding::category).containsExactly("complexity", "database");
        assertThat(filtered.get(0).severity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void styleKeepsOneFindingPerLineAndCategoryAndDropsLowOnceCrowded() {
        List<Finding> many = new ArrayList<>();
        many.add(finding(1, Severity.MEDIUM, "naming", "rename x"));
        many.add(finding(1, Severity.LOW, "naming", "x is too short"));
        for (int i = 0; i < 12; i++) {
            many.add(finding(20 - i, Severity.LOW, "formatting", "line too long " + i));
        }
        many.add(finding(30, Severity.MEDIUM, "structure", "split function"));

        List<Finding> filtered = FindingFilter.style().apply(many);

        assertThat(filtered).hasSize(12);
        assertThat(filtered).extracting(Finding::message).startsWith("rename x", "split function");
        assertThat(filtered).extracting(Finding::message).doesNotContain("x is too short", "line too long 10");
        List<Finding> lows = filtered.subList(2, filtered.size());
        assertThat(lows).extracting(Finding::lineNumber).isSorted();
    }

    @Test
    void documentationKeepsAtMostThreePerCategory() {
        List<Finding> many = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            many.add(finding(10 - i, Severity.LOW, "missing_docstring", "function " + i + " lacks a docstring"));
        }
        many.add(finding(2, Severity.MEDIUM, "missing_params", "document argument"));
        many.add(finding(2, Severity.MEDIUM, "missing_params", "document argument"));

        List<Finding> filtered = FindingFilter.documentation().apply(many);

        assertThat(filtered).extracting(Finding::message).containsExactly(
                "document argument", "document argument",
                "function 2 lacks a docstring", "function 1 lacks a docstring", "function 0 lacks a docstring");
    }

    @Test
    void documentationCapsAtFifteen() {
        List<Finding> many = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            for (int j = 0; j < 2; j++) {
                many.add(finding(i, Severity.INFO, "category" + i, "note " + i + "." + j));
            }
        }

        assertThat(FindingFilter.documentation().apply(many)).hasSize(15);
    }
}
