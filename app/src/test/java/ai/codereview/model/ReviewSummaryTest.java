package ai.codereview.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReviewSummaryTest {

    private static Finding finding(Severity severity, String category) {
        return new Finding(1, severity, category, "m", "s", "f.py", Instant.EPOCH);
    }

    @Test
    void computesBreakdownsFromFileResults() {
        Map<String, Map<String, List<Finding>>> results = new LinkedHashMap<>();
        results.put("f.py", Map.of(
                "Security", List.of(finding(Severity.CRITICAL, "secrets"), finding(Severity.CRITICAL, "sql_injection"),
                        finding(Severity.LOW, "secrets")),
                "Performance", List.of(finding(Severity.HIGH, "complexity|database"))));

        ReviewSummary summary = ReviewSummary.compute(results, Duration.ofMillis(2500));

        assertThat(summary.totalFiles()).isEqualTo(1);
        assertThat(summary.totalIssues()).isEqualTo(4);
        assertThat(summary.criticalIssues()).isEqualTo(2);
        assertThat(summary.countOf(Severity.MEDIUM)).isZero();
        assertThat(summary.severityBreakdown()).containsExactly(
                Map.entry(Severity.CRITICAL, 2),
                Map.entry(Severity.HIGH, 1),
                Map.entry(Severity.MEDIUM, 0),
                Map.entry(Severity.LOW, 1),
                Map.entry(Severity.INFO, 0));
        assertThat(summary.categoryBreakdown()).containsExactly(
                Map.entry("secrets", 2),
                Map.entry("complexity|database", 1),
                Map.entry("sql_injection", 1));
        assertThat(summary.durationSeconds()).isEqualTo(2.5);
        assertThat(summary.agentsUsed()).containsExactly("Performance", "Security");
    }

    @Test
    void emptyResultsYieldZeroedSummary() {
        ReviewSummary summary = ReviewSummary.empty();

        assertThat(summary.totalFiles()).isZero();
        assertThat(summary.totalIssues()).isZero();
        assertThat(summary.severityBreakdown()).hasSize(Severity.values().length).allSatisfy((severity, count) -> assertThat(count).isZero());
        assertThat(summary.categoryBreakdown()).isEmpty();
        assertThat(summary.agentsUsed()).isEmpty();
    }

    @Test
    void negativeDurationIsClampedToZero() {
        assertThat(ReviewSummary.compute(Map.of(), Duration.ofSeconds(-3)).durationSeconds()).isZero();
    }

    @Test
    void findingNormalizesOptionalFields() {
        Finding finding = new Finding(0, Severity.INFO, "  ", null, null, "a.py", Instant.EPOCH);

        assertThat(finding.category()).isEqualTo(Finding.DEFAULT_CATEGORY);
        assertThat(finding.message()).isEmpty();
        assertThat(finding.suggestion()).isEmpty();
        assertThatThrownBy(() -> new Finding(-1, Severity.INFO, "c", "m", "s", "a.py", Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void severityParsingIsLenient() {
        assertThat(Severity.fromLenient(" high ")).isEqualTo(Severity.HIGH);
        assertThat(Severity.fromLenient("catastrophic")).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.fromLenient(null)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.CRITICAL.isMoreSevereThan(Severity.HIGH)).isTrue();
    }

    @Test
    void reportRejectsEndBeforeStart() {
        Instant start = Instant.parse("2024-01-01T00:00:10Z");
        assertThatThrownBy(() -> new ReviewReport(1, "acme/shop", start, start.minusSeconds(1), ReviewSummary.empty(), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
