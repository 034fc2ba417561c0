package ai.codereview.report;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class MarkdownReportRendererTest {

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

    @Test
    void rendersHeaderSummaryAndSeverityTable() {
        String markdown = renderer.render(ReportFixtures.sample());

        assertThat(markdown)
                .contains("**Repository:** acme/shop")
                .contains("**Pull Request:** #17")
                .contains("**Review Duration:** 12.3s")
                .contains("- **Total Issues:** 3")
                .contains("- **Critical Issues:** 1 🚨")
                .contains("- **Files Reviewed:** 1")
                .contains("| 🔴 CRITICAL | 1 | 33.3% |")
                .contains("| 🔵 LOW | 1 | 33.3% |")
                .doesNotContain("| 🟡 MEDIUM")
                .endsWith("*Agents used: Security, Style*");
    }

    @Test
    void listsCriticalBeforeHighBeforeOthers() {
        String markdown = renderer.render(ReportFixtures.sample());

        int critical = markdown.indexOf("- **Line 9** 🔴 `CRITICAL` (Security): Query built from user input");
        int high = markdown.indexOf("- **Line 15** 🟠 `HIGH` (Security): Hardcoded password");
        int low = markdown.indexOf("- **Line 3** 🔵 `LOW` (Style): Function name is not snake_case");
        assertThat(critical).isPositive();
        assertThat(high).isGreaterThan(critical);
        assertThat(low).isGreaterThan(high);
        assertThat(markdown).contains("  - 💡 Use bound parameters");
        assertThat(markdown).doesNotContain("<details>");
    }

    @Test
    void collapsesAndLimitsMinorFindings() {
        String markdown = renderer.render(ReportFixtures.withManyMinorFindings(12));

        assertThat(markdown).contains("<details>", "<summary>Show 12 more issues</summary>", "</details>");
        assertThat(markdown).contains("Missing JSDoc 10").doesNotContain("Missing JSDoc 11");
        assertThat(markdown).contains("- **Critical Issues:** 0 ✅");
    }

    @Test
    void emptyReportHasNoSeverityTable() {
        String markdown = renderer.render(ReportFixtures.report(Map.of()));

        assertThat(markdown).doesNotContain("Issues by Severity").contains("### 📁 Detailed Results");
    }
}
