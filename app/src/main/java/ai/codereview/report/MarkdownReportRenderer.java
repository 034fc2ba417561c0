package ai.codereview.report;

import ai.codereview.model.Finding;
import ai.codereview.model.ReviewReport;
import ai.codereview.model.ReviewSummary;
import ai.codereview.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a review report as a Markdown comment suitable for a pull request.
 *
 * <p>Per file, critical and high findings are always listed. At most {@value #MAX_OTHER_FINDINGS}
 * findings of lower severity follow, folded into a {@code <details>} block when there are more
 * than {@value #COLLAPSE_THRESHOLD} of them.</p>
 */
public class MarkdownReportRenderer {

    static final int MAX_OTHER_FINDINGS = 10;
    static final int COLLAPSE_THRESHOLD = 3;

    public String render(ReviewReport report) {
        Objects.requireNonNull(report, "report");
        ReviewSummary summary = report.summary();
        List<String> lines = new ArrayList<>();
        lines.add("## 🤖 Code Review Report");
        lines.add("");
        lines.add("**Repository:** " + report.repoName());
        lines.add("**Pull Request:** #" + report.prNumber());
        lines.add("**Review Duration:** " + String.format(Locale.ROOT, "%.1f", summary.durationSeconds()) + "s");
        lines.add("");
        lines.add("### 📊 Summary");
        lines.add("- **Total Issues:** " + summary.totalIssues());
        lines.add(summary.criticalIssues() > 0
                ? "- **Critical Issues:** " + summary.criticalIssues() + " 🚨"
                : "- **Critical Issues:** 0 ✅");
        lines.add("- **Files Reviewed:** " + summary.totalFiles());
        lines.add("");

        if (summary.totalIssues() > 0) {
            lines.add("### 🎯 Issues by Severity");
            lines.add("| Severity | Count | Percentage |");
            lines.add("|----------|-------|------------|");
            for (Map.Entry<Severity, Integer> entry : summary.severityBreakdown().entrySet()) {
                int count = entry.getValue();
                if (count == 0) {
                    continue;
                }
                double percentage = count * 100.0 / summary.totalIssues();
                lines.add("| " + badge(entry.getKey()) + " " + entry.getKey() + " | " + count + " | "
                        + String.format(Locale.ROOT, "%.1f", percentage) + "% |");
            }
            lines.add("");
        }

        lines.add("### 📁 Detailed Results");
        lines.add("");
        report.fileResults().forEach((filePath, byAgent) -> renderFile(lines, filePath, byAgent));

        lines.add("---");
        lines.add("*Generated by AI Code Reviewer*");
        lines.add("*Agents used: " + String.join(", ", summary.agentsUsed()) + "*");
        return String.join("\n", lines);
    }

    private void renderFile(List<String> lines, String filePath, Map<String, List<Finding>> byAgent) {
        List<AttributedFinding> critical = new ArrayList<>();
        List<AttributedFinding> high = new ArrayList<>();
        List<AttributedFinding> others = new ArrayList<>();
        byAgent.forEach((agent, findings) -> {
            for (Finding finding : findings) {
                AttributedFinding attributed = new AttributedFinding(agent, finding);
                switch (finding.severity()) {
                    case CRITICAL -> critical.add(attributed);
                    case HIGH -> high.add(attributed);
                    default -> others.add(attributed);
                }
            }
        });
        if (critical.isEmpty() && high.isEmpty() && others.isEmpty()) {
            return;
        }

        lines.add("#### `" + filePath + "`");
        lines.add("");
        critical.forEach(item -> addWithSuggestion(lines, item));
        high.forEach(item -> addWithSuggestion(lines, item));

        boolean collapse = others.size() > COLLAPSE_THRESHOLD;
        if (collapse) {
            lines.add("");
            lines.add("<details>");
            lines.add("<summary>Show " + others.size() + " more issues</summary>");
            lines.add("");
        }
        others.stream().limit(MAX_OTHER_FINDINGS).forEach(item -> lines.add(headline(item)));
        if (collapse) {
            lines.add("");
            lines.add("</details>");
        }
        lines.add("");
    }

    private static void addWithSuggestion(List<String> lines, AttributedFinding item) {
        lines.add(headline(item));
        if (!item.finding().suggestion().isBlank()) {
            lines.add("  - 💡 " + item.finding().suggestion());
        }
    }

    private static String headline(AttributedFinding item) {
        Finding finding = item.finding();
        return "- **Line " + finding.lineNumber() + "** " + badge(finding.severity()) + " `" + finding.severity() + "` ("
                + item.agent() + "): " + finding.message();
    }

    static String badge(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "🔴";
            case HIGH -> "🟠";
            case MEDIUM -> "🟡";
            case LOW -> "🔵";
            case INFO -> "ℹ️";
        };
    }

    private record AttributedFinding(String agent, Finding finding) {
    }
}
