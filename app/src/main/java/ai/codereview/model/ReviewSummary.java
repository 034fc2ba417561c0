package ai.codereview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Summary statistics of a review.
 *
 * <p>Always derived from the file results by {@link #compute(Map, Duration)}; the counters are
 * never maintained incrementally.</p>
 */
@JsonPropertyOrder({"total_files", "total_issues", "critical_issues", "severity_breakdown",
        "category_breakdown", "duration_seconds", "agents_used"})
public record ReviewSummary(
        @JsonProperty("total_files") int totalFiles,
        @JsonProperty("total_issues") int totalIssues,
        @JsonProperty("critical_issues") int criticalIssues,
        @JsonProperty("severity_breakdown") Map<Severity, Integer> severityBreakdown,
        @JsonProperty("category_breakdown") Map<String, Integer> categoryBreakdown,
        @JsonProperty("duration_seconds") double durationSeconds,
        @JsonProperty("agents_used") List<String> agentsUsed
) {

    public ReviewSummary {
        severityBreakdown = Collections.unmodifiableMap(new EnumMap<>(Objects.requireNonNull(severityBreakdown, "severityBreakdown")));
        categoryBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(categoryBreakdown, "categoryBreakdown")));
        agentsUsed = List.copyOf(Objects.requireNonNull(agentsUsed, "agentsUsed"));
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative");
        }
    }

    public static ReviewSummary empty() {
        return compute(Map.of(), Duration.ZERO);
    }

    /**
     * Full pass over the file results. Equal inputs always produce equal summaries, including map
     * iteration order: severities run CRITICAL to INFO, categories by descending count then name,
     * agents by name.
     */
    public static ReviewSummary compute(Map<String, ? extends Map<String, ? extends List<Finding>>> fileResults,
                                        Duration duration) {
        Objects.requireNonNull(fileResults, "fileResults");
        Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            severityCounts.put(severity, 0);
        }
        Map<String, Integer> categoryCounts = new HashMap<>();
        TreeSet<String> agents = new TreeSet<>();
        int totalIssues = 0;

        for (Map<String, ? extends List<Finding>> byAgent : fileResults.values()) {
            for (Map.Entry<String, ? extends List<Finding>> entry : byAgent.entrySet()) {
                agents.add(entry.getKey());
                for (Finding finding : entry.getValue()) {
                    severityCounts.merge(finding.severity(), 1, Integer::sum);
                    categoryCounts.merge(finding.category(), 1, Integer::sum);
                    totalIssues++;
                }
            }
        }

        List<Map.Entry<String, Integer>> rankedCategories = new ArrayList<>(categoryCounts.entrySet());
        rankedCategories.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        Map<String, Integer> categoryBreakdown = new LinkedHashMap<>();
        rankedCategories.forEach(entry -> categoryBreakdown.put(entry.getKey(), entry.getValue()));

        Duration safeDuration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        return new ReviewSummary(
                fileResults.size(),
                totalIssues,
                severityCounts.get(Severity.CRITICAL),
                severityCounts,
                categoryBreakdown,
                toSeconds(safeDuration),
                new ArrayList<>(agents));
    }

    public static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    public int countOf(Severity severity) {
        return severityBreakdown.getOrDefault(severity, 0);
    }
}
