package ai.codereview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sealed result of a review. Instances are deeply immutable; file results are ordered by file path
 * and, within a file, by agent name. Findings keep the order their agent produced them in.
 */
@JsonPropertyOrder({"pr_number", "repo_name", "start_time", "end_time", "summary", "file_results"})
public record ReviewReport(
        @JsonProperty("pr_number") int prNumber,
        @JsonProperty("repo_name") String repoName,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("summary") ReviewSummary summary,
        @JsonProperty("file_results") Map<String, Map<String, List<Finding>>> fileResults
) {

    public ReviewReport {
        Objects.requireNonNull(repoName, "repoName");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        Objects.requireNonNull(summary, "summary");
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime must not precede startTime");
        }
        fileResults = sortedCopy(Objects.requireNonNull(fileResults, "fileResults"));
    }

    public List<Finding> findings(String filePath, String agentName) {
        return fileResults.getOrDefault(filePath, Map.of()).getOrDefault(agentName, List.of());
    }

    static Map<String, Map<String, List<Finding>>> sortedCopy(Map<String, ? extends Map<String, ? extends List<Finding>>> source) {
        TreeMap<String, Map<String, List<Finding>>> files = new TreeMap<>();
        source.forEach((file, byAgent) -> {
            TreeMap<String, List<Finding>> agents = new TreeMap<>();
            byAgent.forEach((agent, findings) -> agents.put(agent, List.copyOf(findings)));
            files.put(file, Collections.unmodifiableMap(agents));
        });
        return Collections.unmodifiableMap(files);
    }
}
