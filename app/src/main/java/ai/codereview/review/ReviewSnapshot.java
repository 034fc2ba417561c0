package ai.codereview.review;

import ai.codereview.model.Finding;
import ai.codereview.model.ReviewSummary;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Point-in-time copy of a review's file results and the summary derived from them.
 */
public record ReviewSnapshot(Map<String, Map<String, List<Finding>>> fileResults, ReviewSummary summary) {

    public ReviewSnapshot {
        Objects.requireNonNull(fileResults, "fileResults");
        Objects.requireNonNull(summary, "summary");
        TreeMap<String, Map<String, List<Finding>>> files = new TreeMap<>();
        fileResults.forEach((file, byAgent) -> {
            TreeMap<String, List<Finding>> agents = new TreeMap<>();
            byAgent.forEach((agent, findings) -> agents.put(agent, List.copyOf(findings)));
            files.put(file, Collections.unmodifiableMap(agents));
        });
        fileResults = Collections.unmodifiableMap(files);
    }

    public static ReviewSnapshot empty() {
        return new ReviewSnapshot(Map.of(), ReviewSummary.empty());
    }

    public boolean isEmpty() {
        return fileResults.isEmpty();
    }
}
