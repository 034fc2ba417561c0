package ai.codereview.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Findings produced by one agent for one file, in the order the agent produced them.
 *
 * @param degraded true when the findings are a synthesized diagnostic rather than agent output
 * @param attempts number of model invocations made, including the successful one
 */
public record AgentResult(String agentName,
                          String filePath,
                          List<Finding> findings,
                          Duration elapsed,
                          Instant completedAt,
                          boolean degraded,
                          int attempts) {

    public AgentResult {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(filePath, "filePath");
        findings = List.copyOf(findings == null ? List.of() : findings);
        elapsed = Objects.requireNonNullElse(elapsed, Duration.ZERO);
        Objects.requireNonNull(completedAt, "completedAt");
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be zero or greater");
        }
    }

    public int issueCount() {
        return findings.size();
    }
}
