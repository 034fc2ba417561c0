package ai.codereview.review;

import ai.codereview.model.AgentResult;
import ai.codereview.model.Finding;
import ai.codereview.model.ReviewSummary;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the agent results of one review into {@code file -> agent -> findings}.
 *
 * <p>All access is serialized on the instance, so completion handlers running on different worker
 * threads never interleave. Once sealed or discarded the aggregator rejects further writes; such
 * late writes are logged as scheduling anomalies and leave the stored results untouched.</p>
 */
public class ResultAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultAggregator.class);

    private final String reviewId;
    private final Instant startTime;
    private final Clock clock;
    private final Map<String, Map<String, List<Finding>>> fileResults = new LinkedHashMap<>();
    private boolean sealed;
    private boolean discarded;
    private int consistencyViolations;
    private int rejectedWrites;

    public ResultAggregator(String reviewId, Instant startTime, Clock clock) {
        this.reviewId = Objects.requireNonNull(reviewId, "reviewId");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores the findings of one (file, agent) pair.
     *
     * @return false when the write was rejected because the review is sealed or discarded
     */
    public synchronized boolean record(String filePath, String agentName, AgentResult result) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(result, "result");
        if (sealed || discarded) {
            rejectedWrites++;
            LOGGER.warn("Scheduling anomaly in review {}: late result from {} for {} discarded ({})",
                    reviewId, agentName, filePath, sealed ? "already finalized" : "review cancelled");
            return false;
        }
        Map<String, List<Finding>> byAgent = fileResults.computeIfAbsent(filePath, key -> new LinkedHashMap<>());
        List<Finding> previous = byAgent.put(agentName, List.copyOf(result.findings()));
        if (previous != null) {
            consistencyViolations++;
            LOGGER.error("Internal consistency error in review {}: {} recorded twice for {}; "
                    + "replaced {} findings with {}", reviewId, agentName, filePath, previous.size(), result.issueCount());
        }
        return true;
    }

    /**
     * Copy of the current results with a summary recomputed from them.
     */
    public synchronized ReviewSnapshot snapshot() {
        if (discarded) {
            return ReviewSnapshot.empty();
        }
        return new ReviewSnapshot(fileResults, ReviewSummary.compute(fileResults, Duration.between(startTime, clock.instant())));
    }

    /**
     * Seals the results with the given end time. No write is accepted afterwards.
     */
    synchronized ReviewSnapshot seal(Instant endTime) {
        if (discarded) {
            throw new IllegalStateException("Review " + reviewId + " was discarded");
        }
        sealed = true;
        return new ReviewSnapshot(fileResults, ReviewSummary.compute(fileResults, Duration.between(startTime, endTime)));
    }

    /**
     * Drops everything recorded so far; used on cancellation.
     */
    synchronized void discard() {
        if (sealed) {
            return;
        }
        discarded = true;
        fileResults.clear();
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public synchronized boolean isDiscarded() {
        return discarded;
    }

    public synchronized int consistencyViolations() {
        return consistencyViolations;
    }

    public synchronized int rejectedWrites() {
        return rejectedWrites;
    }

    public Instant startTime() {
        return startTime;
    }
}
