package ai.codereview.review;

import ai.codereview.model.ReviewReport;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seals a review whose tasks have all settled and produces its immutable report.
 */
public class ReportBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportBuilder.class);

    private final Clock clock;

    public ReportBuilder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ReviewReport finalizeReport(ReviewHandle review) {
        Objects.requireNonNull(review, "review");
        if (review.pendingTasks() != 0) {
            throw new IllegalStateException("Review " + review.id() + " still has " + review.pendingTasks() + " unsettled tasks");
        }
        Instant now = clock.instant();
        Instant endTime = now.isBefore(review.startTime()) ? review.startTime() : now;
        ReviewSnapshot snapshot = review.aggregator().seal(endTime);
        ReviewReport report = new ReviewReport(review.prNumber(), review.repoName(), review.startTime(), endTime,
                snapshot.summary(), snapshot.fileResults());
        LOGGER.info("Review {} of {}#{} complete in {}s. Total issues: {} (Critical: {})",
                review.id(), review.repoName(), review.prNumber(),
                String.format(Locale.ROOT, "%.1f", report.summary().durationSeconds()),
                report.summary().totalIssues(), report.summary().criticalIssues());
        return report;
    }
}
