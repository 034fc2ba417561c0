package ai.codereview.review;

import ai.codereview.agent.AgentRegistry;
import ai.codereview.agent.ReviewAgent;
import ai.codereview.logging.LogContext;
import ai.codereview.model.AgentResult;
import ai.codereview.model.ChangedFile;
import ai.codereview.model.Finding;
import ai.codereview.model.ReviewReport;
import ai.codereview.model.ReviewRequest;
import ai.codereview.model.Severity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans reviews out into (file, agent) tasks and runs them on the shared worker pool.
 *
 * <p>The pool size is a global ceiling: tasks of all active reviews compete for the same workers and
 * are dispatched round-robin across reviews. Every finished task is recorded in its review's
 * {@link ResultAggregator}; when the last task of a review settles, the review is finalized by the
 * {@link ReportBuilder}, or, if it was cancelled, completed with a {@link ReviewCanceledException}.</p>
 */
public class TaskScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskScheduler.class);

    private final AgentRegistry registry;
    private final AgentRunner runner;
    private final ReviewResources resources;
    private final ReportBuilder reportBuilder;
    private final ReviewableFileFilter fileFilter;
    private final Clock clock;
    private final RoundRobinTaskQueue queue = new RoundRobinTaskQueue();
    private final Map<String, ReviewHandle> activeReviews = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public TaskScheduler(AgentRegistry registry,
                         AgentRunner runner,
                         ReviewResources resources,
                         ReportBuilder reportBuilder,
                         ReviewableFileFilter fileFilter,
                         Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.reportBuilder = Objects.requireNonNull(reportBuilder, "reportBuilder");
        this.fileFilter = Objects.requireNonNull(fileFilter, "fileFilter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Schedules every (reviewable file, enabled agent) pair of the request.
     *
     * @throws ReviewRejectedException if the review cannot start
     */
    public ReviewHandle submit(ReviewRequest request) {
        Objects.requireNonNull(request, "request");
        if (closed || resources.isShutdown()) {
            throw new ReviewRejectedException("Scheduler is shut down");
        }
        if (request.enabledAgents().isEmpty()) {
            throw new ReviewRejectedException("No agents enabled for " + request.repoName() + "#" + request.prNumber());
        }
        List<ReviewAgent> agents;
        try {
            agents = registry.resolve(request.enabledAgents());
        } catch (IllegalArgumentException ex) {
            throw new ReviewRejectedException(ex.getMessage(), ex);
        }
        List<ChangedFile> files = fileFilter.select(request.files());
        if (files.isEmpty()) {
            throw new ReviewRejectedException("No reviewable files in " + request.repoName() + "#" + request.prNumber()
                    + " (" + request.files().size() + " changed)");
        }

        String reviewId = UUID.randomUUID().toString();
        Instant startTime = clock.instant();
        ReviewHandle review = new ReviewHandle(reviewId, request, startTime,
                agents.stream().map(ReviewAgent::name).toList(),
                files.stream().map(ChangedFile::path).toList(),
                new ResultAggregator(reviewId, startTime, clock));

        List<ReviewTask> tasks = new ArrayList<>(review.totalTasks());
        for (ChangedFile file : files) {
            for (ReviewAgent agent : agents) {
                tasks.add(new ReviewTask(review, file, agent));
            }
        }

        activeReviews.put(reviewId, review);
        queue.enqueue(review, tasks);
        try (LogContext ignored = LogContext.forReview(reviewId)) {
            LOGGER.info("Scheduled review of {}#{}: {} files x {} agents = {} tasks",
                    request.repoName(), request.prNumber(), files.size(), agents.size(), tasks.size());
        }
        try {
            for (int i = 0; i < tasks.size(); i++) {
                resources.workerPool().execute(this::dispatchNext);
            }
        } catch (RejectedExecutionException ex) {
            cancel(review, "scheduler shut down during submit");
            throw new ReviewRejectedException("Scheduler is shut down", ex);
        }
        return review;
    }

    /**
     * Cancels the review: queued tasks are dropped, running tasks are interrupted and everything
     * recorded so far is discarded.
     *
     * @return false if the review had already completed or been cancelled
     */
    public boolean cancel(ReviewHandle review) {
        return cancel(review, "cancelled by caller");
    }

    private boolean cancel(ReviewHandle review, String reason) {
        Objects.requireNonNull(review, "review");
        if (!review.markCancelled(reason)) {
            return false;
        }
        int dropped = queue.removeAll(review);
        review.aggregator().discard();
        int interrupted = review.interruptInFlight();
        try (LogContext ignored = LogContext.forReview(review.id())) {
            LOGGER.info("Cancelled review of {}#{} ({}): {} queued tasks dropped, {} running tasks interrupted",
                    review.repoName(), review.prNumber(), reason, dropped, interrupted);
        }
        if (dropped > 0 && review.settle(dropped)) {
            complete(review);
        }
        return true;
    }

    /**
     * Blocks until every task of the review has settled.
     *
     * @throws ReviewCanceledException if the review was cancelled
     */
    public ReviewReport awaitCompletion(ReviewHandle review) throws InterruptedException {
        Objects.requireNonNull(review, "review");
        try {
            return review.completion().get();
        } catch (ExecutionException ex) {
            throw unwrap(review, ex);
        }
    }

    /**
     * Like {@link #awaitCompletion(ReviewHandle)}, but cancels the review once {@code timeout} elapses
     * and then waits for its running tasks to unwind.
     */
    public ReviewReport awaitCompletion(ReviewHandle review, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(review, "review");
        Objects.requireNonNull(timeout, "timeout");
        try {
            return review.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            throw unwrap(review, ex);
        } catch (TimeoutException ex) {
            if (cancel(review, "review timed out after " + timeout.toMillis() + " ms")) {
                LOGGER.warn("Review {} exceeded its timeout of {} ms", review.id(), timeout.toMillis());
            }
            return awaitCompletion(review);
        }
    }

    /**
     * Partial results recorded so far. Empty for a cancelled review.
     */
    public ReviewSnapshot snapshot(ReviewHandle review) {
        Objects.requireNonNull(review, "review");
        return review.aggregator().snapshot();
    }

    public int activeReviews() {
        return activeReviews.size();
    }

    public int queuedTasks() {
        return queue.size();
    }

    @Override
    public void close() {
        closed = true;
        for (ReviewHandle review : List.copyOf(activeReviews.values())) {
            cancel(review, "scheduler shutting down");
        }
        resources.close();
    }

    private void dispatchNext() {
        ReviewTask task = queue.poll();
        if (task != null) {
            execute(task);
        }
    }

    private void execute(ReviewTask task) {
        ReviewHandle review = task.review();
        if (!review.taskStarted(task, Thread.currentThread())) {
            if (review.settle(1)) {
                complete(review);
            }
            return;
        }
        try (LogContext ignored = LogContext.forTask(review.id(), task.file().path(), task.agent().name())) {
            AgentResult result = runTask(task);
            if (result != null) {
                review.aggregator().record(task.file().path(), task.agent().name(), result);
            }
        } finally {
            review.taskFinished(task);
            // An interrupt aimed at this task may land after it returned.
            Thread.interrupted();
            if (review.settle(1)) {
                complete(review);
            }
        }
    }

    private AgentResult runTask(ReviewTask task) {
        try {
            return runner.run(task.agent(), task.file());
        } catch (InterruptedException ex) {
            if (task.review().isCancelled()) {
                LOGGER.debug("Task {} stopped by cancellation", task.describe());
                return null;
            }
            LOGGER.warn("Task {} interrupted outside of cancellation", task.describe());
            return internalFailure(task, "interrupted");
        } catch (RuntimeException ex) {
            LOGGER.error("Task {} failed unexpectedly", task.describe(), ex);
            return internalFailure(task, String.valueOf(ex.getMessage()));
        }
    }

    private AgentResult internalFailure(ReviewTask task, String reason) {
        Instant now = clock.instant();
        Finding diagnostic = new Finding(0, Severity.LOW, AgentRunner.FAILURE_CATEGORY,
                "%s agent could not analyze this file: %s".formatted(task.agent().name(), reason),
                "Re-run the review; this file was not fully reviewed by " + task.agent().name() + ".",
                task.file().path(), now);
        return new AgentResult(task.agent().name(), task.file().path(), List.of(diagnostic), Duration.ZERO, now, true, 0);
    }

    private void complete(ReviewHandle review) {
        activeReviews.remove(review.id());
        try (LogContext ignored = LogContext.forReview(review.id())) {
            if (!review.markFinalizing()) {
                review.markTerminal(ReviewState.CANCELLED);
                review.completion().completeExceptionally(new ReviewCanceledException(review.id(),
                        "Review " + review.id() + " of " + review.repoName() + "#" + review.prNumber()
                                + " was cancelled: " + review.cancelReason()));
                return;
            }
            try {
                ReviewReport report = reportBuilder.finalizeReport(review);
                review.markTerminal(ReviewState.COMPLETED);
                review.completion().complete(report);
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to finalize review {}", review.id(), ex);
                review.markTerminal(ReviewState.FAILED);
                review.completion().completeExceptionally(ex);
            }
        }
    }

    private RuntimeException unwrap(ReviewHandle review, ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ReviewCanceledException canceled) {
            return new ReviewCanceledException(canceled.getReviewId(), canceled.getMessage());
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Review " + review.id() + " failed", cause);
    }
}
