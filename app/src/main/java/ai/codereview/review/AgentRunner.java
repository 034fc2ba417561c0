package ai.codereview.review;

import ai.codereview.agent.AgentException;
import ai.codereview.agent.ReviewAgent;
import ai.codereview.model.AgentResult;
import ai.codereview.model.ChangedFile;
import ai.codereview.model.Finding;
import ai.codereview.model.Severity;
import ai.codereview.ratelimit.RateLimiter;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one (file, agent) unit: rate limited, time boxed and retried with exponential backoff.
 *
 * <p>Agent failures never escape. Once the retry budget is spent, or on a failure that cannot be
 * retried, the result is degraded to a single LOW finding of category {@value #FAILURE_CATEGORY}.
 * The only exception thrown is {@link InterruptedException}, which signals cancellation.</p>
 */
public class AgentRunner {

    public static final String FAILURE_CATEGORY = "agent_failure";

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentRunner.class);

    private final RateLimiter rateLimiter;
    private final ExecutorService callExecutor;
    private final Semaphore callPermits;
    private final RetryPolicy retryPolicy;
    private final Duration taskTimeout;
    private final Clock clock;

    public AgentRunner(ReviewResources resources, RetryPolicy retryPolicy, Duration taskTimeout, Clock clock) {
        this(resources.rateLimiter(), resources.callExecutor(), resources.modelCallPermits(), retryPolicy,
                taskTimeout, clock);
    }

    AgentRunner(RateLimiter rateLimiter, ExecutorService callExecutor, Semaphore callPermits, RetryPolicy retryPolicy,
                Duration taskTimeout, Clock clock) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
        this.callPermits = Objects.requireNonNull(callPermits, "callPermits");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.taskTimeout = Objects.requireNonNull(taskTimeout, "taskTimeout");
        if (taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AgentResult run(ReviewAgent agent, ChangedFile file) throws InterruptedException {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(file, "file");
        long startNanos = System.nanoTime();
        int maxAttempts = retryPolicy.maxAttempts();
        AgentException lastFailure = null;
        int attempts = 0;

        while (attempts < maxAttempts) {
            rateLimiter.acquire();
            attempts++;
            try {
                List<Finding> findings = invokeWithTimeout(agent, file);
                LOGGER.info("{} found {} issues in {} (attempt {}/{})",
                        agent.name(), findings.size(), file.path(), attempts, maxAttempts);
                return result(agent, file, findings, false, attempts, startNanos);
            } catch (AgentException ex) {
                lastFailure = ex;
                if (!ex.isRetryable()) {
                    LOGGER.error("{} failed for {} with a non-retryable error: {}", agent.name(), file.path(), ex.getMessage());
                    break;
                }
                if (attempts >= maxAttempts) {
                    LOGGER.error("{} failed for {}; max attempts ({}) exhausted: {}",
                            agent.name(), file.path(), maxAttempts, ex.getMessage());
                    break;
                }
                Duration delay = retryPolicy.backoffFor(attempts - 1);
                LOGGER.warn("{} failed for {}: {}; retrying in {} ms (attempt {}/{})",
                        agent.name(), file.path(), ex.getMessage(), delay.toMillis(), attempts, maxAttempts);
                TimeUnit.MILLISECONDS.sleep(delay.toMillis());
            }
        }
        return degraded(agent, file, lastFailure, attempts, startNanos);
    }

    private List<Finding> invokeWithTimeout(ReviewAgent agent, ChangedFile file) throws InterruptedException {
        callPermits.acquire();
        PermittedCall call = new PermittedCall(agent, file, callPermits);
        Future<List<Finding>> future;
        try {
            future = callExecutor.submit(call);
        } catch (RejectedExecutionException ex) {
            call.abandon();
            throw new AgentException("Agent call executor rejected the invocation", ex, false);
        }
        try {
            List<Finding> findings = future.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return findings == null ? List.of() : findings;
        } catch (TimeoutException ex) {
            future.cancel(true);
            call.abandon();
            throw new AgentException("timed out after " + taskTimeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            call.abandon();
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AgentException("unexpected agent failure: " + cause, cause);
        }
    }

    private AgentResult degraded(ReviewAgent agent, ChangedFile file, AgentException failure, int attempts,
                                 long startNanos) {
        String reason = failure == null ? "unknown failure" : failure.getMessage();
        Finding diagnostic = new Finding(0,
                Severity.LOW,
                FAILURE_CATEGORY,
                "%s agent could not analyze this file after %d attempt(s): %s".formatted(agent.name(), attempts, reason),
                "Re-run the review or check the model endpoint; this file was not fully reviewed by " + agent.name() + ".",
                file.path(),
                clock.instant());
        return result(agent, file, List.of(diagnostic), true, attempts, startNanos);
    }

    private AgentResult result(ReviewAgent agent, ChangedFile file, List<Finding> findings, boolean degraded,
                               int attempts, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        return new AgentResult(agent.name(), file.path(), findings, elapsed, clock.instant(), degraded, attempts);
    }

    /**
     * Model call holding a call permit. The permit is released exactly once: by the call when it
     * returns, or by {@link #abandon()} when the call never started.
     */
    private static final class PermittedCall implements Callable<List<Finding>> {

        private final ReviewAgent agent;
        private final ChangedFile file;
        private final Semaphore permits;
        private final AtomicBoolean claimed = new AtomicBoolean();

        PermittedCall(ReviewAgent agent, ChangedFile file, Semaphore permits) {
            this.agent = agent;
            this.file = file;
            this.permits = permits;
        }

        @Override
        public List<Finding> call() {
            if (!claimed.compareAndSet(false, true)) {
                return List.of();
            }
            try {
                return agent.analyze(file);
            } finally {
                permits.release();
            }
        }

        void abandon() {
            if (claimed.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
