package ai.codereview.review;

import ai.codereview.ratelimit.RateLimiter;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide resources shared by all reviews: the model rate limiter, the bounded worker pool
 * whose size is the global task concurrency ceiling, and the executor that hosts individual model
 * calls so that they can be abandoned on timeout.
 *
 * <p>Model calls hold one of {@code maxConcurrentTasks} permits until they actually return. A call
 * abandoned on timeout or cancellation keeps its permit while it runs, so calls that ignore
 * interruption still count against the ceiling.</p>
 */
public final class ReviewResources implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewResources.class);

    private final RateLimiter rateLimiter;
    private final int maxConcurrentTasks;
    private final ThreadPoolExecutor workerPool;
    private final ThreadPoolExecutor callExecutor;
    private final Semaphore modelCallPermits;

    public ReviewResources(RateLimiter rateLimiter, int maxConcurrentTasks) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.workerPool = new ThreadPoolExecutor(maxConcurrentTasks, maxConcurrentTasks,
                60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), new NamedThreadFactory("review-worker"));
        this.callExecutor = new ThreadPoolExecutor(0, Integer.MAX_VALUE,
                30L, TimeUnit.SECONDS, new SynchronousQueue<>(), new NamedThreadFactory("agent-call"));
        this.modelCallPermits = new Semaphore(maxConcurrentTasks, true);
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public int maxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    ExecutorService workerPool() {
        return workerPool;
    }

    ExecutorService callExecutor() {
        return callExecutor;
    }

    Semaphore modelCallPermits() {
        return modelCallPermits;
    }

    /**
     * Model calls currently running, including calls abandoned after a timeout that have not returned yet.
     */
    public int runningModelCalls() {
        return maxConcurrentTasks - modelCallPermits.availablePermits();
    }

    public boolean isShutdown() {
        return workerPool.isShutdown();
    }

    @Override
    public void close() {
        List<Runnable> dropped = workerPool.shutdownNow();
        int running = runningModelCalls();
        callExecutor.shutdownNow();
        if (running > 0) {
            LOGGER.warn("Abandoning {} model calls that are still running", running);
        }
        if (!dropped.isEmpty()) {
            LOGGER.warn("Shut down review worker pool with {} queued dispatches", dropped.size());
        }
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Review workers did not terminate within 5 seconds");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for review workers to terminate");
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
