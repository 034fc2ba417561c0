package ai.codereview.review;

import ai.codereview.model.ReviewReport;
import ai.codereview.model.ReviewRequest;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caller-facing reference to a submitted review, also holding the scheduler's per-review state.
 */
public final class ReviewHandle {

    private final String id;
    private final ReviewRequest request;
    private final Instant startTime;
    private final List<String> filePaths;
    private final ResultAggregator aggregator;
    private final int totalTasks;
    private final AtomicInteger pendingTasks;
    private final AtomicReference<ReviewState> state = new AtomicReference<>(ReviewState.RUNNING);
    private final CompletableFuture<ReviewReport> completion = new CompletableFuture<>();
    private final Map<ReviewTask, Thread> inFlight = new HashMap<>();
    private volatile String cancelReason;

    ReviewHandle(String id, ReviewRequest request, Instant startTime, List<String> agentNames,
                 List<String> filePaths, ResultAggregator aggregator) {
        this.id = Objects.requireNonNull(id, "id");
        this.request = Objects.requireNonNull(request, "request");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.filePaths = List.copyOf(filePaths);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.totalTasks = agentNames.size() * filePaths.size();
        this.pendingTasks = new AtomicInteger(totalTasks);
    }

    public String id() {
        return id;
    }

    public String repoName() {
        return request.repoName();
    }

    public int prNumber() {
        return request.prNumber();
    }

    public Instant startTime() {
        return startTime;
    }

    public List<String> filePaths() {
        return filePaths;
    }

    public int totalTasks() {
        return totalTasks;
    }

    /**
     * Tasks that have not settled yet, whether queued or running.
     */
    public int pendingTasks() {
        return pendingTasks.get();
    }

    public ReviewState state() {
        return state.get();
    }

    public boolean isCancelled() {
        return state.get() == ReviewState.CANCELLED;
    }

    ResultAggregator aggregator() {
        return aggregator;
    }

    CompletableFuture<ReviewReport> completion() {
        return completion;
    }

    String cancelReason() {
        return cancelReason;
    }

    boolean markCancelled(String reason) {
        if (state.compareAndSet(ReviewState.RUNNING, ReviewState.CANCELLED)) {
            cancelReason = reason;
            return true;
        }
        return false;
    }

    boolean markFinalizing() {
        return state.compareAndSet(ReviewState.RUNNING, ReviewState.FINALIZING);
    }

    void markTerminal(ReviewState terminal) {
        state.set(terminal);
    }

    /**
     * @return true when this call settled the last outstanding task
     */
    boolean settle(int count) {
        int remaining = pendingTasks.addAndGet(-count);
        if (remaining < 0) {
            throw new IllegalStateException("Review " + id + " settled more tasks than it scheduled");
        }
        return remaining == 0;
    }

    /**
     * Registers the worker thread running the task, unless the review has been cancelled meanwhile.
     */
    boolean taskStarted(ReviewTask task, Thread worker) {
        synchronized (inFlight) {
            if (isCancelled()) {
                return false;
            }
            inFlight.put(task, worker);
            return true;
        }
    }

    void taskFinished(ReviewTask task) {
        synchronized (inFlight) {
            inFlight.remove(task);
        }
    }

    int interruptInFlight() {
        synchronized (inFlight) {
            inFlight.values().forEach(Thread::interrupt);
            return inFlight.size();
        }
    }

    @Override
    public String toString() {
        return "Review[" + id + " " + request.repoName() + "#" + request.prNumber() + " " + state.get() + "]";
    }
}
