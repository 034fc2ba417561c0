package ai.codereview.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding window rate limiter shared by every review in the process.
 *
 * <p>At most {@code maxRequests} permits are granted within any window of {@code window} length.
 * A permit is spent when it is granted and expires with the window, so there is nothing to release.
 * Callers never fail under load: they wait in arrival order. A waiter that is interrupted leaves
 * the queue without consuming a permit.</p>
 *
 * <p>Thread-safe.</p>
 */
public class RateLimiter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final int maxRequests;
    private final Duration window;
    private final long windowNanos;
    private final LongSupplier ticker;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<Long> grants = new ArrayDeque<>();
    private final ArrayDeque<Object> waiters = new ArrayDeque<>();

    public RateLimiter(String name, int maxRequests, Duration window) {
        this(name, maxRequests, window, System::nanoTime);
    }

    RateLimiter(String name, int maxRequests, Duration window, LongSupplier ticker) {
        this.name = Objects.requireNonNull(name, "name");
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.windowNanos = window.toNanos();
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    public static RateLimiter perMinute(String name, int requestsPerMinute) {
        return new RateLimiter(name, requestsPerMinute, Duration.ofMinutes(1));
    }

    /**
     * Blocks until a permit is granted.
     *
     * @throws InterruptedException if the caller is interrupted while waiting; no permit is consumed
     */
    public void acquire() throws InterruptedException {
        Object ticket = new Object();
        lock.lockInterruptibly();
        try {
            waiters.addLast(ticket);
            try {
                while (true) {
                    long now = ticker.getAsLong();
                    evictExpired(now);
                    boolean first = waiters.peekFirst() == ticket;
                    if (first && grants.size() < maxRequests) {
                        grants.addLast(now);
                        LOGGER.debug("Rate limiter [{}] granted permit ({}/{} in window)", name, grants.size(), maxRequests);
                        return;
                    }
                    if (first) {
                        long waitNanos = grants.peekFirst() + windowNanos - now;
                        LOGGER.debug("Rate limiter [{}] waiting {}ms ({} queued)", name,
                                TimeUnit.NANOSECONDS.toMillis(waitNanos), waiters.size());
                        changed.awaitNanos(Math.max(1L, waitNanos));
                    } else {
                        changed.await();
                    }
                }
            } finally {
                waiters.remove(ticket);
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of permits granted within the current window.
     */
    public int currentLoad() {
        lock.lock();
        try {
            evictExpired(ticker.getAsLong());
            return grants.size();
        } finally {
            lock.unlock();
        }
    }

    public int queuedCallers() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return window;
    }

    private void evictExpired(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
            grants.pollFirst();
        }
    }
}
