package ai.codereview.review;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pending tasks of all active reviews. {@link #poll()} rotates over reviews, so a review with many
 * files gets one task dispatched per turn like every other review.
 */
final class RoundRobinTaskQueue {

    private final Map<ReviewHandle, ArrayDeque<ReviewTask>> lanes = new HashMap<>();
    private final ArrayDeque<ReviewHandle> rotation = new ArrayDeque<>();

    synchronized void enqueue(ReviewHandle review, List<ReviewTask> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        ArrayDeque<ReviewTask> lane = lanes.get(review);
        if (lane == null) {
            lane = new ArrayDeque<>();
            lanes.put(review, lane);
            rotation.addLast(review);
        }
        lane.addAll(tasks);
    }

    synchronized ReviewTask poll() {
        ReviewHandle review = rotation.pollFirst();
        if (review == null) {
            return null;
        }
        ArrayDeque<ReviewTask> lane = lanes.get(review);
        ReviewTask task = lane.pollFirst();
        if (lane.isEmpty()) {
            lanes.remove(review);
        } else {
            rotation.addLast(review);
        }
        return task;
    }

    /**
     * Drops every queued task of the review and returns how many were dropped.
     */
    synchronized int removeAll(ReviewHandle review) {
        ArrayDeque<ReviewTask> lane = lanes.remove(review);
        if (lane == null) {
            return 0;
        }
        rotation.remove(review);
        return lane.size();
    }

    synchronized int queuedFor(ReviewHandle review) {
        ArrayDeque<ReviewTask> lane = lanes.get(review);
        return lane == null ? 0 : lane.size();
    }

    synchronized int size() {
        int total = 0;
        for (ArrayDeque<ReviewTask> lane : lanes.values()) {
            total += lane.size();
        }
        return total;
    }
}
