package ai.codereview.review;

/**
 * Lifecycle of a submitted review.
 */
public enum ReviewState {
    RUNNING,
    FINALIZING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
