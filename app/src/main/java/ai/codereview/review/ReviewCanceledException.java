package ai.codereview.review;

/**
 * Signals that a review was cancelled before its report was sealed. No partial report exists.
 */
public class ReviewCanceledException extends RuntimeException {

    private final String reviewId;

    public ReviewCanceledException(String reviewId, String message) {
        super(message != null ? message : "Review " + reviewId + " was cancelled.");
        this.reviewId = reviewId;
    }

    public String getReviewId() {
        return reviewId;
    }
}
