package ai.codereview.review;

/**
 * Thrown by {@link TaskScheduler#submit} when a review cannot be started, for example because no
 * reviewable files remain or no agent is enabled.
 */
public class ReviewRejectedException extends RuntimeException {

    public ReviewRejectedException(String message) {
        super(message);
    }

    public ReviewRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
