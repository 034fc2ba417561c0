package ai.codereview.agent;

/**
 * Runtime exception used to report a failed agent invocation.
 */
public class AgentException extends RuntimeException {

    private final boolean retryable;

    public AgentException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public AgentException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Whether another attempt could succeed, as for timeouts and transport errors.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
