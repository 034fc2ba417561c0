package ai.codereview.agent;

/**
 * Raised when a model response cannot be turned into findings.
 */
public class MalformedAgentOutputException extends AgentException {

    public MalformedAgentOutputException(String message) {
        super(message, null, true);
    }

    public MalformedAgentOutputException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
