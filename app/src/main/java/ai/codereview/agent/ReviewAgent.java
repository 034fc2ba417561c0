package ai.codereview.agent;

import ai.codereview.model.ChangedFile;
import ai.codereview.model.Finding;
import java.util.List;

/**
 * A specialized analyzer producing findings for one file per call.
 *
 * <p>One call is one model invocation. Implementations report failures by throwing
 * {@link AgentException}; retries, rate limiting and timeouts are applied by the caller. They must
 * respond to thread interruption by giving up promptly.</p>
 */
public interface ReviewAgent {

    String name();

    List<Finding> analyze(ChangedFile file);
}
