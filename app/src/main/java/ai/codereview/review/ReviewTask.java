package ai.codereview.review;

import ai.codereview.agent.ReviewAgent;
import ai.codereview.model.ChangedFile;
import java.util.Objects;

/**
 * One (file, agent) unit of a review.
 */
record ReviewTask(ReviewHandle review, ChangedFile file, ReviewAgent agent) {

    ReviewTask {
        Objects.requireNonNull(review, "review");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(agent, "agent");
    }

    String describe() {
        return agent.name() + " on " + file.path();
    }
}
