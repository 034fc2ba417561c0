package ai.codereview.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything needed to schedule one review: the pull request identity, the changed files and the
 * names of the agents enabled for this review.
 */
public record ReviewRequest(String repoName, int prNumber, List<ChangedFile> files, Set<String> enabledAgents) {

    public ReviewRequest {
        if (repoName == null || repoName.isBlank()) {
            throw new IllegalArgumentException("repoName must not be blank");
        }
        if (prNumber < 0) {
            throw new IllegalArgumentException("prNumber must be zero or greater");
        }
        files = List.copyOf(Objects.requireNonNullElse(files, List.of()));
        enabledAgents = enabledAgents == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(enabledAgents));
    }
}
