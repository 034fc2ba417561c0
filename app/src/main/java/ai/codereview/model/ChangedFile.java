package ai.codereview.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One file touched by the change under review.
 */
public record ChangedFile(String path, String diff, Optional<String> fullContent) {

    public ChangedFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        path = path.replace('\\', '/').trim();
        diff = Objects.requireNonNullElse(diff, "");
        fullContent = fullContent == null ? Optional.empty() : fullContent;
    }

    public static ChangedFile ofDiff(String path, String diff) {
        return new ChangedFile(path, diff, Optional.empty());
    }
}
