package ai.codereview.review;

import ai.codereview.model.ChangedFile;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the changed files that agents should look at: source files with a known extension, each
 * path at most once.
 */
public class ReviewableFileFilter {

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(
            "py", "js", "jsx", "ts", "tsx", "java", "cpp", "c", "cs", "go", "rb", "php", "swift", "kt", "rs", "scala");

    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewableFileFilter.class);

    private final Set<String> extensions;

    public ReviewableFileFilter() {
        this(DEFAULT_EXTENSIONS);
    }

    public ReviewableFileFilter(Set<String> extensions) {
        Objects.requireNonNull(extensions, "extensions");
        this.extensions = extensions.stream()
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public List<ChangedFile> select(List<ChangedFile> files) {
        if (files == null || files.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<ChangedFile> selected = new ArrayList<>();
        for (ChangedFile file : files) {
            if (!isReviewable(file.path())) {
                LOGGER.debug("Skipping non-code file: {}", file.path());
                continue;
            }
            if (!seen.add(file.path())) {
                LOGGER.warn("Ignoring duplicate entry for {}", file.path());
                continue;
            }
            selected.add(file);
        }
        return List.copyOf(selected);
    }

    public boolean isReviewable(String path) {
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return extensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
