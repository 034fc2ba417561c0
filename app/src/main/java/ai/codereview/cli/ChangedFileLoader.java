package ai.codereview.cli;

import ai.codereview.model.ChangedFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns local files into changed files of a synthetic pull request that adds them in full.
 */
public class ChangedFileLoader {

    private final Path baseDir;

    public ChangedFileLoader(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
    }

    public List<ChangedFile> load(List<String> relativePaths) throws IOException {
        List<ChangedFile> files = new ArrayList<>(relativePaths.size());
        for (String relativePath : relativePaths) {
            Path resolved = baseDir.resolve(relativePath).normalize();
            if (!resolved.startsWith(baseDir)) {
                throw new IOException("File lies outside of " + baseDir + ": " + relativePath);
            }
            String content = Files.readString(resolved, StandardCharsets.UTF_8);
            String reviewPath = baseDir.relativize(resolved).toString().replace('\\', '/');
            files.add(new ChangedFile(reviewPath, asAddedDiff(content), Optional.of(content)));
        }
        return files;
    }

    static String asAddedDiff(String content) {
        return content.lines()
                .map(line -> "+" + line)
                .collect(Collectors.joining("\n"));
    }
}
