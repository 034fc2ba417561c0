package ai.codereview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Objects;

/**
 * A single issue reported by one agent for one file.
 *
 * <p>The category is an opaque key. Compound tags such as {@code complexity|database} are never split.</p>
 */
@JsonPropertyOrder({"line_number", "severity", "category", "message", "suggestion", "file_path", "timestamp"})
public record Finding(
        @JsonProperty("line_number") int lineNumber,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("category") String category,
        @JsonProperty("message") String message,
        @JsonProperty("suggestion") String suggestion,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("timestamp") Instant timestamp
) {

    public static final String DEFAULT_CATEGORY = "general";

    public Finding {
        if (lineNumber < 0) {
            throw new IllegalArgumentException("lineNumber must be zero or greater");
        }
        severity = Objects.requireNonNull(severity, "severity");
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim();
        message = Objects.requireNonNullElse(message, "");
        suggestion = Objects.requireNonNullElse(suggestion, "");
        filePath = Objects.requireNonNull(filePath, "filePath");
        timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }
}
