package ai.codereview.config;

import java.util.Locale;

/**
 * Rendering of the finished review report.
 */
public enum OutputFormat {
    MARKDOWN,
    JSON;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "markdown", "md" -> MARKDOWN;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported output format: " + raw);
        };
    }
}
