package ai.codereview.model;

import java.util.Locale;

/**
 * Finding severity, declared from most to least severe.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * Lenient parse used for model output; unknown or blank values map to {@link #MEDIUM}.
     */
    public static Severity fromLenient(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return MEDIUM;
    }

    public boolean isMoreSevereThan(Severity other) {
        return compareTo(other) < 0;
    }
}
