package ai.codereview.logging;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Scopes MDC entries for the duration of a try-with-resources block and restores the previous
 * values on close. Worker threads use it so that every log line of a task carries its review,
 * file and agent.
 */
public final class LogContext implements AutoCloseable {

    public static final String REVIEW_ID = "review.id";
    public static final String REVIEW_FILE = "review.file";
    public static final String REVIEW_AGENT = "review.agent";

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previousValues = new LinkedHashMap<>();

    private LogContext(Map<String, String> values) {
        values.forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                return;
            }
            keys.add(key);
            previousValues.put(key, MDC.get(key));
            MDC.put(key, value.trim());
        });
    }

    public static LogContext forReview(String reviewId) {
        return new LogContext(Map.of(REVIEW_ID, reviewId));
    }

    public static LogContext forTask(String reviewId, String filePath, String agentName) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(REVIEW_ID, reviewId);
        values.put(REVIEW_FILE, filePath);
        values.put(REVIEW_AGENT, agentName);
        return new LogContext(values);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String key = keys.get(i);
            String previous = previousValues.get(key);
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}
