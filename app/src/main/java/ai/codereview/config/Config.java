package ai.codereview.config;

import ai.codereview.review.RetryPolicy;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * @param reviewTimeout upper bound for a whole review; {@link Duration#ZERO} disables it
 */
public record Config(
        LogFormat logFormat,
        OutputFormat outputFormat,
        ModelConfig modelConfig,
        Secrets secrets,
        Set<String> enabledAgents,
        int maxRequestsPerMinute,
        int maxConcurrentTasks,
        Duration modelTimeout,
        int llmMaxRetryAttempts,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor,
        Duration reviewTimeout,
        Set<String> reviewExtensions
) {

    public Config {
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(modelConfig, "modelConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        enabledAgents = enabledAgents == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(enabledAgents));
        requireAtLeast(maxRequestsPerMinute, 1, "maxRequestsPerMinute");
        requireAtLeast(maxConcurrentTasks, 1, "maxConcurrentTasks");
        Objects.requireNonNull(modelTimeout, "modelTimeout");
        if (modelTimeout.isZero() || modelTimeout.isNegative()) {
            throw new IllegalArgumentException("modelTimeout must be positive");
        }
        requireAtLeast(llmMaxRetryAttempts, 1, "llmMaxRetryAttempts");
        requireAtLeast(llmInitialBackoffSeconds, 0, "llmInitialBackoffSeconds");
        if (llmMaxBackoffSeconds < llmInitialBackoffSeconds) {
            throw new IllegalArgumentException("llmMaxBackoffSeconds must be at least llmInitialBackoffSeconds");
        }
        if (llmRetryJitterFactor < 0.0 || llmRetryJitterFactor > 1.0) {
            throw new IllegalArgumentException("llmRetryJitterFactor must be between 0.0 and 1.0");
        }
        reviewTimeout = reviewTimeout == null ? Duration.ZERO : reviewTimeout;
        if (reviewTimeout.isNegative()) {
            throw new IllegalArgumentException("reviewTimeout must not be negative");
        }
        reviewExtensions = reviewExtensions == null
                ? Set.of()
                : reviewExtensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(llmMaxRetryAttempts,
                Duration.ofSeconds(llmInitialBackoffSeconds),
                Duration.ofSeconds(llmMaxBackoffSeconds),
                llmRetryJitterFactor);
    }

    public boolean hasReviewTimeout() {
        return !reviewTimeout.isZero();
    }

    private static void requireAtLeast(int value, int minimum, String fieldName) {
        if (value < minimum) {
            throw new IllegalArgumentException(fieldName + " must be at least " + minimum);
        }
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
