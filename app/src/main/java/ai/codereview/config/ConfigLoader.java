package ai.codereview.config;

import ai.codereview.agent.AgentProfile;
import ai.codereview.cli.CliArguments;
import ai.codereview.review.ReviewableFileFilter;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_MAX_REQUESTS_PER_MINUTE = "MAX_REQUESTS_PER_MINUTE";
    static final String ENV_MAX_CONCURRENT_TASKS = "MAX_CONCURRENT_TASKS";
    static final String ENV_MAX_CONCURRENT_REVIEWS = "MAX_CONCURRENT_REVIEWS";
    static final String ENV_MODEL_TIMEOUT_SECONDS = "MODEL_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_REVIEW_TIMEOUT_SECONDS = "REVIEW_TIMEOUT_SECONDS";
    static final String ENV_REVIEW_FILE_EXTENSIONS = "REVIEW_FILE_EXTENSIONS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_ENABLE_SECURITY_AGENT = "ENABLE_SECURITY_AGENT";
    static final String ENV_ENABLE_PERFORMANCE_AGENT = "ENABLE_PERFORMANCE_AGENT";
    static final String ENV_ENABLE_STYLE_AGENT = "ENABLE_STYLE_AGENT";
    static final String ENV_ENABLE_DOCS_AGENT = "ENABLE_DOCS_AGENT";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_MAX_REQUESTS_PER_MINUTE = 60;
    private static final int DEFAULT_MAX_CONCURRENT_TASKS = 5;
    private static final int DEFAULT_MODEL_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 3;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 1;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 30;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private static final Map<AgentProfile, String> AGENT_FLAGS = new EnumMap<>(Map.of(
            AgentProfile.SECURITY, ENV_ENABLE_SECURITY_AGENT,
            AgentProfile.PERFORMANCE, ENV_ENABLE_PERFORMANCE_AGENT,
            AgentProfile.STYLE, ENV_ENABLE_STYLE_AGENT,
            AgentProfile.DOCUMENTATION, ENV_ENABLE_DOCS_AGENT));

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        LogFormat logFormat = resolveLogFormat(arguments);
        OutputFormat outputFormat = arguments.outputFormat() != null ? arguments.outputFormat() : OutputFormat.MARKDOWN;

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = provider == LlmProvider.OLLAMA
                ? Optional.of(env(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL))
                : Optional.empty();
        Secrets secrets = new Secrets(env(ENV_GEMINI_API_KEY));

        Set<String> enabledAgents = resolveEnabledAgents(arguments);

        int maxRequestsPerMinute = intValue(ENV_MAX_REQUESTS_PER_MINUTE, DEFAULT_MAX_REQUESTS_PER_MINUTE);
        // MAX_CONCURRENT_REVIEWS is accepted as an alias
        int maxConcurrentTasks = env(ENV_MAX_CONCURRENT_TASKS).isPresent()
                ? intValue(ENV_MAX_CONCURRENT_TASKS, DEFAULT_MAX_CONCURRENT_TASKS)
                : intValue(ENV_MAX_CONCURRENT_REVIEWS, DEFAULT_MAX_CONCURRENT_TASKS);
        int modelTimeoutSeconds = intValue(ENV_MODEL_TIMEOUT_SECONDS, DEFAULT_MODEL_TIMEOUT_SECONDS);
        int llmMaxRetryAttempts = intValue(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int llmInitialBackoffSeconds = intValue(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int llmMaxBackoffSeconds = intValue(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double llmRetryJitterFactor = env(ENV_LLM_RETRY_JITTER_FACTOR)
                .map(value -> parseDouble(ENV_LLM_RETRY_JITTER_FACTOR, value))
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);
        int reviewTimeoutSeconds = intValue(ENV_REVIEW_TIMEOUT_SECONDS, 0);

        Set<String> extensions = env(ENV_REVIEW_FILE_EXTENSIONS)
                .map(ConfigLoader::parseExtensions)
                .orElse(ReviewableFileFilter.DEFAULT_EXTENSIONS);

        return new Config(logFormat, outputFormat, new ModelConfig(provider, modelName, baseUrl), secrets,
                enabledAgents, maxRequestsPerMinute, maxConcurrentTasks, Duration.ofSeconds(modelTimeoutSeconds),
                llmMaxRetryAttempts, llmInitialBackoffSeconds, llmMaxBackoffSeconds, llmRetryJitterFactor,
                Duration.ofSeconds(reviewTimeoutSeconds), extensions);
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "models/gemini-1.5-pro-latest";
            case OLLAMA -> "mistral";
        };
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Set<String> resolveEnabledAgents(CliArguments arguments) {
        List<String> requested = arguments.agents();
        Set<String> enabled = new LinkedHashSet<>();
        if (requested != null && !requested.isEmpty()) {
            for (String name : requested) {
                if (name != null && !name.isBlank()) {
                    enabled.add(AgentProfile.fromName(name).agentName());
                }
            }
            return enabled;
        }
        for (AgentProfile profile : AgentProfile.values()) {
            String flag = AGENT_FLAGS.get(profile);
            boolean on = env(flag).map(value -> parseBoolean(flag, value)).orElse(true);
            if (on) {
                enabled.add(profile.agentName());
            }
        }
        return enabled;
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private int intValue(String key, int defaultValue) {
        return env(key)
                .map(value -> parseNonNegativeInteger(key, value))
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseNonNegativeInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw, ex);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }

    private static boolean parseBoolean(String key, String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: " + raw);
        };
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
