package ai.codereview.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Chat model selection shared by all review agents.
 */
public record ModelConfig(LlmProvider provider, String modelName, Optional<String> baseUrl) {

    public ModelConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }
}
