package ai.codereview.agent;

import ai.codereview.model.ChangedFile;
import ai.codereview.model.Finding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import java.util.Objects;

/**
 * Review agent backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelReviewAgent implements ReviewAgent {

    private final AgentProfile profile;
    private final ChatModel model;
    private final String modelName;
    private final FindingParser parser;
    private final FindingFilter filter;

    public ChatModelReviewAgent(AgentProfile profile, ChatModel model, String modelName,
                                FindingParser parser, FindingFilter filter) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.model = Objects.requireNonNull(model, "model");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public String name() {
        return profile.agentName();
    }

    @Override
    public List<Finding> analyze(ChangedFile file) {
        Objects.requireNonNull(file, "file");
        String response = invoke(ReviewPromptFormatter.buildPrompt(profile, file));
        return filter.apply(parser.parse(response, file.path()));
    }

    private String invoke(String prompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(profile.systemPrompt()), UserMessage.from(prompt))
                .temperature(profile.temperature())
                .build();
        ChatResponse response;
        try {
            response = model.chat(request);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new AgentException("Model '%s' is not available.".formatted(modelName), ex, false);
            }
            throw new AgentException("%s agent model call failed: %s".formatted(name(), ex.getMessage()), ex);
        }
        AiMessage message = response == null ? null : response.aiMessage();
        if (message == null || message.text() == null) {
            throw new MalformedAgentOutputException("Model returned no text");
        }
        return message.text();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
