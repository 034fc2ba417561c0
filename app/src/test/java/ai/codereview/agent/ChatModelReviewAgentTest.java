package ai.codereview.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.codereview.model.ChangedFile;
import ai.codereview.model.Finding;
import ai.codereview.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelReviewAgentTest {

    private static final ChangedFile FILE = new ChangedFile("backend/auth.py",
            "+query = f\"SELECT * FROM users WHERE name='{name}'\"",
            Optional.of("x".repeat(5000)));

    private static ChatModelReviewAgent agent(AgentProfile profile, ChatModel model) {
        return new ChatModelReviewAgent(profile, model, "test-model",
                new FindingParser(new ObjectMapper(), Clock.systemUTC()), new FindingFilter());
    }

    @Test
    @DisplayName("Sends profile prompt and diff, then parses and filters the reply")
    void analyzesFileWithModel() {
        RecordingChatModel model = new RecordingChatModel(request -> """
                {"issues": [
                  {"line_number": 1, "severity": "LOW", "category": "input_validation", "message": "Name not validated"},
                  {"line_number": 1, "severity": "CRITICAL", "category": "sql_injection", "message": "SQL injection"},
                  {"line_number": 1, "severity": "CRITICAL", "category": "sql_injection", "message": "SQL injection"}
                ]}""");

        List<Finding> findings = agent(AgentProfile.SECURITY, model).analyze(FILE);

        assertThat(findings).extracting(Finding::severity).containsExactly(Severity.CRITICAL, Severity.LOW);
        assertThat(model.systemPrompt).isEqualTo(AgentProfile.SECURITY.systemPrompt());
        assertThat(model.userPrompt)
                .contains("backend/auth.py")
                .contains("SELECT * FROM users")
                .contains("=== FULL FILE CONTENT ===")
                .contains("sql_injection")
                .doesNotContain("x".repeat(ReviewPromptFormatter.FULL_CONTENT_LIMIT + 1));
        assertThat(agent(AgentProfile.SECURITY, model).name()).isEqualTo("Security");
    }

    @Test
    void transportFailureIsRetryable() {
        ChatModel model = new RecordingChatModel(request -> {
            throw new IllegalStateException("Connection refused");
        });

        assertThatThrownBy(() -> agent(AgentProfile.STYLE, model).analyze(FILE))
                .isInstanceOfSatisfying(AgentException.class, ex -> {
                    assertThat(ex.isRetryable()).isTrue();
                    assertThat(ex.getMessage()).contains("Style", "Connection refused");
                });
    }

    @Test
    void missingModelIsNotRetryable() {
        ChatModel model = new RecordingChatModel(request -> {
            throw new RuntimeException("wrapped", new ModelNotFoundException("model 'test-model' not found"));
        });

        assertThatThrownBy(() -> agent(AgentProfile.PERFORMANCE, model).analyze(FILE))
                .isInstanceOfSatisfying(AgentException.class, ex -> assertThat(ex.isRetryable()).isFalse());
    }

    @Test
    void proseReplyIsMalformed() {
        ChatModel model = new RecordingChatModel(request -> "The code looks fine to me.");

        assertThatThrownBy(() -> agent(AgentProfile.DOCUMENTATION, model).analyze(FILE))
                .isInstanceOf(MalformedAgentOutputException.class);
    }

    private static final class RecordingChatModel implements ChatModel {

        private final Function<ChatRequest, String> responder;
        private String systemPrompt;
        private String userPrompt;

        RecordingChatModel(Function<ChatRequest, String> responder) {
            this.responder = responder;
        }

        @Override
        public ChatResponse doChat(ChatRequest request) {
            for (ChatMessage message : request.messages()) {
                if (message instanceof SystemMessage system) {
                    systemPrompt = system.text();
                } else if (message instanceof UserMessage user) {
                    userPrompt = user.singleText();
                }
            }
            return ChatResponse.builder().aiMessage(new AiMessage(responder.apply(request))).build();
        }
    }
}
