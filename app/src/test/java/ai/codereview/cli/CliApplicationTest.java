package ai.codereview.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codereview.config.ConfigLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String MODEL_REPLY = """
            {"issues": [{"line_number": 2, "severity": "HIGH", "category": "hardcoded_secret",
                         "message": "Password committed to source", "suggestion": "Read it from the environment"}]}""";

    @TempDir
    Path workspace;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final AtomicInteger modelCalls = new AtomicInteger();

    @BeforeEach
    void writeSources() throws IOException {
        Files.createDirectories(workspace.resolve("src"));
        Files.writeString(workspace.resolve("src/db.py"), "import os\nPASSWORD = 'admin123'\n");
        Files.writeString(workspace.resolve("README.md"), "# Shop\n");
    }

    private CliApplication application(Map<String, String> env) {
        ChatModel model = new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest request) {
                modelCalls.incrementAndGet();
                return ChatResponse.builder().aiMessage(new AiMessage(MODEL_REPLY)).build();
            }
        };
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(env.get(key))), config -> model,
                new PrintStream(stdout, true, StandardCharsets.UTF_8), Clock.systemUTC());
    }

    @Test
    void printsMarkdownReport() {
        int exitCode = application(Map.of()).run(new String[] {
                "--repo", "acme/shop", "--pr", "7", "--base-dir", workspace.toString(), "src/db.py", "README.md"
        });

        String output = stdout.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(modelCalls.get()).isEqualTo(4);
        assertThat(output)
                .contains("**Repository:** acme/shop")
                .contains("**Pull Request:** #7")
                .contains("#### `src/db.py`")
                .contains("- **Total Issues:** 4")
                .contains("*Agents used: Documentation, Performance, Security, Style*")
                .doesNotContain("README.md");
    }

    @Test
    void writesJsonReportForSelectedAgents() throws IOException {
        Path target = workspace.resolve("reports/review.json");

        int exitCode = application(Map.of()).run(new String[] {
                "--base-dir", workspace.toString(), "--format", "json", "--agents", "security",
                "--output", target.toString(), "src/db.py"
        });

        assertThat(exitCode).isZero();
        assertThat(stdout.size()).isZero();
        JsonNode report = new ObjectMapper().readTree(target.toFile());
        assertThat(report.get("repo_name").asText()).isEqualTo("local");
        assertThat(report.get("summary").get("total_issues").asInt()).isEqualTo(1);
        JsonNode finding = report.get("file_results").get("src/db.py").get("Security").get(0);
        assertThat(finding.get("category").asText()).isEqualTo("hardcoded_secret");
        assertThat(finding.get("line_number").asInt()).isEqualTo(2);
    }

    @Test
    void failsWhenNothingIsReviewable() {
        int exitCode = application(Map.of()).run(new String[] {"--base-dir", workspace.toString(), "README.md"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_REVIEW_FAILED);
        assertThat(modelCalls.get()).isZero();
    }

    @Test
    void failsWhenFileIsMissing() {
        int exitCode = application(Map.of()).run(new String[] {"--base-dir", workspace.toString(), "src/missing.py"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_REVIEW_FAILED);
    }

    @Test
    void rejectsInvalidArgumentsAndConfiguration() {
        assertThat(application(Map.of()).run(new String[] {"--pr", "seven"})).isEqualTo(2);
        assertThat(application(Map.of("MAX_CONCURRENT_TASKS", "0"))
                .run(new String[] {"--base-dir", workspace.toString(), "src/db.py"})).isEqualTo(2);
        assertThat(application(Map.of()).run(new String[] {"--format", "yaml"})).isEqualTo(2);
    }

    @Test
    void rejectsInvalidReviewRequest() {
        String baseDir = workspace.toString();

        assertThat(application(Map.of()).run(new String[] {"--pr", "-1", "--base-dir", baseDir, "src/db.py"}))
                .isEqualTo(2);
        assertThat(application(Map.of()).run(new String[] {"--repo", " ", "--base-dir", baseDir, "src/db.py"}))
                .isEqualTo(2);
        assertThat(application(Map.of()).run(new String[] {"--base-dir", baseDir, "src/db\u0000.py"}))
                .isEqualTo(2);
        assertThat(modelCalls.get()).isZero();
    }

    @Test
    void addedDiffPrefixesEveryLine() {
        assertThat(ChangedFileLoader.asAddedDiff("a\nb")).isEqualTo("+a\n+b");
    }
}
