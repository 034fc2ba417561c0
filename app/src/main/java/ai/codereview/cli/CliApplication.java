package ai.codereview.cli;

import ai.codereview.agent.AgentProfile;
import ai.codereview.agent.AgentRegistry;
import ai.codereview.agent.ChatModelReviewAgent;
import ai.codereview.agent.FindingParser;
import ai.codereview.config.Config;
import ai.codereview.config.ConfigLoader;
import ai.codereview.config.ModelConfig;
import ai.codereview.config.OutputFormat;
import ai.codereview.config.Secrets;
import ai.codereview.config.SystemEnvironmentReader;
import ai.codereview.logging.LoggingConfigurator;
import ai.codereview.model.ChangedFile;
import ai.codereview.model.ReviewReport;
import ai.codereview.model.ReviewRequest;
import ai.codereview.ratelimit.RateLimiter;
import ai.codereview.report.MarkdownReportRenderer;
import ai.codereview.report.ReportJsonWriter;
import ai.codereview.review.AgentRunner;
import ai.codereview.review.ReportBuilder;
import ai.codereview.review.ReviewCanceledException;
import ai.codereview.review.ReviewHandle;
import ai.codereview.review.ReviewRejectedException;
import ai.codereview.review.ReviewResources;
import ai.codereview.review.ReviewableFileFilter;
import ai.codereview.review.TaskScheduler;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and review scheduler.
 */
public final class CliApplication {

    static final int EXIT_REVIEW_FAILED = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, ChatModel> chatModelFactory;
    private final PrintStream out;
    private final Clock clock;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createChatModel, System.out, Clock.systemUTC());
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChatModel> chatModelFactory, PrintStream out, Clock clock) {
        this.configLoader = configLoader;
        this.chatModelFactory = chatModelFactory;
        this.out = out;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Reviewing {}#{} with agents {} using {} model '{}'",
                cliArguments.repoName(), cliArguments.prNumber(), config.enabledAgents(),
                config.modelConfig().provider(), config.modelConfig().modelName());

        ReviewRequest request;
        try {
            List<ChangedFile> files = new ChangedFileLoader(cliArguments.baseDir()).load(cliArguments.files());
            request = new ReviewRequest(cliArguments.repoName(), cliArguments.prNumber(), files, config.enabledAgents());
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.error("Failed to read files to review: {}", ex.getMessage());
            return EXIT_REVIEW_FAILED;
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println("Invalid review request: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        ReviewReport report;
        try {
            report = review(config, request);
        } catch (ReviewRejectedException ex) {
            LOGGER.error("Review rejected: {}", ex.getMessage());
            return EXIT_REVIEW_FAILED;
        } catch (ReviewCanceledException ex) {
            LOGGER.error("Review cancelled: {}", ex.getMessage());
            return EXIT_REVIEW_FAILED;
        } catch (IllegalStateException ex) {
            LOGGER.error("Review could not run: {}", ex.getMessage(), ex);
            return EXIT_REVIEW_FAILED;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while waiting for the review to finish");
            return EXIT_REVIEW_FAILED;
        }

        String rendered = config.outputFormat() == OutputFormat.JSON
                ? new ReportJsonWriter().write(report)
                : new MarkdownReportRenderer().render(report);
        try {
            emit(rendered, cliArguments.output());
        } catch (IOException ex) {
            LOGGER.error("Failed to write report to {}: {}", cliArguments.output(), ex.getMessage());
            return EXIT_REVIEW_FAILED;
        }
        return 0;
    }

    private ReviewReport review(Config config, ReviewRequest request) throws InterruptedException {
        ChatModel chatModel = chatModelFactory.apply(config);
        AgentRegistry registry = createRegistry(config.modelConfig(), chatModel);
        RateLimiter rateLimiter = RateLimiter.perMinute("model-requests", config.maxRequestsPerMinute());
        ReviewResources resources = new ReviewResources(rateLimiter, config.maxConcurrentTasks());
        AgentRunner runner = new AgentRunner(resources, config.retryPolicy(), config.modelTimeout(), clock);
        try (TaskScheduler scheduler = new TaskScheduler(registry, runner, resources, new ReportBuilder(clock),
                new ReviewableFileFilter(config.reviewExtensions()), clock)) {
            ReviewHandle review = scheduler.submit(request);
            return config.hasReviewTimeout()
                    ? scheduler.awaitCompletion(review, config.reviewTimeout())
                    : scheduler.awaitCompletion(review);
        }
    }

    private AgentRegistry createRegistry(ModelConfig modelConfig, ChatModel chatModel) {
        FindingParser parser = new FindingParser(ReportJsonWriter.defaultObjectMapper(), clock);
        AgentRegistry registry = new AgentRegistry();
        for (AgentProfile profile : AgentProfile.values()) {
            registry.register(new ChatModelReviewAgent(profile, chatModel, modelConfig.modelName(), parser,
                    profile.findingFilter()));
        }
        return registry;
    }

    private void emit(String rendered, Path output) throws IOException {
        if (output == null) {
            out.println(rendered);
            out.flush();
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, rendered + System.lineSeparator(), StandardCharsets.UTF_8);
        LOGGER.info("Wrote {} report to {}", rendered.length(), output);
    }

    private static ChatModel createChatModel(Config config) {
        ModelConfig modelConfig = config.modelConfig();
        return switch (modelConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(config);
            case GEMINI -> createGeminiChatModel(config, config.secrets());
        };
    }

    private static ChatModel createOllamaChatModel(Config config) {
        ModelConfig modelConfig = config.modelConfig();
        try {
            String baseUrl = modelConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", modelConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(modelConfig.modelName())
                    .timeout(config.modelTimeout())
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(Config config, Secrets secrets) {
        ModelConfig modelConfig = config.modelConfig();
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", modelConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelConfig.modelName())
                    .timeout(config.modelTimeout())
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
