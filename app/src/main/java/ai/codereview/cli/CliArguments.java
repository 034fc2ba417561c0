package ai.codereview.cli;

import ai.codereview.config.LogFormat;
import ai.codereview.config.OutputFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-code-reviewer", mixinStandardHelpOptions = true,
        description = "Reviews changed source files with several AI agents and prints a consolidated report")
public class CliArguments {

    @CommandLine.Option(names = "--repo", defaultValue = "local", description = "Repository name shown in the report", paramLabel = "OWNER/REPO")
    private String repoName = "local";

    @CommandLine.Option(names = "--pr", defaultValue = "0", description = "Pull request number shown in the report", paramLabel = "NUMBER")
    private int prNumber;

    @CommandLine.Option(names = "--agents", split = ",", description = "Agents to run: security, performance, style, documentation", paramLabel = "AGENT")
    private List<String> agents = new ArrayList<>();

    @CommandLine.Option(names = "--base-dir", defaultValue = ".", description = "Directory the file paths are relative to", paramLabel = "DIR")
    private Path baseDir = Path.of(".");

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class, description = "Report format: markdown or json")
    private OutputFormat outputFormat;

    @CommandLine.Option(names = "--output", description = "Write the report to this file instead of standard output", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(arity = "0..*", description = "Files to review", paramLabel = "FILE")
    private List<String> files = new ArrayList<>();

    public String repoName() {
        return repoName;
    }

    public int prNumber() {
        return prNumber;
    }

    public List<String> agents() {
        return agents;
    }

    public Path baseDir() {
        return baseDir;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public Path output() {
        return output;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<String> files() {
        return files;
    }
}
