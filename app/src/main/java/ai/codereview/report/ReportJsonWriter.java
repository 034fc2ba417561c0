package ai.codereview.report;

import ai.codereview.model.ReviewReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes review reports as pretty-printed JSON with ISO-8601 timestamps.
 *
 * <p>Equal reports always produce byte-identical output.</p>
 */
public class ReportJsonWriter {

    private final ObjectMapper objectMapper;

    public ReportJsonWriter() {
        this(defaultObjectMapper());
    }

    public ReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String write(ReviewReport report) {
        Objects.requireNonNull(report, "report");
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize report for " + report.repoName() + "#" + report.prNumber(), ex);
        }
    }

    public void write(ReviewReport report, Writer writer) throws IOException {
        Objects.requireNonNull(writer, "writer");
        writer.write(write(report));
        writer.write(System.lineSeparator());
        writer.flush();
    }

    public void write(ReviewReport report, Path target) {
        Objects.requireNonNull(target, "target");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, write(report) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write report to " + target, ex);
        }
    }
}
