package ai.codereview.agent;

import ai.codereview.model.Finding;
import ai.codereview.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw model response into findings.
 *
 * <p>The JSON object is taken from the first {@code '{'} to the last {@code '}'} so that prose or
 * code fences around it are ignored. Line numbers keep the first integer found ({@code "12-14"}
 * becomes 12); unknown severities become MEDIUM.</p>
 */
public class FindingParser {

    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+)");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FindingParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public List<Finding> parse(String response, String filePath) {
        if (response == null || response.isBlank()) {
            throw new MalformedAgentOutputException("Model returned an empty response");
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedAgentOutputException("Model response does not contain a JSON object");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.substring(start, end + 1));
        } catch (JsonProcessingException ex) {
            throw new MalformedAgentOutputException("Model response is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        JsonNode issues = root.path("issues");
        if (issues.isMissingNode() || issues.isNull()) {
            return List.of();
        }
        if (!issues.isArray()) {
            throw new MalformedAgentOutputException("'issues' must be an array");
        }
        Instant now = clock.instant();
        List<Finding> findings = new ArrayList<>(issues.size());
        for (JsonNode issue : issues) {
            if (!issue.isObject()) {
                throw new MalformedAgentOutputException("Issue entries must be JSON objects");
            }
            findings.add(new Finding(
                    parseLineNumber(issue.path("line_number")),
                    Severity.fromLenient(textOrNull(issue.path("severity"))),
                    textOrNull(issue.path("category")),
                    textOrNull(issue.path("message")),
                    textOrNull(issue.path("suggestion")),
                    filePath,
                    now));
        }
        return findings;
    }

    private int parseLineNumber(JsonNode node) {
        if (node.isIntegralNumber()) {
            return Math.max(0, node.asInt());
        }
        String text = textOrNull(node);
        if (text == null) {
            return 0;
        }
        Matcher matcher = FIRST_NUMBER.matcher(text);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
