package ai.codereview.agent;

import ai.codereview.model.ChangedFile;

final class ReviewPromptFormatter {

    static final int FULL_CONTENT_LIMIT = 3000;

    private ReviewPromptFormatter() {
    }

    static String buildPrompt(AgentProfile profile, ChangedFile file) {
        StringBuilder builder = new StringBuilder(512 + file.diff().length());
        builder.append("Review the following code changes in ").append(file.path()).append(":\n\n");
        builder.append("=== CODE DIFF ===\n").append(file.diff()).append("\n\n");
        file.fullContent()
                .filter(content -> !content.isBlank())
                .ifPresent(content -> builder.append("=== FULL FILE CONTENT ===\n")
                        .append(truncate(content))
                        .append("\n\n"));
        builder.append("""
Provide your review in the following JSON format:
{
  "issues": [
    {
      "line_number": <integer>,
      "severity": "CRITICAL|HIGH|MEDIUM|LOW|INFO",
      "category": "%s",
      "message": "description of the issue",
      "suggestion": "how to fix it"
    }
  ]
}

Focus on issues relevant to your expertise. Return only valid JSON.""".formatted(String.join("|", profile.categories())));
        return builder.toString();
    }

    private static String truncate(String content) {
        if (content.length() <= FULL_CONTENT_LIMIT) {
            return content;
        }
        return content.substring(0, FULL_CONTENT_LIMIT);
    }
}
