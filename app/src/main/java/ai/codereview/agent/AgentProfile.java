package ai.codereview.agent;

import java.util.List;
import java.util.Locale;

/**
 * Built-in review agents with their focus areas and the category vocabulary offered to the model.
 */
public enum AgentProfile {
    SECURITY("Security", 0.1,
            "You are a security expert reviewing code for vulnerabilities. "
                    + "Focus on: SQL injection, XSS, authentication issues, exposed secrets, OWASP Top 10. "
                    + "Provide specific line numbers and severity levels (CRITICAL, HIGH, MEDIUM, LOW).",
            List.of("sql_injection", "xss", "auth", "secrets", "crypto", "path_traversal", "injection", "other")),
    PERFORMANCE("Performance", 0.1,
            "You are a performance optimization expert reviewing code. "
                    + "Focus on: time complexity, memory usage, database queries, caching opportunities. "
                    + "Identify O(n^2) or worse algorithms, N+1 queries, memory leaks.",
            List.of("complexity", "memory", "database", "caching", "io", "algorithm", "resource_leak")),
    STYLE("Style", 0.1,
            "You are a code style expert ensuring clean, readable code. "
                    + "Focus on: naming conventions, code organization, DRY principles, readability. "
                    + "Reference language-specific style guides.",
            List.of("naming", "formatting", "structure", "documentation", "consistency", "complexity")),
    DOCUMENTATION("Documentation", 0.2,
            "You are a documentation expert reviewing code documentation. "
                    + "Focus on: docstrings, inline comments, README updates, API documentation. "
                    + "Ensure complex logic is explained and public APIs are documented.",
            List.of("missing_docstring", "incomplete_docs", "missing_params", "missing_return", "missing_types",
                    "unclear_comment"));

    private final String agentName;
    private final double temperature;
    private final String systemPrompt;
    private final List<String> categories;

    AgentProfile(String agentName, double temperature, String systemPrompt, List<String> categories) {
        this.agentName = agentName;
        this.temperature = temperature;
        this.systemPrompt = systemPrompt;
        this.categories = categories;
    }

    public String agentName() {
        return agentName;
    }

    public double temperature() {
        return temperature;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public List<String> categories() {
        return categories;
    }

    /**
     * Post-processing applied to this agent's findings.
     */
    public FindingFilter findingFilter() {
        return switch (this) {
            case SECURITY -> FindingFilter.security();
            case PERFORMANCE -> FindingFilter.performance();
            case STYLE -> FindingFilter.style();
            case DOCUMENTATION -> FindingFilter.documentation();
        };
    }

    public static AgentProfile fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Agent name must be provided");
        }
        String normalized = raw.trim();
        for (AgentProfile profile : values()) {
            if (profile.agentName.equalsIgnoreCase(normalized)
                    || profile.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return profile;
            }
        }
        if ("docs".equalsIgnoreCase(normalized)) {
            return DOCUMENTATION;
        }
        throw new IllegalArgumentException("Unsupported agent: " + raw);
    }
}
