package ai.codereview.agent;

import ai.codereview.model.Finding;
import ai.codereview.model.Severity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-agent post-processing of parsed findings: de-duplication, optional per-category and low
 * severity limits, ordering and a cap on the number of findings kept. All sorts are stable, so
 * findings that compare equal keep production order.
 *
 * <p>Each {@link AgentProfile} carries its own policy; see {@link #security()}, {@link #performance()},
 * {@link #style()} and {@link #documentation()}.</p>
 */
public class FindingFilter {

    public static final int DEFAULT_LIMIT = 20;

    private static final int MESSAGE_PREFIX_LENGTH = 30;
    private static final Comparator<Finding> BY_SEVERITY = Comparator.comparing(Finding::severity);
    private static final Comparator<Finding> BY_SEVERITY_THEN_LINE = BY_SEVERITY.thenComparingInt(Finding::lineNumber);

    /**
     * What makes two findings of one agent duplicates.
     */
    enum DuplicateKey {
        NONE,
        LINE_AND_MESSAGE,
        LINE_AND_CATEGORY,
        LINE_CATEGORY_AND_MESSAGE_PREFIX;

        Object keyOf(Finding finding) {
            String message = Objects.requireNonNullElse(finding.message(), "");
            return switch (this) {
                case NONE -> null;
                case LINE_AND_MESSAGE -> List.of(finding.lineNumber(), message);
                case LINE_AND_CATEGORY -> List.of(finding.lineNumber(), finding.category());
                case LINE_CATEGORY_AND_MESSAGE_PREFIX -> List.of(finding.lineNumber(), finding.category(),
                        message.substring(0, Math.min(MESSAGE_PREFIX_LENGTH, message.length())));
            };
        }
    }

    private final DuplicateKey duplicateKey;
    private final int limit;
    private final int maxPerCategory;
    private final int lowSeverityThreshold;
    private final Comparator<Finding> order;

    public FindingFilter() {
        this(DEFAULT_LIMIT);
    }

    public FindingFilter(int limit) {
        this(DuplicateKey.LINE_AND_MESSAGE, limit, 0, -1, BY_SEVERITY);
    }

    /**
     * @param maxPerCategory       findings kept per category, or 0 for no limit
     * @param lowSeverityThreshold LOW findings are dropped once more than this many findings were kept;
     *                             negative to keep them all
     */
    FindingFilter(DuplicateKey duplicateKey, int limit, int maxPerCategory, int lowSeverityThreshold,
                  Comparator<Finding> order) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        if (maxPerCategory < 0) {
            throw new IllegalArgumentException("maxPerCategory must not be negative");
        }
        this.duplicateKey = Objects.requireNonNull(duplicateKey, "duplicateKey");
        this.limit = limit;
        this.maxPerCategory = maxPerCategory;
        this.lowSeverityThreshold = lowSeverityThreshold;
        this.order = Objects.requireNonNull(order, "order");
    }

    /** Repeated (line, message) pairs removed, ordered by severity, top 20. */
    public static FindingFilter security() {
        return new FindingFilter();
    }

    /** Repeated (line, category, first 30 message characters) removed, ordered by severity, top 15. */
    public static FindingFilter performance() {
        return new FindingFilter(DuplicateKey.LINE_CATEGORY_AND_MESSAGE_PREFIX, 15, 0, -1, BY_SEVERITY);
    }

    /** One finding per (line, category), LOW dropped past 10 findings, ordered by severity then line, top 20. */
    public static FindingFilter style() {
        return new FindingFilter(DuplicateKey.LINE_AND_CATEGORY, 20, 0, 10, BY_SEVERITY_THEN_LINE);
    }

    /** At most 3 findings per category, ordered by severity then line, top 15. */
    public static FindingFilter documentation() {
        return new FindingFilter(DuplicateKey.NONE, 15, 3, -1, BY_SEVERITY_THEN_LINE);
    }

    public List<Finding> apply(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return List.of();
        }
        Set<Object> seen = new HashSet<>();
        Map<String, Integer> perCategory = new HashMap<>();
        List<Finding> kept = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            if (lowSeverityThreshold >= 0 && kept.size() > lowSeverityThreshold
                    && finding.severity() == Severity.LOW) {
                continue;
            }
            Object key = duplicateKey.keyOf(finding);
            if (key != null && !seen.add(key)) {
                continue;
            }
            if (maxPerCategory > 0 && perCategory.merge(finding.category(), 1, Integer::sum) > maxPerCategory) {
                continue;
            }
            kept.add(finding);
        }
        kept.sort(order);
        if (kept.size() > limit) {
            return List.copyOf(kept.subList(0, limit));
        }
        return List.copyOf(kept);
    }
}
