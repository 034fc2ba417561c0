package ai.codereview.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps agent names to agents. Each review passes the names it wants explicitly.
 */
public class AgentRegistry {

    private final Map<String, ReviewAgent> agents = new LinkedHashMap<>();

    public AgentRegistry register(ReviewAgent agent) {
        Objects.requireNonNull(agent, "agent");
        String name = agent.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("agent name must not be blank");
        }
        if (agents.putIfAbsent(name, agent) != null) {
            throw new IllegalArgumentException("Agent already registered: " + name);
        }
        return this;
    }

    public Optional<ReviewAgent> find(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    /**
     * Resolves the requested names in request order.
     *
     * @throws IllegalArgumentException if any name is not registered
     */
    public List<ReviewAgent> resolve(Set<String> names) {
        Objects.requireNonNull(names, "names");
        List<ReviewAgent> resolved = new ArrayList<>(names.size());
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            ReviewAgent agent = agents.get(name);
            if (agent == null) {
                unknown.add(name);
            } else {
                resolved.add(agent);
            }
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown agents: " + String.join(", ", unknown));
        }
        return List.copyOf(resolved);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(agents.keySet()));
    }

    public boolean isEmpty() {
        return agents.isEmpty();
    }
}
