package ai.rtlgraph.graph;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Demangled name -> mangled graph key, for translating names typed by users.
 * Never used while inserting edges.
 */
public final class NameTable {

    private final Map<String, String> aliases = new HashMap<>();

    /** Last registration wins. */
    public void register(String demangled, String mangled) {
        aliases.put(Objects.requireNonNull(demangled, "demangled"), Objects.requireNonNull(mangled, "mangled"));
    }

    /**
     * Alias first, then the name itself if the graph knows it; empty otherwise.
     */
    public Optional<String> resolve(String name, CallGraph graph) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        final String trimmed = name.trim();
        final String mangled = aliases.get(trimmed);
        if (mangled != null) {
            return Optional.of(mangled);
        }
        if (graph.contains(trimmed)) {
            return Optional.of(trimmed);
        }
        return Optional.empty();
    }

    public int size() {
        return aliases.size();
    }
}
