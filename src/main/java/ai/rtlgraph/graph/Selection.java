package ai.rtlgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.function.Function;

import ai.rtlgraph.model.FunctionNode;
import ai.rtlgraph.model.GraphOptions;
import ai.rtlgraph.model.Ids;
import ai.rtlgraph.model.RefKind;

/**
 * Filters applied to a built graph, always in this order:
 * 1) resolve omit / callee / caller names (unknown names are dropped with a warning)
 * 2) omit
 * 3) keep only what the callee seeds reach
 * 4) keep only what reaches the caller seeds
 * 5) replace high fan-in with summary nodes
 * Each step mutates the graph in place.
 */
public final class Selection {

    private final GraphOptions options;

    public Selection(GraphOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public Result apply(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        final CallGraph calls = graph.calls();
        final List<String> warnings = new ArrayList<>();

        final List<String> omit = resolveAll(options.omit(), "omit", graph, warnings);
        final List<String> calleeSeeds = resolveAll(options.callees(), "callees", graph, warnings);
        final List<String> callerSeeds = resolveAll(options.callers(), "callers", graph, warnings);

        final Set<String> omitted = omit(calls, omit);

        if (!calleeSeeds.isEmpty()) {
            calls.retainOnly(reachable(calleeSeeds, name -> {
                final FunctionNode node = calls.node(name);
                return node == null ? List.of() : CallGraph.sortedOutgoing(node).keySet();
            }));
        }

        if (!callerSeeds.isEmpty()) {
            final SortedMap<String, SortedMap<String, RefKind>> reverse = calls.reverseIndex();
            calls.retainOnly(reachable(callerSeeds, name -> {
                final SortedMap<String, RefKind> in = reverse.get(name);
                return in == null ? List.of() : in.keySet();
            }));
        }

        int summaries = 0;
        if (options.summarizeCallers() != null) {
            summaries = summarize(calls, options.summarizeCallers());
        }

        return new Result(omitted, List.copyOf(warnings), summaries);
    }

    private static List<String> resolveAll(List<String> names,
                                           String listName,
                                           Graph graph,
                                           List<String> warnings) {
        final List<String> out = new ArrayList<>(names.size());
        for (String name : names) {
            final var key = graph.names().resolve(name, graph.calls());
            if (key.isPresent()) {
                out.add(key.get());
            } else {
                warnings.add("unknown function in " + listName + ": " + name);
            }
        }
        return out;
    }

    /** Removes each named node with all its edges; returns the set of names omitted. */
    static Set<String> omit(CallGraph calls, Collection<String> names) {
        final Set<String> omitted = new TreeSet<>();
        for (String name : names) {
            calls.removeNode(name);
            omitted.add(name);
        }
        return omitted;
    }

    /**
     * Iterative depth-first search from every seed. Neighbors are visited in sorted order,
     * so the returned (insertion-ordered) set is reproducible.
     */
    static Set<String> reachable(Collection<String> seeds, Function<String, Collection<String>> neighbors) {
        final Set<String> visited = new LinkedHashSet<>();
        final Deque<String> stack = new ArrayDeque<>();
        for (String seed : new TreeSet<>(seeds)) {
            stack.push(seed);
            while (!stack.isEmpty()) {
                final String name = stack.pop();
                if (!visited.add(name)) {
                    continue;
                }
                final List<String> next = new ArrayList<>(neighbors.apply(name));
                // push in reverse so the smallest name is popped first
                for (int i = next.size() - 1; i >= 0; i--) {
                    if (!visited.contains(next.get(i))) {
                        stack.push(next.get(i));
                    }
                }
            }
        }
        return visited;
    }

    /**
     * For every callee with at least {@code threshold} distinct direct callers, drops those
     * call edges (a recursive self-call included) and adds one summary node calling it.
     * Summary edges are always CALL.
     */
    static int summarize(CallGraph calls, int threshold) {
        int created = 0;
        for (Map.Entry<String, SortedMap<String, RefKind>> e : calls.reverseIndex().entrySet()) {
            final String callee = e.getKey();
            final List<String> callers = new ArrayList<>();
            for (var in : e.getValue().entrySet()) {
                final String caller = in.getKey();
                if (in.getValue() != RefKind.CALL || calls.node(caller).isSummary()) {
                    continue;
                }
                callers.add(caller);
            }
            if (callers.size() < threshold) {
                continue;
            }
            for (String caller : callers) {
                calls.node(caller).removeReference(callee);
            }
            calls.addSummary(Ids.summaryLabel(callers.size()), callee);
            created++;
        }
        return created;
    }

    /**
     * @param omitted    graph keys removed by the omit step; never shown as externals
     * @param warnings   non-fatal name resolution problems, in encounter order
     * @param summaries  number of summary nodes created
     */
    public record Result(Set<String> omitted, List<String> warnings, int summaries) {
    }
}
