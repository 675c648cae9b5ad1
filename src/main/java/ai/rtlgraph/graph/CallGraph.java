package ai.rtlgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import ai.rtlgraph.model.FunctionNode;
import ai.rtlgraph.model.Ids;
import ai.rtlgraph.model.RefKind;

/**
 * Functions and their outgoing references.
 * Storage is unordered; every accessor that walks nodes or edges returns them sorted by name.
 */
public final class CallGraph {

    private final Map<String, FunctionNode> nodes = new HashMap<>();
    private int summaryCounter;

    /** Creates or upgrades the node to DEFINED in {@code sourceFile}. */
    public FunctionNode enterFunction(String name, String sourceFile) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sourceFile, "sourceFile");
        final FunctionNode existing = nodes.get(name);
        if (existing == null) {
            final FunctionNode created = FunctionNode.defined(name, sourceFile);
            nodes.put(name, created);
            return created;
        }
        existing.markDefined(sourceFile);
        return existing;
    }

    /**
     * Adds caller -> callee. Direct calls to unknown functions get an EXTERNAL stub so they
     * can be shown later; plain references do not.
     */
    public void recordReference(String caller, String callee, RefKind kind) {
        final FunctionNode from = nodes.get(caller);
        if (from == null) {
            throw new IllegalStateException("reference from unknown function: " + caller);
        }
        from.addReference(callee, kind);
        if (kind == RefKind.CALL) {
            nodes.computeIfAbsent(callee, FunctionNode::external);
        }
    }

    public void setLabel(String name, String label) {
        final FunctionNode node = nodes.get(name);
        if (node != null) {
            node.setLabel(label);
        }
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public FunctionNode node(String name) {
        return nodes.get(name);
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        int n = 0;
        for (FunctionNode node : nodes.values()) {
            n += node.outgoing().size();
        }
        return n;
    }

    public List<String> names() {
        final List<String> out = new ArrayList<>(nodes.keySet());
        Collections.sort(out);
        return out;
    }

    public List<FunctionNode> nodesSorted() {
        final List<FunctionNode> out = new ArrayList<>(nodes.size());
        for (String name : names()) {
            out.add(nodes.get(name));
        }
        return out;
    }

    public static SortedMap<String, RefKind> sortedOutgoing(FunctionNode node) {
        return new TreeMap<>(node.outgoing());
    }

    /** Drops the node and every edge pointing at it. Returns false if it was not present. */
    public boolean removeNode(String name) {
        if (nodes.remove(name) == null) {
            return false;
        }
        for (FunctionNode node : nodes.values()) {
            node.removeReference(name);
        }
        return true;
    }

    /**
     * Keeps only the named nodes. Edges survive only when their target is in {@code keep}.
     */
    public void retainOnly(Set<String> keep) {
        nodes.keySet().removeIf(name -> !keep.contains(name));
        for (FunctionNode node : nodes.values()) {
            node.removeReferencesIf(callee -> !keep.contains(callee));
        }
    }

    /** Adds a fan-in summary node calling {@code callee}; its name never collides with a function. */
    public FunctionNode addSummary(String label, String callee) {
        String id;
        do {
            id = Ids.summaryId(++summaryCounter);
        } while (nodes.containsKey(id));
        final FunctionNode summary = FunctionNode.summary(id, label, callee);
        nodes.put(id, summary);
        return summary;
    }

    /**
     * callee -> (caller -> kind), for every edge in the graph. Built fresh on each call;
     * callees without a node of their own are included.
     */
    public SortedMap<String, SortedMap<String, RefKind>> reverseIndex() {
        final SortedMap<String, SortedMap<String, RefKind>> out = new TreeMap<>();
        for (FunctionNode node : nodes.values()) {
            for (var e : node.outgoing().entrySet()) {
                out.computeIfAbsent(e.getKey(), k -> new TreeMap<>()).put(node.name(), e.getValue());
            }
        }
        return out;
    }
}
