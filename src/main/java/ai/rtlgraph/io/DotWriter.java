package ai.rtlgraph.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import ai.rtlgraph.graph.CallGraph;
import ai.rtlgraph.model.FunctionNode;
import ai.rtlgraph.model.GraphOptions;
import ai.rtlgraph.model.RefKind;

/**
 * Renders a selected call graph as Graphviz DOT.
 * <p>
 * A callee is visible when it is defined, or when externals are included, the edge is a
 * direct call and the callee was not omitted. Hidden callees take their edges (and any
 * summary node pointing at them) with them. Self-edges are never drawn.
 */
public final class DotWriter {

    static final String GRAPH_NAME = "callgraph";
    static final String GRAPH_STYLE = "graph [rankdir=\"LR\"];";
    static final String NODE_STYLE = "node [shape=\"box\"];";
    static final String EDGE_STYLE = "edge [penwidth=\"1.5\"];";

    private final GraphOptions options;
    private final Set<String> omitted;

    public DotWriter(GraphOptions options, Set<String> omitted) {
        this.options = Objects.requireNonNull(options, "options");
        this.omitted = Set.copyOf(Objects.requireNonNull(omitted, "omitted"));
    }

    public String render(CallGraph calls) {
        Objects.requireNonNull(calls, "calls");
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(GRAPH_NAME).append(" {\n");
        sb.append("  ").append(GRAPH_STYLE).append('\n');
        sb.append("  ").append(NODE_STYLE).append('\n');
        sb.append("  ").append(EDGE_STYLE).append('\n');

        for (FunctionNode node : calls.nodesSorted()) {
            if (!isShown(node, calls)) {
                continue;
            }
            sb.append("  ").append(quote(node.name()));
            if (node.label() != null) {
                sb.append(" [label=").append(quote(node.label())).append(']');
            }
            sb.append(";\n");
        }

        for (FunctionNode node : calls.nodesSorted()) {
            if (!isShown(node, calls)) {
                continue;
            }
            for (Map.Entry<String, RefKind> e : CallGraph.sortedOutgoing(node).entrySet()) {
                final String callee = e.getKey();
                if (callee.equals(node.name()) || !isVisibleTarget(callee, e.getValue(), calls)) {
                    continue;
                }
                sb.append("  ").append(quote(node.name()))
                        .append(" -> ").append(quote(callee))
                        .append(" [style=").append(e.getValue().edgeStyle()).append("];\n");
            }
        }

        if (options.clusterByFile()) {
            appendClusters(sb, calls);
        }

        sb.append("}\n");
        return sb.toString();
    }

    public void write(CallGraph calls, Path file) throws IOException {
        final String dot = render(calls);
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            bw.write(dot);
        }
    }

    private void appendClusters(StringBuilder sb, CallGraph calls) {
        final Map<String, SortedSet<String>> byFile = new TreeMap<>();
        for (FunctionNode node : calls.nodesSorted()) {
            if (node.isDefined()) {
                byFile.computeIfAbsent(node.sourceFile(), k -> new TreeSet<>()).add(node.name());
            }
        }
        for (var e : byFile.entrySet()) {
            sb.append("  subgraph ").append(quote("cluster_" + e.getKey())).append(" {\n");
            sb.append("    label=").append(quote(e.getKey())).append(";\n");
            for (String member : e.getValue()) {
                sb.append("    ").append(quote(member)).append(";\n");
            }
            sb.append("  }\n");
        }
    }

    private boolean isShown(FunctionNode node, CallGraph calls) {
        return switch (node.kind()) {
            case DEFINED -> true;
            case EXTERNAL -> options.includeExternal() && !omitted.contains(node.name());
            case SUMMARY -> isVisibleTarget(summaryTarget(node), RefKind.CALL, calls);
        };
    }

    private static String summaryTarget(FunctionNode summary) {
        if (summary.outgoing().size() != 1) {
            throw new IllegalStateException("summary node " + summary.name()
                    + " has " + summary.outgoing().size() + " outgoing edges, expected 1");
        }
        return summary.outgoing().keySet().iterator().next();
    }

    private boolean isVisibleTarget(String callee, RefKind kind, CallGraph calls) {
        final FunctionNode target = calls.node(callee);
        if (target != null && target.isDefined()) {
            return true;
        }
        return options.includeExternal() && kind == RefKind.CALL && !omitted.contains(callee);
    }

    static String quote(String s) {
        final StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }
}
