package ai.rtlgraph.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One function in the call graph.
 * <p>
 * kind:
 * - DEFINED  body seen in a dump; sourceFile is set
 * - EXTERNAL only called, never defined; sourceFile is null
 * - SUMMARY  synthetic fan-in counter; label is set, exactly one outgoing call
 */
public final class FunctionNode {

    public enum Kind {
        DEFINED,
        EXTERNAL,
        SUMMARY
    }

    private final String name;
    private Kind kind;
    private String sourceFile;
    private String label;
    private final Map<String, RefKind> outgoing = new HashMap<>();

    private FunctionNode(String name, Kind kind, String sourceFile, String label) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.sourceFile = sourceFile;
        this.label = label;
    }

    public static FunctionNode defined(String name, String sourceFile) {
        return new FunctionNode(name, Kind.DEFINED, Objects.requireNonNull(sourceFile, "sourceFile"), null);
    }

    public static FunctionNode external(String name) {
        return new FunctionNode(name, Kind.EXTERNAL, null, null);
    }

    public static FunctionNode summary(String name, String label, String callee) {
        final FunctionNode node = new FunctionNode(name, Kind.SUMMARY, null, Objects.requireNonNull(label, "label"));
        node.outgoing.put(Objects.requireNonNull(callee, "callee"), RefKind.CALL);
        return node;
    }

    /** Marks this node as defined in the given file; a later definition replaces the file. */
    public void markDefined(String file) {
        if (kind == Kind.SUMMARY) {
            throw new IllegalStateException("summary node cannot be defined: " + name);
        }
        this.kind = Kind.DEFINED;
        this.sourceFile = Objects.requireNonNull(file, "file");
    }

    /**
     * Adds or merges an edge. A stored CALL is never weakened to REFERENCE.
     */
    public void addReference(String callee, RefKind refKind) {
        Objects.requireNonNull(callee, "callee");
        Objects.requireNonNull(refKind, "refKind");
        outgoing.merge(callee, refKind, RefKind::strongest);
    }

    public RefKind removeReference(String callee) {
        return outgoing.remove(callee);
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isDefined() {
        return kind == Kind.DEFINED;
    }

    public boolean isSummary() {
        return kind == Kind.SUMMARY;
    }

    public String sourceFile() {
        return sourceFile;
    }

    public String label() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String displayName() {
        return label != null ? label : name;
    }

    /** Live, unordered view of the outgoing edges. */
    public Map<String, RefKind> outgoing() {
        return Collections.unmodifiableMap(outgoing);
    }

    /** Drops every edge whose callee matches; returns how many were dropped. */
    public int removeReferencesIf(Predicate<String> calleeTest) {
        final int before = outgoing.size();
        outgoing.keySet().removeIf(calleeTest);
        return before - outgoing.size();
    }

    @Override
    public String toString() {
        return "FunctionNode[" + name + ", " + kind + (sourceFile != null ? ", " + sourceFile : "") + "]";
    }
}
