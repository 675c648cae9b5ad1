package ai.rtlgraph.model;

/**
 * How a function mentions another symbol.
 * Declaration order is significant: later constants are stronger when two references merge.
 */
public enum RefKind {
    REFERENCE,
    CALL;

    public static RefKind strongest(RefKind a, RefKind b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    public String edgeStyle() {
        return this == CALL ? "solid" : "dotted";
    }
}
