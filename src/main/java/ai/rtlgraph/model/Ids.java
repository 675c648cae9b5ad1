package ai.rtlgraph.model;

import java.nio.file.Path;
import java.util.Objects;

public final class Ids {

    private static final String SUMMARY_PREFIX = "summary:";

    private Ids() {
    }

    /**
     * Logical source name of a dump file: the path with its last two dot-separated
     * suffixes removed ({@code dir/foo.c.233r.expand -> dir/foo.c}).
     * Names with fewer than two suffixes are returned unchanged.
     */
    public static String logicalSourceName(Path dumpFile) {
        Objects.requireNonNull(dumpFile, "dumpFile");
        final String raw = dumpFile.toString().replace('\\', '/');
        final int slash = raw.lastIndexOf('/');
        final int last = raw.lastIndexOf('.');
        if (last <= slash + 1) {
            return raw;
        }
        final int prev = raw.lastIndexOf('.', last - 1);
        if (prev <= slash || prev == last - 1 || last == raw.length() - 1) {
            return raw;
        }
        return raw.substring(0, prev);
    }

    /**
     * Rewrites a base-object constructor/destructor tag (C2/D2) in a nested mangled name
     * to the complete-object variant (C1/D1) used at call sites.
     * <p>
     * Only the shape {@code _ZN<len><name><tag>} is handled: the tag is looked for right after
     * the first length-prefixed component, so names nested deeper are left alone.
     * Classes with virtual bases have distinct base and complete variants, so the result
     * is wrong for them.
     */
    public static String completeObjectTag(String mangled) {
        if (mangled == null || !mangled.startsWith("_ZN")) {
            return mangled;
        }
        int end = 3;
        while (end < mangled.length() && Character.isDigit(mangled.charAt(end))) {
            end++;
        }
        if (end == 3) {
            return mangled;
        }
        final int len;
        try {
            len = Integer.parseInt(mangled.substring(3, end));
        } catch (NumberFormatException ex) {
            return mangled;
        }
        // tag offset after the first nested-name component only
        final long offset = (long) end + len;
        if (len <= 0 || offset + 2 > mangled.length()) {
            return mangled;
        }
        final int pos = (int) offset;
        final String tag = mangled.substring(pos, pos + 2);
        final String fixed = switch (tag) {
            case "C2" -> "C1";
            case "D2" -> "D1";
            default -> null;
        };
        if (fixed == null) {
            return mangled;
        }
        return mangled.substring(0, pos) + fixed + mangled.substring(pos + 2);
    }

    public static String summaryId(int ordinal) {
        return SUMMARY_PREFIX + ordinal;
    }

    public static String summaryLabel(int callers) {
        return callers + " callers";
    }
}
