package ai.rtlgraph.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * What to keep and how to draw it.
 * <p>
 * Lists hold names as typed by the user (demangled or mangled); they are resolved against
 * the graph only when selection runs. {@code summarizeCallers} is null when disabled.
 */
public record GraphOptions(
        List<String> omit,
        List<String> callees,
        List<String> callers,
        boolean includeExternal,
        boolean clusterByFile,
        Integer summarizeCallers
) {

    public static final GraphOptions DEFAULTS = new GraphOptions(List.of(), List.of(), List.of(), false, false, null);

    public GraphOptions {
        omit = omit == null ? List.of() : List.copyOf(omit);
        callees = callees == null ? List.of() : List.copyOf(callees);
        callers = callers == null ? List.of() : List.copyOf(callers);
        if (summarizeCallers != null && summarizeCallers < 1) {
            throw new IllegalArgumentException("summarizeCallers must be a positive integer, got " + summarizeCallers);
        }
    }

    public GraphOptions withOmit(List<String> names) {
        return new GraphOptions(names, callees, callers, includeExternal, clusterByFile, summarizeCallers);
    }

    public GraphOptions withCallees(List<String> names) {
        return new GraphOptions(omit, names, callers, includeExternal, clusterByFile, summarizeCallers);
    }

    public GraphOptions withCallers(List<String> names) {
        return new GraphOptions(omit, callees, names, includeExternal, clusterByFile, summarizeCallers);
    }

    public GraphOptions withIncludeExternal(boolean value) {
        return new GraphOptions(omit, callees, callers, value, clusterByFile, summarizeCallers);
    }

    public GraphOptions withClusterByFile(boolean value) {
        return new GraphOptions(omit, callees, callers, includeExternal, value, summarizeCallers);
    }

    public GraphOptions withSummarizeCallers(Integer value) {
        return new GraphOptions(omit, callees, callers, includeExternal, clusterByFile, value);
    }

    /**
     * Splits one option value into names. A value containing '(' is a single demangled
     * signature whose argument list may itself contain commas, so it is kept whole.
     */
    public static List<String> nameList(String value) {
        if (value == null) {
            return List.of();
        }
        final String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (trimmed.indexOf('(') >= 0) {
            return List.of(trimmed);
        }
        final List<String> out = new ArrayList<>();
        Arrays.stream(trimmed.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
        return out;
    }

    public static List<String> concat(List<String> a, List<String> b) {
        final List<String> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }
}
