package ai.rtlgraph.graph;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of reading all dumps, ready for selection and writing.
 * - calls: function nodes and edges
 * - names: demangled -> mangled aliases for user-supplied names
 * - files: dump files read, in reading order
 */
public record Graph(
        CallGraph calls,
        NameTable names,
        List<Path> files
) {
}
