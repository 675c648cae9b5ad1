package ai.rtlgraph.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import ai.rtlgraph.scan.DumpEvent;
import ai.rtlgraph.scan.DumpFileFinder;
import ai.rtlgraph.scan.DumpFormatException;
import ai.rtlgraph.scan.DumpParser;

/**
 * Reads the dump files in order and folds their events into one {@link CallGraph}.
 * Later files may extend functions seen earlier (e.g. define a former stub).
 */
public final class GraphBuilder {

    private final List<Path> inputs;
    private final DumpParser parser = new DumpParser();
    private final CallGraph calls = new CallGraph();
    private final NameTable names = new NameTable();

    public GraphBuilder(List<Path> inputs) {
        this.inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
    }

    public Graph build() throws IOException, DumpFormatException {
        final List<Path> files = new DumpFileFinder(inputs).findAll();
        for (Path file : files) {
            apply(parser.parse(file));
        }
        return new Graph(calls, names, files);
    }

    /** Applies already-parsed events; usable without touching the file system. */
    public GraphBuilder apply(List<DumpEvent> events) {
        for (DumpEvent ev : events) {
            if (ev instanceof DumpEvent.EnterFunction e) {
                calls.enterFunction(e.name(), e.sourceFile());
            } else if (ev instanceof DumpEvent.SetDisplayLabel l) {
                calls.setLabel(l.name(), l.label());
            } else if (ev instanceof DumpEvent.RegisterNameAlias a) {
                names.register(a.demangled(), a.mangled());
            } else if (ev instanceof DumpEvent.RecordReference r) {
                calls.recordReference(r.caller(), r.callee(), r.kind());
            }
        }
        return this;
    }

    /** The graph built so far, without file information. */
    public Graph toGraph() {
        return new Graph(calls, names, List.of());
    }
}
