package ai.rtlgraph;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import ai.rtlgraph.graph.Graph;
import ai.rtlgraph.graph.GraphBuilder;
import ai.rtlgraph.graph.Selection;
import ai.rtlgraph.io.DotWriter;
import ai.rtlgraph.io.OptionsLoader;
import ai.rtlgraph.model.GraphOptions;
import ai.rtlgraph.scan.DumpFileFinder;
import ai.rtlgraph.scan.DumpFormatException;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final List<Path> inputs = new ArrayList<>();
        final List<String> omit = new ArrayList<>();
        final List<String> callees = new ArrayList<>();
        final List<String> callers = new ArrayList<>();
        Boolean includeExternal = null;
        Boolean clusterByFile = null;
        Integer summarizeCallers = null;
        Path configFile = null;
        Path outputFile = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage(out);
                    return 0;
                }
                if (arg.startsWith("--omit=")) {
                    omit.addAll(GraphOptions.nameList(arg.substring("--omit=".length())));
                    continue;
                }
                if (arg.startsWith("--callees=")) {
                    callees.addAll(GraphOptions.nameList(arg.substring("--callees=".length())));
                    continue;
                }
                if (arg.startsWith("--callers=")) {
                    callers.addAll(GraphOptions.nameList(arg.substring("--callers=".length())));
                    continue;
                }
                if ("--include-external".equals(arg)) {
                    includeExternal = true;
                    continue;
                }
                if (arg.startsWith("--include-external=")) {
                    includeExternal = Boolean.parseBoolean(arg.substring("--include-external=".length()));
                    continue;
                }
                if ("--cluster-by-file".equals(arg)) {
                    clusterByFile = true;
                    continue;
                }
                if (arg.startsWith("--cluster-by-file=")) {
                    clusterByFile = Boolean.parseBoolean(arg.substring("--cluster-by-file=".length()));
                    continue;
                }
                if (arg.startsWith("--summarize-callers=")) {
                    summarizeCallers = parseThreshold(arg.substring("--summarize-callers=".length()));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(arg.substring("--config=".length()));
                    continue;
                }
                if (arg.startsWith("--output=")) {
                    outputFile = Paths.get(arg.substring("--output=".length()));
                    continue;
                }
                if (arg.startsWith("--")) {
                    err.println("ERROR: unknown argument: " + arg);
                    printUsage(err);
                    return 2;
                }
                inputs.add(Paths.get(arg));
            }

            if (inputs.isEmpty()) {
                err.println("ERROR: no dump files given");
                printUsage(err);
                return 2;
            }

            GraphOptions options = configFile != null ? new OptionsLoader().load(configFile) : GraphOptions.DEFAULTS;
            options = options
                    .withOmit(GraphOptions.concat(options.omit(), omit))
                    .withCallees(GraphOptions.concat(options.callees(), callees))
                    .withCallers(GraphOptions.concat(options.callers(), callers));
            if (includeExternal != null) {
                options = options.withIncludeExternal(includeExternal);
            }
            if (clusterByFile != null) {
                options = options.withClusterByFile(clusterByFile);
            }
            if (summarizeCallers != null) {
                options = options.withSummarizeCallers(summarizeCallers);
            }

            final Graph graph = new GraphBuilder(inputs).build();
            final Selection.Result selected = new Selection(options).apply(graph);
            for (String warning : selected.warnings()) {
                err.println("WARN: " + safeMsg(warning));
            }

            final DotWriter writer = new DotWriter(options, selected.omitted());
            if (outputFile != null) {
                writer.write(graph.calls(), outputFile);
            } else {
                out.print(writer.render(graph.calls()));
                out.flush();
            }

            err.println("Files: " + graph.files().size()
                    + ", functions: " + graph.calls().size()
                    + ", edges: " + graph.calls().edgeCount()
                    + ", omitted: " + selected.omitted().size()
                    + ", summaries: " + selected.summaries());
            return 0;
        } catch (IllegalArgumentException ex) {
            err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (java.io.IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (DumpFormatException ex) {
            err.println("ERROR: malformed dump: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            err.println("ERROR: failed to build call graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static Integer parseThreshold(String raw) {
        try {
            final int n = Integer.parseInt(raw.trim());
            if (n < 1) {
                throw new IllegalArgumentException("--summarize-callers must be a positive integer: " + raw);
            }
            return n;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--summarize-callers must be a positive integer: " + raw, ex);
        }
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: rtl-callgraph [options] <dump file or directory>...");
        ps.println("Options:");
        ps.println("  --omit=<f1,f2>            Functions to leave out entirely");
        ps.println("  --callees=<f1,f2>         Show only functions reachable from these");
        ps.println("  --callers=<f1,f2>         Show only functions that reach these");
        ps.println("  --include-external[=b]    Show called functions not defined in the dumps");
        ps.println("  --cluster-by-file[=b]     Group defined functions by source file");
        ps.println("  --summarize-callers=<n>   Collapse callees with at least n callers");
        ps.println("  --config=<file.json>      Read options from JSON (CLI values are added on top)");
        ps.println("  --output=<file>           Write DOT to a file instead of stdout");
        ps.println("  --help, -h                Show this help");
        ps.println("A name containing '(' is taken whole; other values are split on commas.");
        ps.println("Directories are searched for *" + DumpFileFinder.DUMP_SUFFIX + " dumps.");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
