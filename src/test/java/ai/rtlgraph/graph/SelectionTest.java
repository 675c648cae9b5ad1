package ai.rtlgraph.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import ai.rtlgraph.model.FunctionNode;
import ai.rtlgraph.model.GraphOptions;
import ai.rtlgraph.model.RefKind;
import ai.rtlgraph.scan.DumpFormatException;
import ai.rtlgraph.scan.DumpParser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SelectionTest {

    // main -> parse -> lex -> log
    // main -> run -> log
    // run  ~> on_signal (address taken)
    // tool -> lex
    private static final String PROGRAM = String.join("\n",
            ";; Function main",
            "(call (mem:QI (symbol_ref:DI (\"parse\"))))",
            "(call (mem:QI (symbol_ref:DI (\"run\"))))",
            ";; Function parse",
            "(call (mem:QI (symbol_ref:DI (\"lex\"))))",
            ";; Function lex",
            "(call (mem:QI (symbol_ref:DI (\"log\"))))",
            ";; Function run",
            "(call (mem:QI (symbol_ref:DI (\"log\"))))",
            "(set (reg:DI 1) (symbol_ref:DI (\"on_signal\")))",
            ";; Function on_signal",
            ";; Function tool",
            "(call (mem:QI (symbol_ref:DI (\"lex\"))))",
            "");

    private static Graph program() throws DumpFormatException {
        return new GraphBuilder(List.of()).apply(new DumpParser().parse(PROGRAM, "prog.c")).toGraph();
    }

    // -- omission ----------------------------------------------------------

    @Test
    void whenOmitting_shouldRemoveNodeAndEdgesAndRecordIt() throws Exception {
        final Graph graph = program();

        final Selection.Result result = new Selection(GraphOptions.DEFAULTS.withOmit(List.of("lex"))).apply(graph);

        assertFalse(graph.calls().contains("lex"));
        assertFalse(graph.calls().node("parse").outgoing().containsKey("lex"));
        assertFalse(graph.calls().node("tool").outgoing().containsKey("lex"));
        assertEquals(Set.of("lex"), result.omitted());
    }

    @Test
    void whenOmitting_givenSameListTwice_shouldLeaveSameGraph() throws Exception {
        final GraphOptions options = GraphOptions.DEFAULTS.withOmit(List.of("lex", "log"));
        final Graph once = program();
        final Graph twice = program();

        new Selection(options).apply(once);
        new Selection(options).apply(twice);
        new Selection(options).apply(twice);

        assertEquals(snapshot(once.calls()), snapshot(twice.calls()));
    }

    @Test
    void whenOmitting_givenUnknownName_shouldWarnAndContinue() throws Exception {
        final Graph graph = program();

        final Selection.Result result = new Selection(
                GraphOptions.DEFAULTS.withOmit(List.of("nosuch", "log"))).apply(graph);

        assertEquals(List.of("unknown function in omit: nosuch"), result.warnings());
        assertEquals(Set.of("log"), result.omitted());
        assertFalse(graph.calls().contains("log"));
    }

    // -- reachability ------------------------------------------------------

    @Test
    void whenSelectingCallees_shouldKeepExactlyWhatTheSeedReaches() throws Exception {
        final Graph graph = program();

        new Selection(GraphOptions.DEFAULTS.withCallees(List.of("parse"))).apply(graph);

        assertEquals(List.of("lex", "log", "parse"), graph.calls().names());
        assertEquals(Set.of("lex"), graph.calls().node("parse").outgoing().keySet());
    }

    @Test
    void whenSelectingCallees_shouldFollowAddressTakenEdges() throws Exception {
        final Graph graph = program();

        new Selection(GraphOptions.DEFAULTS.withCallees(List.of("run"))).apply(graph);

        assertEquals(List.of("log", "on_signal", "run"), graph.calls().names());
    }

    @Test
    void whenSelectingCallers_shouldKeepExactlyWhatReachesTheSeed() throws Exception {
        final Graph graph = program();

        new Selection(GraphOptions.DEFAULTS.withCallers(List.of("lex"))).apply(graph);

        assertEquals(List.of("lex", "main", "parse", "tool"), graph.calls().names());
        assertEquals(Set.of("parse"), graph.calls().node("main").outgoing().keySet());
        assertTrue(graph.calls().node("lex").outgoing().isEmpty());
    }

    @Test
    void whenSelectingCallees_givenOnlyUnknownSeeds_shouldLeaveGraphAlone() throws Exception {
        final Graph graph = program();
        final int before = graph.calls().size();

        final Selection.Result result = new Selection(
                GraphOptions.DEFAULTS.withCallees(List.of("nosuch"))).apply(graph);

        assertEquals(before, graph.calls().size());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void whenSearching_givenCycle_shouldTerminateInSortedDepthFirstOrder() {
        final var edges = java.util.Map.of(
                "a", List.of("c", "b"),
                "b", List.of("a"),
                "c", List.of("d"),
                "d", List.<String>of());

        final Set<String> seen = Selection.reachable(List.of("a"),
                name -> new java.util.TreeSet<>(edges.getOrDefault(name, List.of())));

        assertEquals(List.of("a", "b", "c", "d"), List.copyOf(seen));
    }

    // -- summarization -----------------------------------------------------

    @Test
    void whenSummarizing_givenCalleeBelowThreshold_shouldKeepIndividualEdges() throws Exception {
        final Graph graph = program();

        final Selection.Result result = new Selection(GraphOptions.DEFAULTS.withSummarizeCallers(3)).apply(graph);

        assertEquals(0, result.summaries());
        assertTrue(graph.calls().node("lex").outgoing().containsKey("log"));
        assertTrue(graph.calls().node("run").outgoing().containsKey("log"));
    }

    @Test
    void whenSummarizing_givenCalleeAtThreshold_shouldReplaceEdgesWithOneSummary() throws Exception {
        final Graph graph = program();

        final Selection.Result result = new Selection(GraphOptions.DEFAULTS.withSummarizeCallers(2)).apply(graph);

        // lex (parse, tool) and log (lex, run) both have two callers
        assertEquals(2, result.summaries());
        assertFalse(graph.calls().node("lex").outgoing().containsKey("log"));
        assertFalse(graph.calls().node("run").outgoing().containsKey("log"));
        assertFalse(graph.calls().node("parse").outgoing().containsKey("lex"));

        final List<FunctionNode> summaries = graph.calls().nodesSorted().stream()
                .filter(FunctionNode::isSummary)
                .toList();
        assertEquals(2, summaries.size());
        for (FunctionNode summary : summaries) {
            assertEquals("2 callers", summary.label());
            assertEquals(1, summary.outgoing().size());
        }
    }

    @Test
    void whenSummarizing_givenOnlyAddressTakenCallers_shouldNotCountThem() throws Exception {
        final Graph graph = program();

        new Selection(GraphOptions.DEFAULTS.withSummarizeCallers(1)).apply(graph);

        assertEquals(RefKind.REFERENCE, graph.calls().node("run").outgoing().get("on_signal"));
    }

    @Test
    void whenSummarizing_givenRecursiveCalleeAtThreshold_shouldCountItsSelfCall() throws Exception {
        final String dump = String.join("\n",
                ";; Function A",
                "(call (mem:QI (symbol_ref:DI (\"log\"))))",
                ";; Function B",
                "(call (mem:QI (symbol_ref:DI (\"log\"))))",
                ";; Function log",
                "(call (mem:QI (symbol_ref:DI (\"log\"))))",
                "");
        final Graph graph = new GraphBuilder(List.of()).apply(new DumpParser().parse(dump, "log.c")).toGraph();

        final Selection.Result result = new Selection(GraphOptions.DEFAULTS.withSummarizeCallers(3)).apply(graph);

        assertEquals(1, result.summaries());
        assertFalse(graph.calls().node("A").outgoing().containsKey("log"));
        assertFalse(graph.calls().node("B").outgoing().containsKey("log"));
        assertFalse(graph.calls().node("log").outgoing().containsKey("log"));
        final FunctionNode summary = graph.calls().nodesSorted().stream()
                .filter(FunctionNode::isSummary)
                .findFirst()
                .orElseThrow();
        assertEquals("3 callers", summary.label());
    }

    // -- reuse -------------------------------------------------------------

    @Test
    void whenApplyingTwice_givenUnknownName_shouldReportWarningOncePerRun() throws Exception {
        final Selection selection = new Selection(GraphOptions.DEFAULTS.withOmit(List.of("nosuch")));

        final Selection.Result first = selection.apply(program());
        final Selection.Result second = selection.apply(program());

        assertEquals(List.of("unknown function in omit: nosuch"), first.warnings());
        assertEquals(List.of("unknown function in omit: nosuch"), second.warnings());
    }

    private static String snapshot(CallGraph calls) {
        final StringBuilder sb = new StringBuilder();
        for (FunctionNode node : calls.nodesSorted()) {
            sb.append(node).append(CallGraph.sortedOutgoing(node)).append('\n');
        }
        return sb.toString();
    }
}
