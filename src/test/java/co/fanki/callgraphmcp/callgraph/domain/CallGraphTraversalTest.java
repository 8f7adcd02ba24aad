package co.fanki.callgraphmcp.callgraph.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CallGraphTraversal}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CallGraphTraversalTest {

    private CallGraphTraversal traversal;
    private CallGraph graph;

    @BeforeEach
    void setUp() {
        traversal = new CallGraphTraversal();
        graph = new CallGraph();
        new CallGraphIngestor().ingest(graph, List.of(
                ExtractedFunction.of("log_transaction", "db_connect"),
                ExtractedFunction.of("update_balance", "db_connect",
                        "log_transaction"),
                ExtractedFunction.of("calculate_interest"),
                ExtractedFunction.of("hidden_backdoor", "db_connect")));
    }

    @Test
    void whenGettingCallers_givenSharedCallee_shouldListInCreationOrder() {
        assertEquals(List.of("log_transaction", "update_balance",
                        "hidden_backdoor"),
                traversal.upstreamCallers(graph, "db_connect"));
    }

    @Test
    void whenGettingCallees_shouldListDirectCalleesOnly() {
        assertEquals(List.of("log_transaction", "db_connect"),
                traversal.downstreamDependencies(graph, "update_balance"));
        assertTrue(traversal.downstreamDependencies(graph, "db_connect")
                .isEmpty());
    }

    @Test
    void whenGettingNeighbours_givenUnknownFunction_shouldReturnEmpty() {
        assertTrue(traversal.upstreamCallers(graph, "ghost").isEmpty());
        assertTrue(traversal.downstreamDependencies(graph, "ghost").isEmpty());
    }

    @Test
    void whenFindingOrphans_shouldReturnDefinedFunctionsWithNoCallers() {
        assertEquals(List.of("update_balance", "calculate_interest",
                        "hidden_backdoor"),
                traversal.orphanFunctions(graph));
    }

    @Test
    void whenFindingOrphans_shouldNeverIncludeUndefinedFunctions() {
        final CallGraph external = new CallGraph();
        new CallGraphIngestor().ingest(external, List.of(
                ExtractedFunction.of("main", "printf")));

        assertEquals(List.of("main"), traversal.orphanFunctions(external));
    }

    @Test
    void whenFindingOrphans_givenSelfRecursiveFunction_shouldNotReportIt() {
        final CallGraph recursive = new CallGraph();
        new CallGraphIngestor().ingest(recursive, List.of(
                ExtractedFunction.of("main_loop", "main_loop")));

        assertTrue(traversal.orphanFunctions(recursive).isEmpty());
    }

    @Test
    void whenSummarizing_shouldReportDefinitionAndDegrees() {
        final List<FunctionSummary> summaries = traversal.summarize(graph);

        assertEquals(5, summaries.size());
        assertEquals(new FunctionSummary("log_transaction", true, 1, 1),
                summaries.get(0));
        assertEquals(new FunctionSummary("db_connect", false, 3, 0),
                summaries.get(1));
    }

    @Test
    void whenTraversing_shouldReturnImmutableLists() {
        assertThrows(UnsupportedOperationException.class,
                () -> traversal.orphanFunctions(graph).add("x"));
        assertThrows(UnsupportedOperationException.class,
                () -> traversal.upstreamCallers(graph, "db_connect")
                        .clear());
    }

}
