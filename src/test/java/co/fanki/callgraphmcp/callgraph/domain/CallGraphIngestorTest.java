package co.fanki.callgraphmcp.callgraph.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CallGraphIngestor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CallGraphIngestorTest {

    private CallGraphIngestor ingestor;
    private CallGraph graph;

    @BeforeEach
    void setUp() {
        ingestor = new CallGraphIngestor();
        graph = new CallGraph();
    }

    @Test
    void whenIngesting_givenLinearChain_shouldBuildEdges() {
        final int count = ingestor.ingest(graph, List.of(
                ExtractedFunction.of("funcC"),
                ExtractedFunction.of("funcB", "funcC"),
                ExtractedFunction.of("funcA", "funcB")));

        assertEquals(3, count);
        assertEquals(Set.of("funcC"), graph.outgoing("funcB"));
        assertEquals(Set.of("funcB"), graph.incoming("funcC"));
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void whenIngesting_givenUndefinedCallee_shouldCreateUndefinedNode() {
        ingestor.ingest(graph, List.of(
                ExtractedFunction.of("process_client", "log_transaction")));

        assertEquals(2, graph.nodeCount());
        assertTrue(graph.isDefined("process_client"));
        assertFalse(graph.isDefined("log_transaction"));
    }

    @Test
    void whenIngesting_givenDuplicateNames_shouldUnionCallees() {
        ingestor.ingest(graph, List.of(
                ExtractedFunction.of("a", "b"),
                ExtractedFunction.of("a", "c", "b")));

        assertEquals(Set.of("b", "c"), graph.outgoing("a"));
        assertEquals(2, graph.edgeCount());
        assertEquals(1, graph.definedCount());
    }

    @Test
    void whenIngesting_givenFunctionWithoutCalls_shouldStillAddNode() {
        ingestor.ingest(graph, List.of(ExtractedFunction.of("standalone")));

        assertTrue(graph.contains("standalone"));
        assertTrue(graph.isDefined("standalone"));
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void whenIngesting_givenPopulatedGraph_shouldReplaceContents() {
        ingestor.ingest(graph, List.of(ExtractedFunction.of("old", "x")));

        ingestor.ingest(graph, List.of(ExtractedFunction.of("new", "y")));

        assertFalse(graph.contains("old"));
        assertFalse(graph.contains("x"));
        assertEquals(2, graph.nodeCount());
    }

    @Test
    void whenIngesting_givenEmptyList_shouldLeaveEmptyGraph() {
        ingestor.ingest(graph, List.of(ExtractedFunction.of("a", "b")));

        final int count = ingestor.ingest(graph, List.of());

        assertEquals(0, count);
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void whenIngesting_givenBlankOrNullEntries_shouldSkipThem() {
        final Set<String> callees = new LinkedHashSet<>();
        callees.add("b");
        callees.add(" ");
        callees.add(null);

        final int count = ingestor.ingest(graph, Arrays.asList(
                new ExtractedFunction("a", callees),
                new ExtractedFunction("  ", Set.of("c")),
                null));

        assertEquals(2, count);
        assertEquals(Set.of("b"), graph.outgoing("a"));
        assertFalse(graph.contains("c"));
    }

    @Test
    void whenIngesting_shouldMakeDefinedCountMatchDistinctRecordNames() {
        final List<ExtractedFunction> records = List.of(
                ExtractedFunction.of("a", "b", "ext1"),
                ExtractedFunction.of("b", "a"),
                ExtractedFunction.of("a", "ext2"),
                ExtractedFunction.of("c"));

        ingestor.ingest(graph, records);

        assertEquals(3, graph.definedCount());
        assertEquals(5, graph.nodeCount());
    }

    @Test
    void whenIngesting_givenNullList_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> ingestor.ingest(graph, null));
    }

}
