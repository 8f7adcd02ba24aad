package co.fanki.callgraphmcp.callgraph.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CycleDetector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CycleDetectorTest {

    private CycleDetector detector;
    private CallGraph graph;

    @BeforeEach
    void setUp() {
        detector = new CycleDetector();
        graph = new CallGraph();
    }

    @Test
    void whenDetecting_givenEmptyGraph_shouldReturnNoCycles() {
        assertTrue(detector.detectCycles(graph).isEmpty());
    }

    @Test
    void whenDetecting_givenAcyclicGraph_shouldReturnNoCycles() {
        graph.addEdge("funcA", "funcB");
        graph.addEdge("funcB", "funcC");
        graph.addEdge("funcA", "funcC");

        assertTrue(detector.detectCycles(graph).isEmpty());
    }

    @Test
    void whenDetecting_givenMutualRecursion_shouldReturnClosedPath() {
        graph.addEdge("funcA", "funcB");
        graph.addEdge("funcB", "funcA");

        assertEquals(List.of(List.of("funcA", "funcB", "funcA")),
                detector.detectCycles(graph));
    }

    @Test
    void whenDetecting_givenSelfRecursion_shouldReturnTwoElementCycle() {
        graph.addEdge("main", "main_loop");
        graph.addEdge("main_loop", "process_client");
        graph.addEdge("main_loop", "main_loop");

        assertEquals(List.of(List.of("main_loop", "main_loop")),
                detector.detectCycles(graph));
    }

    @Test
    void whenDetecting_givenSelfLoopInsideLargerCycle_shouldReportBoth() {
        graph.addEdge("x", "y");
        graph.addEdge("y", "x");
        graph.addEdge("y", "y");

        assertEquals(List.of(
                        List.of("x", "y", "x"),
                        List.of("y", "y")),
                detector.detectCycles(graph));
    }

    @Test
    void whenDetecting_givenThreeNodeCycle_shouldStartAndEndWithSameFunction() {
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "a");
        graph.addEdge("c", "d");

        final List<List<String>> cycles = detector.detectCycles(graph);

        assertEquals(1, cycles.size());
        final List<String> cycle = cycles.get(0);
        assertEquals(List.of("a", "b", "c", "a"), cycle);
        for (int i = 0; i + 1 < cycle.size(); i++) {
            assertTrue(graph.outgoing(cycle.get(i)).contains(cycle.get(i + 1)),
                    "Cycle step " + cycle.get(i) + " -> " + cycle.get(i + 1)
                            + " must be an edge");
        }
    }

    @Test
    void whenDetecting_givenDisjointCycles_shouldReportOnePerComponent() {
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");
        graph.addEdge("p", "q");
        graph.addEdge("q", "r");
        graph.addEdge("r", "p");

        final List<List<String>> cycles = detector.detectCycles(graph);

        assertEquals(List.of(
                        List.of("a", "b", "a"),
                        List.of("p", "q", "r", "p")),
                cycles);
    }

    @Test
    void whenDetecting_givenSameGraphTwice_shouldReturnSameResult() {
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "a");
        graph.addEdge("c", "c");

        assertEquals(detector.detectCycles(graph),
                detector.detectCycles(graph));
    }

    @Test
    void whenDetecting_givenVeryLongChain_shouldNotOverflowStack() {
        final int length = 100_000;
        for (int i = 0; i < length; i++) {
            graph.addEdge("f" + i, "f" + (i + 1));
        }

        assertTrue(detector.detectCycles(graph).isEmpty());

        graph.addEdge("f" + length, "f0");

        final List<List<String>> cycles = detector.detectCycles(graph);
        assertEquals(1, cycles.size());
        assertEquals(length + 2, cycles.get(0).size());
        assertEquals("f0", cycles.get(0).get(0));
        assertEquals("f0", cycles.get(0).get(length + 1));
    }

    @Test
    void whenDetecting_givenNullGraph_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> detector.detectCycles(null));
    }

}
