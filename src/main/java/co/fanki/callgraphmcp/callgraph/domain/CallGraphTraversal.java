package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * One-hop queries over a {@link CallGraph}.
 *
 * <p>Unknown function names are not errors: agents ask about arbitrary
 * identifiers, and "no such function" is observably the same as "a
 * function nobody calls". Both return an empty list.</p>
 *
 * <p>Every list is ordered by node creation, so repeated queries against
 * the same graph return identical results.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallGraphTraversal {

    /**
     * Returns the functions that directly call the given function.
     *
     * @param graph the graph to query
     * @param function the function name
     * @return the direct callers, empty if none or unknown
     */
    public List<String> upstreamCallers(final CallGraph graph,
            final String function) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return ordered(graph, graph.incoming(function));
    }

    /**
     * Returns the functions directly called by the given function.
     *
     * @param graph the graph to query
     * @param function the function name
     * @return the direct callees, empty if none or unknown
     */
    public List<String> downstreamDependencies(final CallGraph graph,
            final String function) {
        Preconditions.requireNonNull(graph, "Graph is required");
        return ordered(graph, graph.outgoing(function));
    }

    /**
     * Returns the defined functions that no ingested function calls.
     *
     * <p>Functions known only as call targets are never orphans: they are
     * unresolved external calls, not dead local code. A function that
     * only calls itself is called, and so is not an orphan either.</p>
     *
     * @param graph the graph to query
     * @return the orphan functions in creation order
     */
    public List<String> orphanFunctions(final CallGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<String> orphans = new ArrayList<>();
        for (final String function : graph.nodes()) {
            if (graph.isDefined(function)
                    && graph.incoming(function).isEmpty()) {
                orphans.add(function);
            }
        }
        return List.copyOf(orphans);
    }

    /**
     * Summarizes every node of the graph.
     *
     * @param graph the graph to query
     * @return one summary per node, in creation order
     */
    public List<FunctionSummary> summarize(final CallGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<FunctionSummary> summaries = new ArrayList<>();
        for (final String function : graph.nodes()) {
            summaries.add(new FunctionSummary(function,
                    graph.isDefined(function),
                    graph.incoming(function).size(),
                    graph.outgoing(function).size()));
        }
        return List.copyOf(summaries);
    }

    private static List<String> ordered(final CallGraph graph,
            final Collection<String> functions) {
        final List<String> sorted = new ArrayList<>(functions);
        sorted.sort(graph.creationOrder());
        return List.copyOf(sorted);
    }

}
