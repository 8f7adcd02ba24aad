package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the cycles of a {@link CallGraph}.
 *
 * <p>Strongly connected components are computed with Tarjan's algorithm in
 * O(V+E). Each component with two or more functions yields exactly one
 * representative cycle; each function that calls itself yields the
 * length-1 cycle {@code [f, f]}, whatever the size of its component.</p>
 *
 * <p>A cycle is a path that starts and ends with the same function, e.g.
 * {@code [a, b, a]}. The representative cycle of a component starts at the
 * first of its functions reached by the depth-first search, and follows
 * outgoing edges in insertion order until it returns to that start.</p>
 *
 * <p>Results are deterministic for a given graph: the search visits roots
 * in node creation order, and cycles are reported in the order their start
 * function was discovered. For the same start, the component cycle comes
 * before the self-loop.</p>
 *
 * <p>Both the component search and the cycle walk use explicit stacks, so
 * long call chains do not exhaust the thread stack.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CycleDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            CycleDetector.class);

    /** One level of the depth-first search. */
    private record Frame(String function, Iterator<String> successors) {}

    /**
     * Detects every cycle of the graph.
     *
     * @param graph the graph to inspect
     * @return unmodifiable list of cycles, empty if the graph is acyclic
     */
    public List<List<String>> detectCycles(final CallGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        if (graph.nodeCount() == 0) {
            return List.of();
        }

        final Search search = new Search(graph);
        for (final String function : graph.nodes()) {
            if (!search.isVisited(function)) {
                search.run(function);
            }
        }

        final List<List<String>> cycles = new ArrayList<>();
        for (final String function : search.discoveryOrder) {
            final Set<String> component = search.components.get(function);
            if (component != null) {
                final List<String> cycle = walkCycle(graph, function,
                        component);
                if (!cycle.isEmpty()) {
                    cycles.add(cycle);
                }
            }
            if (graph.outgoing(function).contains(function)) {
                cycles.add(List.of(function, function));
            }
        }

        LOG.debug("Found {} cycle(s) in {} strongly connected component(s)",
                cycles.size(), search.components.size());

        return List.copyOf(cycles);
    }

    /**
     * Walks from the component root along edges that stay inside the
     * component until an edge leads back to the root.
     */
    private List<String> walkCycle(final CallGraph graph, final String root,
            final Set<String> component) {

        final List<String> path = new ArrayList<>();
        final Deque<Iterator<String>> pending = new ArrayDeque<>();
        final Set<String> visited = new HashSet<>();

        path.add(root);
        visited.add(root);
        pending.push(graph.outgoing(root).iterator());

        while (!pending.isEmpty()) {
            final Iterator<String> successors = pending.peek();
            if (!successors.hasNext()) {
                pending.pop();
                path.remove(path.size() - 1);
                continue;
            }

            final String next = successors.next();
            if (!component.contains(next)) {
                continue;
            }
            if (next.equals(root)) {
                // the root's own self-edge is reported separately
                if (path.size() > 1) {
                    path.add(root);
                    return List.copyOf(path);
                }
                continue;
            }
            if (visited.add(next)) {
                path.add(next);
                pending.push(graph.outgoing(next).iterator());
            }
        }

        LOG.warn("No closing path found for component rooted at {}", root);
        return List.of();
    }

    /**
     * Iterative Tarjan state for one graph.
     */
    private static final class Search {

        private final CallGraph graph;

        private final Map<String, Integer> index = new HashMap<>();

        private final Map<String, Integer> lowLink = new HashMap<>();

        private final Deque<String> stack = new ArrayDeque<>();

        private final Set<String> onStack = new HashSet<>();

        /** Functions in the order the search first reached them. */
        private final List<String> discoveryOrder = new ArrayList<>();

        /** Components of two or more functions, keyed by their root. */
        private final Map<String, Set<String>> components = new HashMap<>();

        private Search(final CallGraph theGraph) {
            this.graph = theGraph;
        }

        private boolean isVisited(final String function) {
            return index.containsKey(function);
        }

        private void run(final String start) {
            final Deque<Frame> frames = new ArrayDeque<>();
            frames.push(open(start));

            while (!frames.isEmpty()) {
                final Frame frame = frames.peek();
                final String current = frame.function();

                if (frame.successors().hasNext()) {
                    final String next = frame.successors().next();
                    if (!isVisited(next)) {
                        frames.push(open(next));
                    } else if (onStack.contains(next)) {
                        lowLink.put(current, Math.min(lowLink.get(current),
                                index.get(next)));
                    }
                    continue;
                }

                frames.pop();
                if (lowLink.get(current).equals(index.get(current))) {
                    closeComponent(current);
                }

                final Frame parent = frames.peek();
                if (parent != null) {
                    final String caller = parent.function();
                    lowLink.put(caller, Math.min(lowLink.get(caller),
                            lowLink.get(current)));
                }
            }
        }

        private Frame open(final String function) {
            final int order = discoveryOrder.size();
            index.put(function, order);
            lowLink.put(function, order);
            stack.push(function);
            onStack.add(function);
            discoveryOrder.add(function);
            return new Frame(function, graph.outgoing(function).iterator());
        }

        private void closeComponent(final String root) {
            final Set<String> members = new LinkedHashSet<>();
            String member;
            do {
                member = stack.pop();
                onStack.remove(member);
                members.add(member);
            } while (!member.equals(root));

            if (members.size() > 1) {
                components.put(root, members);
            }
        }
    }

}
