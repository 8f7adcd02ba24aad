package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.Preconditions;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Storage for the call graph of one analysis: functions and the
 * {@code caller -> callee} relation between them.
 *
 * <p>Identity is the raw function name in a single flat namespace. Two
 * functions that share a name collapse into one node.</p>
 *
 * <p>The forward index (caller to callees) and the reverse index (callee
 * to callers) are kept in lockstep: for every edge {@code (a, b)}, {@code b}
 * is in the outgoing set of {@code a}, {@code a} is in the incoming set of
 * {@code b}, and both are nodes. Every node owns an entry in both indexes,
 * possibly empty.</p>
 *
 * <p>Not thread safe. Instances are built by a single writer and published
 * through {@link GraphService}, which guards concurrent reads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallGraph {

    /**
     * Per-node bookkeeping.
     *
     * <p>{@code ordinal} is the creation index and never changes, so result
     * ordering stays stable for the lifetime of the graph.</p>
     */
    private static final class Node {

        private final int ordinal;

        private boolean defined;

        private Node(final int theOrdinal) {
            this.ordinal = theOrdinal;
        }
    }

    /** Maps function name to its node, in creation order. */
    private final Map<String, Node> nodes;

    /** Maps function name to the functions it calls (outgoing edges). */
    private final Map<String, Set<String>> outgoing;

    /** Maps function name to the functions that call it (incoming edges). */
    private final Map<String, Set<String>> incoming;

    private int edgeCount;

    /**
     * Creates an empty call graph.
     */
    public CallGraph() {
        this.nodes = new LinkedHashMap<>();
        this.outgoing = new LinkedHashMap<>();
        this.incoming = new LinkedHashMap<>();
    }

    /**
     * Adds a function node if absent.
     *
     * <p>A new node starts as not defined: it is known only as a call
     * target until {@link #markDefined(String)} is called for it.</p>
     *
     * @param name the function name
     * @return true if the node was created by this call
     */
    public boolean addNode(final String name) {
        Preconditions.requireNonBlank(name, "Function name is required");

        if (nodes.containsKey(name)) {
            return false;
        }
        nodes.put(name, new Node(nodes.size()));
        outgoing.put(name, new LinkedHashSet<>());
        incoming.put(name, new LinkedHashSet<>());
        return true;
    }

    /**
     * Marks a function as defined, creating its node if needed.
     *
     * @param name the function name whose body was ingested
     */
    public void markDefined(final String name) {
        addNode(name);
        nodes.get(name).defined = true;
    }

    /**
     * Adds a call edge from caller to callee.
     *
     * <p>Both endpoints are created when missing and the caller is marked
     * as defined, since only a defined function can be observed calling
     * something. Adding an existing edge is a no-op.</p>
     *
     * @param caller the calling function
     * @param callee the called function
     * @return true if the edge was created by this call
     */
    public boolean addEdge(final String caller, final String callee) {
        Preconditions.requireNonBlank(caller, "Caller name is required");
        Preconditions.requireNonBlank(callee, "Callee name is required");

        markDefined(caller);
        addNode(callee);

        if (!outgoing.get(caller).add(callee)) {
            return false;
        }
        incoming.get(callee).add(caller);
        edgeCount++;
        return true;
    }

    /**
     * Drops every node and edge.
     */
    public void clear() {
        nodes.clear();
        outgoing.clear();
        incoming.clear();
        edgeCount = 0;
    }

    /**
     * Returns all function names in creation order.
     *
     * @return unmodifiable set of function names
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    /**
     * Returns the functions directly called by the given function.
     *
     * @param name the function name
     * @return unmodifiable set of callees, empty if the name is unknown
     */
    public Set<String> outgoing(final String name) {
        return view(outgoing, name);
    }

    /**
     * Returns the functions that directly call the given function.
     *
     * @param name the function name
     * @return unmodifiable set of callers, empty if the name is unknown
     */
    public Set<String> incoming(final String name) {
        return view(incoming, name);
    }

    /**
     * Checks if the graph contains a given function.
     *
     * @param name the function name, may be null
     * @return true if a node with that name exists
     */
    public boolean contains(final String name) {
        return name != null && nodes.containsKey(name);
    }

    /**
     * Checks if a function body with the given name was ingested.
     *
     * @param name the function name, may be null
     * @return true if the node exists and is defined
     */
    public boolean isDefined(final String name) {
        final Node node = name == null ? null : nodes.get(name);
        return node != null && node.defined;
    }

    /**
     * Returns the number of nodes, defined or not.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of defined nodes.
     *
     * @return the defined node count
     */
    public int definedCount() {
        int count = 0;
        for (final Node node : nodes.values()) {
            if (node.defined) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of distinct edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Returns a comparator that orders function names by node creation.
     *
     * <p>Names that are not nodes of this graph sort last, by name.</p>
     *
     * @return the creation order comparator
     */
    public Comparator<String> creationOrder() {
        return Comparator.comparingInt(this::ordinalOf)
                .thenComparing(Comparator.naturalOrder());
    }

    private int ordinalOf(final String name) {
        final Node node = nodes.get(name);
        return node == null ? Integer.MAX_VALUE : node.ordinal;
    }

    private static Set<String> view(final Map<String, Set<String>> index,
            final String name) {
        if (name == null) {
            return Set.of();
        }
        final Set<String> adjacent = index.get(name);
        if (adjacent == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(adjacent);
    }

}
