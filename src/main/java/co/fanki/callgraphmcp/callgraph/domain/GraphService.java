package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Holds the call graph of the current session.
 *
 * <p>There is exactly one live graph. An analysis builds its graph
 * privately and hands it over through {@link #replace(CallGraph)}, which
 * swaps the reference under the write lock; the previous graph is dropped
 * whole. A failed analysis never reaches the swap, so the previous graph
 * stays in place.</p>
 *
 * <p>Queries run through {@link #read(Function)} under the shared lock and
 * must not mutate the graph or leak it out of the callback.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphService {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphService.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private CallGraph current = new CallGraph();

    private long generation;

    /**
     * Replaces the live graph.
     *
     * @param graph the fully built graph that becomes current
     */
    public void replace(final CallGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        lock.writeLock().lock();
        try {
            current = graph;
            generation++;
            LOG.info("Call graph replaced (generation {}): {} nodes, {} edges",
                    generation, graph.nodeCount(), graph.edgeCount());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs a read-only query against the live graph.
     *
     * @param query the query, receives the live graph
     * @param <T> the query result type
     * @return the query result
     */
    public <T> T read(final Function<CallGraph, T> query) {
        Preconditions.requireNonNull(query, "Query is required");

        lock.readLock().lock();
        try {
            return query.apply(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns how many times the graph has been replaced.
     *
     * @return the generation, 0 before the first analysis
     */
    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

}
