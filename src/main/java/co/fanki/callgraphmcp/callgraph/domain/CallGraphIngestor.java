package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns extracted function records into {@link CallGraph} content.
 *
 * <p>Ingestion replaces whatever the target graph held: it is cleared
 * first, then records are applied in order. A name defined more than once
 * keeps the union of all its callee sets, since error-tolerant extraction
 * can emit duplicate or partial definitions and none of their edges may be
 * dropped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallGraphIngestor {

    private static final Logger LOG = LoggerFactory.getLogger(
            CallGraphIngestor.class);

    /**
     * Rebuilds the given graph from the extracted records.
     *
     * @param graph the graph to rebuild, cleared before ingestion
     * @param functions the extracted records, in source order
     * @return the number of distinct nodes in the rebuilt graph
     */
    public int ingest(final CallGraph graph,
            final List<ExtractedFunction> functions) {

        Preconditions.requireNonNull(graph, "Target graph is required");
        Preconditions.requireNonNull(functions, "Extracted functions are required");

        graph.clear();

        int skipped = 0;
        for (final ExtractedFunction function : functions) {
            if (function == null || isBlank(function.name())) {
                skipped++;
                continue;
            }
            graph.markDefined(function.name());

            for (final String callee : function.callees()) {
                if (isBlank(callee)) {
                    LOG.debug("Ignoring blank callee in {}", function.name());
                    continue;
                }
                graph.addEdge(function.name(), callee);
            }
        }

        if (skipped > 0) {
            LOG.warn("Ignored {} unnamed function record(s)", skipped);
        }
        LOG.info("Ingested {} records into {} nodes ({} defined), {} edges",
                functions.size(), graph.nodeCount(), graph.definedCount(),
                graph.edgeCount());

        return graph.nodeCount();
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

}
