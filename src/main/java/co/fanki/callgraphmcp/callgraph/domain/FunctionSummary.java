package co.fanki.callgraphmcp.callgraph.domain;

/**
 * Snapshot of a single node of the call graph.
 *
 * @param name the function name
 * @param defined true if a body with this name was ingested
 * @param callerCount the number of direct callers
 * @param calleeCount the number of direct callees
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FunctionSummary(
        String name,
        boolean defined,
        int callerCount,
        int calleeCount
) {
}
