package co.fanki.callgraphmcp.callgraph.domain;

/**
 * Diagnostic for a region of source the extractor could not make sense of.
 *
 * <p>Malformed regions never fail an analysis; they are reported so an
 * agent can tell why a function it expected is missing from the graph.</p>
 *
 * @param startLine the 1-based first line of the region
 * @param endLine the 1-based last line of the region
 * @param reason a short description, e.g. "unparseable syntax"
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SkippedRegion(
        int startLine,
        int endLine,
        String reason
) {
}
