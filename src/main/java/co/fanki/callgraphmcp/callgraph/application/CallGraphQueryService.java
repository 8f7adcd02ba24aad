package co.fanki.callgraphmcp.callgraph.application;

import co.fanki.callgraphmcp.callgraph.domain.CallGraph;
import co.fanki.callgraphmcp.callgraph.domain.CallGraphIngestor;
import co.fanki.callgraphmcp.callgraph.domain.CallGraphTraversal;
import co.fanki.callgraphmcp.callgraph.domain.CycleDetector;
import co.fanki.callgraphmcp.callgraph.domain.ExtractionResult;
import co.fanki.callgraphmcp.callgraph.domain.FunctionSummary;
import co.fanki.callgraphmcp.callgraph.domain.GraphService;
import co.fanki.callgraphmcp.callgraph.domain.SkippedRegion;
import co.fanki.callgraphmcp.callgraph.domain.SourceExtractor;
import co.fanki.callgraphmcp.shared.DomainException;
import co.fanki.callgraphmcp.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application service behind every call-graph operation.
 *
 * <p>Validates requests, runs analyses and answers queries against the
 * graph held by {@link GraphService}. This is the only place that reads
 * the live graph, and it mutates it only through the analyze swap.</p>
 *
 * <p>Analysis flow: source text -> {@link SourceExtractor} -> fresh
 * {@link CallGraph} via {@link CallGraphIngestor} -> swap into
 * {@link GraphService}. Extraction and ingestion run outside any lock; if
 * either fails, the previous graph stays live.</p>
 *
 * <p>Query flow: validate identifier -> shared lock -> one traversal ->
 * immutable result.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class CallGraphQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(
            CallGraphQueryService.class);

    private final GraphService graphService;
    private final SourceExtractor sourceExtractor;
    private final CallGraphIngestor ingestor;
    private final CycleDetector cycleDetector;
    private final CallGraphTraversal traversal;
    private final SourceTreeReader sourceTreeReader;
    private final int maxSourceLength;

    /**
     * Creates a new CallGraphQueryService.
     *
     * @param theGraphService the holder of the live graph
     * @param theSourceExtractor the extractor that turns source into facts
     * @param theSourceTreeReader the reader behind
     *        {@link #analyzeDirectory(String)}
     * @param theMaxSourceLength the largest source text accepted, in chars
     */
    public CallGraphQueryService(
            final GraphService theGraphService,
            final SourceExtractor theSourceExtractor,
            final SourceTreeReader theSourceTreeReader,
            @Value("${callgraph.analysis.max-source-length:10000000}")
            final int theMaxSourceLength) {
        this.graphService = theGraphService;
        this.sourceExtractor = theSourceExtractor;
        this.sourceTreeReader = theSourceTreeReader;
        this.ingestor = new CallGraphIngestor();
        this.cycleDetector = new CycleDetector();
        this.traversal = new CallGraphTraversal();
        this.maxSourceLength = theMaxSourceLength;
    }

    /**
     * Extracts the call structure of a source text and replaces the live
     * graph with it.
     *
     * <p>Malformed source never fails this call; it yields fewer functions
     * and the skipped regions are reported in the result.</p>
     *
     * @param sourceText the full source text, may be empty
     * @return the analysis summary
     * @throws DomainException with {@code INVALID_ARGUMENT} for a null or
     *         oversized source, {@code PARSE_UNAVAILABLE} if the extractor
     *         cannot run
     */
    public AnalysisResult analyzeCodebase(final String sourceText) {
        if (sourceText == null) {
            throw DomainException.invalidArgument("Source code is required");
        }
        if (sourceText.length() > maxSourceLength) {
            throw DomainException.invalidArgument("Source code is "
                    + sourceText.length() + " characters, the limit is "
                    + maxSourceLength);
        }

        LOG.info("Starting codebase analysis ({} characters)",
                sourceText.length());

        final ExtractionResult extraction = sourceExtractor.extract(sourceText);

        final CallGraph graph = new CallGraph();
        final int nodeCount = ingestor.ingest(graph, extraction.functions());
        graphService.replace(graph);

        LOG.info("Analysis complete: {} functions, {} edges, {} skipped"
                + " region(s)", nodeCount, graph.edgeCount(),
                extraction.skippedRegions().size());

        return new AnalysisResult(nodeCount, graph.definedCount(),
                graph.edgeCount(), extraction.skippedRegions(),
                "Successfully analyzed codebase. Graph built with "
                        + nodeCount + " functions.");
    }

    /**
     * Reads every C/C++ source file under a directory and analyzes them
     * as one codebase.
     *
     * <p>Files are concatenated in path order, so results are stable for
     * a given tree. Bytes that are not valid UTF-8 are replaced rather
     * than rejected. Reading stops as soon as the sources exceed the
     * configured limit.</p>
     *
     * @param directory the directory to scan recursively
     * @return the analysis summary
     * @throws DomainException with {@code INVALID_ARGUMENT} if the path is
     *         blank, malformed or not a directory, or the sources are too
     *         large; {@code SOURCE_UNREADABLE} if the tree cannot be read
     */
    public AnalysisResult analyzeDirectory(final String directory) {
        return analyzeCodebase(sourceTreeReader.read(directory,
                maxSourceLength));
    }

    /**
     * Returns the direct callers of a function.
     *
     * @param functionName the function to look up
     * @return the callers in node creation order, empty if none or unknown
     * @throws DomainException with {@code INVALID_ARGUMENT} if the name is
     *         null or blank
     */
    public List<String> getCallers(final String functionName) {
        final String function = Preconditions.requireFunctionName(
                functionName);
        final List<String> callers = graphService.read(
                graph -> traversal.upstreamCallers(graph, function));
        LOG.debug("Callers of {}: {}", function, callers);
        return callers;
    }

    /**
     * Returns the direct callees of a function.
     *
     * @param functionName the function to look up
     * @return the callees in node creation order, empty if none or unknown
     * @throws DomainException with {@code INVALID_ARGUMENT} if the name is
     *         null or blank
     */
    public List<String> getCallees(final String functionName) {
        final String function = Preconditions.requireFunctionName(
                functionName);
        final List<String> callees = graphService.read(
                graph -> traversal.downstreamDependencies(graph, function));
        LOG.debug("Callees of {}: {}", function, callees);
        return callees;
    }

    /**
     * Returns the direct callers of a function, flagging unknown names.
     *
     * <p>An unknown name is not an error; {@code known} tells an agent
     * that the empty list means "no such function" rather than "nobody
     * calls it".</p>
     *
     * @param functionName the function to look up
     * @return the callers and whether the function exists
     * @throws DomainException with {@code INVALID_ARGUMENT} if the name is
     *         null or blank
     */
    public FunctionRelations callerRelations(final String functionName) {
        final String function = Preconditions.requireFunctionName(
                functionName);
        return graphService.read(graph -> new FunctionRelations(function,
                graph.contains(function),
                traversal.upstreamCallers(graph, function)));
    }

    /**
     * Returns the direct callees of a function, flagging unknown names.
     *
     * @param functionName the function to look up
     * @return the callees and whether the function exists
     * @throws DomainException with {@code INVALID_ARGUMENT} if the name is
     *         null or blank
     */
    public FunctionRelations calleeRelations(final String functionName) {
        final String function = Preconditions.requireFunctionName(
                functionName);
        return graphService.read(graph -> new FunctionRelations(function,
                graph.contains(function),
                traversal.downstreamDependencies(graph, function)));
    }

    /**
     * Returns every cycle of the live graph, self-recursion included.
     *
     * @return the cycles, each starting and ending with the same function
     */
    public List<List<String>> detectCycles() {
        final List<List<String>> cycles = graphService.read(
                cycleDetector::detectCycles);
        LOG.debug("Detected {} cycle(s)", cycles.size());
        return cycles;
    }

    /**
     * Returns the defined functions that nothing calls.
     *
     * @return the orphan functions in node creation order
     */
    public List<String> getOrphanFunctions() {
        final List<String> orphans = graphService.read(
                traversal::orphanFunctions);
        LOG.debug("Found {} orphan function(s)", orphans.size());
        return orphans;
    }

    /**
     * Returns a summary of every function in the live graph.
     *
     * @return one summary per node, in creation order
     */
    public List<FunctionSummary> listFunctions() {
        return graphService.read(traversal::summarize);
    }

    /**
     * Checks if the live graph knows a function.
     *
     * @param functionName the function to look up
     * @return true if the function is a node of the live graph
     * @throws DomainException with {@code INVALID_ARGUMENT} if the name is
     *         null or blank
     */
    public boolean contains(final String functionName) {
        final String function = Preconditions.requireFunctionName(
                functionName);
        return graphService.read(graph -> graph.contains(function));
    }

    /**
     * Returns the number of nodes in the live graph.
     *
     * @return the node count
     */
    public int nodeCount() {
        return graphService.read(CallGraph::nodeCount);
    }

    /**
     * Summary of a completed analysis.
     *
     * @param nodeCount the number of distinct functions in the new graph
     * @param definedCount how many of them have an ingested body
     * @param edgeCount the number of distinct call edges
     * @param skippedRegions the regions the extractor could not parse
     * @param message a human-readable status line
     */
    public record AnalysisResult(
            int nodeCount,
            int definedCount,
            int edgeCount,
            List<SkippedRegion> skippedRegions,
            String message) {}

    /**
     * One-hop neighbours of a function.
     *
     * @param function the queried function
     * @param known false if the function is not in the graph
     * @param functions the callers or callees, in node creation order
     */
    public record FunctionRelations(
            String function,
            boolean known,
            List<String> functions) {}

}
