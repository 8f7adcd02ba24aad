package co.fanki.callgraphmcp.callgraph.application;

import co.fanki.callgraphmcp.callgraph.application.CallGraphQueryService.AnalysisResult;
import co.fanki.callgraphmcp.callgraph.domain.FunctionSummary;
import co.fanki.callgraphmcp.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller exposing the call-graph operations over HTTP.
 *
 * <p>Mirrors the MCP tools one to one. Domain errors map to 400 for bad
 * arguments, 503 when the extractor cannot run and 500 when a source tree
 * cannot be read, always with an {@code {error, errorCode}} body.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/callgraph")
@Tag(name = "Call Graph",
        description = "Analyze C/C++ sources and query their call graph")
public class CallGraphController {

    private static final Logger LOG = LoggerFactory.getLogger(
            CallGraphController.class);

    private final CallGraphQueryService queryService;

    /**
     * Creates a new CallGraphController.
     *
     * @param theQueryService the call-graph query service
     */
    public CallGraphController(final CallGraphQueryService theQueryService) {
        this.queryService = theQueryService;
    }

    /**
     * Analyzes source text and replaces the current graph.
     *
     * @param request the request holding the source text
     * @return the analysis summary
     */
    @Operation(
            summary = "Analyze source code",
            description = "Extracts functions and calls from C/C++ source"
                    + " and replaces the current call graph with the result"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Graph rebuilt",
                    content = @Content(schema = @Schema(
                            implementation = AnalysisResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid source"),
            @ApiResponse(responseCode = "503",
                    description = "Parser unavailable")
    })
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(
            @RequestBody final AnalyzeRequest request) {

        LOG.info("Received analyze request");
        return respond(() -> queryService.analyzeCodebase(
                request == null ? null : request.code()));
    }

    /**
     * Analyzes every C/C++ file under a server-side directory.
     *
     * @param request the request holding the directory path
     * @return the analysis summary
     */
    @Operation(
            summary = "Analyze a source directory",
            description = "Reads every C/C++ file under the directory and"
                    + " replaces the current call graph with the result"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Graph rebuilt",
                    content = @Content(schema = @Schema(
                            implementation = AnalysisResult.class))),
            @ApiResponse(responseCode = "400", description = "Missing or"
                    + " invalid directory, or sources over the size limit"),
            @ApiResponse(responseCode = "500",
                    description = "Source tree cannot be read"),
            @ApiResponse(responseCode = "503",
                    description = "Parser unavailable")
    })
    @PostMapping("/analyze-directory")
    public ResponseEntity<?> analyzeDirectory(
            @RequestBody final AnalyzeDirectoryRequest request) {

        LOG.info("Received analyze-directory request: {}",
                request == null ? null : request.path());
        return respond(() -> queryService.analyzeDirectory(
                request == null ? null : request.path()));
    }

    /**
     * Returns the direct callers of a function.
     *
     * @param functionName the function name
     * @return the callers, empty if the function is unknown
     */
    @Operation(summary = "Get direct callers")
    @GetMapping("/callers")
    public ResponseEntity<?> callers(
            @Parameter(description = "Function name", example = "update_balance")
            @RequestParam(required = false) final String functionName) {

        return respond(() -> queryService.callerRelations(functionName));
    }

    /**
     * Returns the direct callees of a function.
     *
     * @param functionName the function name
     * @return the callees, empty if the function is unknown
     */
    @Operation(summary = "Get direct callees")
    @GetMapping("/callees")
    public ResponseEntity<?> callees(
            @Parameter(description = "Function name", example = "process_client")
            @RequestParam(required = false) final String functionName) {

        return respond(() -> queryService.calleeRelations(functionName));
    }

    /**
     * Returns every cycle of the current graph.
     *
     * @return the cycles
     */
    @Operation(summary = "Detect call cycles",
            description = "Each cycle starts and ends with the same function")
    @GetMapping("/cycles")
    public ResponseEntity<List<List<String>>> cycles() {
        return ResponseEntity.ok(queryService.detectCycles());
    }

    /**
     * Returns the defined functions that nothing calls.
     *
     * @return the orphan functions
     */
    @Operation(summary = "Get orphan functions")
    @GetMapping("/orphans")
    public ResponseEntity<List<String>> orphans() {
        return ResponseEntity.ok(queryService.getOrphanFunctions());
    }

    /**
     * Lists every function of the current graph.
     *
     * @return one summary per function
     */
    @Operation(summary = "List functions")
    @GetMapping("/functions")
    public ResponseEntity<List<FunctionSummary>> functions() {
        return ResponseEntity.ok(queryService.listFunctions());
    }

    private ResponseEntity<?> respond(final Supplier<?> operation) {
        try {
            return ResponseEntity.ok(operation.get());
        } catch (final DomainException e) {
            LOG.warn("Call graph request failed: {}", e.getMessage());
            return ResponseEntity.status(statusOf(e)).body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        }
    }

    private static HttpStatus statusOf(final DomainException e) {
        return switch (e.getErrorCode()) {
            case DomainException.INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case DomainException.PARSE_UNAVAILABLE ->
                    HttpStatus.SERVICE_UNAVAILABLE;
            case DomainException.SOURCE_UNREADABLE ->
                    HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Request for source analysis.
     *
     * @param code the full source text
     */
    public record AnalyzeRequest(String code) {}

    /**
     * Request for directory analysis.
     *
     * @param path the directory to scan
     */
    public record AnalyzeDirectoryRequest(String path) {}

}
