package co.fanki.callgraphmcp.config;

import co.fanki.callgraphmcp.callgraph.application.CallGraphQueryService;
import co.fanki.callgraphmcp.shared.DomainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Configures the MCP stdio server transport for agent integration.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. Every tool delegates to
 * {@link CallGraphQueryService} and answers with a JSON text payload.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String ANALYZE_CODEBASE_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "code": {
                  "type": "string",
                  "description": "The full C/C++ source code to analyze"
                }
              },
              "required": ["code"]
            }
            """;

    private static final String ANALYZE_DIRECTORY_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "path": {
                  "type": "string",
                  "description": "A directory on the server holding C/C++ sources"
                }
              },
              "required": ["path"]
            }
            """;

    private static final String FUNCTION_NAME_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "functionName": {
                  "type": "string",
                  "description": "The function name, e.g. process_client or Account::deposit"
                }
              },
              "required": ["functionName"]
            }
            """;

    private static final String NO_ARGUMENTS_SCHEMA = """
            {
              "type": "object",
              "properties": {}
            }
            """;

    /** A tool body: receives the raw arguments, returns the payload. */
    @FunctionalInterface
    private interface ToolCall {
        Object call(Map<String, Object> arguments);
    }

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param queryService the service that handles all tool operations
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final CallGraphQueryService queryService,
            final ObjectMapper objectMapper) {

        final List<McpServerFeatures.SyncToolSpecification> tools = List.of(
                tool(objectMapper, "analyze_codebase",
                        "Parse C/C++ source code and build the call graph."
                                + " Call this first. Replaces any graph"
                                + " built before. Malformed code is"
                                + " skipped, not rejected; skipped regions"
                                + " are listed in the result.",
                        ANALYZE_CODEBASE_SCHEMA,
                        args -> queryService.analyzeCodebase(
                                stringArgument(args, "code"))),
                tool(objectMapper, "analyze_directory",
                        "Read every C/C++ file under a server-side"
                                + " directory and build the call graph"
                                + " from all of them. Replaces any graph"
                                + " built before.",
                        ANALYZE_DIRECTORY_SCHEMA,
                        args -> queryService.analyzeDirectory(
                                stringArgument(args, "path"))),
                tool(objectMapper, "get_callers",
                        "List the functions that directly call the given"
                                + " function (one hop). known=false means"
                                + " the function is not in the graph.",
                        FUNCTION_NAME_SCHEMA,
                        args -> queryService.callerRelations(
                                stringArgument(args, "functionName"))),
                tool(objectMapper, "get_callees",
                        "List the functions directly called by the given"
                                + " function (one hop). known=false means"
                                + " the function is not in the graph.",
                        FUNCTION_NAME_SCHEMA,
                        args -> queryService.calleeRelations(
                                stringArgument(args, "functionName"))),
                tool(objectMapper, "detect_cycles",
                        "Find circular call chains, including direct"
                                + " recursion. Each cycle is a path that"
                                + " starts and ends with the same function.",
                        NO_ARGUMENTS_SCHEMA,
                        args -> queryService.detectCycles()),
                tool(objectMapper, "get_orphan_functions",
                        "List functions that are defined in the analyzed"
                                + " code but never called by it. Calls to"
                                + " external functions are not reported.",
                        NO_ARGUMENTS_SCHEMA,
                        args -> queryService.getOrphanFunctions()),
                tool(objectMapper, "list_functions",
                        "List every function in the graph with whether it"
                                + " is defined and its caller and callee"
                                + " counts.",
                        NO_ARGUMENTS_SCHEMA,
                        args -> queryService.listFunctions()));

        // Registered at build time: nothing may be written before initialize.
        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("callgraph-mcp-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .tools(tools)
                .build();

        LOG.info("MCP stdio server initialized with {} tools", tools.size());

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification tool(
            final ObjectMapper objectMapper, final String name,
            final String description, final String schema,
            final ToolCall call) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool(name, description, schema),
                (exchange, arguments) -> {
                    LOG.debug("Tool {} called with {}", name,
                            arguments == null ? Map.of() : arguments.keySet());
                    try {
                        final Object result = call.call(
                                arguments == null ? Map.of() : arguments);
                        return toCallToolResult(objectMapper, result);
                    } catch (final DomainException e) {
                        LOG.warn("Tool {} rejected: [{}] {}", name,
                                e.getErrorCode(), e.getMessage());
                        return errorResult(e);
                    } catch (final Exception e) {
                        LOG.error("Tool {} execution error", name, e);
                        return errorResult(e);
                    }
                }
        );
    }

    private static String stringArgument(final Map<String, Object> arguments,
            final String name) {
        final Object value = arguments.get(name);
        return value instanceof String text ? text : null;
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            LOG.error("Cannot serialize tool result", e);
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
