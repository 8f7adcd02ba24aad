package co.fanki.callgraphmcp.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Call Graph MCP Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Call Graph MCP Server API")
                        .description("""
                                Call Graph MCP Server - lets an AI agent query the call
                                structure of a C/C++ codebase instead of reading raw source.

                                ## Operations
                                - **Analyze**: build the call graph from source text or a directory
                                - **Navigate**: direct callers and callees of a function
                                - **Inspect**: call cycles (including self-recursion) and orphan functions

                                ## MCP Tools
                                - `analyze_codebase` / `analyze_directory` - rebuild the graph
                                - `get_callers` / `get_callees` - one-hop navigation
                                - `detect_cycles` - every cycle, as a closed path
                                - `get_orphan_functions` - defined but never called
                                - `list_functions` - every function with its degrees
                                """)
                        .version("0.0.1"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
