package co.fanki.callgraphmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Call Graph MCP Server Application.
 *
 * <p>Main entry point of a Model Context Protocol server that lets an
 * agent ask structural questions about C/C++ code: who calls a function,
 * what it calls, where the call cycles are, and which functions are never
 * called.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CallGraphMcpServerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CallGraphMcpServerApplication.class, args);
    }

}
