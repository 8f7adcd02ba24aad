package co.fanki.callgraphmcp.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * Switches the application to a console-silent, non-web process when the
 * MCP stdio server is enabled.
 *
 * <p>In stdio mode stdout carries JSON-RPC only, so the banner is turned
 * off and no servlet container is started. The switch follows the
 * {@code mcp.server.stdio} property wherever it comes from (application
 * file, {@code MCP_SERVER_STDIO}, command line or the {@code stdio}
 * profile).</p>
 *
 * <p>Runs after the config data post processor so the application files
 * are already loaded. Registered in {@code META-INF/spring.factories}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StdioModeEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    /** Name of the property source added in stdio mode. */
    static final String PROPERTY_SOURCE_NAME = "mcpStdioMode";

    private static final Map<String, Object> STDIO_PROPERTIES = Map.of(
            "spring.main.web-application-type", "none",
            "spring.main.banner-mode", "off");

    /** {@inheritDoc} */
    @Override
    public void postProcessEnvironment(
            final ConfigurableEnvironment environment,
            final SpringApplication application) {

        final boolean stdio = environment.getProperty(
                "mcp.server.stdio", Boolean.class, Boolean.FALSE);
        if (!stdio) {
            return;
        }
        environment.getPropertySources().addFirst(
                new MapPropertySource(PROPERTY_SOURCE_NAME, STDIO_PROPERTIES));
    }

    /** {@inheritDoc} */
    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }

}
