package co.fanki.callgraphmcp.config;

import co.fanki.callgraphmcp.callgraph.application.CallGraphQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint that also reports the size of the live graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final CallGraphQueryService queryService;

    /**
     * Creates a new HealthController.
     *
     * @param theQueryService the call-graph query service
     */
    public HealthController(final CallGraphQueryService theQueryService) {
        this.queryService = theQueryService;
    }

    /**
     * Returns health status.
     *
     * @return "up" plus the current node count
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of("status", "up",
                "nodeCount", queryService.nodeCount());
    }

}
