package co.fanki.callgraphmcp.callgraph.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Carries one function definition found by a {@link SourceExtractor}
 * together with the names it calls.
 *
 * <p>The callee set keeps the order in which calls were found. A source
 * that defines the same name twice produces two records; the
 * {@link CallGraphIngestor} unions them.</p>
 *
 * @param name the defined function name
 * @param callees the names called from the function body, may be empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractedFunction(
        String name,
        Set<String> callees
) {

    /**
     * Copies the callee set so later mutation of the caller's collection
     * cannot leak into an extraction result.
     */
    public ExtractedFunction {
        callees = callees == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(callees));
    }

    /**
     * Creates a record for a function that calls the given names.
     *
     * @param name the defined function name
     * @param callees the called names, in call order
     * @return the extracted function
     */
    public static ExtractedFunction of(final String name,
            final String... callees) {
        final Set<String> calls = new LinkedHashSet<>();
        Collections.addAll(calls, callees);
        return new ExtractedFunction(name, calls);
    }

}
