package co.fanki.callgraphmcp.callgraph.domain;

import java.util.List;

/**
 * Output of a {@link SourceExtractor} run.
 *
 * @param functions the extracted definitions, in source order
 * @param skippedRegions diagnostics for regions that were skipped
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ExtractionResult(
        List<ExtractedFunction> functions,
        List<SkippedRegion> skippedRegions
) {

    /** Defensive copies; null lists become empty. */
    public ExtractionResult {
        functions = functions == null ? List.of() : List.copyOf(functions);
        skippedRegions = skippedRegions == null
                ? List.of() : List.copyOf(skippedRegions);
    }

    /**
     * Creates a result without diagnostics.
     *
     * @param functions the extracted definitions
     * @return the extraction result
     */
    public static ExtractionResult of(final List<ExtractedFunction> functions) {
        return new ExtractionResult(functions, List.of());
    }

    /**
     * Returns an empty result, for sources with no function definitions.
     *
     * @return the empty extraction result
     */
    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }

}
