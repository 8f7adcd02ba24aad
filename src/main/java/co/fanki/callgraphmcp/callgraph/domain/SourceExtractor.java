package co.fanki.callgraphmcp.callgraph.domain;

import co.fanki.callgraphmcp.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract strategy that turns source text into function/call facts.
 *
 * <p>Implementations are fault tolerant: malformed regions are skipped
 * and reported as {@link SkippedRegion} diagnostics instead of failing
 * the whole extraction. The graph core only ever sees the resulting
 * {@link ExtractedFunction} records, never syntax trees.</p>
 *
 * <p>{@link #extract(String)} is the template method; subclasses provide
 * the language-specific {@link #doExtract(String)}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceExtractor.class);

    /**
     * Returns the language identifier for this extractor.
     *
     * @return the language name (e.g., "cpp")
     */
    public abstract String language();

    /**
     * Performs the language-specific extraction.
     *
     * @param source the source text, never null or blank
     * @return the extraction result, never null
     * @throws ParseUnavailableException if the extractor cannot run
     */
    protected abstract ExtractionResult doExtract(String source);

    /**
     * Extracts function definitions and their calls from source text.
     *
     * <p>Blank sources short-circuit to an empty result.</p>
     *
     * @param source the source text
     * @return the extraction result
     * @throws ParseUnavailableException if the extractor cannot run
     */
    public ExtractionResult extract(final String source) {
        Preconditions.requireNonNull(source, "Source text is required");

        if (source.isBlank()) {
            LOG.info("Empty {} source, nothing to extract", language());
            return ExtractionResult.empty();
        }

        LOG.info("Extracting {} functions from {} characters of source",
                language(), source.length());

        final ExtractionResult result = doExtract(source);

        if (!result.skippedRegions().isEmpty()) {
            LOG.warn("Skipped {} malformed region(s) while extracting {}",
                    result.skippedRegions().size(), language());
        }
        LOG.info("Extracted {} function definitions",
                result.functions().size());

        return result;
    }

}
