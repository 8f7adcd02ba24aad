package co.fanki.callgraphmcp.config;

import co.fanki.callgraphmcp.callgraph.domain.SourceExtractor;
import co.fanki.callgraphmcp.callgraph.domain.cpp.CppSourceExtractor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the source extraction collaborator.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ExtractionConfiguration {

    /**
     * Creates the tree-sitter backed C/C++ extractor.
     *
     * @return the source extractor
     */
    @Bean
    public SourceExtractor sourceExtractor() {
        return new CppSourceExtractor();
    }

}
