package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.analyzer.template.TemplateVariableExtractor;
import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

import java.util.List;

/**
 * A query block reads the variables of its template and the in-memory relations it selects from,
 * and defines the data frame it is configured to store its result in.
 */
public class SqlBlockAnalyzer implements BlockAnalyzer {

    private final TemplateVariableExtractor extractor = new TemplateVariableExtractor();

    @Override
    public AnalysisResult analyze(Block block) {
        String variableName = Metadata.text(block.getMetadata(), Metadata.VARIABLE_NAME);
        return AnalysisResult.of(block.getId(),
                variableName != null ? List.of(variableName) : List.of(),
                extractor.extract(block.getContent()));
    }
}
