package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * A big-number chart reads the variable holding its value and, if set, the one it is compared to.
 */
public class BigNumberBlockAnalyzer implements BlockAnalyzer {

    @Override
    public AnalysisResult analyze(Block block) {
        List<String> used = new ArrayList<>();
        String value = Metadata.text(block.getMetadata(), Metadata.BIG_NUMBER_VALUE);
        String comparisonValue = Metadata.text(block.getMetadata(), Metadata.BIG_NUMBER_COMPARISON_VALUE);
        if (value != null) used.add(value);
        if (comparisonValue != null) used.add(comparisonValue);
        return AnalysisResult.of(block.getId(), List.of(), used);
    }
}
