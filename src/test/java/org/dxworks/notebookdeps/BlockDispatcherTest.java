package org.dxworks.notebookdeps;

import org.dxworks.notebookdeps.analyzer.BlockAnalyzer;
import org.dxworks.notebookdeps.model.AnalysisResult;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.notebookdeps.TestUtils.block;
import static org.dxworks.notebookdeps.TestUtils.map;
import static org.junit.jupiter.api.Assertions.*;

public class BlockDispatcherTest {

    private final BlockDispatcher dispatcher = new BlockDispatcher();

    @Test
    void codeBlock() {
        AnalysisResult result = dispatcher.dispatch(block("b1", "code", "import numpy as np\ny = np.sqrt(x)"));
        assertEquals("b1", result.id);
        assertEquals(List.of("y"), result.definedVariables);
        assertEquals(List.of("np", "x"), result.usedVariables);
        assertEquals(List.of("np"), result.importedModules);
        assertNull(result.error);
    }

    @Test
    void missingTypeIsCode() {
        AnalysisResult result = dispatcher.dispatch(block("b1", null, "a = b"));
        assertEquals(List.of("a"), result.definedVariables);
        assertEquals(List.of("b"), result.usedVariables);
    }

    @Test
    void codeBlockWithMagics() {
        AnalysisResult result = dispatcher.dispatch(block("b1", "code", "%load_ext autoreload\n!ls\nx = 1"));
        assertEquals(List.of("x"), result.definedVariables);
        assertNull(result.error);
    }

    @Test
    void codeSyntaxErrorBecomesErrorResult() {
        AnalysisResult result = dispatcher.dispatch(block("bad", "code", "def broken(:\n"));
        assertEquals("bad", result.id);
        assertTrue(result.hasError());
        assertEquals("SyntaxError", result.error.type);
        assertTrue(result.definedVariables.isEmpty());
        assertTrue(result.usedVariables.isEmpty());
        assertTrue(result.importedModules.isEmpty());
    }

    @Test
    void sqlBlock() {
        AnalysisResult result = dispatcher.dispatch(block("q", "sql",
                "SELECT * FROM df WHERE amount > {{ threshold }}",
                map("deepnote_variable_name", "filtered")));
        assertEquals(List.of("filtered"), result.definedVariables);
        assertEquals(List.of("df", "threshold"), result.usedVariables);
        assertTrue(result.importedModules.isEmpty());
    }

    @Test
    void sqlBlockWithoutConfiguredVariable() {
        AnalysisResult result = dispatcher.dispatch(block("q", "sql", "SELECT 1", map("deepnote_variable_name", "")));
        assertTrue(result.definedVariables.isEmpty());
        assertTrue(result.usedVariables.isEmpty());
    }

    @Test
    void sqlTemplateErrorBecomesErrorResult() {
        AnalysisResult result = dispatcher.dispatch(block("q", "sql", "SELECT {{ x"));
        assertEquals("TemplateSyntaxError", result.error.type);
    }

    @Test
    void buttonBlock() {
        AnalysisResult result = dispatcher.dispatch(block("btn", "button", "", map("deepnote_variable_name", "clicked")));
        assertEquals(List.of("clicked"), result.definedVariables);
        assertTrue(result.usedVariables.isEmpty());
    }

    @Test
    void bigNumberBlock() {
        AnalysisResult result = dispatcher.dispatch(block("n", "big-number", "", map(
                "deepnote_big_number_value", "revenue",
                "deepnote_big_number_comparison_value", "target")));
        assertTrue(result.definedVariables.isEmpty());
        assertEquals(List.of("revenue", "target"), result.usedVariables);
    }

    @Test
    void bigNumberIgnoresNonTextValues() {
        AnalysisResult result = dispatcher.dispatch(block("n", "big-number", "", map(
                "deepnote_big_number_value", 5,
                "deepnote_big_number_comparison_value", null)));
        assertTrue(result.usedVariables.isEmpty());
    }

    @Test
    void inputBlockSanitizesName() {
        AnalysisResult result = dispatcher.dispatch(block("i", "input-text", "", map("deepnote_variable_name", "My Input")));
        assertEquals(List.of("My_Input"), result.definedVariables);
    }

    @Test
    void inputBlockWithEmptyNameFallsBack() {
        AnalysisResult result = dispatcher.dispatch(block("i", "input-slider", "", map("deepnote_variable_name", "")));
        assertEquals(List.of("input_1"), result.definedVariables);
    }

    @Test
    void inputBlockWithoutNameDefinesNothing() {
        AnalysisResult result = dispatcher.dispatch(block("i", "input-select", ""));
        assertTrue(result.definedVariables.isEmpty());
    }

    @Test
    void notebookFunctionBlock() {
        Map<String, Object> metadata = map(
                "function_notebook_inputs", map(
                        "a", map("custom_value", null, "variable_name", "in put"),
                        "b", map("custom_value", "literal", "variable_name", "overridden"),
                        "c", map("variable_name", ""),
                        "d", map("variable_name", "another")),
                "function_notebook_export_mappings", map(
                        "o1", map("enabled", true, "variable_name", "result df"),
                        "o2", map("enabled", false, "variable_name", "skipped"),
                        "o3", map("variable_name", "unset")));
        AnalysisResult result = dispatcher.dispatch(block("fn", "notebook-function", "", metadata));
        assertEquals(List.of("result_df"), result.definedVariables);
        assertEquals(List.of("another", "in_put"), result.usedVariables);
    }

    @Test
    void notebookFunctionIgnoresMalformedMappings() {
        Map<String, Object> metadata = map(
                "function_notebook_inputs", "not a mapping",
                "function_notebook_export_mappings", map(
                        "o1", "not an entry",
                        "o2", map("enabled", "true", "variable_name", "stringly"),
                        "o3", map("enabled", true, "variable_name", 7)));
        AnalysisResult result = dispatcher.dispatch(block("fn", "notebook-function", "", metadata));
        assertNull(result.error);
        assertTrue(result.definedVariables.isEmpty());
        assertTrue(result.usedVariables.isEmpty());
    }

    @Test
    void unknownTypeYieldsEmptyResult() {
        AnalysisResult result = dispatcher.dispatch(block("md", "markdown", "# x = y"));
        assertEquals("md", result.id);
        assertTrue(result.definedVariables.isEmpty());
        assertTrue(result.usedVariables.isEmpty());
        assertTrue(result.importedModules.isEmpty());
        assertNull(result.error);
    }

    @Test
    void unexpectedFailureIsReportedByClassName() {
        Map<BlockType, BlockAnalyzer> failing = new EnumMap<>(BlockType.class);
        for (BlockType type : BlockType.values()) {
            failing.put(type, block -> {
                throw new IllegalStateException("boom");
            });
        }
        AnalysisResult result = new BlockDispatcher(failing).dispatch(block("x", "code", "a = 1"));
        assertEquals("x", result.id);
        assertEquals("IllegalStateException", result.error.type);
        assertEquals("boom", result.error.message);
    }

    @Test
    void nullBlockDoesNotThrow() {
        AnalysisResult result = dispatcher.dispatch(null);
        assertTrue(result.hasError());
    }
}
