package org.dxworks.notebookdeps.analyzer.python;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import static org.dxworks.notebookdeps.analyzer.TreeSitterHelper.*;

/**
 * Scope-tracking analyzer for one Python fragment.
 *
 * Determines the names bound at module scope, the reads that resolve to such a global and the
 * local aliases created by imports. Bindings inside functions and classes stay local unless the
 * same name is also bound at module level; a {@code global} declaration on its own does not
 * create a module binding.
 *
 * A fragment tree-sitter parses but Python 3 would refuse to compile fails with
 * {@link PythonSyntaxException} or its {@link PythonIndentationException} subtype.
 */
public class PythonScopeAnalyzer {

    public ScopeAnalysis analyze(String sourceCode) {
        String code = sourceCode != null ? sourceCode : "";
        byte[] source = utf8(code);

        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        TSTree tree = parser.parseString(null, code);
        TSNode rootNode = tree.getRootNode();

        TSNode errorNode = findFirstErrorNode(rootNode);
        if (errorNode != null) {
            throw syntaxError(errorNode);
        }
        Python3SyntaxCheck.check(rootNode, source);

        ScopeAnalysis analysis = new ScopeAnalysis();
        new ScopeWalker(source, analysis, ScopeWalker.Pass.BINDINGS).walk(rootNode);
        new ScopeWalker(source, analysis, ScopeWalker.Pass.USES).walk(rootNode);
        return analysis;
    }

    private static PythonSyntaxException syntaxError(TSNode errorNode) {
        TSPoint start = errorNode.getStartPoint();
        String reason = errorNode.isMissing()
                ? "expected '" + errorNode.getType() + "'"
                : "invalid syntax";
        return new PythonSyntaxException(reason, start.getRow() + 1, start.getColumn());
    }
}
