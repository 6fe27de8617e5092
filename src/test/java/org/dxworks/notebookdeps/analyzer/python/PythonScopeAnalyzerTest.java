package org.dxworks.notebookdeps.analyzer.python;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PythonScopeAnalyzerTest {

    private final PythonScopeAnalyzer analyzer = new PythonScopeAnalyzer();

    @Test
    void readBeforeAssignmentIsStillAGlobalRead() {
        ScopeAnalysis analysis = analyzer.analyze("y = x + 1\nx = 2");
        assertEquals(List.of("x", "y"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("x"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void builtinsAreNeverUsedVariables() {
        ScopeAnalysis analysis = analyzer.analyze("print(len([1,2]))");
        assertTrue(analysis.getGlobalVars().isEmpty());
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
    }

    @Test
    void functionLocalsStayLocal() {
        ScopeAnalysis analysis = analyzer.analyze("def f():\n    z = 1\n");
        assertEquals(List.of("f"), List.copyOf(analysis.getGlobalVars()));
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
    }

    @Test
    void globalDeclarationAloneDoesNotDefineModuleName() {
        ScopeAnalysis analysis = analyzer.analyze("def f():\n    global w\n    w = 5\n");
        assertEquals(List.of("f"), List.copyOf(analysis.getGlobalVars()));
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
    }

    @Test
    void functionReadsNameItDeclaredGlobal() {
        ScopeAnalysis analysis = analyzer.analyze("def f():\n    global w\n    return w\n");
        assertEquals(List.of("f"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("w"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void nestedFunctionDoesNotInheritGlobalDeclaration() {
        ScopeAnalysis analysis = analyzer.analyze(
                "def f():\n    global w\n    def g():\n        return w\n    return g\n");
        assertEquals(List.of("f"), List.copyOf(analysis.getGlobalVars()));
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
    }

    @Test
    void classBodySharesEnclosingGlobalDeclaration() {
        ScopeAnalysis analysis = analyzer.analyze(
                "def f():\n    global w\n    class C:\n        value = w\n    return C\n");
        assertEquals(List.of("f"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("w"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void globalDeclarationEndsWithItsFunction() {
        ScopeAnalysis analysis = analyzer.analyze(
                "def f():\n    global w\n    return w\ndef h():\n    return w\n");
        assertEquals(List.of("f", "h"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("w"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void functionBodyReadsOnlyModuleBindings() {
        ScopeAnalysis analysis = analyzer.analyze("a = 1\ndef g():\n    return a + b\n");
        assertEquals(List.of("a", "g"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("a"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void functionMayReadNameBoundFurtherDown() {
        ScopeAnalysis analysis = analyzer.analyze("@cache\ndef load():\n    return source\nsource = 1\n");
        assertEquals(List.of("load", "source"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("cache", "source"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void comprehensionTargetsAreLocal() {
        ScopeAnalysis analysis = analyzer.analyze("result = [i * factor for i in items]");
        assertEquals(List.of("result"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("factor", "items"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void lambdaParametersAreLocalButDefaultsAreRead() {
        ScopeAnalysis analysis = analyzer.analyze("f = lambda x, y=default: x + y + z");
        assertEquals(List.of("f"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("default", "z"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void importsRecordAliasesAndSkipWildcards() {
        ScopeAnalysis analysis = analyzer.analyze(
                "import os.path\n"
                        + "import numpy as np\n"
                        + "from collections import OrderedDict, defaultdict as dd\n"
                        + "from math import *\n");
        assertEquals(List.of("OrderedDict", "dd", "np", "os.path"), List.copyOf(analysis.getImportedModules()));
        assertTrue(analysis.getGlobalVars().isEmpty());
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
    }

    @Test
    void attributeAndKeywordNamesAreNotVariables() {
        ScopeAnalysis analysis = analyzer.analyze("df.plot(x=col)");
        assertEquals(List.of("col", "df"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void walrusBindsAtModuleScope() {
        ScopeAnalysis analysis = analyzer.analyze("if (n := len(data)) > 10:\n    print(n)\n");
        assertEquals(List.of("n"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("data", "n"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void forTargetsAreBound() {
        ScopeAnalysis analysis = analyzer.analyze("for key, value in pairs:\n    total = value\n");
        assertEquals(List.of("key", "total", "value"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("pairs", "value"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void withAliasIsBound() {
        ScopeAnalysis analysis = analyzer.analyze("with open(path) as fh:\n    content = fh.read()\n");
        assertEquals(List.of("content", "fh"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("fh", "path"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void classBasesAreReadInEnclosingScope() {
        ScopeAnalysis analysis = analyzer.analyze("class Model(Base):\n    def fit(self):\n        return self\n");
        assertEquals(List.of("Model"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("Base"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    @Test
    void augmentedAssignmentOnlyBinds() {
        ScopeAnalysis analysis = analyzer.analyze("counter += 1");
        assertEquals(List.of("counter"), List.copyOf(analysis.getGlobalVars()));
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
    }

    @Test
    void emptySourceYieldsNothing() {
        ScopeAnalysis analysis = analyzer.analyze("");
        assertTrue(analysis.getGlobalVars().isEmpty());
        assertTrue(analysis.getUsedGlobalVars().isEmpty());
        assertTrue(analysis.getImportedModules().isEmpty());
    }

    @Test
    void syntaxErrorReportsLocation() {
        PythonSyntaxException e = assertThrows(PythonSyntaxException.class,
                () -> analyzer.analyze("def broken(:\n"));
        assertEquals("SyntaxError", e.getKind());
        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().matches(".*\\(line 1, column \\d+\\)"), e.getMessage());
    }

    @Test
    void python2PrintStatementIsASyntaxError() {
        assertSyntaxError("SyntaxError", "print \"hello\"");
        assertSyntaxError("SyntaxError", "print 'a', b");
    }

    @Test
    void python2ExecStatementIsASyntaxError() {
        assertSyntaxError("SyntaxError", "exec \"x = 1\"");
    }

    @Test
    void bareAssignmentExpressionIsASyntaxError() {
        assertSyntaxError("SyntaxError", "x := 5");
    }

    @Test
    void indentedFirstStatementIsAnIndentationError() {
        PythonSyntaxException e = assertSyntaxError("IndentationError", "  y = 1");
        assertEquals(1, e.getLine());
        assertEquals(2, e.getColumn());
    }

    @Test
    void bodyNotIndentedPastHeaderIsAnIndentationError() {
        assertSyntaxError("IndentationError", "def f():\nreturn 1");
    }

    @Test
    void misalignedElseIsAnIndentationError() {
        PythonSyntaxException e = assertSyntaxError("IndentationError", "if True:\n  x = 1\n else:\n  y = 2");
        assertEquals(3, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void wellFormedCompoundStatementsPass() {
        ScopeAnalysis analysis = analyzer.analyze(
                "try:\n"
                        + "    run()\n"
                        + "except ValueError:\n"
                        + "    pass\n"
                        + "else:\n"
                        + "    done = True\n"
                        + "finally:\n"
                        + "    cleanup()\n"
                        + "if ready: mode = 1\n"
                        + "else: mode = 2\n"
                        + "a = 1; b = 2\n"
                        + "def g():\n"
                        + "    # body follows\n"
                        + "    print(a)\n");
        assertEquals(List.of("a", "b", "done", "g", "mode"), List.copyOf(analysis.getGlobalVars()));
        assertEquals(List.of("ValueError", "a", "cleanup", "ready", "run"), List.copyOf(analysis.getUsedGlobalVars()));
    }

    private PythonSyntaxException assertSyntaxError(String kind, String code) {
        PythonSyntaxException e = assertThrows(PythonSyntaxException.class, () -> analyzer.analyze(code), code);
        assertEquals(kind, e.getKind(), code);
        return e;
    }
}
