package org.dxworks.notebookdeps.analyzer.python;

import java.util.Set;

/**
 * Names that resolve to Python builtins and therefore never create a dependency on another block.
 */
public final class PythonBuiltins {

    private static final Set<String> NAMES = Set.of(
            "print", "len", "range", "str", "int", "float", "bool", "list", "dict", "set", "tuple",
            "abs", "all", "any", "bin", "callable", "chr", "dir", "enumerate", "eval", "exec",
            "filter", "format", "getattr", "globals", "hasattr", "hash", "help", "hex", "id",
            "input", "isinstance", "issubclass", "iter", "locals", "map", "max", "min", "next",
            "oct", "open", "ord", "pow", "repr", "reversed", "round", "setattr", "sorted", "sum",
            "type", "vars", "zip", "__import__", "True", "False", "None"
    );

    private PythonBuiltins() {}

    public static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }
}
