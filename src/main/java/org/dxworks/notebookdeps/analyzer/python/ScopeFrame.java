package org.dxworks.notebookdeps.analyzer.python;

import java.util.HashSet;
import java.util.Set;

/**
 * One lexical scope on the walker's stack. Functions start with an empty set of names redeclared
 * {@code global}; class bodies share the set of the scope they are nested in.
 */
final class ScopeFrame {

    enum Kind { MODULE, FUNCTION, CLASS }

    private final Kind kind;
    private final Set<String> declaredGlobals;

    private ScopeFrame(Kind kind, Set<String> declaredGlobals) {
        this.kind = kind;
        this.declaredGlobals = declaredGlobals;
    }

    static ScopeFrame module() {
        return new ScopeFrame(Kind.MODULE, new HashSet<>());
    }

    static ScopeFrame function() {
        return new ScopeFrame(Kind.FUNCTION, new HashSet<>());
    }

    static ScopeFrame classBody(ScopeFrame enclosing) {
        return new ScopeFrame(Kind.CLASS, enclosing.declaredGlobals);
    }

    boolean isModule() {
        return kind == Kind.MODULE;
    }

    void declareGlobal(String identifier) {
        declaredGlobals.add(identifier);
    }

    boolean isDeclaredGlobal(String identifier) {
        return declaredGlobals.contains(identifier);
    }
}
