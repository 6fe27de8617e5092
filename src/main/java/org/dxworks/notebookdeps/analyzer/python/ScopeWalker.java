package org.dxworks.notebookdeps.analyzer.python;

import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.dxworks.notebookdeps.analyzer.TreeSitterHelper.*;

/**
 * Depth-first walk over a tree-sitter Python tree.
 *
 * The same walk runs twice: {@link Pass#BINDINGS} records module-scope bindings and imports,
 * {@link Pass#USES} then classifies reads against the complete set of module bindings, so a read
 * inside a function of a name assigned further down the fragment still counts.
 *
 * All traversal state lives in this instance; a walker is used for one pass over one tree.
 */
final class ScopeWalker {

    enum Pass { BINDINGS, USES }

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final byte[] source;
    private final ScopeAnalysis names;
    private final Pass pass;
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    // lambda parameters and comprehension targets, innermost first
    private final Deque<Set<String>> expressionLocals = new ArrayDeque<>();

    ScopeWalker(byte[] source, ScopeAnalysis names, Pass pass) {
        this.source = source;
        this.names = names;
        this.pass = pass;
    }

    void walk(TSNode module) {
        frames.push(ScopeFrame.module());
        visitChildren(module);
        frames.pop();
    }

    private void visit(TSNode node) {
        if (!isPresent(node) || !node.isNamed()) return;
        switch (node.getType()) {
            case "identifier":
                read(text(node));
                break;
            case "attribute":
                visitAttribute(node);
                break;
            case "dotted_name":
                visitDottedName(node);
                break;
            case "assignment":
                visitAssignment(node);
                break;
            case "augmented_assignment":
                visitAugmentedAssignment(node);
                break;
            case "named_expression":
                visitNamedExpression(node);
                break;
            case "for_statement":
                visitForStatement(node);
                break;
            case "with_item":
                visitWithItem(node);
                break;
            case "as_pattern":
                visitAsPattern(node);
                break;
            case "except_clause":
            case "except_group_clause":
                visitExceptClause(node);
                break;
            case "decorated_definition":
                visitDecoratedDefinition(node);
                break;
            case "function_definition":
                visitFunctionDefinition(node);
                break;
            case "class_definition":
                visitClassDefinition(node);
                break;
            case "lambda":
                visitLambda(node);
                break;
            case "list_comprehension":
            case "set_comprehension":
            case "dictionary_comprehension":
            case "generator_expression":
                visitComprehension(node);
                break;
            case "global_statement":
                visitGlobalStatement(node);
                break;
            case "import_statement":
            case "import_from_statement":
            case "future_import_statement":
                visitImport(node);
                break;
            case "keyword_argument":
                visit(getChildByFieldName(node, "value"));
                break;
            case "delete_statement":
                visitDeleteStatement(node);
                break;
            case "type_alias_statement":
                visitTypeAlias(node);
                break;
            case "nonlocal_statement":
            case "case_pattern":
            case "comment":
                break;
            default:
                visitChildren(node);
        }
    }

    private void visitChildren(TSNode node) {
        for (TSNode child : namedChildren(node)) {
            visit(child);
        }
    }

    // --- reads ---

    private void read(String name) {
        if (pass != Pass.USES || name == null) return;
        if (PythonBuiltins.isBuiltin(name)) return;
        for (Set<String> locals : expressionLocals) {
            if (locals.contains(name)) return;
        }
        ScopeFrame frame = frames.peek();
        if (frame.isModule() || frame.isDeclaredGlobal(name) || names.isGlobal(name)) {
            names.addUsed(name);
        }
    }

    private void visitAttribute(TSNode node) {
        TSNode object = getChildByFieldName(node, "object");
        if (isNodeTypeOneOf(object, "identifier")) {
            read(text(object));
        } else {
            visit(object);
        }
    }

    private void visitDottedName(TSNode node) {
        List<TSNode> parts = namedChildren(node);
        if (!parts.isEmpty()) {
            read(text(parts.get(0)));
        }
    }

    // --- bindings ---

    private void bind(String name) {
        if (pass != Pass.BINDINGS || name == null) return;
        if (frames.peek().isModule()) {
            names.addGlobal(name);
        }
    }

    /**
     * Binds every plain name in an assignment target. Attribute and subscript targets bind nothing
     * and are walked as reads of their base.
     */
    private void bindTarget(TSNode target) {
        if (!isPresent(target)) return;
        switch (target.getType()) {
            case "identifier":
                bind(text(target));
                break;
            case "pattern_list":
            case "tuple_pattern":
            case "list_pattern":
            case "tuple":
            case "list":
            case "expression_list":
            case "parenthesized_expression":
            case "list_splat_pattern":
            case "list_splat":
                for (TSNode element : namedChildren(target)) {
                    bindTarget(element);
                }
                break;
            case "as_pattern_target":
                bindAsPatternTarget(target);
                break;
            default:
                visit(target);
        }
    }

    private void bindAsPatternTarget(TSNode target) {
        List<TSNode> children = namedChildren(target);
        if (children.isEmpty()) {
            String name = text(target);
            if (name != null && IDENTIFIER.matcher(name.trim()).matches()) {
                bind(name.trim());
            }
            return;
        }
        for (TSNode child : children) {
            bindTarget(child);
        }
    }

    private void visitAssignment(TSNode node) {
        visit(getChildByFieldName(node, "type"));
        visit(getChildByFieldName(node, "right"));
        bindTarget(getChildByFieldName(node, "left"));
    }

    private void visitAugmentedAssignment(TSNode node) {
        visit(getChildByFieldName(node, "right"));
        bindTarget(getChildByFieldName(node, "left"));
    }

    private void visitNamedExpression(TSNode node) {
        visit(getChildByFieldName(node, "value"));
        bindTarget(getChildByFieldName(node, "name"));
    }

    private void visitForStatement(TSNode node) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if ("left".equals(node.getFieldNameForChild(i))) {
                bindTarget(child);
            } else {
                visit(child);
            }
        }
    }

    private void visitWithItem(TSNode node) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if ("alias".equals(node.getFieldNameForChild(i))) {
                bindTarget(child);
            } else {
                visit(child);
            }
        }
    }

    private void visitAsPattern(TSNode node) {
        List<TSNode> children = namedChildren(node);
        if (!children.isEmpty()) {
            visit(children.get(0));
        }
        bindTarget(getChildByFieldName(node, "alias"));
    }

    /**
     * The name bound by {@code except E as e} is handler-local: the exception type is read, the
     * alias is neither bound nor read.
     */
    private void visitExceptClause(TSNode node) {
        boolean afterAs = false;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!isPresent(child)) continue;
            if (!child.isNamed()) {
                afterAs = afterAs || "as".equals(child.getType());
                continue;
            }
            if ("as_pattern".equals(child.getType())) {
                List<TSNode> parts = namedChildren(child);
                if (!parts.isEmpty()) visit(parts.get(0));
            } else if (afterAs && !"block".equals(child.getType())) {
                afterAs = false;
            } else {
                visit(child);
            }
        }
    }

    private void visitDeleteStatement(TSNode node) {
        for (TSNode target : namedChildren(node)) {
            if ("expression_list".equals(target.getType())) {
                for (TSNode element : namedChildren(target)) {
                    visitDeleteTarget(element);
                }
            } else {
                visitDeleteTarget(target);
            }
        }
    }

    private void visitDeleteTarget(TSNode target) {
        if (!"identifier".equals(target.getType())) {
            visit(target);
        }
    }

    private void visitTypeAlias(TSNode node) {
        TSNode left = getChildByFieldName(node, "left");
        TSNode name = firstIdentifier(left);
        if (name != null) {
            bind(text(name));
        }
        visit(getChildByFieldName(node, "right"));
    }

    // --- scopes ---

    private void visitDecoratedDefinition(TSNode node) {
        for (TSNode child : namedChildren(node)) {
            if ("decorator".equals(child.getType())) {
                visitChildren(child);
            }
        }
        visit(getChildByFieldName(node, "definition"));
    }

    /**
     * The function name is bound in the enclosing scope, as are the defaults and annotations that
     * are evaluated at definition time. Only the body runs in the new frame.
     */
    private void visitFunctionDefinition(TSNode node) {
        String name = text(getChildByFieldName(node, "name"));
        bind(name);

        TSNode parameters = getChildByFieldName(node, "parameters");
        for (TSNode parameter : namedChildren(parameters)) {
            visit(getChildByFieldName(parameter, "type"));
            visit(getChildByFieldName(parameter, "value"));
        }
        visit(getChildByFieldName(node, "return_type"));

        frames.push(ScopeFrame.function());
        visit(getChildByFieldName(node, "body"));
        frames.pop();
    }

    private void visitClassDefinition(TSNode node) {
        String name = text(getChildByFieldName(node, "name"));
        bind(name);
        visit(getChildByFieldName(node, "superclasses"));

        frames.push(ScopeFrame.classBody(frames.peek()));
        visit(getChildByFieldName(node, "body"));
        frames.pop();
    }

    private void visitLambda(TSNode node) {
        TSNode parameters = getChildByFieldName(node, "parameters");
        Set<String> locals = new HashSet<>();
        for (TSNode parameter : namedChildren(parameters)) {
            collectParameterName(parameter, locals);
            visit(getChildByFieldName(parameter, "value"));
        }

        expressionLocals.push(locals);
        visit(getChildByFieldName(node, "body"));
        expressionLocals.pop();
    }

    private void collectParameterName(TSNode parameter, Set<String> into) {
        switch (parameter.getType()) {
            case "identifier":
                into.add(text(parameter));
                break;
            case "default_parameter":
            case "typed_default_parameter":
                collectParameterName(getChildByFieldName(parameter, "name"), into);
                break;
            case "typed_parameter":
            case "list_splat_pattern":
            case "dictionary_splat_pattern":
                TSNode name = firstIdentifier(parameter);
                if (name != null) into.add(text(name));
                break;
            default:
                break;
        }
    }

    /**
     * Comprehension targets are local to the comprehension. The first iterable is evaluated in the
     * enclosing scope; everything else sees the targets.
     */
    private void visitComprehension(TSNode node) {
        Set<String> locals = new HashSet<>();
        TSNode firstClause = null;
        for (TSNode child : namedChildren(node)) {
            if ("for_in_clause".equals(child.getType())) {
                if (firstClause == null) firstClause = child;
                collectTargetNames(getChildByFieldName(child, "left"), locals);
            }
        }

        if (firstClause != null) {
            for (TSNode iterable : getChildrenByFieldName(firstClause, "right")) {
                visit(iterable);
            }
        }

        expressionLocals.push(locals);
        for (TSNode child : namedChildren(node)) {
            if (!"for_in_clause".equals(child.getType())) {
                visit(child);
            } else if (child.getStartByte() != firstClause.getStartByte()) {
                for (TSNode iterable : getChildrenByFieldName(child, "right")) {
                    visit(iterable);
                }
            }
        }
        expressionLocals.pop();
    }

    private void collectTargetNames(TSNode target, Set<String> into) {
        if (!isPresent(target)) return;
        if ("identifier".equals(target.getType())) {
            into.add(text(target));
            return;
        }
        for (TSNode child : namedChildren(target)) {
            collectTargetNames(child, into);
        }
    }

    private void visitGlobalStatement(TSNode node) {
        for (TSNode child : namedChildren(node)) {
            if ("identifier".equals(child.getType())) {
                frames.peek().declareGlobal(text(child));
            }
        }
    }

    // --- imports ---

    private void visitImport(TSNode node) {
        if (pass != Pass.BINDINGS) return;
        for (TSNode imported : getChildrenByFieldName(node, "name")) {
            if ("aliased_import".equals(imported.getType())) {
                names.addImport(compact(text(getChildByFieldName(imported, "alias"))));
            } else {
                names.addImport(compact(text(imported)));
            }
        }
    }

    // --- helpers ---

    private String text(TSNode node) {
        return getNodeText(source, node);
    }

    private static String compact(String dottedName) {
        return dottedName == null ? null : dottedName.replaceAll("\\s+", "");
    }

    private static TSNode firstIdentifier(TSNode node) {
        if (!isPresent(node)) return null;
        if ("identifier".equals(node.getType())) return node;
        for (TSNode child : namedChildren(node)) {
            TSNode found = firstIdentifier(child);
            if (found != null) return found;
        }
        return null;
    }
}
