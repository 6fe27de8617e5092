package org.dxworks.notebookdeps.analyzer.python;

import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.util.List;
import java.util.Set;

import static org.dxworks.notebookdeps.analyzer.TreeSitterHelper.*;

/**
 * Rejects code the tree-sitter grammar accepts without error nodes but Python 3 does not compile:
 * Python 2 {@code print}/{@code exec} statements, indentation the grammar recovers from silently
 * and unparenthesized assignment expressions used as statements.
 */
final class Python3SyntaxCheck {

    private static final Set<String> COMPOUND_STATEMENTS = Set.of(
            "function_definition", "class_definition", "if_statement", "elif_clause", "else_clause",
            "for_statement", "while_statement", "with_statement", "try_statement", "except_clause",
            "except_group_clause", "finally_clause", "match_statement", "case_clause");

    private static final Set<String> CONTINUATION_CLAUSES = Set.of(
            "elif_clause", "else_clause", "except_clause", "except_group_clause", "finally_clause");

    private final byte[] source;

    private Python3SyntaxCheck(byte[] source) {
        this.source = source;
    }

    static void check(TSNode module, byte[] source) {
        new Python3SyntaxCheck(source).checkModule(module);
    }

    private void checkModule(TSNode module) {
        for (TSNode statement : namedChildren(module)) {
            if (!isComment(statement) && startsLine(statement) && statement.getStartPoint().getColumn() > 0) {
                throw indentationError("unexpected indent", statement.getStartPoint());
            }
            visit(statement);
        }
    }

    private void visit(TSNode node) {
        switch (node.getType()) {
            case "print_statement":
                if (!isParenthesizedCall(node)) {
                    throw syntaxError("Missing parentheses in call to 'print'", node.getStartPoint());
                }
                break;
            case "exec_statement":
                throw syntaxError("Missing parentheses in call to 'exec'", node.getStartPoint());
            case "expression_statement":
                for (TSNode child : namedChildren(node)) {
                    if ("named_expression".equals(child.getType())) {
                        throw syntaxError("invalid syntax", child.getStartPoint());
                    }
                }
                break;
            default:
                break;
        }

        if (COMPOUND_STATEMENTS.contains(node.getType())) {
            checkCompound(node);
        }
        for (TSNode child : namedChildren(node)) {
            visit(child);
        }
    }

    private void checkCompound(TSNode header) {
        TSPoint headerStart = header.getStartPoint();
        for (TSNode child : namedChildren(header)) {
            if ("block".equals(child.getType())) {
                checkBody(child, headerStart);
            } else if (CONTINUATION_CLAUSES.contains(child.getType()) && startsLine(child)
                    && child.getStartPoint().getColumn() != headerStart.getColumn()) {
                throw indentationError("unindent does not match any outer indentation level", child.getStartPoint());
            }
        }
    }

    private void checkBody(TSNode block, TSPoint headerStart) {
        TSNode firstStatement = null;
        for (TSNode statement : namedChildren(block)) {
            if (!isComment(statement)) {
                firstStatement = statement;
                break;
            }
        }
        if (firstStatement == null) {
            throw indentationError("expected an indented block after line " + (headerStart.getRow() + 1),
                    block.getStartPoint());
        }
        // comments may sit at any indentation; the first statement decides
        TSPoint bodyStart = firstStatement.getStartPoint();
        if (bodyStart.getRow() > headerStart.getRow() && bodyStart.getColumn() <= headerStart.getColumn()) {
            throw indentationError("expected an indented block after line " + (headerStart.getRow() + 1), bodyStart);
        }
    }

    /**
     * {@code print(x)} and {@code print(a, b)} may be read as a statement with one parenthesized operand;
     * both are valid calls.
     */
    private static boolean isParenthesizedCall(TSNode printStatement) {
        List<TSNode> operands = namedChildren(printStatement);
        return operands.size() == 1 && isNodeTypeOneOf(operands.get(0), "parenthesized_expression", "tuple");
    }

    private static boolean isComment(TSNode node) {
        return "comment".equals(node.getType());
    }

    /**
     * Whether only whitespace precedes the node on its physical line and that line does not
     * continue the previous one with a backslash.
     */
    private boolean startsLine(TSNode node) {
        int i = Math.min(node.getStartByte(), source.length) - 1;
        while (i >= 0 && source[i] != '\n') {
            if (source[i] != ' ' && source[i] != '\t' && source[i] != '\f') return false;
            i--;
        }
        int previous = i - 1;
        if (previous >= 0 && source[previous] == '\r') previous--;
        return previous < 0 || source[previous] != '\\';
    }

    private static PythonSyntaxException syntaxError(String reason, TSPoint at) {
        return new PythonSyntaxException(reason, at.getRow() + 1, at.getColumn());
    }

    private static PythonIndentationException indentationError(String reason, TSPoint at) {
        return new PythonIndentationException(reason, at.getRow() + 1, at.getColumn());
    }
}
