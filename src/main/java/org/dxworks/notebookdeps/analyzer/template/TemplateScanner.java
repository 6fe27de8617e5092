package org.dxworks.notebookdeps.analyzer.template;

import org.dxworks.notebookdeps.analyzer.template.TemplateLexer.Tag;
import org.dxworks.notebookdeps.analyzer.template.TemplateLexer.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the free variables of a Jinja-style template: names the template reads but never binds
 * itself through {@code for}, {@code set}, {@code macro}, {@code with}, {@code call} or imports.
 *
 * Filters ({@code | inclause}, {@code | bind}, {@code | sqlsafe} and any other) and tests
 * ({@code is defined}) are never variables, so no filter registry is needed to read a template.
 */
final class TemplateScanner {

    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else",
            "true", "false", "none", "True", "False", "None");

    private static final Set<String> INCLUDE_MODIFIERS = Set.of(
            "ignore", "missing", "with", "without", "context");

    private static final Set<String> SCOPE_CLOSERS = Set.of(
            "endfor", "endmacro", "endwith", "endcall");

    private final Deque<Set<String>> scopes = new ArrayDeque<>();
    private final Set<String> free = new LinkedHashSet<>();

    Set<String> freeVariables(String template) {
        scopes.clear();
        free.clear();
        scopes.push(new HashSet<>());
        for (Tag tag : new TemplateLexer(template).tags()) {
            if (tag.kind == TemplateLexer.TagKind.EXPRESSION) {
                readExpression(tag.tokens, 0, tag.tokens.size());
            } else {
                statement(tag.tokens, tag.keyword());
            }
        }
        return new LinkedHashSet<>(free);
    }

    private void statement(List<Token> tokens, String keyword) {
        int size = tokens.size();
        switch (keyword) {
            case "for":
                forLoop(tokens);
                break;
            case "set":
                assignment(tokens);
                break;
            case "macro":
                macro(tokens);
                break;
            case "call":
                callBlock(tokens);
                break;
            case "with":
                withBlock(tokens);
                break;
            case "import":
                importTemplate(tokens);
                break;
            case "from":
                fromImport(tokens);
                break;
            case "include":
            case "extends":
                readExpressionExcept(tokens, 1, size, INCLUDE_MODIFIERS);
                break;
            case "filter":
                // the filter name itself is not a variable, its arguments may be
                readExpression(tokens, 2, size);
                break;
            case "block":
            case "else":
            case "endif":
            case "endset":
            case "endfilter":
            case "endblock":
            case "endautoescape":
            case "endtrans":
                break;
            default:
                if (SCOPE_CLOSERS.contains(keyword)) {
                    if (scopes.size() > 1) scopes.pop();
                } else {
                    readExpression(tokens, keyword.isEmpty() ? 0 : 1, size);
                }
        }
    }

    private void forLoop(List<Token> tokens) {
        int in = indexOfName(tokens, "in", 1);
        if (in < 0) {
            readExpression(tokens, 1, tokens.size());
            return;
        }
        int condition = indexOfName(tokens, "if", in + 1);
        int end = condition >= 0 ? condition : tokens.size();
        if (end > in + 1 && tokens.get(end - 1).isName("recursive")) end--;

        readExpression(tokens, in + 1, end);

        Set<String> loopScope = new HashSet<>(names(tokens, 1, in));
        loopScope.add("loop");
        scopes.push(loopScope);
        if (condition >= 0) {
            int conditionEnd = tokens.get(tokens.size() - 1).isName("recursive") ? tokens.size() - 1 : tokens.size();
            readExpression(tokens, condition + 1, conditionEnd);
        }
    }

    private void assignment(List<Token> tokens) {
        int equals = indexOfOperator(tokens, "=", 1);
        if (equals < 0) {
            // block set: {% set name %}...{% endset %}, optionally filtered
            if (tokens.size() > 1 && tokens.get(1).isName()) {
                bind(tokens.get(1).text);
            }
            return;
        }
        readExpression(tokens, equals + 1, tokens.size());
        if (indexOfOperator(tokens, ".", 1) >= 0 && indexOfOperator(tokens, ".", 1) < equals) {
            // namespace attribute: {% set ns.total = ... %} reads ns
            read(tokens.get(1).text);
            return;
        }
        for (String name : names(tokens, 1, equals)) {
            bind(name);
        }
    }

    private void macro(List<Token> tokens) {
        if (tokens.size() < 2 || !tokens.get(1).isName()) return;
        bind(tokens.get(1).text);
        Set<String> parameters = new HashSet<>(List.of("varargs", "kwargs", "caller"));
        if (tokens.size() > 2 && tokens.get(2).isOperator("(")) {
            parameters.addAll(parameterList(tokens, 2));
        }
        scopes.push(parameters);
    }

    private void callBlock(List<Token> tokens) {
        Set<String> parameters = new HashSet<>();
        int expressionStart = 1;
        if (tokens.size() > 1 && tokens.get(1).isOperator("(")) {
            parameters.addAll(parameterList(tokens, 1));
            expressionStart = matchingClose(tokens, 1) + 1;
        }
        readExpression(tokens, expressionStart, tokens.size());
        scopes.push(parameters);
    }

    private void withBlock(List<Token> tokens) {
        Set<String> bound = new HashSet<>();
        for (int[] part : splitTopLevel(tokens, 1, tokens.size())) {
            int equals = indexOfOperator(tokens, "=", part[0]);
            if (equals >= 0 && equals < part[1]) {
                readExpression(tokens, equals + 1, part[1]);
                bound.addAll(names(tokens, part[0], equals));
            } else {
                readExpression(tokens, part[0], part[1]);
            }
        }
        scopes.push(bound);
    }

    private void importTemplate(List<Token> tokens) {
        int as = indexOfName(tokens, "as", 1);
        readExpressionExcept(tokens, 1, as >= 0 ? as : tokens.size(), INCLUDE_MODIFIERS);
        if (as >= 0 && as + 1 < tokens.size() && tokens.get(as + 1).isName()) {
            bind(tokens.get(as + 1).text);
        }
    }

    private void fromImport(List<Token> tokens) {
        int importIndex = indexOfName(tokens, "import", 1);
        if (importIndex < 0) {
            readExpression(tokens, 1, tokens.size());
            return;
        }
        readExpression(tokens, 1, importIndex);
        for (int[] part : splitTopLevel(tokens, importIndex + 1, tokens.size())) {
            List<String> parts = new ArrayList<>(names(tokens, part[0], part[1]));
            parts.removeAll(INCLUDE_MODIFIERS);
            parts.remove("as");
            if (!parts.isEmpty()) {
                bind(parts.get(parts.size() - 1));
            }
        }
    }

    // --- expressions ---

    private void readExpression(List<Token> tokens, int from, int to) {
        readExpressionExcept(tokens, from, to, Set.of());
    }

    private void readExpressionExcept(List<Token> tokens, int from, int to, Set<String> ignored) {
        int depth = 0;
        for (int i = Math.max(from, 0); i < to && i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOperator("(") || token.isOperator("[") || token.isOperator("{")) depth++;
            if (token.isOperator(")") || token.isOperator("]") || token.isOperator("}")) depth = Math.max(0, depth - 1);
            if (!token.isName() || KEYWORDS.contains(token.text) || ignored.contains(token.text)) continue;

            Token previous = i > from ? tokens.get(i - 1) : null;
            if (previous != null && (previous.isOperator(".") || previous.isOperator("|"))) continue;
            if (isTestName(tokens, i, from)) continue;
            if (depth > 0 && i + 1 < to && tokens.get(i + 1).isOperator("=")) continue;
            read(token.text);
        }
    }

    private static boolean isTestName(List<Token> tokens, int i, int from) {
        if (i - 1 >= from && tokens.get(i - 1).isName("is")) return true;
        return i - 2 >= from && tokens.get(i - 1).isName("not") && tokens.get(i - 2).isName("is");
    }

    private void read(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return;
        }
        free.add(name);
    }

    private void bind(String name) {
        scopes.peek().add(name);
    }

    // --- token helpers ---

    private static Set<String> parameterList(List<Token> tokens, int open) {
        Set<String> parameters = new HashSet<>();
        int close = matchingClose(tokens, open);
        for (int[] part : splitTopLevel(tokens, open + 1, close)) {
            if (part[0] < part[1] && tokens.get(part[0]).isName()) {
                parameters.add(tokens.get(part[0]).text);
            }
        }
        return parameters;
    }

    private static int matchingClose(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).isOperator("(")) depth++;
            if (tokens.get(i).isOperator(")") && --depth == 0) return i;
        }
        return tokens.size();
    }

    /**
     * Ranges {@code [start, end)} between top-level commas.
     */
    private static List<int[]> splitTopLevel(List<Token> tokens, int from, int to) {
        List<int[]> parts = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.isOperator("(") || token.isOperator("[") || token.isOperator("{")) depth++;
            if (token.isOperator(")") || token.isOperator("]") || token.isOperator("}")) depth--;
            if (depth == 0 && token.isOperator(",")) {
                parts.add(new int[]{start, i});
                start = i + 1;
            }
        }
        if (start < to) parts.add(new int[]{start, to});
        return parts;
    }

    private static List<String> names(List<Token> tokens, int from, int to) {
        List<String> result = new ArrayList<>();
        for (int i = from; i < to && i < tokens.size(); i++) {
            if (tokens.get(i).isName()) result.add(tokens.get(i).text);
        }
        return result;
    }

    private static int indexOfName(List<Token> tokens, String name, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (tokens.get(i).isName(name)) return i;
        }
        return -1;
    }

    private static int indexOfOperator(List<Token> tokens, String operator, int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (tokens.get(i).isOperator(operator)) return i;
        }
        return -1;
    }
}
