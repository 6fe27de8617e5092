package org.dxworks.notebookdeps.analyzer.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits template text into its {@code {{ }}} and {@code {% %}} tags and tokenizes their
 * contents. Plain text and {@code {# #}} comments are dropped; {@code raw} regions are skipped whole.
 */
final class TemplateLexer {

    enum TagKind { EXPRESSION, STATEMENT }

    enum TokenKind { NAME, STRING, NUMBER, OPERATOR }

    static final class Token {
        final TokenKind kind;
        final String text;

        Token(TokenKind kind, String text) {
            this.kind = kind;
            this.text = text;
        }

        boolean isName() {
            return kind == TokenKind.NAME;
        }

        boolean isName(String name) {
            return kind == TokenKind.NAME && text.equals(name);
        }

        boolean isOperator(String operator) {
            return kind == TokenKind.OPERATOR && text.equals(operator);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    static final class Tag {
        final TagKind kind;
        final List<Token> tokens;
        final int line;

        Tag(TagKind kind, List<Token> tokens, int line) {
            this.kind = kind;
            this.tokens = tokens;
            this.line = line;
        }

        String keyword() {
            return !tokens.isEmpty() && tokens.get(0).isName() ? tokens.get(0).text : "";
        }
    }

    private static final Pattern END_RAW = Pattern.compile("\\{%[-+]?\\s*endraw\\s*[-+]?%\\}");
    private static final String[] TWO_CHAR_OPERATORS = {"==", "!=", "<=", ">=", "//", "**"};

    private final String text;
    private int pos;

    TemplateLexer(String text) {
        this.text = text != null ? text : "";
    }

    List<Tag> tags() {
        List<Tag> tags = new ArrayList<>();
        pos = 0;
        while (true) {
            int open = nextOpening(pos);
            if (open < 0) break;
            int line = lineAt(open);
            char marker = text.charAt(open + 1);
            pos = open + 2;
            if (marker == '#') {
                int close = text.indexOf("#}", pos);
                if (close < 0) {
                    throw new TemplateSyntaxException("missing end of comment tag (line " + line + ")");
                }
                pos = close + 2;
                continue;
            }

            skipWhitespaceControl();
            String closing = marker == '{' ? "}}" : "%}";
            List<Token> tokens = tokenize(closing, line);
            Tag tag = new Tag(marker == '{' ? TagKind.EXPRESSION : TagKind.STATEMENT, tokens, line);
            if (tag.kind == TagKind.STATEMENT && "raw".equals(tag.keyword())) {
                skipRaw(line);
                continue;
            }
            tags.add(tag);
        }
        return tags;
    }

    private int nextOpening(int from) {
        int i = text.indexOf('{', from);
        while (i >= 0 && i + 1 < text.length()) {
            char next = text.charAt(i + 1);
            if (next == '{' || next == '%' || next == '#') return i;
            i = text.indexOf('{', i + 1);
        }
        return -1;
    }

    private void skipWhitespaceControl() {
        if (pos < text.length() && (text.charAt(pos) == '-' || text.charAt(pos) == '+')) {
            pos++;
        }
    }

    private void skipRaw(int line) {
        Matcher matcher = END_RAW.matcher(text);
        if (!matcher.find(pos)) {
            throw new TemplateSyntaxException("missing endraw for raw block opened on line " + line);
        }
        pos = matcher.end();
    }

    private List<Token> tokenize(String closing, int line) {
        List<Token> tokens = new ArrayList<>();
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (depth == 0 && closesAt(pos, closing)) {
                pos = text.startsWith(closing, pos) ? pos + 2 : pos + 3;
                return tokens;
            }
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                    pos++;
                }
                tokens.add(new Token(TokenKind.NAME, text.substring(start, pos)));
            } else if (Character.isDigit(c)) {
                int start = pos;
                while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '.'
                        || text.charAt(pos) == '_')) {
                    pos++;
                }
                tokens.add(new Token(TokenKind.NUMBER, text.substring(start, pos)));
            } else if (c == '\'' || c == '"') {
                tokens.add(new Token(TokenKind.STRING, readString(c, line)));
            } else {
                String operator = readOperator();
                if (operator.equals("(") || operator.equals("[") || operator.equals("{")) depth++;
                if ((operator.equals(")") || operator.equals("]") || operator.equals("}")) && depth > 0) depth--;
                tokens.add(new Token(TokenKind.OPERATOR, operator));
            }
        }
        throw new TemplateSyntaxException("unexpected end of template, expected '" + closing + "' (line " + line + ")");
    }

    private boolean closesAt(int at, String closing) {
        if (text.startsWith(closing, at)) return true;
        char c = text.charAt(at);
        return (c == '-' || c == '+') && text.startsWith(closing, at + 1);
    }

    private String readString(char quote, int line) {
        int start = pos;
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            pos++;
            if (c == quote) {
                return text.substring(start, pos);
            }
        }
        throw new TemplateSyntaxException("unexpected end of string (line " + line + ")");
    }

    private String readOperator() {
        for (String operator : TWO_CHAR_OPERATORS) {
            if (text.startsWith(operator, pos)) {
                pos += 2;
                return operator;
            }
        }
        return String.valueOf(text.charAt(pos++));
    }

    private int lineAt(int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }
}
