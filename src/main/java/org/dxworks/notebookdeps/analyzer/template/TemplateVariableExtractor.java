package org.dxworks.notebookdeps.analyzer.template;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the variables a templated SQL query depends on.
 *
 * Two sources are combined: the free variables of the template expressions, and relation names
 * following {@code FROM}, {@code JOIN}, {@code INTO} or {@code UPDATE}, which may refer to data
 * frames queried in memory.
 */
public class TemplateVariableExtractor {

    private static final Pattern EXPRESSION_REGION = Pattern.compile("\\{\\{.*?\\}\\}");
    private static final Pattern STATEMENT_REGION = Pattern.compile("\\{%.*?%\\}", Pattern.DOTALL);

    private static final String RELATION_NAME = "\\s+([a-zA-Z_][a-zA-Z0-9_]*)";
    // matched one keyword at a time so "FROM join x" still yields both candidates
    private static final List<Pattern> RELATION_PATTERNS = List.of(
            Pattern.compile("\\bFROM" + RELATION_NAME, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bJOIN" + RELATION_NAME, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bINTO" + RELATION_NAME, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bUPDATE" + RELATION_NAME, Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> SQL_KEYWORDS = Set.of(
            "select", "where", "group", "order", "having", "limit", "offset", "union", "intersect", "except");

    public Set<String> extract(String sql) {
        String text = sql != null ? sql : "";
        Set<String> variables = new TreeSet<>(new TemplateScanner().freeVariables(text));
        variables.addAll(relationNames(text));
        return variables;
    }

    /**
     * Relation names referenced by the query once every template tag has been cut out.
     */
    public static Set<String> relationNames(String sql) {
        String cleanSql = EXPRESSION_REGION.matcher(sql).replaceAll("");
        cleanSql = STATEMENT_REGION.matcher(cleanSql).replaceAll("");

        Set<String> relations = new TreeSet<>();
        for (Pattern pattern : RELATION_PATTERNS) {
            Matcher matcher = pattern.matcher(cleanSql);
            while (matcher.find()) {
                String candidate = matcher.group(1);
                if (!SQL_KEYWORDS.contains(candidate.toLowerCase(Locale.ROOT))) {
                    relations.add(candidate);
                }
            }
        }
        return relations;
    }
}
