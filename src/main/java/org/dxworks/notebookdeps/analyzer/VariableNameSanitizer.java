package org.dxworks.notebookdeps.analyzer;

import java.util.regex.Pattern;

/**
 * Turns a user-facing label into a bare Python identifier, the same way the notebook front end
 * names widget and function variables.
 */
public final class VariableNameSanitizer {

    public static final String EMPTY_FALLBACK = "input_1";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[^0-9a-zA-Z_]");
    private static final Pattern INVALID_LEADING = Pattern.compile("^[^a-zA-Z_]+");

    private VariableNameSanitizer() {}

    public static String sanitize(String name) {
        return sanitize(name, true);
    }

    /**
     * @param emptyFallback when false an input with no usable characters yields {@code ""}
     *                      instead of {@value #EMPTY_FALLBACK}
     */
    public static String sanitize(String name, boolean emptyFallback) {
        String sanitized = name == null ? "" : name;
        // a label such as "2 cool variable" starts at its first letter, not at the underscore
        // its leading gap would turn into
        sanitized = INVALID_LEADING.matcher(sanitized).replaceAll("");
        sanitized = WHITESPACE.matcher(sanitized).replaceAll("_");
        sanitized = INVALID_CHARACTERS.matcher(sanitized).replaceAll("");
        sanitized = INVALID_LEADING.matcher(sanitized).replaceAll("");

        if (sanitized.isEmpty() && emptyFallback) {
            return EMPTY_FALLBACK;
        }
        return sanitized;
    }
}
