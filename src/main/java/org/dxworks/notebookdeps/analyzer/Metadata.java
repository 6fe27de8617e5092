package org.dxworks.notebookdeps.analyzer;

import java.util.Collections;
import java.util.Map;

/**
 * Lenient accessors for block metadata. A missing, null or mistyped value reads as absent:
 * an unconfigured widget is a valid authoring state, not an error.
 */
public final class Metadata {

    public static final String VARIABLE_NAME = "deepnote_variable_name";
    public static final String BIG_NUMBER_VALUE = "deepnote_big_number_value";
    public static final String BIG_NUMBER_COMPARISON_VALUE = "deepnote_big_number_comparison_value";
    public static final String FUNCTION_INPUTS = "function_notebook_inputs";
    public static final String FUNCTION_EXPORT_MAPPINGS = "function_notebook_export_mappings";

    private Metadata() {}

    /** Non-empty string value, or null. */
    public static String text(Map<?, ?> metadata, String key) {
        if (metadata == null) return null;
        Object value = metadata.get(key);
        if (value instanceof String && !((String) value).isEmpty()) {
            return (String) value;
        }
        return null;
    }

    public static Map<?, ?> section(Map<?, ?> metadata, String key) {
        if (metadata == null) return Collections.emptyMap();
        Object value = metadata.get(key);
        if (value instanceof Map) {
            return (Map<?, ?>) value;
        }
        return Collections.emptyMap();
    }
}
