package org.dxworks.notebookdeps.analyzer.python;

/**
 * Jupyter magics ({@code %}) and shell escapes ({@code !}) are not Python. They are commented out
 * rather than removed so line numbers in syntax errors stay accurate.
 */
public final class ShellEscapes {

    private ShellEscapes() {}

    public static String neutralize(String code) {
        if (code == null || code.isEmpty()) return "";
        String[] lines = code.split("\n", -1);
        StringBuilder sb = new StringBuilder(code.length() + 8);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            if (line.startsWith("%") || line.startsWith("!")) {
                sb.append('#');
            }
            sb.append(line);
        }
        return sb.toString();
    }
}
