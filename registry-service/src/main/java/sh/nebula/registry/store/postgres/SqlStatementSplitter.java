package sh.nebula.registry.store.postgres;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a migration script on top-level semicolons, dropping {@code --} and block comments.
 */
final class SqlStatementSplitter {

    private SqlStatementSplitter() {
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null || script.isBlank()) {
            return statements;
        }

        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < script.length()) {
            char c = script.charAt(i);
            char next = i + 1 < script.length() ? script.charAt(i + 1) : '\0';

            if (!quoted && c == '-' && next == '-') {
                int end = script.indexOf('\n', i);
                i = end < 0 ? script.length() : end + 1;
                continue;
            }
            if (!quoted && c == '/' && next == '*') {
                int end = script.indexOf("*/", i + 2);
                i = end < 0 ? script.length() : end + 2;
                continue;
            }
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == ';' && !quoted) {
                flush(current, statements);
            } else {
                current.append(c);
            }
            i++;
        }
        flush(current, statements);
        return statements;
    }

    private static void flush(StringBuilder current, List<String> statements) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }
}
