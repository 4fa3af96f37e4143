package sh.nebula.registry.console;

import org.fusesource.jansi.Ansi;

import java.util.ArrayList;
import java.util.List;

/**
 * Box-drawn table for console listings.
 */
public class TableFormatter {

    private final List<String> headers = new ArrayList<>();
    private final List<Integer> widths = new ArrayList<>();
    private final List<List<String>> rows = new ArrayList<>();

    public TableFormatter addHeaders(String... values) {
        for (String header : values) {
            headers.add(header);
            widths.add(header.length());
        }
        return this;
    }

    /**
     * Extra values beyond the header count are dropped; missing ones render blank.
     */
    public TableFormatter addRow(String... values) {
        List<String> row = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = i < values.length && values[i] != null ? values[i] : "";
            row.add(value);
            widths.set(i, Math.max(widths.get(i), visibleLength(value)));
        }
        rows.add(row);
        return this;
    }

    public int rowCount() {
        return rows.size();
    }

    public String build() {
        StringBuilder sb = new StringBuilder();
        sb.append(border('┌', '┬', '┐')).append('\n');
        appendLine(sb, headers);
        sb.append(border('├', '┼', '┤')).append('\n');
        for (List<String> row : rows) {
            appendLine(sb, row);
        }
        sb.append(border('└', '┴', '┘'));
        return sb.toString();
    }

    public static String green(String text) {
        return Ansi.ansi().fgGreen().a(text).reset().toString();
    }

    public static String red(String text) {
        return Ansi.ansi().fgRed().a(text).reset().toString();
    }

    public static String yellow(String text) {
        return Ansi.ansi().fgYellow().a(text).reset().toString();
    }

    private void appendLine(StringBuilder sb, List<String> cells) {
        sb.append('│');
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            sb.append(' ').append(cell).append(" ".repeat(widths.get(i) - visibleLength(cell))).append(" │");
        }
        sb.append('\n');
    }

    private String border(char left, char middle, char right) {
        StringBuilder sb = new StringBuilder().append(left);
        for (int i = 0; i < widths.size(); i++) {
            sb.append("─".repeat(widths.get(i) + 2));
            sb.append(i < widths.size() - 1 ? middle : right);
        }
        return sb.toString();
    }

    // ANSI escapes take no columns
    private static int visibleLength(String text) {
        return text.replaceAll("\u001B\\[[;\\d]*m", "").length();
    }
}
