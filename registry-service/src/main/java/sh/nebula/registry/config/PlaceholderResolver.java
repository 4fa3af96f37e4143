package sh.nebula.registry.config;

import java.util.Objects;
import java.util.function.Function;

/**
 * Expands {@code ${NAME}} and {@code ${NAME:default}} placeholders. Defaults may
 * themselves contain placeholders, e.g. {@code ${A:${B:fallback}}}.
 */
public final class PlaceholderResolver {

    private final Function<String, String> lookup;

    public PlaceholderResolver(Function<String, String> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public static PlaceholderResolver systemEnvironment() {
        return new PlaceholderResolver(System::getenv);
    }

    public String lookup(String name) {
        String value = lookup.apply(name);
        return value == null || value.isBlank() ? null : value;
    }

    public String resolve(String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        StringBuilder result = new StringBuilder();
        int index = 0;
        while (index < value.length()) {
            int start = value.indexOf("${", index);
            if (start < 0) {
                result.append(value, index, value.length());
                break;
            }
            int end = findClosing(value, start + 2);
            if (end < 0) {
                result.append(value, index, value.length());
                break;
            }
            result.append(value, index, start);
            result.append(expand(value.substring(start + 2, end)));
            index = end + 1;
        }
        return result.toString();
    }

    private String expand(String expression) {
        int separator = topLevelSeparator(expression);
        String name = separator < 0 ? expression : expression.substring(0, separator);
        String value = lookup(name.trim());
        if (value != null) {
            return value;
        }
        return separator < 0 ? "" : resolve(expression.substring(separator + 1));
    }

    private static int findClosing(String value, int from) {
        int depth = 0;
        for (int i = from; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '{' && i > 0 && value.charAt(i - 1) == '$') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    private static int topLevelSeparator(String expression) {
        int depth = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == ':' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
