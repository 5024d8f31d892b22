package io.github.cyfko.taskql.core.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Normalizes the value of a list-typed user field into comparable tokens.
 * <p>
 * A list value may be a real list or a comma separated string. Strings are split on
 * top-level commas only: commas inside {@code [[...]]} links or quotes stay in their token.
 * A wiki link token yields two tokens, its display text first and the raw link second, so
 * both {@code "Chuck Norris"} and {@code "[[People/Chuck Norris]]"} match.
 * </p>
 *
 * <pre>{@code
 * ListTokens.normalize("[[A,B]], [[C|X,Y]], Z");
 * // ["A,B", "[[A,B]]", "X,Y", "[[C|X,Y]]", "Z"]
 * ListTokens.normalize(List.of("[[People/Chuck Norris]]", "second"));
 * // ["Chuck Norris", "[[People/Chuck Norris]]", "second"]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ListTokens {

    private ListTokens() {
    }

    /**
     * @param raw list, string or scalar; null yields an empty list
     * @return tokens in order, blanks removed
     */
    public static List<String> normalize(Object raw) {
        List<String> tokens = new ArrayList<>();
        if (raw == null) return tokens;

        if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null) expand(ValueCoercion.text(item).trim(), tokens);
            }
        } else if (raw instanceof String text) {
            for (String part : splitTopLevel(text)) {
                expand(part, tokens);
            }
        } else {
            expand(ValueCoercion.text(raw).trim(), tokens);
        }
        return tokens;
    }

    /**
     * @param raw list value
     * @return the first display token, or null when the value has no token
     */
    public static String firstDisplayToken(Object raw) {
        List<String> tokens = normalize(raw);
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int linkDepth = 0;
        char quote = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
                continue;
            }
            if (c == '[' && i + 1 < text.length() && text.charAt(i + 1) == '[') {
                linkDepth++;
                current.append("[[");
                i++;
                continue;
            }
            if (c == ']' && linkDepth > 0 && i + 1 < text.length() && text.charAt(i + 1) == ']') {
                linkDepth--;
                current.append("]]");
                i++;
                continue;
            }
            if ((c == '"' || c == '\'') && linkDepth == 0) {
                quote = c;
                current.append(c);
                continue;
            }
            if (c == ',' && linkDepth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString().trim());
        return parts;
    }

    private static void expand(String token, List<String> out) {
        String t = unquote(token);
        if (t.isEmpty()) return;

        if (t.startsWith("[[") && t.endsWith("]]") && t.length() > 4) {
            String display = linkDisplay(t.substring(2, t.length() - 2));
            if (!display.isEmpty()) out.add(display);
            out.add(t);
            return;
        }
        out.add(t);
    }

    /**
     * Display text of a link target: the alias after {@code |}, otherwise the last path
     * segment without heading or {@code .md} suffix.
     *
     * @param inner link content between the brackets
     * @return display text
     */
    public static String linkDisplay(String inner) {
        int pipe = inner.indexOf('|');
        if (pipe >= 0) return inner.substring(pipe + 1).trim();
        return linkTarget(inner);
    }

    /**
     * Name of the note a link points to, ignoring alias and heading:
     * {@code Projects/Apollo.md#Goals|Moon} gives {@code Apollo}.
     *
     * @param inner link content between the brackets
     * @return target name
     */
    public static String linkTarget(String inner) {
        String target = inner;
        int pipe = target.indexOf('|');
        if (pipe >= 0) target = target.substring(0, pipe);
        int hash = target.indexOf('#');
        if (hash >= 0) target = target.substring(0, hash);
        int slash = target.lastIndexOf('/');
        if (slash >= 0) target = target.substring(slash + 1);
        if (target.endsWith(".md")) target = target.substring(0, target.length() - 3);
        return target.trim();
    }

    private static String unquote(String token) {
        String t = token.trim();
        if (t.length() >= 2 && (t.startsWith("\"") && t.endsWith("\"") || t.startsWith("'") && t.endsWith("'"))) {
            return t.substring(1, t.length() - 1).trim();
        }
        return t;
    }
}
