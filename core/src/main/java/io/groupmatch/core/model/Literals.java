package io.groupmatch.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the canonical spec form, the exception renderer and the spec parser:
 * quoting of string literals, type names and regex flag names.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class Literals {

    /** Flag names in bit order, as rendered in {@code flags=...}. */
    private static final Map<String, Integer> FLAGS = new LinkedHashMap<>();

    static {
        FLAGS.put("UNIX_LINES", Pattern.UNIX_LINES);
        FLAGS.put("CASE_INSENSITIVE", Pattern.CASE_INSENSITIVE);
        FLAGS.put("COMMENTS", Pattern.COMMENTS);
        FLAGS.put("MULTILINE", Pattern.MULTILINE);
        FLAGS.put("LITERAL", Pattern.LITERAL);
        FLAGS.put("DOTALL", Pattern.DOTALL);
        FLAGS.put("UNICODE_CASE", Pattern.UNICODE_CASE);
        FLAGS.put("CANON_EQ", Pattern.CANON_EQ);
        FLAGS.put("UNICODE_CHARACTER_CLASS", Pattern.UNICODE_CHARACTER_CLASS);
    }

    private Literals() {}

    /**
     * Quotes a string: single quotes unless the text contains a single quote and no double quote.
     * Backslash, the chosen quote, {@code \n}, {@code \r}, {@code \t} and other control characters
     * are escaped.
     */
    public static String quote(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder out = new StringBuilder(text.length() + 2).append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c == quote) {
                        out.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append(quote).toString();
    }

    /**
     * Reverses {@link #quote(String)}.
     *
     * @param literal the quoted literal including its quotes
     * @throws IllegalArgumentException if the literal is malformed
     */
    public static String unquote(String literal) {
        if (literal.length() < 2) {
            throw new IllegalArgumentException("not a string literal: " + literal);
        }
        char quote = literal.charAt(0);
        if ((quote != '\'' && quote != '"') || literal.charAt(literal.length() - 1) != quote) {
            throw new IllegalArgumentException("not a string literal: " + literal);
        }
        StringBuilder out = new StringBuilder(literal.length());
        int end = literal.length() - 1;
        for (int i = 1; i < end; i++) {
            char c = literal.charAt(i);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (++i >= end) {
                throw new IllegalArgumentException("dangling escape in " + literal);
            }
            char escaped = literal.charAt(i);
            switch (escaped) {
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'x' -> {
                    if (i + 2 >= end) {
                        throw new IllegalArgumentException("truncated \\x escape in " + literal);
                    }
                    out.append((char) Integer.parseInt(literal.substring(i + 1, i + 3), 16));
                    i += 2;
                }
                case '\\', '\'', '"' -> out.append(escaped);
                default -> throw new IllegalArgumentException("unknown escape \\" + escaped + " in " + literal);
            }
        }
        return out.toString();
    }

    /** Simple class name, or the binary name when the class is anonymous. */
    public static String typeName(Class<?> type) {
        String simple = type.getSimpleName();
        return simple.isEmpty() ? type.getName() : simple;
    }

    /** Renders regex flags as {@code CASE_INSENSITIVE|MULTILINE}; empty string for none. */
    public static String flagNames(int flags) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Integer> flag : FLAGS.entrySet()) {
            if ((flags & flag.getValue()) != 0) {
                names.add(flag.getKey());
            }
        }
        return String.join("|", names);
    }

    /**
     * Resolves one flag name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static int flag(String name) {
        Integer value = FLAGS.get(name);
        if (value == null) {
            throw new IllegalArgumentException("unknown regex flag '" + name + "', expected one of " + FLAGS.keySet());
        }
        return value;
    }
}
