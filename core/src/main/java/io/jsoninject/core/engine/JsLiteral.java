package io.jsoninject.core.engine;

/**
 * Escaping for text embedded as a JavaScript string literal inside an HTML {@code <script>}
 * element.
 *
 * <p>Backslash, both quote characters, control characters, {@code <}, {@code >}, {@code &},
 * {@code /} and U+2028/U+2029 are replaced by escape sequences. The output therefore never
 * contains a raw quote, a line break or the sequence {@code </script>}, whatever the input.
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class JsLiteral {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private JsLiteral() {}

    /**
     * Escapes {@code text} and surrounds it with {@code quote}.
     *
     * @param text  the raw text
     * @param quote {@code '"'} or {@code '\''}
     * @return a complete string literal
     * @throws IllegalArgumentException if {@code quote} is not a quote character
     */
    public static String quote(String text, char quote) {
        if (quote != '"' && quote != '\'') {
            throw new IllegalArgumentException("quote must be ' or \", got: " + quote);
        }
        String escaped = escape(text);
        return new StringBuilder(escaped.length() + 2)
                .append(quote)
                .append(escaped)
                .append(quote)
                .toString();
    }

    /**
     * Escapes {@code text} without adding quotes. {@code null} is treated as empty.
     *
     * @param text the raw text
     * @return the escaped body of a string literal
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = null;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            String replacement = replacementFor(c);
            if (replacement == null) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(length + 16);
                out.append(text, 0, i);
            }
            out.append(replacement);
        }
        return out == null ? text : out.toString();
    }

    private static String replacementFor(char c) {
        switch (c) {
            case '\\':
                return "\\\\";
            case '"':
                return "\\\"";
            case '\'':
                return "\\'";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            case '\t':
                return "\\t";
            case '\b':
                return "\\b";
            case '\f':
                return "\\f";
            case '/':
                return "\\/";
            case '<':
            case '>':
            case '&':
            case '\u2028':
            case '\u2029':
            case '\u007f':
                return unicodeEscape(c);
            default:
                return c < 0x20 ? unicodeEscape(c) : null;
        }
    }

    private static String unicodeEscape(char c) {
        return new String(new char[] {
            '\\', 'u', HEX[(c >> 12) & 0xF], HEX[(c >> 8) & 0xF], HEX[(c >> 4) & 0xF], HEX[c & 0xF]
        });
    }
}
