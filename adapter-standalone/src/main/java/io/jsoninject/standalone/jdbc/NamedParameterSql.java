package io.jsoninject.standalone.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A statement whose {@code :NAME} bind references were replaced by JDBC {@code ?} placeholders.
 *
 * <p>References are recognized only in SQL text: never inside {@code '...'} literals, {@code
 * "..."} quoted identifiers, {@code --} line comments or {@code /* *}{@code /} block comments. A
 * double colon ({@code ::} cast) is left alone. Names are upper-cased so that they match {@link
 * io.jsoninject.core.model.BindContext} items.
 *
 * @param sql   the JDBC statement text
 * @param names bind names in placeholder order; a name may appear several times
 */
public record NamedParameterSql(String sql, List<String> names) {

    public NamedParameterSql {
        Objects.requireNonNull(sql, "sql must not be null");
        names = List.copyOf(names);
    }

    /** Rewrites {@code statement}, collecting its bind names. */
    public static NamedParameterSql parse(String statement) {
        Objects.requireNonNull(statement, "statement must not be null");
        StringBuilder out = new StringBuilder(statement.length());
        List<String> names = new ArrayList<>();
        int length = statement.length();
        int i = 0;
        while (i < length) {
            char c = statement.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(statement, i, c);
                out.append(statement, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && statement.charAt(i + 1) == '-') {
                int end = statement.indexOf('\n', i);
                end = end < 0 ? length : end;
                out.append(statement, i, end);
                i = end;
            } else if (c == '/' && i + 1 < length && statement.charAt(i + 1) == '*') {
                int end = statement.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                out.append(statement, i, end);
                i = end;
            } else if (c == ':' && i + 1 < length && statement.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
            } else if (c == ':' && i + 1 < length && isNameStart(statement.charAt(i + 1))) {
                int end = i + 2;
                while (end < length && isNamePart(statement.charAt(end))) {
                    end++;
                }
                names.add(statement.substring(i + 1, end).toUpperCase(Locale.ROOT));
                out.append('?');
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return new NamedParameterSql(out.toString(), names);
    }

    /** Index just past the closing quote; a doubled quote is an escaped quote. */
    private static int skipQuoted(String s, int start, char quote) {
        int i = start + 1;
        while (i < s.length()) {
            if (s.charAt(i) == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }
}
