package io.github.yok.dbbridge.util;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntFunction;
import lombok.Generated;

/**
 * Literal-aware scanning of SQL text.
 *
 * <p>
 * Both operations of this class walk the text once and recognise the regions in which a
 * {@code ;} or {@code ?} character has no syntactic meaning:
 * </p>
 *
 * <ul>
 * <li>single-quoted string literals, with {@code ''} as an escaped quote</li>
 * <li>double-quoted identifiers, with {@code ""} as an escaped quote</li>
 * <li>line comments ({@code -- ...}) and block comments (<code>/* ... *&#47;</code>); block comments
 * nest as in PostgreSQL unless the caller asks for SQLite's non-nesting rule</li>
 * <li>PostgreSQL dollar-quoted bodies ({@code $$ ... $$}, {@code $tag$ ... $tag$})</li>
 * </ul>
 *
 * <p>
 * An unterminated region extends to the end of the text. When splitting, the {@code BEGIN ... END}
 * body of a {@code CREATE TRIGGER} statement is kept in one piece.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlScripts {

    /**
     * Prevents instantiation.
     */
    @Generated
    private SqlScripts() {
        throw new AssertionError("No io.github.yok.dbbridge.util.SqlScripts instances for you!");
    }

    /**
     * Splits a script into statements, nesting block comments.
     *
     * @param script SQL script text
     * @return statements in source order
     * @throws NullPointerException if {@code script} is {@code null}
     * @see #splitStatements(String, boolean)
     */
    public static List<String> splitStatements(String script) {
        return splitStatements(script, true);
    }

    /**
     * Splits a script into statements on the {@code ;} terminator.
     *
     * <p>
     * Terminators inside literals, identifiers, comments, dollar-quoted bodies and trigger bodies
     * do not split. Returned statements are trimmed and do not include the terminator. Chunks that
     * contain only whitespace and comments are discarded. A final statement without terminator is
     * kept.
     * </p>
     *
     * @param script SQL script text
     * @param nestedComments {@code true} when <code>/*</code> inside a block comment opens a nested
     *        comment (PostgreSQL), {@code false} when the first <code>*&#47;</code> closes it
     *        (SQLite)
     * @return statements in source order
     * @throws NullPointerException if {@code script} is {@code null}
     */
    public static List<String> splitStatements(String script, boolean nestedComments) {
        Preconditions.checkNotNull(script, "script must not be null");
        List<String> statements = new ArrayList<>();
        int len = script.length();
        int start = 0;
        boolean hasCode = false;
        // Leading keywords identify CREATE TRIGGER; BEGIN/CASE ... END depth inside its body
        int words = 0;
        boolean create = false;
        boolean trigger = false;
        int blockDepth = 0;
        int i = 0;
        while (i < len) {
            int skipped = skipInert(script, i, nestedComments);
            if (skipped > i) {
                // Literals and identifiers are code, comments are not
                if (!isCommentStart(script, i)) {
                    hasCode = true;
                }
                i = skipped;
                continue;
            }
            char c = script.charAt(i);
            if (isWordStart(script, i)) {
                int end = i + 1;
                while (end < len && isIdentifierPart(script.charAt(end))) {
                    end++;
                }
                String word = script.substring(i, end).toUpperCase(Locale.ROOT);
                words++;
                if (words == 1) {
                    create = "CREATE".equals(word);
                } else if (create && !trigger && words <= 3 && "TRIGGER".equals(word)) {
                    trigger = true;
                } else if (trigger) {
                    if ("BEGIN".equals(word) || (blockDepth > 0 && "CASE".equals(word))) {
                        blockDepth++;
                    } else if (blockDepth > 0 && "END".equals(word)) {
                        blockDepth--;
                    }
                }
                hasCode = true;
                i = end;
                continue;
            }
            if (c == ';' && blockDepth == 0) {
                if (hasCode) {
                    statements.add(script.substring(start, i).trim());
                }
                start = i + 1;
                hasCode = false;
                words = 0;
                create = false;
                trigger = false;
            } else if (!Character.isWhitespace(c)) {
                hasCode = true;
            }
            i++;
        }
        if (hasCode) {
            statements.add(script.substring(start).trim());
        }
        return statements;
    }

    /**
     * Replaces every {@code ?} placeholder outside inert regions with a marker.
     *
     * <p>
     * Placeholders are numbered from 1, left to right. Text without placeholders is returned
     * unchanged.
     * </p>
     *
     * @param sql SQL statement
     * @param marker maps the 1-based placeholder number to its replacement
     * @return rewritten statement
     * @throws NullPointerException if an argument is {@code null}
     */
    public static String replacePlaceholders(String sql, IntFunction<String> marker) {
        Preconditions.checkNotNull(sql, "sql must not be null");
        Preconditions.checkNotNull(marker, "marker must not be null");
        if (sql.indexOf('?') < 0) {
            return sql;
        }
        StringBuilder out = new StringBuilder(sql.length() + 8);
        int len = sql.length();
        int number = 0;
        int i = 0;
        while (i < len) {
            int skipped = skipInert(sql, i, true);
            if (skipped > i) {
                out.append(sql, i, skipped);
                i = skipped;
                continue;
            }
            char c = sql.charAt(i);
            if (c == '?') {
                out.append(marker.apply(++number));
            } else {
                out.append(c);
            }
            i++;
        }
        return out.toString();
    }

    /**
     * Returns the index just past the inert region starting at {@code i}, or {@code i} when no
     * inert region starts there.
     */
    private static int skipInert(String sql, int i, boolean nestedComments) {
        char c = sql.charAt(i);
        switch (c) {
            case '\'':
            case '"':
                return skipQuoted(sql, i, c);
            case '-':
                if (startsWith(sql, i, "--")) {
                    int eol = sql.indexOf('\n', i);
                    return eol < 0 ? sql.length() : eol + 1;
                }
                return i;
            case '/':
                if (startsWith(sql, i, "/*")) {
                    return skipBlockComment(sql, i, nestedComments);
                }
                return i;
            case '$':
                String tag = dollarTag(sql, i);
                if (tag == null) {
                    return i;
                }
                int close = sql.indexOf(tag, i + tag.length());
                return close < 0 ? sql.length() : close + tag.length();
            default:
                return i;
        }
    }

    private static boolean isCommentStart(String sql, int i) {
        return startsWith(sql, i, "--") || startsWith(sql, i, "/*");
    }

    private static int skipQuoted(String sql, int i, char quote) {
        int len = sql.length();
        int j = i + 1;
        while (j < len) {
            if (sql.charAt(j) == quote) {
                if (j + 1 < len && sql.charAt(j + 1) == quote) {
                    j += 2;
                    continue;
                }
                return j + 1;
            }
            j++;
        }
        return len;
    }

    private static int skipBlockComment(String sql, int i, boolean nested) {
        if (!nested) {
            int close = sql.indexOf("*/", i + 2);
            return close < 0 ? sql.length() : close + 2;
        }
        int len = sql.length();
        int depth = 0;
        int j = i;
        while (j < len) {
            if (startsWith(sql, j, "/*")) {
                depth++;
                j += 2;
            } else if (startsWith(sql, j, "*/")) {
                depth--;
                j += 2;
                if (depth == 0) {
                    return j;
                }
            } else {
                j++;
            }
        }
        return len;
    }

    /**
     * Reads a dollar-quote tag ({@code $$} or {@code $name$}) at {@code i}.
     *
     * @return the tag including both dollar signs, or {@code null} if none starts at {@code i}
     */
    private static String dollarTag(String sql, int i) {
        // "$" inside an identifier (a$b) or a positional marker ($1) is not a quote
        if (i > 0 && isIdentifierPart(sql.charAt(i - 1))) {
            return null;
        }
        int len = sql.length();
        int j = i + 1;
        if (j < len && sql.charAt(j) == '$') {
            return "$$";
        }
        if (j >= len || !(Character.isLetter(sql.charAt(j)) || sql.charAt(j) == '_')) {
            return null;
        }
        while (j < len && isIdentifierPart(sql.charAt(j))) {
            j++;
        }
        if (j < len && sql.charAt(j) == '$') {
            return sql.substring(i, j + 1);
        }
        return null;
    }

    private static boolean isWordStart(String sql, int i) {
        char c = sql.charAt(i);
        return (Character.isLetter(c) || c == '_')
                && (i == 0 || !isIdentifierPart(sql.charAt(i - 1)));
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean startsWith(String sql, int i, String token) {
        return sql.startsWith(token, i);
    }
}
