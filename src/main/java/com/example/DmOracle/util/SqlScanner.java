package com.example.DmOracle.util;

import java.util.Locale;

public final class SqlScanner {

    private SqlScanner() {
    }

    /**
     * Lower-cased view of a query for keyword and table checks:
     *  - string literals become ''
     *  - comments become a single space
     *  - double-quoted identifiers lose their quotes
     *
     * Example:
     *   SELECT name FROM "Monsters" WHERE note = 'a;b' -- done
     *   select name from monsters where note = ''
     */
    public static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'') {
                i = skipQuoted(sql, i, '\'');
                out.append("''");
            } else if (c == '"') {
                int end = skipQuoted(sql, i, '"');
                boolean closed = end - 1 > i && sql.charAt(end - 1) == '"';
                out.append(sql.substring(i + 1, closed ? end - 1 : end).replace("\"\"", "\""));
                i = end;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol;
                out.append(' ');
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString().toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Index just past the closing quote, treating a doubled quote as an escape.
     * An unterminated quote runs to the end of the text.
     */
    private static int skipQuoted(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
