package com.rdslens.parser;

import com.rdslens.model.SlowQueryRecord;

/**
 * Shortens statement text so slow queries stay readable and comparable.
 *
 * Both steps are literal text operations, not SQL parsing. Only the first {@code IN (} occurrence
 * (matched case-insensitively, so {@code JOIN (} also counts) is considered; later lists are left as is.
 */
public final class QueryNormalizer {

    static final String IN_MARKER = "IN (";
    static final int MAX_IN_VALUES = 5;
    static final int MAX_SQL_LENGTH = 1500;
    static final String ELLIPSIS = ", ... ";
    static final String TRUNCATION_MARKER = "... [truncated]";

    private QueryNormalizer() {
    }

    /**
     * Normalize the statement of a record.
     *
     * @param record record, possibly without statement
     * @return record with normalized statement; the same instance when there is nothing to change
     */
    public static SlowQueryRecord normalize(SlowQueryRecord record) {
        if (record.getSql() == null) {
            return record;
        }
        String sql = normalize(record.getSql());
        if (sql.equals(record.getSql())) {
            return record;
        }
        return record.toBuilder().sql(sql).build();
    }

    /**
     * Collapse an oversized {@code IN (...)} list to its first three and last two values, then cap the
     * length at 1500 characters.
     *
     * @param sql statement text
     * @return normalized text
     */
    public static String normalize(String sql) {
        if (sql == null) {
            return null;
        }
        String out = collapseInList(sql);
        if (out.length() > MAX_SQL_LENGTH) {
            out = out.substring(0, MAX_SQL_LENGTH) + TRUNCATION_MARKER;
        }
        return out;
    }

    static String collapseInList(String sql) {
        int start = indexOfIgnoreCase(sql, IN_MARKER);
        if (start < 0) {
            return sql;
        }

        int listStart = start + IN_MARKER.length();
        int close = sql.indexOf(')', listStart);
        String list = close >= 0 ? sql.substring(listStart, close) : sql.substring(listStart);
        String trailer = close >= 0 ? sql.substring(close + 1) : "";

        String[] values = list.split(",", -1);
        if (values.length <= MAX_IN_VALUES) {
            return sql;
        }

        String head = String.join(",", values[0], values[1], values[2]);
        String tail = String.join(",", values[values.length - 2], values[values.length - 1]);
        return sql.substring(0, listStart) + head + ELLIPSIS + tail + ")" + trailer;
    }

    private static int indexOfIgnoreCase(String text, String needle) {
        int max = text.length() - needle.length();
        for (int i = 0; i <= max; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
