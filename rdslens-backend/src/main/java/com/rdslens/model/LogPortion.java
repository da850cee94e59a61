package com.rdslens.model;

/**
 * One downloaded portion of a log file.
 *
 * @param data raw log text, never null
 * @param nextCursor cursor to resume from, may be null when the API omits it
 * @param morePending whether the API reports more data after this portion
 */
public record LogPortion(String data, String nextCursor, boolean morePending) {

    public LogPortion {
        data = data != null ? data : "";
    }
}
