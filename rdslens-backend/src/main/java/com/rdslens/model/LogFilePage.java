package com.rdslens.model;

import java.util.List;

/**
 * One page of a log file listing.
 *
 * @param files files on this page
 * @param nextCursor cursor for the next page, null when the listing is complete
 */
public record LogFilePage(List<LogFileDescriptor> files, String nextCursor) {

    public LogFilePage {
        files = files != null ? List.copyOf(files) : List.of();
    }
}
