package com.rdslens.logs;

import com.rdslens.cloud.ControlPlaneClient;
import com.rdslens.model.LogPortion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, finite, non-restartable sequence of log text chunks for one log file.
 *
 * Each {@link #next()} downloads one portion starting at the cursor returned by the previous call
 * ({@code "0"} for the first). Iteration ends when the API stops reporting pending data, when it
 * reports pending data without a cursor to resume from, or after {@code maxPages} portions.
 */
class LogPortionIterator implements Iterator<String> {
    private static final Logger log = LoggerFactory.getLogger(LogPortionIterator.class);

    static final String START_CURSOR = "0";

    private final ControlPlaneClient controlPlane;
    private final String instanceId;
    private final String logFileName;
    private final int pageLines;
    private final int maxPages;

    private String cursor = START_CURSOR;
    private int pages;
    private boolean done;

    LogPortionIterator(ControlPlaneClient controlPlane, String instanceId, String logFileName, int pageLines, int maxPages) {
        this.controlPlane = controlPlane;
        this.instanceId = instanceId;
        this.logFileName = logFileName;
        this.pageLines = pageLines;
        this.maxPages = maxPages;
    }

    @Override
    public boolean hasNext() {
        return !done;
    }

    @Override
    public String next() {
        if (done) {
            throw new NoSuchElementException();
        }

        LogPortion portion = controlPlane.downloadLogPortion(instanceId, logFileName, cursor, pageLines);
        pages++;

        if (!portion.morePending()) {
            done = true;
        } else if (portion.nextCursor() == null || portion.nextCursor().isBlank()) {
            log.warn("More data pending for {} on {} but no cursor returned; stopping after {} portions",
                    logFileName, instanceId, pages);
            done = true;
        } else if (pages >= maxPages) {
            log.warn("Stopping download of {} on {} after {} portions", logFileName, instanceId, pages);
            done = true;
        } else {
            cursor = portion.nextCursor();
        }
        return portion.data();
    }
}
