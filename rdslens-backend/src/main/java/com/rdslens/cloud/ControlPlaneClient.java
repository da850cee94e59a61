package com.rdslens.cloud;

import com.rdslens.model.InstanceDirectoryEntry;
import com.rdslens.model.LogFilePage;
import com.rdslens.model.LogPortion;

import java.util.List;

/**
 * Read-only view of the managed database control plane.
 *
 * Implementations translate transport failures into {@link UpstreamServiceException}.
 */
public interface ControlPlaneClient {

    /**
     * List every instance visible to the caller in one call.
     */
    List<InstanceDirectoryEntry> describeInstances();

    /**
     * Describe one instance.
     *
     * @throws InstanceNotFoundException when the identifier is unknown
     */
    InstanceDirectoryEntry describeInstance(String identifier);

    /**
     * List log files of an instance.
     *
     * @param identifier instance identifier
     * @param filenameContains substring filter on file names
     * @param lastWrittenSinceMillis only files written at or after this epoch millis; null for no filter
     * @param cursor page cursor, null for the first page
     */
    LogFilePage describeLogFiles(String identifier, String filenameContains, Long lastWrittenSinceMillis, String cursor);

    /**
     * Download one portion of a log file.
     *
     * @param identifier instance identifier
     * @param logFileName log file name
     * @param cursor position to read from, {@code "0"} for the start of the file
     * @param numberOfLines maximum lines in the portion
     */
    LogPortion downloadLogPortion(String identifier, String logFileName, String cursor, int numberOfLines);
}
