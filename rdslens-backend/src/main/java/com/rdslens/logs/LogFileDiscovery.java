package com.rdslens.logs;

import com.rdslens.cloud.ControlPlaneClient;
import com.rdslens.model.LogFileDescriptor;
import com.rdslens.model.LogFilePage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds recently written log files of an instance.
 */
@Slf4j
@Component
public class LogFileDiscovery {

    private final ControlPlaneClient controlPlane;

    public LogFileDiscovery(ControlPlaneClient controlPlane) {
        this.controlPlane = controlPlane;
    }

    /**
     * Page through the log file listing and keep files last written at or after {@code since}.
     *
     * @param instanceId instance identifier
     * @param filenameContains substring filter, e.g. {@code error/postgresql.log.}
     * @param since lower bound on the last-written time
     * @return matching file names in listing order
     */
    public List<String> findRecent(String instanceId, String filenameContains, Instant since) {
        long sinceMillis = since.toEpochMilli();
        List<String> names = new ArrayList<>();
        String cursor = null;
        do {
            LogFilePage page = controlPlane.describeLogFiles(instanceId, filenameContains, sinceMillis, cursor);
            for (LogFileDescriptor file : page.files()) {
                if (file.lastWrittenMillis() >= sinceMillis) {
                    names.add(file.name());
                }
            }
            cursor = page.nextCursor();
        } while (cursor != null && !cursor.isBlank());

        log.info("Found {} log files matching {} on {} since {}", names.size(), filenameContains, instanceId, since);
        return names;
    }
}
