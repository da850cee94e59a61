package com.rdslens.logs;

import com.rdslens.cloud.ControlPlaneClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Iterator;

/**
 * Downloads complete log files through the control plane's paginated portion API.
 */
@Slf4j
@Component
public class LogFetcher {

    private final ControlPlaneClient controlPlane;
    private final int pageLines;
    private final int maxPages;

    public LogFetcher(
            ControlPlaneClient controlPlane,
            @Value("${rdslens.logs.page-lines:1000}") int pageLines,
            @Value("${rdslens.logs.max-pages:100000}") int maxPages
    ) {
        this.controlPlane = controlPlane;
        this.pageLines = pageLines;
        this.maxPages = maxPages;
    }

    /**
     * Lazily iterate over the portions of a log file, in order.
     *
     * @param instanceId instance identifier
     * @param logFileName log file name
     * @return single-use iterator; each element is the raw text of one portion
     */
    public Iterator<String> portions(String instanceId, String logFileName) {
        return new LogPortionIterator(controlPlane, instanceId, logFileName, pageLines, maxPages);
    }

    /**
     * Download a whole log file.
     *
     * @param instanceId instance identifier
     * @param logFileName log file name
     * @return concatenated text of all portions
     * @throws com.rdslens.cloud.UpstreamServiceException when any portion fails
     */
    public String fetchFullLog(String instanceId, String logFileName) {
        StringBuilder sb = new StringBuilder();
        int count = 0;
        Iterator<String> it = portions(instanceId, logFileName);
        while (it.hasNext()) {
            sb.append(it.next());
            count++;
        }
        log.debug("Downloaded {} from {} in {} portions ({} chars)", logFileName, instanceId, count, sb.length());
        return sb.toString();
    }
}
