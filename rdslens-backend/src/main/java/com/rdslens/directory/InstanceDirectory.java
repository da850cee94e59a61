package com.rdslens.directory;

import com.rdslens.cloud.ControlPlaneClient;
import com.rdslens.model.InstanceDirectoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Cached list of every instance known to the control plane.
 *
 * The list is fetched with a single describe call and kept for {@code rdslens.directory.ttl}
 * (five minutes by default).
 */
@Slf4j
@Service
public class InstanceDirectory {

    private final ControlPlaneClient controlPlane;
    private final SnapshotCache<List<InstanceDirectoryEntry>> cache;

    public InstanceDirectory(
            ControlPlaneClient controlPlane,
            Clock clock,
            @Value("${rdslens.directory.ttl:300s}") Duration ttl
    ) {
        this.controlPlane = controlPlane;
        this.cache = new SnapshotCache<>(ttl, clock);
    }

    /**
     * List all instances, served from cache while fresh.
     *
     * @return immutable list of instances
     * @throws com.rdslens.cloud.UpstreamServiceException when a refresh is needed and fails
     */
    public List<InstanceDirectoryEntry> listInstances() {
        if (cache.isFresh()) {
            log.info("Returning cached rds instances data");
        }
        return cache.get(this::fetch);
    }

    /**
     * Identifiers of all instances, in control-plane order.
     */
    public List<String> listIdentifiers() {
        return listInstances().stream().map(InstanceDirectoryEntry::getIdentifier).toList();
    }

    private List<InstanceDirectoryEntry> fetch() {
        try {
            List<InstanceDirectoryEntry> entries = List.copyOf(controlPlane.describeInstances());
            log.info("Refreshed instance directory: {} instances", entries.size());
            return entries;
        } catch (RuntimeException e) {
            log.error("Error getting rds instances: {}", e.getMessage());
            throw e;
        }
    }
}
