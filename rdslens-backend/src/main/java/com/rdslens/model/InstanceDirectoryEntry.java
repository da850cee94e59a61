package com.rdslens.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of one managed database instance as reported by the control plane.
 */
@Value
@Builder
public class InstanceDirectoryEntry {
    String identifier;
    String engine;
    EngineFamily engineFamily;
    String status;
    String endpointHost;
    Integer endpointPort;
    String resourceId;
    Long allocatedStorage;
}
