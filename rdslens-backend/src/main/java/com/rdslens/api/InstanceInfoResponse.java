package com.rdslens.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Result of {@code get_instance_info}. On success {@code status} is the instance status reported by
 * the control plane (e.g. {@code available}); on failure it is {@code error}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InstanceInfoResponse {
    private String status;
    private String message;
    private String dbInstanceIdentifier;
    private String engine;
    private String dbInstanceEndpoint;
    private Integer dbInstancePort;
    private String dbiResourceId;
    /**
     * Allocated storage as reported by the control plane (GiB for RDS).
     */
    private Long allocatedStorage;
}
