package com.rdslens.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request for {@code get_instance_info}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InstanceInfoRequest {
    /**
     * Free-text database name, resolved to an instance identifier.
     */
    @NotBlank(message = "database_name is required")
    private String databaseName;
}
