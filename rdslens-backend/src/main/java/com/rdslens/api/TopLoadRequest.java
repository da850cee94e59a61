package com.rdslens.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request for {@code get_top_load}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TopLoadRequest {
    @NotBlank(message = "database_name is required")
    private String databaseName;

    /**
     * statement | user | wait_event
     */
    private String dimension;

    @Min(value = 1, message = "period_minutes must be at least 1")
    @Max(value = 10080, message = "period_minutes must be at most 10080")
    private Integer periodMinutes = 60;

    @Min(value = 1, message = "limit must be at least 1")
    @Max(value = 25, message = "limit must be at most 25")
    private Integer limit = 10;
}
