package com.rdslens.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request for {@code get_metrics}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsRequest {
    @NotBlank(message = "database_name is required")
    private String databaseName;

    @Min(value = 5, message = "period_minutes must be at least 5")
    @Max(value = 20160, message = "period_minutes must be at most 20160")
    private Integer periodMinutes = 60;
}
