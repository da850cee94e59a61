package com.rdslens.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Result of {@code get_metrics}. Each metric holds its most recent sample, or null when the window
 * had none.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsResponse {
    private String status;
    private String message;
    private String database;
    private Integer periodMinutes;
    private Map<String, Double> metrics;
    private OffsetDateTime timestamp;
}
