package com.rdslens.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rdslens.model.SlowQueryRecord;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of {@code get_slow_queries}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SlowQueriesResponse {
    private String status;
    private String message;
    private String database;
    private String engine;
    private Integer periodMinutes;
    private Integer logFilesScanned;
    private Integer totalSlowQueries;
    private List<SlowQueryRecord> topQueries;
}
