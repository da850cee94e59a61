package com.rdslens.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rdslens.model.DimensionLoad;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of {@code get_top_load}: average active sessions per dimension value.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TopLoadResponse {
    private String status;
    private String message;
    private String database;
    private String dimension;
    private Integer periodMinutes;
    private List<DimensionLoad> items;
}
