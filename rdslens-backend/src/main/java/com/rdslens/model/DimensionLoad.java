package com.rdslens.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Average active sessions attributed to one dimension value over a window.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DimensionLoad {
    String value;
    Double totalLoad;
    Map<String, String> dimensions;
}
