package com.rdslens.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * One slow statement extracted from an engine log.
 *
 * {@code queryTime} is always present. Its unit follows the engine log format and is carried in
 * {@code queryTimeUnit}: seconds for the MySQL slow log, milliseconds for the PostgreSQL error log.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SlowQueryRecord {
    public static final String UNIT_SECONDS = "s";
    public static final String UNIT_MILLIS = "ms";

    OffsetDateTime timestamp;
    double queryTime;
    String queryTimeUnit;
    Double lockTime;
    Long rowsSent;
    Long rowsExamined;
    String sql;
}
