package com.rdslens.cloud;

import com.rdslens.model.DimensionLoad;
import com.rdslens.model.LoadDimension;

import java.time.Instant;
import java.util.List;

/**
 * Database load (average active sessions) broken down by dimension.
 */
public interface LoadInsightsClient {

    /**
     * Top contributors to database load.
     *
     * @param resourceId storage-resource id of the instance ({@code DbiResourceId})
     * @param dimension dimension group to break load down by
     * @param start window start
     * @param end window end
     * @param limit maximum number of entries
     * @return entries ordered by total load, highest first
     */
    List<DimensionLoad> topLoad(String resourceId, LoadDimension dimension, Instant start, Instant end, int limit);
}
