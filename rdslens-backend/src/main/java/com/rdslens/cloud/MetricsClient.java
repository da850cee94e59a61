package com.rdslens.cloud;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Time-series metrics API.
 */
public interface MetricsClient {

    /**
     * Fetch samples of one metric, oldest first.
     *
     * @param namespace metric namespace, e.g. {@code AWS/RDS}
     * @param metricName metric name
     * @param dimensions metric dimensions
     * @param periodSeconds aggregation period
     * @param stat statistic, e.g. {@code Average}
     * @param start window start
     * @param end window end
     * @return samples in ascending time order, empty when the window holds no data
     */
    List<Double> getMetric(String namespace, String metricName, Map<String, String> dimensions,
                           int periodSeconds, String stat, Instant start, Instant end);
}
