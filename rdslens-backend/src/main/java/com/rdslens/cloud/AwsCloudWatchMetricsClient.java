package com.rdslens.cloud;

import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataResponse;
import software.amazon.awssdk.services.cloudwatch.model.Metric;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataQuery;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataResult;
import software.amazon.awssdk.services.cloudwatch.model.MetricStat;
import software.amazon.awssdk.services.cloudwatch.model.ScanBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link MetricsClient} backed by Amazon CloudWatch {@code GetMetricData}.
 */
@Component
public class AwsCloudWatchMetricsClient implements MetricsClient {

    private final CloudWatchClient cloudWatch;

    public AwsCloudWatchMetricsClient(CloudWatchClient cloudWatch) {
        this.cloudWatch = cloudWatch;
    }

    @Override
    public List<Double> getMetric(String namespace, String metricName, Map<String, String> dimensions,
                                  int periodSeconds, String stat, Instant start, Instant end) {
        List<Dimension> cwDimensions = new ArrayList<>();
        dimensions.forEach((name, value) -> cwDimensions.add(Dimension.builder().name(name).value(value).build()));

        MetricDataQuery query = MetricDataQuery.builder()
                .id(metricName.toLowerCase(Locale.ROOT))
                .metricStat(MetricStat.builder()
                        .metric(Metric.builder()
                                .namespace(namespace)
                                .metricName(metricName)
                                .dimensions(cwDimensions)
                                .build())
                        .period(periodSeconds)
                        .stat(stat)
                        .build())
                .build();

        try {
            GetMetricDataResponse response = cloudWatch.getMetricData(GetMetricDataRequest.builder()
                    .metricDataQueries(query)
                    .startTime(start)
                    .endTime(end)
                    .scanBy(ScanBy.TIMESTAMP_ASCENDING)
                    .build());
            List<MetricDataResult> results = response.metricDataResults();
            if (results.isEmpty()) {
                return List.of();
            }
            return List.copyOf(results.get(0).values());
        } catch (SdkException e) {
            throw new UpstreamServiceException("Failed to get metric " + metricName + ": " + e.getMessage(), e);
        }
    }
}
