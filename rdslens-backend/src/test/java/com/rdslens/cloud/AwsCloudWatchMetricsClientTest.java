package com.rdslens.cloud;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricDataResponse;
import software.amazon.awssdk.services.cloudwatch.model.MetricDataResult;
import software.amazon.awssdk.services.cloudwatch.model.ScanBy;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AwsCloudWatchMetricsClientTest {

    private static final Instant START = Instant.parse("2024-01-01T09:00:00Z");
    private static final Instant END = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void requestsAscendingSamples() {
        CloudWatchClient cloudWatch = mock(CloudWatchClient.class);
        when(cloudWatch.getMetricData(any(GetMetricDataRequest.class))).thenReturn(GetMetricDataResponse.builder()
                .metricDataResults(MetricDataResult.builder().id("cpuutilization").values(1.0, 3.5).build())
                .build());

        var values = new AwsCloudWatchMetricsClient(cloudWatch).getMetric("AWS/RDS", "CPUUtilization",
                Map.of("DBInstanceIdentifier", "orders-prod"), 300, "Average", START, END);

        assertThat(values).containsExactly(1.0, 3.5);
        ArgumentCaptor<GetMetricDataRequest> captor = ArgumentCaptor.forClass(GetMetricDataRequest.class);
        verify(cloudWatch).getMetricData(captor.capture());
        GetMetricDataRequest request = captor.getValue();
        assertThat(request.scanBy()).isEqualTo(ScanBy.TIMESTAMP_ASCENDING);
        assertThat(request.metricDataQueries().get(0).metricStat().metric().dimensions().get(0).value())
                .isEqualTo("orders-prod");
        assertThat(request.metricDataQueries().get(0).metricStat().period()).isEqualTo(300);
    }

    @Test
    void emptyResultsAndFailures() {
        CloudWatchClient cloudWatch = mock(CloudWatchClient.class);
        when(cloudWatch.getMetricData(any(GetMetricDataRequest.class)))
                .thenReturn(GetMetricDataResponse.builder().build())
                .thenThrow(CloudWatchException.builder().message("denied").build());
        AwsCloudWatchMetricsClient client = new AwsCloudWatchMetricsClient(cloudWatch);

        assertThat(client.getMetric("AWS/RDS", "DBLoad", Map.of(), 300, "Average", START, END)).isEmpty();
        assertThatThrownBy(() -> client.getMetric("AWS/RDS", "DBLoad", Map.of(), 300, "Average", START, END))
                .isInstanceOf(UpstreamServiceException.class)
                .hasMessageContaining("DBLoad");
    }
}
