package com.rdslens.cloud;

import com.rdslens.model.DimensionLoad;
import com.rdslens.model.LoadDimension;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.pi.PiClient;
import software.amazon.awssdk.services.pi.model.DescribeDimensionKeysRequest;
import software.amazon.awssdk.services.pi.model.DescribeDimensionKeysResponse;
import software.amazon.awssdk.services.pi.model.DimensionGroup;
import software.amazon.awssdk.services.pi.model.DimensionKeyDescription;
import software.amazon.awssdk.services.pi.model.ServiceType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link LoadInsightsClient} backed by Performance Insights {@code DescribeDimensionKeys}.
 */
@Component
public class AwsPerformanceInsightsClient implements LoadInsightsClient {

    static final String LOAD_METRIC = "db.load.avg";

    private final PiClient pi;

    public AwsPerformanceInsightsClient(PiClient pi) {
        this.pi = pi;
    }

    @Override
    public List<DimensionLoad> topLoad(String resourceId, LoadDimension dimension, Instant start, Instant end, int limit) {
        try {
            DescribeDimensionKeysResponse response = pi.describeDimensionKeys(DescribeDimensionKeysRequest.builder()
                    .serviceType(ServiceType.RDS)
                    .identifier(resourceId)
                    .metric(LOAD_METRIC)
                    .startTime(start)
                    .endTime(end)
                    .periodInSeconds(periodFor(start, end))
                    .groupBy(DimensionGroup.builder().group(dimension.getGroup()).limit(limit).build())
                    .maxResults(limit)
                    .build());

            List<DimensionLoad> out = new ArrayList<>();
            for (DimensionKeyDescription key : response.keys()) {
                Map<String, String> dims = key.dimensions() != null ? key.dimensions() : Map.of();
                out.add(DimensionLoad.builder()
                        .value(dims.getOrDefault(dimension.getNameKey(), dims.values().stream().findFirst().orElse(null)))
                        .totalLoad(key.total())
                        .dimensions(Map.copyOf(dims))
                        .build());
            }
            return out;
        } catch (SdkException e) {
            throw new UpstreamServiceException("Failed to get database load for " + resourceId + ": " + e.getMessage(), e);
        }
    }

    // Performance Insights accepts 1, 60, 300, 3600 or 86400 second periods.
    static int periodFor(Instant start, Instant end) {
        long seconds = Duration.between(start, end).getSeconds();
        if (seconds <= 3600) {
            return 60;
        }
        if (seconds <= 6 * 3600) {
            return 300;
        }
        if (seconds <= 7 * 86400) {
            return 3600;
        }
        return 86400;
    }
}
