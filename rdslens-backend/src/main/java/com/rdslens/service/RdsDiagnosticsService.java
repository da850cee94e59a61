package com.rdslens.service;

import com.rdslens.api.InstanceInfoResponse;
import com.rdslens.api.InstancesResponse;
import com.rdslens.api.MetricsResponse;
import com.rdslens.api.SlowQueriesResponse;
import com.rdslens.api.TopLoadResponse;
import com.rdslens.cloud.ControlPlaneClient;
import com.rdslens.cloud.LoadInsightsClient;
import com.rdslens.cloud.MetricsClient;
import com.rdslens.directory.InstanceDirectory;
import com.rdslens.logs.LogFetcher;
import com.rdslens.logs.LogFileDiscovery;
import com.rdslens.model.DimensionLoad;
import com.rdslens.model.InstanceDirectoryEntry;
import com.rdslens.model.LoadDimension;
import com.rdslens.model.SlowQueryRecord;
import com.rdslens.parser.SlowQueryParser;
import com.rdslens.parser.SlowQueryParsers;
import com.rdslens.parser.SlowQueryRanker;
import com.rdslens.resolver.NameResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implements the diagnostic tools.
 *
 * Every tool method resolves the free-text database name first and converts any failure into a
 * result with {@code status = "error"} and a message; nothing is thrown to the caller.
 */
@Slf4j
@Service
public class RdsDiagnosticsService {

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_ERROR = "error";
    static final String NO_MATCH_MESSAGE = "No matching RDS instance found";

    static final String MYSQL_SLOW_LOG = "slowquery/mysql-slowquery.log";
    static final String POSTGRES_LOG_FILTER = "error/postgresql.log.";

    static final String METRIC_NAMESPACE = "AWS/RDS";
    static final String METRIC_DIMENSION = "DBInstanceIdentifier";
    static final String METRIC_STAT = "Average";
    static final int METRIC_PERIOD_SECONDS = 300;

    /**
     * CloudWatch metric name to result key, in output order.
     */
    static final Map<String, String> METRICS = buildMetrics();

    private final NameResolver nameResolver;
    private final InstanceDirectory instanceDirectory;
    private final ControlPlaneClient controlPlane;
    private final MetricsClient metricsClient;
    private final LoadInsightsClient loadInsightsClient;
    private final LogFetcher logFetcher;
    private final LogFileDiscovery logFileDiscovery;
    private final SlowQueryParsers parsers;
    private final Clock clock;

    public RdsDiagnosticsService(
            NameResolver nameResolver,
            InstanceDirectory instanceDirectory,
            ControlPlaneClient controlPlane,
            MetricsClient metricsClient,
            LoadInsightsClient loadInsightsClient,
            LogFetcher logFetcher,
            LogFileDiscovery logFileDiscovery,
            SlowQueryParsers parsers,
            Clock clock
    ) {
        this.nameResolver = nameResolver;
        this.instanceDirectory = instanceDirectory;
        this.controlPlane = controlPlane;
        this.metricsClient = metricsClient;
        this.loadInsightsClient = loadInsightsClient;
        this.logFetcher = logFetcher;
        this.logFileDiscovery = logFileDiscovery;
        this.parsers = parsers;
        this.clock = clock;
    }

    /**
     * List the identifiers in the instance directory.
     *
     * Unlike the tools this is not wrapped: a failed directory refresh propagates.
     *
     * @throws com.rdslens.cloud.UpstreamServiceException when the instance list cannot be fetched
     */
    public InstancesResponse listInstances() {
        List<String> identifiers = instanceDirectory.listIdentifiers();
        return InstancesResponse.builder()
                .status(STATUS_SUCCESS)
                .rdsInstances(identifiers)
                .totalRdsInstances(identifiers.size())
                .build();
    }

    /**
     * Describe one instance.
     *
     * @param databaseName free-text name
     */
    public InstanceInfoResponse getInstanceInfo(String databaseName) {
        try {
            Optional<String> identifier = nameResolver.resolve(databaseName);
            if (identifier.isEmpty()) {
                return InstanceInfoResponse.builder().status(STATUS_ERROR).message(NO_MATCH_MESSAGE).build();
            }

            InstanceDirectoryEntry info = controlPlane.describeInstance(identifier.get());
            return InstanceInfoResponse.builder()
                    .status(info.getStatus())
                    .dbInstanceIdentifier(info.getIdentifier())
                    .engine(info.getEngine())
                    .dbInstanceEndpoint(info.getEndpointHost())
                    .dbInstancePort(info.getEndpointPort())
                    .dbiResourceId(info.getResourceId())
                    .allocatedStorage(info.getAllocatedStorage())
                    .build();
        } catch (Exception e) {
            log.error("Error getting instance info for '{}': {}", databaseName, e.getMessage());
            return InstanceInfoResponse.builder().status(STATUS_ERROR).message(messageOf(e)).build();
        }
    }

    /**
     * Latest value of the key instance metrics.
     *
     * @param databaseName free-text name
     * @param periodMinutes look-back window
     */
    public MetricsResponse getMetrics(String databaseName, int periodMinutes) {
        try {
            Optional<String> identifier = nameResolver.resolve(databaseName);
            if (identifier.isEmpty()) {
                return MetricsResponse.builder().status(STATUS_ERROR).message(NO_MATCH_MESSAGE).build();
            }

            Instant end = clock.instant();
            Instant start = end.minus(Duration.ofMinutes(periodMinutes));
            Map<String, String> dimensions = Map.of(METRIC_DIMENSION, identifier.get());

            Map<String, Double> values = new LinkedHashMap<>();
            for (Map.Entry<String, String> metric : METRICS.entrySet()) {
                List<Double> samples = metricsClient.getMetric(
                        METRIC_NAMESPACE, metric.getKey(), dimensions, METRIC_PERIOD_SECONDS, METRIC_STAT, start, end);
                values.put(metric.getValue(), samples.isEmpty() ? null : samples.get(samples.size() - 1));
            }

            return MetricsResponse.builder()
                    .status(STATUS_SUCCESS)
                    .database(identifier.get())
                    .periodMinutes(periodMinutes)
                    .metrics(values)
                    .timestamp(OffsetDateTime.now(clock))
                    .build();
        } catch (Exception e) {
            log.error("Error getting metrics for '{}': {}", databaseName, e.getMessage());
            return MetricsResponse.builder().status(STATUS_ERROR).message(messageOf(e)).build();
        }
    }

    /**
     * Slowest statements found in the engine logs.
     *
     * @param databaseName free-text name
     * @param periodMinutes look-back window used to pick PostgreSQL log files
     * @param limit detail rows requested, capped at {@link SlowQueryRanker#MAX_TOP}
     */
    public SlowQueriesResponse getSlowQueries(String databaseName, int periodMinutes, int limit) {
        try {
            Optional<String> identifier = nameResolver.resolve(databaseName);
            if (identifier.isEmpty()) {
                return SlowQueriesResponse.builder().status(STATUS_ERROR).message(NO_MATCH_MESSAGE).build();
            }
            String id = identifier.get();

            InstanceDirectoryEntry instance = controlPlane.describeInstance(id);
            SlowQueryParser parser = parsers.forEngine(instance.getEngineFamily(), instance.getEngine());

            List<String> logFiles = logFilesFor(instance, id, periodMinutes);
            List<SlowQueryRecord> records = new ArrayList<>();
            for (String logFile : logFiles) {
                records.addAll(parser.parse(logFetcher.fetchFullLog(id, logFile)));
            }

            SlowQueryRanker.Ranking ranking = SlowQueryRanker.rank(records, limit);
            log.info("Found {} slow queries in {} log files for {}", ranking.total(), logFiles.size(), id);

            return SlowQueriesResponse.builder()
                    .status(STATUS_SUCCESS)
                    .database(id)
                    .engine(instance.getEngine())
                    .periodMinutes(periodMinutes)
                    .logFilesScanned(logFiles.size())
                    .totalSlowQueries(ranking.total())
                    .topQueries(ranking.top())
                    .build();
        } catch (Exception e) {
            log.error("Error getting database queries for '{}': {}", databaseName, e.getMessage());
            return SlowQueriesResponse.builder().status(STATUS_ERROR).message(messageOf(e)).build();
        }
    }

    /**
     * Top contributors to database load, grouped by one dimension.
     *
     * @param databaseName free-text name
     * @param dimension statement, user or wait_event
     * @param periodMinutes look-back window
     * @param limit maximum entries
     */
    public TopLoadResponse getTopLoad(String databaseName, String dimension, int periodMinutes, int limit) {
        try {
            LoadDimension loadDimension = LoadDimension.parse(dimension);

            Optional<String> identifier = nameResolver.resolve(databaseName);
            if (identifier.isEmpty()) {
                return TopLoadResponse.builder().status(STATUS_ERROR).message(NO_MATCH_MESSAGE).build();
            }

            InstanceDirectoryEntry instance = controlPlane.describeInstance(identifier.get());
            if (instance.getResourceId() == null || instance.getResourceId().isBlank()) {
                return TopLoadResponse.builder()
                        .status(STATUS_ERROR)
                        .message("No DbiResourceId reported for " + identifier.get())
                        .build();
            }

            Instant end = clock.instant();
            Instant start = end.minus(Duration.ofMinutes(periodMinutes));
            List<DimensionLoad> items = new ArrayList<>(
                    loadInsightsClient.topLoad(instance.getResourceId(), loadDimension, start, end, limit));
            items.sort(Comparator.comparing(DimensionLoad::getTotalLoad, Comparator.nullsLast(Comparator.reverseOrder())));

            return TopLoadResponse.builder()
                    .status(STATUS_SUCCESS)
                    .database(identifier.get())
                    .dimension(loadDimension.getGroup())
                    .periodMinutes(periodMinutes)
                    .items(items.size() > limit ? items.subList(0, limit) : items)
                    .build();
        } catch (Exception e) {
            log.error("Error getting top load for '{}': {}", databaseName, e.getMessage());
            return TopLoadResponse.builder().status(STATUS_ERROR).message(messageOf(e)).build();
        }
    }

    private List<String> logFilesFor(InstanceDirectoryEntry instance, String id, int periodMinutes) {
        switch (instance.getEngineFamily()) {
            case MYSQL:
                return List.of(MYSQL_SLOW_LOG);
            case POSTGRES:
                Instant since = clock.instant().minus(Duration.ofMinutes(periodMinutes));
                return logFileDiscovery.findRecent(id, POSTGRES_LOG_FILTER, since);
            default:
                return List.of();
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Map<String, String> buildMetrics() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("CPUUtilization", "cpu_utilization");
        m.put("FreeableMemory", "free_memory_bytes");
        m.put("DatabaseConnections", "connections");
        m.put("FreeStorageSpace", "free_storage_bytes");
        m.put("ReadThroughput", "read_throughput");
        m.put("WriteThroughput", "write_throughput");
        m.put("ReadLatency", "read_latency");
        m.put("WriteLatency", "write_latency");
        m.put("DBLoad", "db_load");
        return Collections.unmodifiableMap(m);
    }
}
