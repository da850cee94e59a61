package com.rdslens.service;

import com.rdslens.MutableClock;
import com.rdslens.api.InstanceInfoResponse;
import com.rdslens.api.InstancesResponse;
import com.rdslens.api.MetricsResponse;
import com.rdslens.api.SlowQueriesResponse;
import com.rdslens.api.TopLoadResponse;
import com.rdslens.cloud.ControlPlaneClient;
import com.rdslens.cloud.InstanceNotFoundException;
import com.rdslens.cloud.LoadInsightsClient;
import com.rdslens.cloud.MetricsClient;
import com.rdslens.cloud.UpstreamServiceException;
import com.rdslens.directory.InstanceDirectory;
import com.rdslens.logs.LogFetcher;
import com.rdslens.logs.LogFileDiscovery;
import com.rdslens.model.DimensionLoad;
import com.rdslens.model.EngineFamily;
import com.rdslens.model.InstanceDirectoryEntry;
import com.rdslens.model.LoadDimension;
import com.rdslens.model.SlowQueryRecord;
import com.rdslens.parser.MySqlSlowLogParser;
import com.rdslens.parser.PostgresLogParser;
import com.rdslens.parser.SlowQueryParser;
import com.rdslens.parser.SlowQueryParsers;
import com.rdslens.resolver.NameResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RdsDiagnosticsServiceTest {

    private NameResolver resolver;
    private InstanceDirectory directory;
    private ControlPlaneClient controlPlane;
    private MetricsClient metricsClient;
    private LoadInsightsClient loadInsights;
    private LogFetcher logFetcher;
    private LogFileDiscovery logFileDiscovery;
    private SlowQueryParser mysqlParser;
    private SlowQueryParser postgresParser;
    private MutableClock clock;
    private RdsDiagnosticsService service;

    @BeforeEach
    void setUp() {
        resolver = mock(NameResolver.class);
        directory = mock(InstanceDirectory.class);
        controlPlane = mock(ControlPlaneClient.class);
        metricsClient = mock(MetricsClient.class);
        loadInsights = mock(LoadInsightsClient.class);
        logFetcher = mock(LogFetcher.class);
        logFileDiscovery = mock(LogFileDiscovery.class);
        mysqlParser = spy(new MySqlSlowLogParser());
        postgresParser = spy(new PostgresLogParser());
        clock = new MutableClock();
        service = new RdsDiagnosticsService(resolver, directory, controlPlane, metricsClient, loadInsights,
                logFetcher, logFileDiscovery, new SlowQueryParsers(List.of(mysqlParser, postgresParser)), clock);
    }

    @Test
    void listsInstances() {
        when(directory.listIdentifiers()).thenReturn(List.of("a", "b"));

        InstancesResponse response = service.listInstances();

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getRdsInstances()).containsExactly("a", "b");
        assertThat(response.getTotalRdsInstances()).isEqualTo(2);
    }

    @Test
    void listInstancesPropagatesUpstreamFailure() {
        when(directory.listIdentifiers()).thenThrow(new UpstreamServiceException("Failed to get rds instances: denied"));

        assertThatThrownBy(() -> service.listInstances())
                .isInstanceOf(UpstreamServiceException.class)
                .hasMessageContaining("denied");
    }

    @Test
    void instanceInfoCopiesDescribedFields() {
        when(resolver.resolve("orders")).thenReturn(Optional.of("orders-prod"));
        when(controlPlane.describeInstance("orders-prod")).thenReturn(entry("orders-prod", "mysql", EngineFamily.MYSQL));

        InstanceInfoResponse response = service.getInstanceInfo("orders");

        assertThat(response.getStatus()).isEqualTo("available");
        assertThat(response.getDbInstanceIdentifier()).isEqualTo("orders-prod");
        assertThat(response.getEngine()).isEqualTo("mysql");
        assertThat(response.getDbInstanceEndpoint()).isEqualTo("orders-prod.abc.us-east-1.rds.amazonaws.com");
        assertThat(response.getDbInstancePort()).isEqualTo(3306);
        assertThat(response.getDbiResourceId()).isEqualTo("db-ORDERSPROD");
        assertThat(response.getAllocatedStorage()).isEqualTo(100L);
    }

    @Test
    void unresolvedNameIsReportedWithoutDescribing() {
        when(resolver.resolve("nope")).thenReturn(Optional.empty());

        InstanceInfoResponse response = service.getInstanceInfo("nope");

        assertThat(response.getStatus()).isEqualTo("error");
        assertThat(response.getMessage()).isEqualTo("No matching RDS instance found");
        verifyNoInteractions(controlPlane);
    }

    @Test
    void vanishedInstanceIsAnError() {
        when(resolver.resolve("orders")).thenReturn(Optional.of("orders-prod"));
        when(controlPlane.describeInstance("orders-prod")).thenThrow(new InstanceNotFoundException("orders-prod"));

        InstanceInfoResponse response = service.getInstanceInfo("orders");

        assertThat(response.getStatus()).isEqualTo("error");
        assertThat(response.getMessage()).contains("orders-prod");
    }

    @Test
    void metricsReportLatestSamplePerKey() {
        when(resolver.resolve("orders")).thenReturn(Optional.of("orders-prod"));
        when(metricsClient.getMetric(anyString(), anyString(), anyMap(), anyInt(), anyString(), any(), any()))
                .thenReturn(List.of(1.0, 2.0));
        when(metricsClient.getMetric(anyString(), eq("CPUUtilization"), anyMap(), anyInt(), anyString(), any(), any()))
                .thenReturn(List.of(10.0, 42.5));
        when(metricsClient.getMetric(anyString(), eq("DBLoad"), anyMap(), anyInt(), anyString(), any(), any()))
                .thenReturn(List.of());

        MetricsResponse response = service.getMetrics("orders", 60);

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getDatabase()).isEqualTo("orders-prod");
        assertThat(response.getMetrics()).containsOnlyKeys(
                "cpu_utilization", "free_memory_bytes", "connections", "free_storage_bytes",
                "read_throughput", "write_throughput", "read_latency", "write_latency", "db_load");
        assertThat(response.getMetrics().get("cpu_utilization")).isEqualTo(42.5);
        assertThat(response.getMetrics().get("connections")).isEqualTo(2.0);
        assertThat(response.getMetrics()).containsEntry("db_load", null);

        Instant end = clock.instant();
        verify(metricsClient).getMetric("AWS/RDS", "CPUUtilization", Map.of("DBInstanceIdentifier", "orders-prod"),
                300, "Average", end.minus(Duration.ofMinutes(60)), end);
    }

    @Test
    void mysqlSlowQueriesFromSlowLog() {
        when(resolver.resolve("orders")).thenReturn(Optional.of("orders-prod"));
        when(controlPlane.describeInstance("orders-prod")).thenReturn(entry("orders-prod", "mysql", EngineFamily.MYSQL));
        when(logFetcher.fetchFullLog("orders-prod", "slowquery/mysql-slowquery.log")).thenReturn(String.join("\n",
                "# Time: 2024-01-01T10:00:00Z",
                "# Query_time: 5  Lock_time: 0.0  Rows_sent: 1  Rows_examined: 1",
                "select 5;",
                "# Time: 2024-01-01T10:01:00Z",
                "# Query_time: 50  Lock_time: 0.0  Rows_sent: 1  Rows_examined: 1",
                "select 50;",
                "# Time: 2024-01-01T10:02:00Z",
                "# Query_time: 1  Lock_time: 0.0  Rows_sent: 1  Rows_examined: 1",
                "select 1;",
                "# Time: 2024-01-01T10:03:00Z",
                "# Query_time: 20  Lock_time: 0.0  Rows_sent: 1  Rows_examined: 1",
                "select 20;"));

        SlowQueriesResponse response = service.getSlowQueries("orders", 60, 3);

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getEngine()).isEqualTo("mysql");
        assertThat(response.getLogFilesScanned()).isEqualTo(1);
        assertThat(response.getTotalSlowQueries()).isEqualTo(4);
        assertThat(response.getTopQueries()).extracting(SlowQueryRecord::getQueryTime).containsExactly(50.0, 20.0, 5.0);
        verifyNoInteractions(logFileDiscovery);
    }

    @Test
    void postgresSlowQueriesFromRecentLogFiles() {
        when(resolver.resolve("pg")).thenReturn(Optional.of("pg-prod"));
        when(controlPlane.describeInstance("pg-prod")).thenReturn(entry("pg-prod", "postgres", EngineFamily.POSTGRES));
        Instant since = clock.instant().minus(Duration.ofMinutes(30));
        when(logFileDiscovery.findRecent("pg-prod", "error/postgresql.log.", since))
                .thenReturn(List.of("error/postgresql.log.2024-01-01-09", "error/postgresql.log.2024-01-01-10"));
        when(logFetcher.fetchFullLog("pg-prod", "error/postgresql.log.2024-01-01-09")).thenReturn(
                "2024-01-01 09:59:00 UTC:h:u@d:[1]:LOG:  duration: 120.5 ms  statement: SELECT a");
        when(logFetcher.fetchFullLog("pg-prod", "error/postgresql.log.2024-01-01-10")).thenReturn(
                "2024-01-01 10:00:00 UTC:h:u@d:[1]:LOG:  duration: 900 ms  statement: SELECT b");

        SlowQueriesResponse response = service.getSlowQueries("pg", 30, 5);

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getLogFilesScanned()).isEqualTo(2);
        assertThat(response.getTopQueries()).extracting(SlowQueryRecord::getSql).containsExactly("SELECT b", "SELECT a");
        assertThat(response.getTopQueries().get(0).getQueryTimeUnit()).isEqualTo("ms");
    }

    @Test
    void unsupportedEngineNeverFetchesOrParses() {
        when(resolver.resolve("mssql")).thenReturn(Optional.of("mssql-prod"));
        when(controlPlane.describeInstance("mssql-prod"))
                .thenReturn(entry("mssql-prod", "sqlserver-ex", EngineFamily.OTHER));

        SlowQueriesResponse response = service.getSlowQueries("mssql", 60, 5);

        assertThat(response.getStatus()).isEqualTo("error");
        assertThat(response.getMessage()).isEqualTo("Unsupported database engine: sqlserver-ex");
        verifyNoInteractions(logFetcher, logFileDiscovery);
        verify(mysqlParser, never()).parse(anyString());
        verify(postgresParser, never()).parse(anyString());
    }

    @Test
    void topLoadSortedAndBounded() {
        when(resolver.resolve("orders")).thenReturn(Optional.of("orders-prod"));
        when(controlPlane.describeInstance("orders-prod")).thenReturn(entry("orders-prod", "mysql", EngineFamily.MYSQL));
        when(loadInsights.topLoad(eq("db-ORDERSPROD"), eq(LoadDimension.WAIT_EVENT), any(), any(), eq(2)))
                .thenReturn(List.of(load("io", 0.5), load("cpu", 2.0), load("lock", 1.0)));

        TopLoadResponse response = service.getTopLoad("orders", "wait_event", 60, 2);

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getDimension()).isEqualTo("db.wait_event");
        assertThat(response.getItems()).extracting(DimensionLoad::getValue).containsExactly("cpu", "lock");
    }

    @Test
    void topLoadRejectsUnknownDimension() {
        TopLoadResponse response = service.getTopLoad("orders", "planet", 60, 10);

        assertThat(response.getStatus()).isEqualTo("error");
        assertThat(response.getMessage()).isEqualTo("Unsupported load dimension: planet");
        verifyNoInteractions(resolver, loadInsights);
    }

    private static InstanceDirectoryEntry entry(String id, String engine, EngineFamily family) {
        return InstanceDirectoryEntry.builder()
                .identifier(id)
                .engine(engine)
                .engineFamily(family)
                .status("available")
                .endpointHost(id + ".abc.us-east-1.rds.amazonaws.com")
                .endpointPort(3306)
                .resourceId("db-" + id.replace("-", "").toUpperCase())
                .allocatedStorage(100L)
                .build();
    }

    private static DimensionLoad load(String value, double total) {
        return DimensionLoad.builder().value(value).totalLoad(total).dimensions(Map.of("db.wait_event.name", value)).build();
    }
}
