package com.rdslens.controller;

import com.rdslens.api.InstanceInfoRequest;
import com.rdslens.api.InstanceInfoResponse;
import com.rdslens.api.InstancesResponse;
import com.rdslens.api.MetricsRequest;
import com.rdslens.api.MetricsResponse;
import com.rdslens.api.SlowQueriesRequest;
import com.rdslens.api.SlowQueriesResponse;
import com.rdslens.api.ToolDescriptor;
import com.rdslens.api.TopLoadRequest;
import com.rdslens.api.TopLoadResponse;
import com.rdslens.service.RdsDiagnosticsService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP surface of the diagnostic tools.
 *
 * Tool endpoints always answer 200 with a structured result; failures are reported through its
 * {@code status} and {@code message} fields. Only malformed requests are rejected with 400.
 */
@RestController
@RequestMapping("/v1")
public class RdsLensController {

    private static final Logger log = LoggerFactory.getLogger(RdsLensController.class);

    private static final ToolDescriptor.Parameter DATABASE_NAME = new ToolDescriptor.Parameter(
            "database_name", "string", true, "Database name; matched against known RDS instance identifiers");
    private static final ToolDescriptor.Parameter PERIOD_MINUTES = new ToolDescriptor.Parameter(
            "period_minutes", "integer", false, "Look-back window in minutes (default 60)");

    private final RdsDiagnosticsService diagnosticsService;

    public RdsLensController(RdsDiagnosticsService diagnosticsService) {
        this.diagnosticsService = diagnosticsService;
    }

    /**
     * Describe the callable tools.
     *
     * GET /v1/tools
     */
    @GetMapping("/tools")
    public ResponseEntity<List<ToolDescriptor>> listTools() {
        return ResponseEntity.ok(List.of(
                new ToolDescriptor("get_instance_info", "/v1/tools/get_instance_info",
                        "Get detailed information about an RDS database instance",
                        List.of(DATABASE_NAME)),
                new ToolDescriptor("get_metrics", "/v1/tools/get_metrics",
                        "Get key RDS metrics including CPU, memory, connections, storage, throughput, latency and load",
                        List.of(DATABASE_NAME, PERIOD_MINUTES)),
                new ToolDescriptor("get_slow_queries", "/v1/tools/get_slow_queries",
                        "Get the slowest queries from the RDS slow query log (MySQL and PostgreSQL)",
                        List.of(DATABASE_NAME, PERIOD_MINUTES,
                                new ToolDescriptor.Parameter("limit", "integer", false, "Queries to return, at most 5"))),
                new ToolDescriptor("get_top_load", "/v1/tools/get_top_load",
                        "Get top database load (average active sessions) grouped by statement, user or wait event",
                        List.of(DATABASE_NAME, PERIOD_MINUTES,
                                new ToolDescriptor.Parameter("dimension", "string", false, "statement | user | wait_event"),
                                new ToolDescriptor.Parameter("limit", "integer", false, "Entries to return, at most 25")))
        ));
    }

    /**
     * List known instance identifiers.
     *
     * GET /v1/instances
     */
    @GetMapping("/instances")
    public ResponseEntity<InstancesResponse> listInstances() {
        return ResponseEntity.ok(diagnosticsService.listInstances());
    }

    /**
     * POST /v1/tools/get_instance_info
     */
    @PostMapping("/tools/get_instance_info")
    public ResponseEntity<InstanceInfoResponse> getInstanceInfo(@Valid @RequestBody InstanceInfoRequest request) {
        log.info("get_instance_info: database_name={}, trace_id={}", request.getDatabaseName(), MDC.get("trace_id"));
        return ResponseEntity.ok(diagnosticsService.getInstanceInfo(request.getDatabaseName()));
    }

    /**
     * POST /v1/tools/get_metrics
     */
    @PostMapping("/tools/get_metrics")
    public ResponseEntity<MetricsResponse> getMetrics(@Valid @RequestBody MetricsRequest request) {
        log.info("get_metrics: database_name={}, trace_id={}", request.getDatabaseName(), MDC.get("trace_id"));
        return ResponseEntity.ok(diagnosticsService.getMetrics(
                request.getDatabaseName(),
                request.getPeriodMinutes() != null ? request.getPeriodMinutes() : 60));
    }

    /**
     * POST /v1/tools/get_slow_queries
     */
    @PostMapping("/tools/get_slow_queries")
    public ResponseEntity<SlowQueriesResponse> getSlowQueries(@Valid @RequestBody SlowQueriesRequest request) {
        log.info("get_slow_queries: database_name={}, trace_id={}", request.getDatabaseName(), MDC.get("trace_id"));
        return ResponseEntity.ok(diagnosticsService.getSlowQueries(
                request.getDatabaseName(),
                request.getPeriodMinutes() != null ? request.getPeriodMinutes() : 60,
                request.getLimit() != null ? request.getLimit() : 5));
    }

    /**
     * POST /v1/tools/get_top_load
     */
    @PostMapping("/tools/get_top_load")
    public ResponseEntity<TopLoadResponse> getTopLoad(@Valid @RequestBody TopLoadRequest request) {
        log.info("get_top_load: database_name={}, dimension={}, trace_id={}",
                request.getDatabaseName(), request.getDimension(), MDC.get("trace_id"));
        return ResponseEntity.ok(diagnosticsService.getTopLoad(
                request.getDatabaseName(),
                request.getDimension(),
                request.getPeriodMinutes() != null ? request.getPeriodMinutes() : 60,
                request.getLimit() != null ? request.getLimit() : 10));
    }
}
