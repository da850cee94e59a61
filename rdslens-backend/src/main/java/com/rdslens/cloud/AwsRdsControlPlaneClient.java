package com.rdslens.cloud;

import com.rdslens.model.EngineFamily;
import com.rdslens.model.InstanceDirectoryEntry;
import com.rdslens.model.LogFileDescriptor;
import com.rdslens.model.LogFilePage;
import com.rdslens.model.LogPortion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DbInstanceNotFoundException;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbLogFilesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbLogFilesResponse;
import software.amazon.awssdk.services.rds.model.DownloadDbLogFilePortionRequest;
import software.amazon.awssdk.services.rds.model.DownloadDbLogFilePortionResponse;
import software.amazon.awssdk.services.rds.model.Endpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ControlPlaneClient} backed by the Amazon RDS API.
 */
@Component
public class AwsRdsControlPlaneClient implements ControlPlaneClient {
    private static final Logger log = LoggerFactory.getLogger(AwsRdsControlPlaneClient.class);

    private final RdsClient rds;

    public AwsRdsControlPlaneClient(RdsClient rds) {
        this.rds = rds;
    }

    @Override
    public List<InstanceDirectoryEntry> describeInstances() {
        try {
            DescribeDbInstancesResponse response = rds.describeDBInstances(DescribeDbInstancesRequest.builder().build());
            List<InstanceDirectoryEntry> entries = new ArrayList<>(response.dbInstances().size());
            for (DBInstance instance : response.dbInstances()) {
                entries.add(toEntry(instance));
            }
            return entries;
        } catch (SdkException e) {
            throw new UpstreamServiceException("Failed to get rds instances: " + e.getMessage(), e);
        }
    }

    @Override
    public InstanceDirectoryEntry describeInstance(String identifier) {
        try {
            DescribeDbInstancesResponse response = rds.describeDBInstances(DescribeDbInstancesRequest.builder()
                    .dbInstanceIdentifier(identifier)
                    .build());
            if (response.dbInstances().isEmpty()) {
                throw new InstanceNotFoundException(identifier);
            }
            return toEntry(response.dbInstances().get(0));
        } catch (DbInstanceNotFoundException e) {
            throw new InstanceNotFoundException(identifier);
        } catch (SdkException e) {
            throw new UpstreamServiceException("Failed to describe rds instance " + identifier + ": " + e.getMessage(), e);
        }
    }

    @Override
    public LogFilePage describeLogFiles(String identifier, String filenameContains, Long lastWrittenSinceMillis, String cursor) {
        try {
            DescribeDbLogFilesRequest.Builder request = DescribeDbLogFilesRequest.builder()
                    .dbInstanceIdentifier(identifier)
                    .filenameContains(filenameContains);
            if (lastWrittenSinceMillis != null) {
                request.fileLastWritten(lastWrittenSinceMillis);
            }
            if (cursor != null && !cursor.isBlank()) {
                request.marker(cursor);
            }

            DescribeDbLogFilesResponse response = rds.describeDBLogFiles(request.build());
            List<LogFileDescriptor> files = response.describeDBLogFiles().stream()
                    .map(f -> new LogFileDescriptor(
                            f.logFileName(),
                            f.lastWritten() != null ? f.lastWritten() : 0L,
                            f.size()))
                    .toList();
            log.debug("Listed {} log files for {} (filter={}, cursor={})", files.size(), identifier, filenameContains, cursor);
            return new LogFilePage(files, response.marker());
        } catch (DbInstanceNotFoundException e) {
            throw new InstanceNotFoundException(identifier);
        } catch (SdkException e) {
            throw new UpstreamServiceException("Failed to list log files for " + identifier + ": " + e.getMessage(), e);
        }
    }

    @Override
    public LogPortion downloadLogPortion(String identifier, String logFileName, String cursor, int numberOfLines) {
        try {
            DownloadDbLogFilePortionResponse response = rds.downloadDBLogFilePortion(DownloadDbLogFilePortionRequest.builder()
                    .dbInstanceIdentifier(identifier)
                    .logFileName(logFileName)
                    .marker(cursor)
                    .numberOfLines(numberOfLines)
                    .build());
            return new LogPortion(
                    response.logFileData(),
                    response.marker(),
                    Boolean.TRUE.equals(response.additionalDataPending()));
        } catch (DbInstanceNotFoundException e) {
            throw new InstanceNotFoundException(identifier);
        } catch (SdkException e) {
            throw new UpstreamServiceException("Failed to download " + logFileName + " from " + identifier + ": " + e.getMessage(), e);
        }
    }

    static InstanceDirectoryEntry toEntry(DBInstance instance) {
        Endpoint endpoint = instance.endpoint();
        return InstanceDirectoryEntry.builder()
                .identifier(instance.dbInstanceIdentifier())
                .engine(instance.engine())
                .engineFamily(EngineFamily.fromEngine(instance.engine()))
                .status(instance.dbInstanceStatus())
                .endpointHost(endpoint != null ? endpoint.address() : null)
                .endpointPort(endpoint != null ? endpoint.port() : null)
                .resourceId(instance.dbiResourceId())
                .allocatedStorage(instance.allocatedStorage() != null ? instance.allocatedStorage().longValue() : null)
                .build();
    }
}
