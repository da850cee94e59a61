package com.rdslens.cloud;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.pi.PiClient;
import software.amazon.awssdk.services.rds.RdsClient;

import java.net.URI;

/**
 * Builds the AWS SDK clients used by the control-plane, metrics and load adapters.
 *
 * Static credentials are used only when both access key and secret key are configured;
 * configuring just one of them is rejected at startup. With neither, the default provider chain
 * (environment, profile, instance role) applies.
 */
@Configuration
public class AwsClients {

    @Value("${rdslens.aws.region:us-east-1}")
    String region;

    @Value("${rdslens.aws.access-key:}")
    String accessKey;

    @Value("${rdslens.aws.secret-key:}")
    String secretKey;

    @Value("${rdslens.aws.session-token:}")
    String sessionToken;

    @Value("${rdslens.aws.endpoint-override:}")
    String endpointOverride;

    @Bean(destroyMethod = "close")
    RdsClient rdsClient() {
        var builder = RdsClient.builder()
                .region(Region.of(region))
                .httpClient(UrlConnectionHttpClient.create())
                .credentialsProvider(resolveCredentials())
                .overrideConfiguration(ClientOverrideConfiguration.builder().build());
        URI endpoint = endpoint();
        if (endpoint != null) {
            builder.endpointOverride(endpoint);
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    CloudWatchClient cloudWatchClient() {
        var builder = CloudWatchClient.builder()
                .region(Region.of(region))
                .httpClient(UrlConnectionHttpClient.create())
                .credentialsProvider(resolveCredentials())
                .overrideConfiguration(ClientOverrideConfiguration.builder().build());
        URI endpoint = endpoint();
        if (endpoint != null) {
            builder.endpointOverride(endpoint);
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    PiClient piClient() {
        var builder = PiClient.builder()
                .region(Region.of(region))
                .httpClient(UrlConnectionHttpClient.create())
                .credentialsProvider(resolveCredentials())
                .overrideConfiguration(ClientOverrideConfiguration.builder().build());
        URI endpoint = endpoint();
        if (endpoint != null) {
            builder.endpointOverride(endpoint);
        }
        return builder.build();
    }

    AwsCredentialsProvider resolveCredentials() {
        String trimmedAccess = trim(accessKey);
        String trimmedSecret = trim(secretKey);
        if ((trimmedAccess == null) != (trimmedSecret == null)) {
            throw new IllegalStateException(
                    "Both rdslens.aws.access-key and rdslens.aws.secret-key must be provided together, "
                            + "or neither to use the default credentials chain");
        }
        if (trimmedAccess != null) {
            String token = trim(sessionToken);
            AwsCredentials creds = token != null
                    ? AwsSessionCredentials.create(trimmedAccess, trimmedSecret, token)
                    : AwsBasicCredentials.create(trimmedAccess, trimmedSecret);
            return StaticCredentialsProvider.create(creds);
        }
        return DefaultCredentialsProvider.create();
    }

    private URI endpoint() {
        String trimmed = trim(endpointOverride);
        return trimmed != null ? URI.create(trimmed) : null;
    }

    private static String trim(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
