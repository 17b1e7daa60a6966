package com.github.nlayna.coldarchive.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class AwsConfig {

    private final ArchiveProperties archiveProperties;

    /**
     * Static keys when both are configured, the default AWS provider chain otherwise.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        String accessKeyId = archiveProperties.getAccessKeyId();
        String secretAccessKey = archiveProperties.getSecretAccessKey();
        if (accessKeyId != null && !accessKeyId.isBlank() && secretAccessKey != null && !secretAccessKey.isBlank()) {
            log.info("Using static AWS credentials for access key {}", mask(accessKeyId));
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
        }
        log.info("Using default AWS credentials provider chain");
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(archiveProperties.getRegion()))
                .credentialsProvider(credentialsProvider)
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(archiveProperties.isPathStyleAccess())
                        .build());

        String endpoint = archiveProperties.getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        log.info("Created S3 client: region={}, bucket={}, endpoint={}",
                archiveProperties.getRegion(), archiveProperties.getBucket(), endpoint == null ? "default" : endpoint);
        return builder.build();
    }

    private static String mask(String accessKeyId) {
        if (accessKeyId.length() <= 4) {
            return "****";
        }
        return accessKeyId.substring(0, 4) + "****";
    }
}
