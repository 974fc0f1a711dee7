package com.clinicalbatch.patientrecords.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

import java.net.URI;

/**
 * Builds the S3 and SQS clients once per process.
 * Credentials come from the SDK default provider chain.
 */
@Slf4j
@Configuration
public class AwsClientConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(WorkerProperties props) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(props.getRegion()));

        if (hasEndpoint(props)) {
            log.info("Using S3 endpoint override: {}", props.getEndpoint());
            builder.endpointOverride(URI.create(props.getEndpoint()))
                    .serviceConfiguration(S3Configuration.builder()
                            .pathStyleAccessEnabled(props.isPathStyleAccess())
                            .build());
        }

        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public SqsClient sqsClient(WorkerProperties props) {
        SqsClientBuilder builder = SqsClient.builder()
                .region(Region.of(props.getRegion()));

        if (hasEndpoint(props)) {
            log.info("Using SQS endpoint override: {}", props.getEndpoint());
            builder.endpointOverride(URI.create(props.getEndpoint()));
        }

        return builder.build();
    }

    private static boolean hasEndpoint(WorkerProperties props) {
        return props.getEndpoint() != null && !props.getEndpoint().isBlank();
    }

}
