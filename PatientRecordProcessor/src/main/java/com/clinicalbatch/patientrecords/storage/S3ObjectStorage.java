package com.clinicalbatch.patientrecords.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link ObjectStorage} on top of the synchronous S3 client.
 */
@Slf4j
@Component
public class S3ObjectStorage implements ObjectStorage {

    private static final String CSV_CONTENT_TYPE = "text/csv; charset=utf-8";

    private final S3Client s3Client;

    public S3ObjectStorage(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public void fetch(String bucket, String key, Path target) {
        try {
            // the SDK refuses to overwrite an existing file
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot clear " + target, e);
        }

        s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build(),
            ResponseTransformer.toFile(target));
        log.debug("Downloaded s3://{}/{} to {}", bucket, key, target);
    }

    @Override
    public void publish(Path source, String bucket, String key) {
        s3Client.putObject(PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(CSV_CONTENT_TYPE)
                .build(),
            RequestBody.fromFile(source));
        log.debug("Uploaded {} to s3://{}/{}", source, bucket, key);
    }

}
