package com.clinicalbatch.patientrecords.config;

import com.clinicalbatch.patientrecords.extractor.FamilyNameFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed binding for all worker.* configuration.
 *
 * The four identifiers below are mandatory: application.yml maps them from the
 * s3InputBucket, s3OutputBucket, SQSBatchQueue and AWSRegion environment
 * variables, and a blank value aborts start-up.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    /** Bucket the notifications point into. */
    @NotBlank(message = "Input bucket is required")
    private String inputBucket;

    /** Bucket receiving the CSV extracts. */
    @NotBlank(message = "Output bucket is required")
    private String outputBucket;

    /** Name of the SQS queue carrying the S3 notifications. */
    @NotBlank(message = "Queue name is required")
    private String queueName;

    /** AWS region for both S3 and SQS. */
    @NotBlank(message = "Region is required")
    private String region;

    /** Optional endpoint override (LocalStack, MinIO...). */
    private String endpoint;

    /** Path-style bucket addressing, only honoured with an endpoint override. */
    private boolean pathStyleAccess = true;

    /** Max messages per receive call (SQS caps this at 10). */
    @Min(1)
    @Max(10)
    private int batchSize = 10;

    /** Seconds a received message stays hidden while we work on it. */
    @Min(0)
    private int visibilityTimeoutSeconds = 120;

    /** Long-poll wait per receive call. */
    @Min(0)
    @Max(20)
    private int waitTimeSeconds = 20;

    /** Pause after a failed receive call. */
    @Min(0)
    private long receiveErrorDelayMs = 1000;

    /** Local directory for downloaded bundles and generated extracts. */
    @NotBlank
    private String stagingDir = System.getProperty("java.io.tmpdir") + "/patient-records";

    /** Extension replacing the input object's extension. */
    @NotBlank
    private String outputExtension = ".csv";

    /** Key prefix for published extracts, empty for the bucket root. */
    private String outputPrefix = "";

    /** How the last_name column renders the family name. */
    @NotNull
    private FamilyNameFormat familyNameFormat = FamilyNameFormat.LIST_LITERAL;

    /** Log the counters every N batches, 0 disables the summary. */
    @Min(0)
    private int statsEveryBatches = 30;

    /** Starts the polling thread when the context comes up. */
    private boolean enabled = true;

}
