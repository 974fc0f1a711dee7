package com.clinicalbatch.patientrecords.pipeline;

import com.clinicalbatch.patientrecords.config.WorkerProperties;
import com.clinicalbatch.patientrecords.exception.ErrorKind;
import com.clinicalbatch.patientrecords.exception.RecordProcessingException;
import com.clinicalbatch.patientrecords.extractor.PatientRecordExtractor;
import com.clinicalbatch.patientrecords.model.PatientRow;
import com.clinicalbatch.patientrecords.model.ProcessingOutcome;
import com.clinicalbatch.patientrecords.notification.ObjectReference;
import com.clinicalbatch.patientrecords.notification.StorageEventParser;
import com.clinicalbatch.patientrecords.queue.WorkItem;
import com.clinicalbatch.patientrecords.storage.ObjectStorage;
import com.clinicalbatch.patientrecords.writer.CsvTabularWriter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns one work item into one published extract.
 *
 * Flow:
 * 1. Parse the notification for the object key
 * 2. Download the bundle into the staging area
 * 3. Parse the bundle
 * 4. Extract patient rows
 * 5. Write the CSV extract
 * 6. Upload it to the output bucket
 * 7. Remove both staged files
 * <p>
 * Never throws: every failure comes back as a {@link ProcessingOutcome}. The
 * caller decides what to do with the queue message.
 */
@Slf4j
@Service
public class FileProcessingPipeline {

    private final StorageEventParser eventParser;
    private final ObjectStorage storage;
    private final PatientRecordExtractor extractor;
    private final CsvTabularWriter writer;
    private final StagingArea staging;
    private final WorkerProperties props;

    public FileProcessingPipeline(StorageEventParser eventParser,
                                  ObjectStorage storage,
                                  PatientRecordExtractor extractor,
                                  CsvTabularWriter writer,
                                  StagingArea staging,
                                  WorkerProperties props) {
        this.eventParser = eventParser;
        this.storage = storage;
        this.extractor = extractor;
        this.writer = writer;
        this.staging = staging;
        this.props = props;
    }

    public ProcessingOutcome process(WorkItem item) {
        String messageId = item.messageId();
        Path input = staging.inputFile(messageId);
        Path output = staging.outputFile(messageId);
        boolean released = false;

        try {
            ObjectReference ref = eventParser.parse(messageId, item.body());
            if (ref.bucket() != null && !ref.bucket().equals(props.getInputBucket())) {
                log.warn("Message {} names bucket {}, reading from configured input bucket {}",
                    messageId, ref.bucket(), props.getInputBucket());
            }

            fetch(ref.key(), input);

            List<PatientRow> rows;
            try (InputStream in = Files.newInputStream(input)) {
                JsonNode bundle = extractor.parse(in, ref.key());
                rows = extractor.extract(bundle, ref.key());
            }

            try (OutputStream out = Files.newOutputStream(output)) {
                writer.write(rows, out);
            }

            String outputKey = outputKey(ref);
            storage.publish(output, props.getOutputBucket(), outputKey);

            staging.release(input, output);
            released = true;

            log.info("Processed {}: {} patient row(s) -> s3://{}/{}",
                ref.key(), rows.size(), props.getOutputBucket(), outputKey);
            return ProcessingOutcome.success(outputKey, rows.size());

        } catch (RecordProcessingException e) {
            return ProcessingOutcome.failure(e.getKind(), e.getMessage());
        } catch (Exception e) {
            log.debug("Unexpected failure for message {}", messageId, e);
            return ProcessingOutcome.failure(ErrorKind.UNKNOWN,
                e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            if (!released) {
                staging.releaseQuietly(input, output);
            }
        }
    }

    String outputKey(ObjectReference ref) {
        return props.getOutputPrefix() + ref.baseName() + props.getOutputExtension();
    }

    private void fetch(String key, Path target) {
        try {
            storage.fetch(props.getInputBucket(), key, target);
        } catch (Exception e) {
            throw new RecordProcessingException(ErrorKind.FETCH_ERROR,
                "Cannot fetch s3://" + props.getInputBucket() + "/" + key + ": " + e.getMessage(), e);
        }
    }

}
