package com.clinicalbatch.patientrecords.notification;

import com.clinicalbatch.patientrecords.exception.ErrorKind;
import com.clinicalbatch.patientrecords.exception.RecordProcessingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Reads the object reference out of an S3 event notification body.
 *
 * Expected shape: {@code {"Records":[{"s3":{"bucket":{"name":..},"object":{"key":..}}}]}}.
 * Keys arrive form-encoded ('+' for space) and are decoded here.
 */
@Slf4j
@Component
public class StorageEventParser {

    private final ObjectMapper objectMapper;

    public StorageEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws RecordProcessingException BAD_NOTIFICATION when the body is not an
     *                                   event with at least one object key
     */
    public ObjectReference parse(String messageId, String body) {
        if (body == null || body.isBlank()) {
            throw bad(messageId, "empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RecordProcessingException(ErrorKind.BAD_NOTIFICATION,
                "Message " + messageId + " is not JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode records = root.path("Records");
        if (!records.isArray() || records.isEmpty()) {
            // s3:TestEvent and friends
            throw bad(messageId, "no Records in notification (event=" + root.path("Event").asText("n/a") + ")");
        }
        if (records.size() > 1) {
            log.warn("Message {} carries {} records, only the first is processed", messageId, records.size());
        }

        JsonNode s3 = records.get(0).path("s3");
        JsonNode keyNode = s3.path("object").path("key");
        if (!keyNode.isTextual() || keyNode.textValue().isBlank()) {
            throw bad(messageId, "missing s3.object.key");
        }

        String key;
        try {
            key = URLDecoder.decode(keyNode.textValue(), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new RecordProcessingException(ErrorKind.BAD_NOTIFICATION,
                "Message " + messageId + " has an undecodable key: " + keyNode.textValue(), e);
        }

        JsonNode bucketNode = s3.path("bucket").path("name");
        String bucket = bucketNode.isTextual() ? bucketNode.textValue() : null;

        return new ObjectReference(bucket, key);
    }

    private static RecordProcessingException bad(String messageId, String reason) {
        return new RecordProcessingException(ErrorKind.BAD_NOTIFICATION,
            "Message " + messageId + " is not a storage event: " + reason);
    }

}
