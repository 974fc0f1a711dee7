package com.clinicalbatch.patientrecords.notification;

import com.clinicalbatch.patientrecords.config.JacksonConfig;
import com.clinicalbatch.patientrecords.exception.ErrorKind;
import com.clinicalbatch.patientrecords.exception.RecordProcessingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StorageEventParserTest {

    private final StorageEventParser parser = new StorageEventParser(new JacksonConfig().objectMapper());

    static String event(String bucket, String key) {
        return "{\"Records\":[{\"eventSource\":\"aws:s3\",\"eventName\":\"ObjectCreated:Put\","
            + "\"s3\":{\"bucket\":{\"name\":\"" + bucket + "\"},\"object\":{\"key\":\"" + key + "\",\"size\":42}}}]}";
    }

    @Test
    void readsBucketAndKey() {
        ObjectReference ref = parser.parse("m1", event("in-bucket", "bundles/patients.json"));

        assertEquals("in-bucket", ref.bucket());
        assertEquals("bundles/patients.json", ref.key());
    }

    @Test
    void decodesFormEncodedKey() {
        ObjectReference ref = parser.parse("m1", event("b", "my+folder/p%C3%A4tient%2B1.json"));

        assertEquals("my folder/pätient+1.json", ref.key());
    }

    @Test
    void usesFirstRecordOnly() {
        String body = "{\"Records\":["
            + "{\"s3\":{\"object\":{\"key\":\"first.json\"}}},"
            + "{\"s3\":{\"object\":{\"key\":\"second.json\"}}}]}";

        ObjectReference ref = parser.parse("m1", body);

        assertEquals("first.json", ref.key());
        assertNull(ref.bucket());
    }

    @Test
    void rejectsBodiesThatAreNotStorageEvents() {
        List<String> bodies = List.of(
            "",
            "plain text",
            "{}",
            "{\"Service\":\"Amazon S3\",\"Event\":\"s3:TestEvent\",\"Bucket\":\"b\"}",
            "{\"Records\":[]}",
            "{\"Records\":[{\"s3\":{\"object\":{}}}]}",
            "{\"Records\":[{\"s3\":{\"object\":{\"key\":\"\"}}}]}",
            "{\"Records\":[{\"s3\":{\"object\":{\"key\":\"bad%zz\"}}}]}"
        );

        for (String body : bodies) {
            RecordProcessingException e = assertThrows(RecordProcessingException.class,
                () -> parser.parse("m1", body), body);
            assertEquals(ErrorKind.BAD_NOTIFICATION, e.getKind(), body);
        }
    }

    @Test
    void baseNameDropsDirectoriesAndExtension() {
        assertEquals("patients", new ObjectReference(null, "a/b/patients.json").baseName());
        assertEquals("patients.v2", new ObjectReference(null, "patients.v2.json").baseName());
        assertEquals("README", new ObjectReference(null, "README").baseName());
        assertEquals(".hidden", new ObjectReference(null, "dir/.hidden").baseName());
    }
}
