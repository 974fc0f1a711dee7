package com.clinicalbatch.patientrecords.storage;

import java.nio.file.Path;

/**
 * Object store access by bucket and key.
 */
public interface ObjectStorage {

    /**
     * Downloads an object to a local file, replacing it if present.
     */
    void fetch(String bucket, String key, Path target);

    /**
     * Uploads a local file, overwriting any object under the same key.
     */
    void publish(Path source, String bucket, String key);

}
