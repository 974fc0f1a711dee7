package com.clinicalbatch.patientrecords.notification;

/**
 * Decoded object key taken from a storage event, plus the bucket the event named (may be null).
 */
public record ObjectReference(String bucket, String key) {

    /**
     * Key without directories or extension: {@code in/2024/bundle.json -> bundle}.
     */
    public String baseName() {
        String name = key.substring(key.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
