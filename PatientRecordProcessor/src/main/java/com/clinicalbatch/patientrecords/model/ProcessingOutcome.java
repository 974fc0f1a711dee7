package com.clinicalbatch.patientrecords.model;

import com.clinicalbatch.patientrecords.exception.ErrorKind;

/**
 * Result of running the pipeline over one work item.
 *
 * @param kind   null on success
 * @param reason human readable failure reason, null on success
 */
public record ProcessingOutcome(ErrorKind kind, String reason, String outputKey, int rowCount) {

    public static ProcessingOutcome success(String outputKey, int rowCount) {
        return new ProcessingOutcome(null, null, outputKey, rowCount);
    }

    public static ProcessingOutcome failure(ErrorKind kind, String reason) {
        return new ProcessingOutcome(kind, reason, null, 0);
    }

    public boolean isSuccess() {
        return kind == null;
    }
}
