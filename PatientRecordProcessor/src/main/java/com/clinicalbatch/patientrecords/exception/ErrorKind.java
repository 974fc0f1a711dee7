package com.clinicalbatch.patientrecords.exception;

/**
 * Why a work item could not be turned into an extract.
 *
 * Deterministic kinds fail the same way on every redelivery of the same
 * message; today they are still requeued and left to the queue's
 * redrive policy.
 */
public enum ErrorKind {

    BAD_NOTIFICATION(true),
    FETCH_ERROR(false),
    MALFORMED_BUNDLE(true),
    NO_PATIENT_RECORDS(true),
    UNKNOWN(false);

    private final boolean deterministic;

    ErrorKind(boolean deterministic) {
        this.deterministic = deterministic;
    }

    public boolean isDeterministic() {
        return deterministic;
    }

}
