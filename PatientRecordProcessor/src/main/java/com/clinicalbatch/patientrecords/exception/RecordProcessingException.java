package com.clinicalbatch.patientrecords.exception;

/**
 * Failure of one pipeline step, tagged with its {@link ErrorKind}.
 */
public class RecordProcessingException extends RuntimeException {

    private final ErrorKind kind;

    public RecordProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RecordProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

}
