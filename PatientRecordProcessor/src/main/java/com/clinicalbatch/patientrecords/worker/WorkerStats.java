package com.clinicalbatch.patientrecords.worker;

import com.clinicalbatch.patientrecords.exception.ErrorKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of the worker loop.
 */
public class WorkerStats {

    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong emptyBatches = new AtomicLong();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong rowsWritten = new AtomicLong();
    private final AtomicLong receiveErrors = new AtomicLong();
    private final Map<ErrorKind, AtomicLong> failures = new EnumMap<>(ErrorKind.class);

    public WorkerStats() {
        for (ErrorKind kind : ErrorKind.values()) {
            failures.put(kind, new AtomicLong());
        }
    }

    void batch(int size) {
        batches.incrementAndGet();
        received.addAndGet(size);
        if (size == 0) {
            emptyBatches.incrementAndGet();
        }
    }

    void success(int rows) {
        succeeded.incrementAndGet();
        rowsWritten.addAndGet(rows);
    }

    void failure(ErrorKind kind) {
        failures.get(kind).incrementAndGet();
    }

    void receiveError() {
        receiveErrors.incrementAndGet();
    }

    public long getBatches() {
        return batches.get();
    }

    public long getEmptyBatches() {
        return emptyBatches.get();
    }

    public long getReceived() {
        return received.get();
    }

    public long getSucceeded() {
        return succeeded.get();
    }

    public long getRowsWritten() {
        return rowsWritten.get();
    }

    public long getReceiveErrors() {
        return receiveErrors.get();
    }

    public long getFailures(ErrorKind kind) {
        return failures.get(kind).get();
    }

    public long getFailed() {
        return failures.values().stream().mapToLong(AtomicLong::get).sum();
    }

    @Override
    public String toString() {
        return "batches=" + batches + " received=" + received + " ok=" + succeeded
            + " failed=" + failures + " rows=" + rowsWritten + " receiveErrors=" + receiveErrors;
    }
}
