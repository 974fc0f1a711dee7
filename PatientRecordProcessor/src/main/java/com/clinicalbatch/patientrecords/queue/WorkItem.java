package com.clinicalbatch.patientrecords.queue;

/**
 * One received queue notification.
 * Exactly one of {@link #acknowledge()} or {@link #setVisibility(int)} is
 * called per delivery.
 */
public interface WorkItem {

    String messageId();

    String body();

    /** Delivery count reported by the queue, 0 when unknown. */
    int receiveCount();

    /** Removes the message from the queue for good. */
    void acknowledge();

    /** Changes the remaining visibility timeout; 0 makes it redeliverable at once. */
    void setVisibility(int seconds);

}
