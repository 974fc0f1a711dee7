package com.clinicalbatch.patientrecords.worker;

import com.clinicalbatch.patientrecords.config.WorkerProperties;
import com.clinicalbatch.patientrecords.exception.ErrorKind;
import com.clinicalbatch.patientrecords.model.ProcessingOutcome;
import com.clinicalbatch.patientrecords.pipeline.FileProcessingPipeline;
import com.clinicalbatch.patientrecords.queue.WorkItem;
import com.clinicalbatch.patientrecords.queue.WorkQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Process-wide polling loop.
 *
 * Receives a batch, runs the pipeline over each item in receipt order and
 * settles every message: delete on success, visibility 0 on failure so it is
 * redelivered at once. Redelivery limits and dead-lettering belong to the
 * queue's redrive policy. No exception thrown by one item reaches its
 * siblings or stops the loop. An {@link Error} requeues the item in flight,
 * stops the loop and hands the error to the fatal handler, which by default
 * exits the application with status 1 so the process gets restarted.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerLoop {

    private final WorkQueue queue;
    private final FileProcessingPipeline pipeline;
    private final WorkerProperties props;
    private final Consumer<Throwable> fatalHandler;

    private final WorkerStats stats = new WorkerStats();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "patient-record-worker");
        t.setDaemon(false);
        return t;
    });

    private volatile Thread workerThread;

    @Autowired
    public WorkerLoop(WorkQueue queue, FileProcessingPipeline pipeline, WorkerProperties props,
                      ConfigurableApplicationContext context) {
        this(queue, pipeline, props, t -> System.exit(SpringApplication.exit(context, () -> 1)));
    }

    WorkerLoop(WorkQueue queue, FileProcessingPipeline pipeline, WorkerProperties props,
               Consumer<Throwable> fatalHandler) {
        this.queue = queue;
        this.pipeline = pipeline;
        this.props = props;
        this.fatalHandler = fatalHandler;
    }

    @PostConstruct
    public void start() {
        log.info("Starting worker: queue={}, batchSize={}, visibility={}s, wait={}s",
            props.getQueueName(), props.getBatchSize(),
            props.getVisibilityTimeoutSeconds(), props.getWaitTimeSeconds());
        running.set(true);
        executor.submit(this::runLoop);
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping worker...");
        running.set(false);
        executor.shutdownNow();
        if (Thread.currentThread() == workerThread) {
            // called from the loop thread itself, which cannot await its own termination
            return;
        }
        try {
            if (!executor.awaitTermination(props.getWaitTimeSeconds() + 5L, TimeUnit.SECONDS)) {
                log.warn("Worker thread did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Worker stopped: {}", stats);
    }

    /**
     * Polls until stopped. {@link #start()} sets the running flag before this is submitted.
     */
    void runLoop() {
        workerThread = Thread.currentThread();
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                pollOnce();
            }
        } catch (Throwable t) {
            running.set(false);
            log.error("Worker loop died, exiting: {}", t.toString(), t);
            fatalHandler.accept(t);
        } finally {
            running.set(false);
        }
    }

    /**
     * Runs the loop on the calling thread.
     */
    void runInline() {
        running.set(true);
        runLoop();
    }

    /**
     * One receive-and-settle cycle.
     *
     * @return number of items received
     */
    int pollOnce() {
        List<WorkItem> batch;
        try {
            batch = queue.receive(props.getBatchSize(),
                props.getVisibilityTimeoutSeconds(), props.getWaitTimeSeconds());
        } catch (Exception e) {
            stats.receiveError();
            log.error("Error receiving from queue {}: {}", props.getQueueName(), e.getMessage());
            pause(props.getReceiveErrorDelayMs());
            return 0;
        }

        stats.batch(batch.size());
        if (batch.isEmpty()) {
            return 0;
        }

        log.debug("Processing batch of {} item(s)", batch.size());
        for (WorkItem item : batch) {
            handle(item);
        }

        if (props.getStatsEveryBatches() > 0 && stats.getBatches() % props.getStatsEveryBatches() == 0) {
            log.info("Worker stats: {}", stats);
        }
        return batch.size();
    }

    void handle(WorkItem item) {
        ProcessingOutcome outcome;
        try {
            outcome = pipeline.process(item);
        } catch (Exception e) {
            outcome = ProcessingOutcome.failure(ErrorKind.UNKNOWN, e.getMessage());
        } catch (Error e) {
            stats.failure(ErrorKind.UNKNOWN);
            log.error("Message {} aborted by {}, requeued", item.messageId(), e.toString());
            requeue(item);
            throw e;
        }

        if (outcome.isSuccess()) {
            stats.success(outcome.rowCount());
            acknowledge(item);
        } else {
            stats.failure(outcome.kind());
            logFailure(item, outcome);
            requeue(item);
        }
    }

    private void acknowledge(WorkItem item) {
        try {
            item.acknowledge();
            log.debug("Acknowledged message {}", item.messageId());
        } catch (Exception e) {
            // visibility timeout will expire and the item comes back; output is overwritten then
            log.error("Error acknowledging message {}: {}", item.messageId(), e.getMessage());
        }
    }

    private void requeue(WorkItem item) {
        try {
            item.setVisibility(0);
        } catch (Exception e) {
            log.error("Error resetting visibility of message {}: {}", item.messageId(), e.getMessage());
        }
    }

    private void logFailure(WorkItem item, ProcessingOutcome outcome) {
        if (outcome.kind().isDeterministic()) {
            log.error("Message {} failed ({}), receive count {}, will fail again until dead-lettered: {}",
                item.messageId(), outcome.kind(), item.receiveCount(), outcome.reason());
        } else {
            log.warn("Message {} failed ({}), receive count {}, requeued: {}",
                item.messageId(), outcome.kind(), item.receiveCount(), outcome.reason());
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public WorkerStats getStats() {
        return stats;
    }

    public boolean isRunning() {
        return running.get();
    }

}
