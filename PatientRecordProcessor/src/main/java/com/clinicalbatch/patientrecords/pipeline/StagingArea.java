package com.clinicalbatch.patientrecords.pipeline;

import com.clinicalbatch.patientrecords.config.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local directory holding the downloaded bundle and generated extract of the
 * item being processed. Files are named after the queue message id so a
 * redelivery overwrites rather than accumulates.
 */
@Slf4j
@Component
public class StagingArea {

    private final Path root;

    @Autowired
    public StagingArea(WorkerProperties props) {
        this(Paths.get(props.getStagingDir()));
    }

    public StagingArea(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create staging directory " + root, e);
        }
        log.info("Staging directory: {}", root.toAbsolutePath());
    }

    public Path inputFile(String messageId) {
        return root.resolve(safe(messageId) + ".input.json");
    }

    public Path outputFile(String messageId) {
        return root.resolve(safe(messageId) + ".output.csv");
    }

    /**
     * Deletes the given files.
     *
     * @throws UncheckedIOException on the first file that cannot be removed
     */
    public void release(Path... files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot remove staged file " + file, e);
            }
        }
    }

    /**
     * Same as {@link #release} but only logs failures; used on the failure path.
     */
    public void releaseQuietly(Path... files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Could not remove staged file {}: {}", file, e.getMessage());
            }
        }
    }

    public Path getRoot() {
        return root;
    }

    private static String safe(String messageId) {
        return messageId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

}
