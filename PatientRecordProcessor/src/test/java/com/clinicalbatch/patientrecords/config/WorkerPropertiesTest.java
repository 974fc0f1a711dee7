package com.clinicalbatch.patientrecords.config;

import com.clinicalbatch.patientrecords.extractor.FamilyNameFormat;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(WorkerProperties.class)
    static class PropertiesOnly {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
        .withUserConfiguration(PropertiesOnly.class);

    private static final String[] REQUIRED = {
        "worker.input-bucket=in",
        "worker.output-bucket=out",
        "worker.queue-name=patient-batch",
        "worker.region=eu-west-1"
    };

    @Test
    void bindsRequiredAndDefaults() {
        runner.withPropertyValues(REQUIRED).run(context -> {
            assertNull(context.getStartupFailure());
            WorkerProperties props = context.getBean(WorkerProperties.class);
            assertEquals("in", props.getInputBucket());
            assertEquals("out", props.getOutputBucket());
            assertEquals("patient-batch", props.getQueueName());
            assertEquals("eu-west-1", props.getRegion());
            assertEquals(10, props.getBatchSize());
            assertEquals(120, props.getVisibilityTimeoutSeconds());
            assertEquals(20, props.getWaitTimeSeconds());
            assertEquals(".csv", props.getOutputExtension());
            assertEquals(FamilyNameFormat.LIST_LITERAL, props.getFamilyNameFormat());
        });
    }

    @Test
    void missingRequiredSettingFailsStartup() {
        for (int skip = 0; skip < REQUIRED.length; skip++) {
            String[] values = new String[REQUIRED.length - 1];
            for (int i = 0, j = 0; i < REQUIRED.length; i++) {
                if (i != skip) {
                    values[j++] = REQUIRED[i];
                }
            }
            String missing = REQUIRED[skip];
            runner.withPropertyValues(values).run(context ->
                assertNotNull(context.getStartupFailure(), "expected failure without " + missing));
        }
    }

    @Test
    void blankRequiredSettingFailsStartup() {
        runner.withPropertyValues(REQUIRED).withPropertyValues("worker.region=").run(context ->
            assertNotNull(context.getStartupFailure()));
    }

    @Test
    void batchSizeAboveQueueLimitFailsStartup() {
        runner.withPropertyValues(REQUIRED).withPropertyValues("worker.batch-size=11").run(context ->
            assertNotNull(context.getStartupFailure()));
    }

    @Test
    void scalarFamilyNameFormatBinds() {
        runner.withPropertyValues(REQUIRED).withPropertyValues("worker.family-name-format=scalar").run(context ->
            assertEquals(FamilyNameFormat.SCALAR, context.getBean(WorkerProperties.class).getFamilyNameFormat()));
    }
}
