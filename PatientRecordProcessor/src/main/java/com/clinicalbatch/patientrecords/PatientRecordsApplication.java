package com.clinicalbatch.patientrecords;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Patient Record Processor - SQS/S3 batch worker
 *
 * Long-polls the batch queue for object-created notifications, flattens
 * the referenced patient bundle into a CSV extract and publishes it to
 * the output bucket.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PatientRecordsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatientRecordsApplication.class, args);
    }

}
