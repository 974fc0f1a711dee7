package com.clinicalbatch.patientrecords.model;

import java.util.List;

/**
 * One flattened patient entry, in CSV column order.
 */
public record PatientRow(
    String url,
    String resourceId,
    String lastUpdated,
    String status,
    String systemId,
    boolean active,
    String firstName,
    String lastName,
    String phone,
    String gender,
    String address
) {

    public static final List<String> HEADER = List.of(
        "url", "resource_id", "last_updated", "status", "system_id", "active",
        "first_name", "last_name", "phone", "gender", "address"
    );

    /**
     * Column values as written to the extract. Booleans use the
     * capitalised True/False form of the legacy extracts.
     */
    public List<String> values() {
        return List.of(
            url, resourceId, lastUpdated, status, systemId, active ? "True" : "False",
            firstName, lastName, phone, gender, address
        );
    }
}
