package com.clinicalbatch.patientrecords.extractor;

/**
 * Rendering of the family name, which bundles carry as a list.
 */
public enum FamilyNameFormat {

    /** Whole list in bracket form, e.g. {@code ['Lee']}. Matches the extracts produced so far. */
    LIST_LITERAL,

    /** First element only, like the given name. */
    SCALAR
}
