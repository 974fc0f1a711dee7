package com.clinicalbatch.patientrecords.extractor;

import com.clinicalbatch.patientrecords.config.WorkerProperties;
import com.clinicalbatch.patientrecords.exception.ErrorKind;
import com.clinicalbatch.patientrecords.exception.RecordProcessingException;
import com.clinicalbatch.patientrecords.model.PatientRow;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Flattens a patient bundle into {@link PatientRow}s.
 *
 * Every field is read on its own: a missing or oddly shaped value yields an
 * empty column (false for active) and never drops the row. Entries without a
 * resource, or whose resourceType is not patient, are skipped with a warning.
 */
@Slf4j
@Component
public class PatientRecordExtractor {

    private static final String PATIENT_TYPE = "patient";

    private final ObjectMapper objectMapper;
    private final FamilyNameFormat familyNameFormat;

    @Autowired
    public PatientRecordExtractor(ObjectMapper objectMapper, WorkerProperties props) {
        this(objectMapper, props.getFamilyNameFormat());
    }

    public PatientRecordExtractor(ObjectMapper objectMapper, FamilyNameFormat familyNameFormat) {
        this.objectMapper = objectMapper;
        this.familyNameFormat = familyNameFormat;
    }

    /**
     * Parses raw bundle JSON.
     *
     * @throws RecordProcessingException MALFORMED_BUNDLE when the bytes are not a JSON object
     */
    public JsonNode parse(InputStream in, String source) {
        JsonNode bundle;
        try {
            bundle = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new RecordProcessingException(ErrorKind.MALFORMED_BUNDLE,
                "Bundle " + source + " is not valid JSON: " + e.getMessage(), e);
        }
        if (bundle == null || !bundle.isObject()) {
            throw new RecordProcessingException(ErrorKind.MALFORMED_BUNDLE,
                "Bundle " + source + " is not a JSON object");
        }
        return bundle;
    }

    /**
     * Extracts one row per patient entry, in entry order.
     *
     * @param bundle parsed bundle
     * @param source object key, used in diagnostics only
     * @throws RecordProcessingException MALFORMED_BUNDLE without an entry list,
     *                                   NO_PATIENT_RECORDS when nothing qualified
     */
    public List<PatientRow> extract(JsonNode bundle, String source) {
        JsonNode entries = bundle == null ? null : bundle.get("entry");
        if (entries == null || !entries.isArray()) {
            throw new RecordProcessingException(ErrorKind.MALFORMED_BUNDLE,
                "Bundle " + source + " has no entry list");
        }

        List<PatientRow> rows = new ArrayList<>();
        for (JsonNode entry : entries) {
            String url = text(entry.path("fullUrl"));
            JsonNode resource = entry.path("resource");

            if (!resource.isObject() || resource.isEmpty()) {
                log.warn("Resource not found for url {} in {}, skipping entry", url, source);
                continue;
            }

            String resourceType = text(resource.path("resourceType"));
            if (!PATIENT_TYPE.equalsIgnoreCase(resourceType)) {
                log.warn("Resource type '{}' is not patient for url {} in {}, skipping entry",
                    resourceType, url, source);
                continue;
            }

            rows.add(toRow(url, resource));
        }

        if (rows.isEmpty()) {
            throw new RecordProcessingException(ErrorKind.NO_PATIENT_RECORDS,
                "Bundle " + source + " contains no patient entries");
        }

        log.debug("Extracted {} patient row(s) from {}", rows.size(), source);
        return rows;
    }

    private PatientRow toRow(String url, JsonNode resource) {
        JsonNode name = first(resource.path("name"));

        return new PatientRow(
            url,
            text(resource.path("id")),
            text(resource.path("meta").path("lastUpdated")),
            text(resource.path("text").path("status")).toLowerCase(Locale.ROOT),
            text(resource.path("text").path("value")),
            bool(resource.path("active")),
            text(first(name.path("given"))),
            familyName(name.path("family")),
            text(first(resource.path("telecom")).path("value")),
            text(resource.path("gender")),
            text(first(resource.path("address")).path("value"))
        );
    }

    private String familyName(JsonNode family) {
        if (!family.isArray()) {
            return text(family);
        }
        if (familyNameFormat == FamilyNameFormat.SCALAR) {
            return text(first(family));
        }
        return listLiteral(family);
    }

    // --- Helper methods ---

    /**
     * First element of an array, or the node itself when it is a single object.
     * Anything else resolves to a missing node so chained path() calls stay safe.
     */
    private static JsonNode first(JsonNode node) {
        if (node.isArray()) {
            return node.path(0);
        }
        return node.isObject() ? node : MissingNode.getInstance();
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText();
    }

    private static boolean bool(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.isTextual() && Boolean.parseBoolean(node.textValue());
    }

    /**
     * Bracketed, single-quoted rendering of a list of names: {@code ['Lee', 'Ng']}.
     * A name containing a single quote but no double quote is double-quoted instead.
     */
    static String listLiteral(JsonNode array) {
        StringBuilder sb = new StringBuilder("[");
        Iterator<JsonNode> it = array.elements();
        while (it.hasNext()) {
            JsonNode element = it.next();
            if (element.isTextual()) {
                sb.append(quote(element.textValue()));
            } else if (element.isNull()) {
                sb.append("None");
            } else {
                sb.append(element.asText());
            }
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }

    private static String quote(String value) {
        if (value.contains("'") && !value.contains("\"")) {
            return "\"" + value.replace("\\", "\\\\") + "\"";
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
