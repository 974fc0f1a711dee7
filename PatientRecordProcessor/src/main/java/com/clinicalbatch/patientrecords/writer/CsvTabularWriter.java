package com.clinicalbatch.patientrecords.writer;

import com.clinicalbatch.patientrecords.model.PatientRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes patient rows as UTF-8 CSV in Excel dialect (comma, double-quote, CRLF).
 * The header is always written, even for an empty row list. Minimal quoting
 * also quotes an empty first field and values starting with a space or '#'.
 */
@Component
public class CsvTabularWriter {

    private static final CSVFormat FORMAT = CSVFormat.EXCEL.builder()
        .setHeader(PatientRow.HEADER.toArray(new String[0]))
        .build();

    /**
     * Streams the extract to the given sink. The sink is flushed, not closed.
     */
    public void write(List<PatientRow> rows, OutputStream sink) throws IOException {
        Writer writer = new OutputStreamWriter(sink, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        for (PatientRow row : rows) {
            printer.printRecord(row.values());
        }
        printer.flush();
    }

    public byte[] toBytes(List<PatientRow> rows) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(rows, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

}
