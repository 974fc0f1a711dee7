package com.clinicalbatch.patientrecords.writer;

import com.clinicalbatch.patientrecords.model.PatientRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTabularWriterTest {

    private final CsvTabularWriter writer = new CsvTabularWriter();

    private static List<CSVRecord> parse(byte[] csv) throws Exception {
        try (CSVParser parser = CSVParser.parse(new StringReader(new String(csv, StandardCharsets.UTF_8)),
            CSVFormat.EXCEL)) {
            return parser.getRecords();
        }
    }

    @Test
    void headerOnlyForNoRows() {
        String csv = new String(writer.toBytes(List.of()), StandardCharsets.UTF_8);

        assertEquals("url,resource_id,last_updated,status,system_id,active,"
            + "first_name,last_name,phone,gender,address\r\n", csv);
    }

    @Test
    void writesRowsInOrder() throws Exception {
        PatientRow first = new PatientRow("u1", "p1", "", "", "", true, "Ann", "['Lee']", "555-1234", "female", "1 Main St");
        PatientRow second = new PatientRow("u2", "p2", "", "", "", false, "Bo", "['Ng']", "", "male", "");

        List<CSVRecord> records = parse(writer.toBytes(List.of(first, second)));

        assertEquals(3, records.size());
        assertEquals(PatientRow.HEADER, records.get(0).toList());
        assertEquals(first.values(), records.get(1).toList());
        assertEquals(second.values(), records.get(2).toList());
    }

    @Test
    void rendersLegacyExampleLine() {
        PatientRow row = new PatientRow("u1", "p1", "", "", "", true, "Ann", "['Lee']", "555-1234", "female", "1 Main St");

        String csv = new String(writer.toBytes(List.of(row)), StandardCharsets.UTF_8);

        assertTrue(csv.endsWith("\r\nu1,p1,,,,True,Ann,['Lee'],555-1234,female,1 Main St\r\n"), csv);
    }

    @Test
    void roundTripsDelimitersQuotesAndNewlines() throws Exception {
        PatientRow tricky = new PatientRow(
            "http://x/a,b", "id \"quoted\"", "line1\nline2", "s\r\nt", "", false,
            "Ann, Jr.", "[\"O'Neil\"]", "\"", ",", "Flat 2\n1 Main St, Town");

        List<CSVRecord> records = parse(writer.toBytes(List.of(tricky)));

        assertEquals(2, records.size());
        assertEquals(tricky.values(), records.get(1).toList());
    }

    @Test
    void writeLeavesSinkOpen() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        writer.write(List.of(), sink);
        sink.write('x');

        assertTrue(sink.toString(StandardCharsets.UTF_8).endsWith("\r\nx"));
    }

    @Test
    void quotesLeadingEmptyAndLowCharacterValuesButParsesBackUnchanged() throws Exception {
        // empty first field and values starting at or below '#' get quoted; parsed values are unchanged
        PatientRow row = new PatientRow("", "p1", "", "", "", true, "Ann", "['Lee']", "#1", "female", " 1 Main St");

        byte[] csv = writer.toBytes(List.of(row));

        assertTrue(new String(csv, StandardCharsets.UTF_8)
            .endsWith("\r\n\"\",p1,,,,True,Ann,['Lee'],\"#1\",female,\" 1 Main St\"\r\n"));
        assertEquals(row.values(), parse(csv).get(1).toList());
    }
}
