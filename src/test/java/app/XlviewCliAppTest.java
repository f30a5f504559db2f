package app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import infra.xml.XlsxFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class XlviewCliAppTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args) {
        return XlviewCliApp.run(args,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    private Path sampleFile() throws Exception {
        byte[] xlsx = XlsxFixtures.workbook()
                .sheet("First", "<sheetData><row r=\"1\">"
                        + "<c r=\"A1\" t=\"inlineStr\"><is><t>Hello</t></is></c>"
                        + "<c r=\"B1\" t=\"inlineStr\"><is><t>a,b</t></is></c>"
                        + "</row></sheetData>")
                .sheet("Second", "<sheetData><row r=\"2\"><c r=\"A2\" t=\"inlineStr\"><is><t>x</t></is></c></row></sheetData>")
                .build();
        Path file = tempDir.resolve("book.xlsx");
        Files.write(file, xlsx);
        return file;
    }

    @Test
    void should_print_usage_and_fail_without_input() {
        assertEquals(1, run());
        assertTrue(err().startsWith("usage: xlview"));
        assertEquals("", out());
    }

    @Test
    void should_dump_json_to_stdout() throws Exception {
        Path file = sampleFile();

        assertEquals(0, run(file.toString()));

        JsonNode root = new ObjectMapper().readTree(out());
        assertEquals(2, root.get("sheets").size());
        assertEquals("First", root.get("sheets").get(0).get("name").asText());
        assertEquals("Hello", root.get("sheets").get(0).get("cells").get(0).get("cell").get("v").asText());
        assertTrue(out().endsWith("\n"));
    }

    @Test
    void should_write_output_file_when_requested() throws Exception {
        Path file = sampleFile();
        Path target = tempDir.resolve("out/book.json");

        assertEquals(0, run(file.toString(), "-o", target.toString(), "--pretty=false"));

        assertEquals("", out());
        assertTrue(Files.exists(target));
        String json = Files.readString(target, StandardCharsets.UTF_8);
        assertFalse(json.contains("\n"));
        assertEquals("Second", new ObjectMapper().readTree(json).get("sheets").get(1).get("name").asText());
    }

    @Test
    void should_export_selected_sheet_as_csv() throws Exception {
        Path file = sampleFile();

        assertEquals(0, run(file.toString(), "--format=csv"));
        assertEquals("Hello,\"a,b\"\r\n", out());

        stdout.reset();
        assertEquals(0, run(file.toString(), "--format=csv", "--sheet=1"));
        assertEquals("\"\"\r\nx\r\n", out());
    }

    @Test
    void should_only_validate_with_format_none() throws Exception {
        assertEquals(0, run(sampleFile().toString(), "--format=none"));
        assertEquals("", out());
    }

    @Test
    void should_report_error_code_for_invalid_archive() throws Exception {
        Path file = tempDir.resolve("broken.xlsx");
        Files.writeString(file, "not a zip");

        assertEquals(1, run(file.toString()));
        assertTrue(err().startsWith("error: INVALID_ARCHIVE"), err());
    }

    @Test
    void should_fail_for_unknown_format_and_sheet_index() throws Exception {
        Path file = sampleFile();

        assertEquals(1, run(file.toString(), "--format=xml"));
        assertTrue(err().contains("Unknown format: xml"));

        stderr.reset();
        assertEquals(1, run(file.toString(), "--format=csv", "--sheet=5"));
        assertTrue(err().startsWith("error: INVALID_SHEET_INDEX"), err());
    }

    @Test
    void should_fail_for_missing_input_file() {
        assertEquals(1, run(tempDir.resolve("nope.xlsx").toString()));
        assertTrue(err().startsWith("error: Failed to read input"));
    }
}
