package infra.xml;

import domain.edit.WorkbookEditor;
import domain.model.Cell;
import domain.model.Sheet;
import domain.model.Workbook;
import domain.model.XlsxErrorCode;
import domain.model.XlsxException;
import infra.pkg.ZipPackagePatcher;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookRoundTripTest {

    private byte[] original;
    private WorkbookEditor editor;

    private static WorkbookEditor newEditor() {
        return new WorkbookEditor(new XlsxWorkbookReader(), new WorksheetRewriter(), new ZipPackagePatcher());
    }

    @BeforeEach
    void setUp() {
        original = XlsxFixtures.workbook()
                .styles(XlsxWorkbookReaderTest.STYLES)
                .sharedStrings("shared")
                .sheet("Edit", "<dimension ref=\"A1:B1\"/>"
                        + "<sheetData><row r=\"1\" spans=\"1:2\">"
                        + "<c r=\"A1\" s=\"1\"><v>45000</v></c>"
                        + "<c r=\"B1\"><f>A1*2</f><v>90000</v></c>"
                        + "</row></sheetData>"
                        + "<pageMargins left=\"0.7\" right=\"0.7\" top=\"0.75\" bottom=\"0.75\" header=\"0.3\" footer=\"0.3\"/>")
                .sheet("Keep", "<sheetData><row r=\"1\"><c r=\"A1\" t=\"s\"><v>0</v></c></row></sheetData>")
                .build();
        editor = newEditor();
        editor.load(original);
    }

    @Test
    void should_return_identical_bytes_when_nothing_was_edited() {
        assertArrayEquals(original, editor.save());
    }

    @Test
    void should_reparse_edited_values() {
        editor.commitEdit(0, 0, 0, "46000");
        editor.commitEdit(0, 0, 1, "hello");
        editor.commitEdit(0, 2, 3, "true");

        Sheet live = editor.workbook().sheet(0);
        assertEquals("2025-12-09", live.cellAt(0, 0).getDisplay());

        WorkbookEditor reloaded = newEditor();
        reloaded.load(editor.save());
        Sheet sheet = reloaded.workbook().sheet(0);

        Cell number = sheet.cellAt(0, 0);
        assertEquals("46000", number.getValue());
        assertEquals(Integer.valueOf(1), number.getStyleIndex());
        assertEquals("2025-12-09", number.getDisplay());

        Cell text = sheet.cellAt(0, 1);
        assertEquals(domain.model.CellType.STRING, text.getType());
        assertEquals("hello", text.getValue());
        assertNull(text.getFormula());

        Cell flag = sheet.cellAt(2, 3);
        assertEquals(domain.model.CellType.BOOLEAN, flag.getType());
        assertEquals("TRUE", flag.getValue());

        assertEquals("shared", reloaded.workbook().sheet(1).cellAt(0, 0).getValue());
    }

    @Test
    void should_reparse_text_with_characters_xml_cannot_carry() {
        editor.commitEdit(0, 0, 1, "a\u0001b");
        editor.commitEdit(0, 1, 0, "x\uFFFEy_x0041_z");

        byte[] saved = editor.save();
        assertTrue(sheetPart(saved).contains("a_x0001_b"));

        WorkbookEditor reloaded = newEditor();
        reloaded.load(saved);
        Sheet sheet = reloaded.workbook().sheet(0);
        assertEquals("a\u0001b", sheet.cellAt(0, 1).getValue());
        assertEquals("x\uFFFEy_x0041_z", sheet.cellAt(1, 0).getValue());
    }

    @Test
    void should_keep_untouched_members_byte_identical_and_in_order() throws IOException {
        editor.commitEdit(0, 0, 0, "1");

        byte[] saved = editor.save();

        assertEquals(entryNames(original), entryNames(saved));
        for (String name : List.of("xl/worksheets/sheet2.xml", "xl/styles.xml", "xl/workbook.xml", "[Content_Types].xml")) {
            assertArrayEquals(rawEntry(original, name), rawEntry(saved, name), name);
        }
        assertFalse(Arrays.equals(rawEntry(original, "xl/worksheets/sheet1.xml"),
                rawEntry(saved, "xl/worksheets/sheet1.xml")));
    }

    @Test
    void should_update_dimension_and_drop_spans() {
        editor.commitEdit(0, 0, 1, "y");
        editor.commitEdit(0, 2, 3, "x");

        String part = sheetPart(editor.save());

        assertTrue(part.contains("<dimension ref=\"A1:D3\"/>"), part);
        assertFalse(part.contains("spans="), part);
        assertTrue(part.contains("<c r=\"D3\" t=\"inlineStr\"><is><t>x</t></is></c>"), part);
        assertTrue(part.indexOf("</sheetData>") < part.indexOf("<pageMargins"), part);
    }

    @Test
    void should_remove_cleared_cells_and_empty_rows() {
        editor.commitEdit(0, 0, 0, "");
        editor.commitEdit(0, 0, 1, " ");

        byte[] saved = editor.save();
        String part = sheetPart(saved);

        assertFalse(part.contains("<row"), part);
        assertTrue(part.contains("<dimension ref=\"A1\"/>"), part);

        WorkbookEditor reloaded = newEditor();
        reloaded.load(saved);
        assertEquals(0, reloaded.workbook().sheet(0).cellCount());
    }

    @Test
    void should_produce_package_readable_by_poi() throws IOException {
        editor.commitEdit(0, 0, 0, "12.5");
        editor.commitEdit(0, 0, 1, "hello");
        editor.commitEdit(0, 2, 3, "false");

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(editor.save()))) {
            assertEquals(2, wb.getNumberOfSheets());
            XSSFSheet sheet = wb.getSheet("Edit");
            assertEquals(12.5, sheet.getRow(0).getCell(0).getNumericCellValue(), 1e-9);
            assertEquals("hello", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals(CellType.BOOLEAN, sheet.getRow(2).getCell(3).getCellType());
            assertFalse(sheet.getRow(2).getCell(3).getBooleanCellValue());
            assertEquals("shared", wb.getSheet("Keep").getRow(0).getCell(0).getStringCellValue());
        }
    }

    @Test
    void should_reject_out_of_range_sheet_index() {
        XlsxException ex = assertThrows(XlsxException.class, () -> editor.commitEdit(5, 0, 0, "1"));
        assertEquals(XlsxErrorCode.INVALID_SHEET_INDEX, ex.getCode());
    }

    @Test
    void should_not_change_model_of_other_sheets() {
        editor.commitEdit(0, 0, 0, "7");

        Workbook wb = editor.workbook();
        assertEquals(1, wb.sheet(1).cellCount());
        assertEquals("7", editor.cellValue(0, 0, 0));
    }

    private static String sheetPart(byte[] pkg) {
        byte[] part = new ZipPackagePatcher().readPart(pkg, "xl/worksheets/sheet1.xml");
        return new String(part, StandardCharsets.UTF_8);
    }

    private static ZipFile open(byte[] zip) throws IOException {
        return ZipFile.builder().setSeekableByteChannel(new SeekableInMemoryByteChannel(zip)).get();
    }

    private static List<String> entryNames(byte[] zip) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipFile zf = open(zip)) {
            for (ZipArchiveEntry e : Collections.list(zf.getEntriesInPhysicalOrder())) {
                names.add(e.getName());
            }
        }
        return names;
    }

    private static byte[] rawEntry(byte[] zip, String name) throws IOException {
        try (ZipFile zf = open(zip); InputStream in = zf.getRawInputStream(zf.getEntry(name))) {
            return in.readAllBytes();
        }
    }
}
