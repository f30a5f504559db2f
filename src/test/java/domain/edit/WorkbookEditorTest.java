package domain.edit;

import domain.model.Cell;
import domain.model.CellType;
import domain.model.Sheet;
import domain.model.Style;
import domain.model.Workbook;
import domain.model.XlsxErrorCode;
import domain.model.XlsxException;
import domain.read.ParseOptions;
import domain.read.WorkbookReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookEditorTest {

    private static final byte[] PACKAGE = "fake-package".getBytes(StandardCharsets.US_ASCII);

    private final List<String> readParts = new ArrayList<>();
    private final List<Collection<CellEdit>> rewrites = new ArrayList<>();
    private Map<String, byte[]> lastReplacements;

    private WorkbookEditor editor;

    @BeforeEach
    void setUp() {
        WorkbookReader reader = new WorkbookReader() {
            @Override
            public Workbook read(byte[] packageBytes, ParseOptions options) {
                Workbook wb = new Workbook();
                Sheet first = new Sheet("Data", "xl/worksheets/sheet1.xml");
                Style money = Style.builder().numberFormat("0.00").numFmtId(2).build();
                first.putCell(0, 0, new Cell(CellType.NUMBER, "1", "1.00", null, null, money, 3, false, true, null));
                first.putCell(0, 1, new Cell(CellType.FORMULA, "2", "2", "A1*2", CellType.NUMBER, null, null, false, false, null));
                wb.addSheet(first);
                wb.addSheet(new Sheet("Other", "xl/worksheets/sheet2.xml"));
                Sheet chart = new Sheet("Chart1", "xl/chartsheets/sheet1.xml");
                chart.setChartsheet(true);
                wb.addSheet(chart);
                return wb;
            }
        };
        SheetPartWriter writer = (originalPart, partPath, edits) -> {
            rewrites.add(List.copyOf(edits));
            return ("rewritten:" + partPath).getBytes(StandardCharsets.UTF_8);
        };
        PackagePatcher patcher = new PackagePatcher() {
            @Override
            public byte[] readPart(byte[] packageBytes, String partPath) {
                readParts.add(partPath);
                return new byte[0];
            }

            @Override
            public byte[] replaceParts(byte[] packageBytes, Map<String, byte[]> replacements) {
                lastReplacements = new HashMap<>(replacements);
                return "patched".getBytes(StandardCharsets.US_ASCII);
            }
        };
        editor = new WorkbookEditor(reader, writer, patcher);
    }

    @Test
    void should_reject_operations_before_load() {
        XlsxException ex = assertThrows(XlsxException.class, () -> editor.commitEdit(0, 0, 0, "1"));
        assertEquals(XlsxErrorCode.NOT_LOADED, ex.getCode());
        assertEquals(XlsxErrorCode.NOT_LOADED, assertThrows(XlsxException.class, editor::save).getCode());
        assertFalse(editor.isLoaded());
    }

    @Test
    void should_return_copy_of_original_bytes_without_edits() {
        editor.load(PACKAGE);

        byte[] saved = editor.save();

        assertArrayEquals(PACKAGE, saved);
        assertNotSame(PACKAGE, saved);
        assertFalse(editor.isDirty());
        assertTrue(readParts.isEmpty());
    }

    @Test
    void should_keep_style_and_reformat_number_edit() {
        editor.load(PACKAGE);

        editor.commitEdit(0, 0, 0, "3.456");

        Cell cell = editor.workbook().sheet(0).cellAt(0, 0);
        assertEquals(CellType.NUMBER, cell.getType());
        assertEquals("3.456", cell.getValue());
        assertEquals("3.46", cell.getDisplay());
        assertEquals(Integer.valueOf(3), cell.getStyleIndex());
        assertTrue(cell.isHasComment());
        assertTrue(editor.isDirty());
    }

    @Test
    void should_drop_formula_and_remove_cleared_cells() {
        editor.load(PACKAGE);

        editor.commitEdit(0, 0, 1, "hello");
        Cell text = editor.workbook().sheet(0).cellAt(0, 1);
        assertEquals(CellType.STRING, text.getType());
        assertNull(text.getFormula());

        editor.commitEdit(0, 0, 0, "  ");
        assertNull(editor.cellValue(0, 0, 0));
    }

    @Test
    void should_validate_sheet_index_and_coordinates() {
        editor.load(PACKAGE);

        assertEquals(XlsxErrorCode.INVALID_SHEET_INDEX,
                assertThrows(XlsxException.class, () -> editor.commitEdit(3, 0, 0, "1")).getCode());
        assertEquals(XlsxErrorCode.INVALID_REFERENCE,
                assertThrows(XlsxException.class, () -> editor.commitEdit(0, -1, 0, "1")).getCode());
        assertFalse(editor.isDirty());
    }

    @Test
    void should_refuse_edits_on_chart_sheets() {
        editor.load(PACKAGE);

        XlsxException ex = assertThrows(XlsxException.class, () -> editor.commitEdit(2, 0, 0, "1"));

        assertEquals(XlsxErrorCode.INVALID_SHEET_INDEX, ex.getCode());
        assertTrue(ex.getMessage().contains("chart sheet"));
        assertFalse(editor.isDirty());
        assertEquals(0, editor.workbook().sheet(2).cellCount());
    }

    @Test
    void should_rewrite_only_edited_sheets_with_latest_edit_per_cell() {
        editor.load(PACKAGE);
        editor.commitEdit(1, 4, 2, "first");
        editor.commitEdit(1, 4, 2, "second");
        editor.commitEdit(1, 0, 0, "true");

        byte[] saved = editor.save();

        assertEquals("patched", new String(saved, StandardCharsets.US_ASCII));
        assertEquals(List.of("xl/worksheets/sheet2.xml"), readParts);
        assertEquals(1, lastReplacements.size());
        assertTrue(lastReplacements.containsKey("xl/worksheets/sheet2.xml"));

        Collection<CellEdit> edits = rewrites.get(0);
        assertEquals(2, edits.size());
        assertTrue(edits.contains(new CellEdit(4, 2, new EditValue(EditValue.Kind.STRING, "second"))));
        assertTrue(edits.contains(new CellEdit(0, 0, new EditValue(EditValue.Kind.BOOLEAN, "TRUE"))));
    }

    @Test
    void should_discard_pending_edits_on_reload() {
        editor.load(PACKAGE);
        editor.commitEdit(0, 0, 0, "9");

        editor.load(PACKAGE);

        assertFalse(editor.isDirty());
        assertEquals("1", editor.cellValue(0, 0, 0));
    }
}
