package infra.output;

import domain.model.Cell;
import domain.model.CellType;
import domain.model.Sheet;
import domain.model.Workbook;
import domain.model.XlsxErrorCode;
import domain.model.XlsxException;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class CsvSheetExporterTest {

    @Test
    void should_write_dense_grid_of_display_values() {
        Workbook wb = new Workbook();
        Sheet sheet = new Sheet("S", "xl/worksheets/sheet1.xml");
        sheet.putCell(0, 0, Cell.of(CellType.STRING, "a"));
        sheet.putCell(1, 2, new Cell(CellType.NUMBER, "1234", "1,234", null, null, null, null, false, false, null));
        wb.addSheet(sheet);

        StringWriter out = new StringWriter();
        new CsvSheetExporter(0).write(wb, out);

        assertEquals("a,,\r\n\"\",,\"1,234\"\r\n", out.toString());
    }

    @Test
    void should_write_nothing_for_empty_sheet() {
        Workbook wb = new Workbook();
        wb.addSheet(new Sheet("Empty", "xl/worksheets/sheet1.xml"));

        StringWriter out = new StringWriter();
        new CsvSheetExporter(0).write(wb, out);

        assertEquals("", out.toString());
    }

    @Test
    void should_reject_unknown_sheet_index() {
        Workbook wb = new Workbook();
        XlsxException ex = assertThrows(XlsxException.class, () -> new CsvSheetExporter(3).write(wb, new StringWriter()));
        assertEquals(XlsxErrorCode.INVALID_SHEET_INDEX, ex.getCode());
    }
}
