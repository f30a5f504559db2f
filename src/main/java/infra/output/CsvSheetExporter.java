package infra.output;

import domain.model.Cell;
import domain.model.Sheet;
import domain.model.Workbook;
import domain.output.WorkbookExporter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * One sheet as CSV: a dense grid of display values from A1 to the sheet's bounding box.
 */
public final class CsvSheetExporter implements WorkbookExporter {

    private final int sheetIndex;

    public CsvSheetExporter(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }

    @Override
    public void write(Workbook workbook, Writer out) {
        Sheet sheet = workbook.sheet(sheetIndex);
        if (sheet.cellCount() == 0) return;

        try {
            CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT);
            List<String> record = new ArrayList<>(sheet.getMaxCol() + 1);
            for (int r = 0; r <= sheet.getMaxRow(); r++) {
                record.clear();
                for (int c = 0; c <= sheet.getMaxCol(); c++) {
                    record.add(text(sheet.cellAt(r, c)));
                }
                printer.printRecord(record);
            }
            printer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
    }

    private static String text(Cell cell) {
        if (cell == null) return "";
        if (cell.getDisplay() != null) return cell.getDisplay();
        return cell.getValue() == null ? "" : cell.getValue();
    }
}
