package domain.edit;

import domain.model.Cell;
import domain.model.CellRef;
import domain.model.CellType;
import domain.model.Sheet;
import domain.model.Style;
import domain.model.Workbook;
import domain.model.XlsxException;
import domain.numfmt.NumberFormatEngine;
import domain.read.WorkbookReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Edit session over one package.
 *
 * <p>{@link #load(byte[])} parses the package and keeps its bytes. Edits update the
 * in-memory model immediately and are remembered per sheet. {@link #save()} regenerates only
 * the worksheet parts that have edits; every other member is copied unchanged. Saving
 * without edits returns the loaded bytes as they were.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class WorkbookEditor {

    private static final Logger log = LoggerFactory.getLogger(WorkbookEditor.class);

    private final WorkbookReader reader;
    private final SheetPartWriter sheetWriter;
    private final PackagePatcher patcher;
    private final NumberFormatEngine formats = new NumberFormatEngine();

    private byte[] original;
    private Workbook workbook;
    /** sheet index to (cell key to edit); TreeMap keeps sheets in index order for save. */
    private final Map<Integer, Map<Long, CellEdit>> edits = new TreeMap<>();

    public WorkbookEditor(WorkbookReader reader, SheetPartWriter sheetWriter, PackagePatcher patcher) {
        this.reader = reader;
        this.sheetWriter = sheetWriter;
        this.patcher = patcher;
    }

    /**
     * Parses the package and starts a fresh session; pending edits are discarded.
     */
    public void load(byte[] packageBytes) {
        Workbook parsed = reader.read(packageBytes);
        this.original = packageBytes.clone();
        this.workbook = parsed;
        this.edits.clear();
    }

    public boolean isLoaded() {
        return workbook != null;
    }

    /** The live model, reflecting committed edits. */
    public Workbook workbook() {
        requireLoaded();
        return workbook;
    }

    public int sheetCount() {
        requireLoaded();
        return workbook.sheetCount();
    }

    /**
     * Applies user input to one cell. Blank input removes the cell; otherwise the type is
     * inferred by {@link CellInputParser}. The cell keeps its style, and any formula is
     * dropped.
     *
     * @throws XlsxException NOT_LOADED; INVALID_SHEET_INDEX for an unknown index or a chart
     *                       sheet; INVALID_REFERENCE for coordinates outside the grid
     */
    public void commitEdit(int sheetIndex, int row, int col, String input) {
        requireLoaded();
        Sheet sheet = workbook.sheet(sheetIndex);
        if (sheet.isChartsheet()) throw XlsxException.notEditableSheet(sheetIndex, sheet.getName());
        if (row < 0 || row >= CellRef.MAX_ROWS || col < 0 || col >= CellRef.MAX_COLS) {
            throw XlsxException.invalidReference("(" + row + ", " + col + ")");
        }

        EditValue value = CellInputParser.parse(input);
        Cell previous = sheet.cellAt(row, col);
        if (value.isClear()) {
            sheet.removeCell(row, col);
        } else {
            sheet.putCell(row, col, editedCell(previous, value));
        }

        edits.computeIfAbsent(sheetIndex, k -> new LinkedHashMap<>())
                .put(((long) row << 20) | col, new CellEdit(row, col, value));
        log.debug("Edit {}!{} = {}", sheet.getName(), CellRef.format(row, col), value);
    }

    private Cell editedCell(Cell previous, EditValue value) {
        Style style = previous == null ? null : previous.getStyle();
        Integer styleIndex = previous == null ? null : previous.getStyleIndex();
        boolean comment = previous != null && previous.isHasComment();

        CellType type = switch (value.kind()) {
            case NUMBER -> CellType.NUMBER;
            case BOOLEAN -> CellType.BOOLEAN;
            default -> CellType.STRING;
        };
        String display = value.text();
        boolean date = false;
        if (type == CellType.NUMBER) {
            String code = style == null ? Style.GENERAL : style.getNumberFormat();
            display = formats.format(Double.parseDouble(value.text()), code, workbook.isDate1904());
            date = formats.isDateCode(code);
        }
        return new Cell(type, value.text(), display, null, null, style, styleIndex, date, comment,
                previous == null ? null : previous.getHyperlink());
    }

    public boolean isDirty() {
        return !edits.isEmpty();
    }

    /** Current value of a cell, or null when it is empty. */
    public String cellValue(int sheetIndex, int row, int col) {
        requireLoaded();
        Cell cell = workbook.sheet(sheetIndex).cellAt(row, col);
        return cell == null ? null : cell.getValue();
    }

    /**
     * @return package bytes with the edited worksheets regenerated
     * @throws XlsxException NOT_LOADED before {@link #load(byte[])}
     */
    public byte[] save() {
        requireLoaded();
        if (edits.isEmpty()) return original.clone();

        long started = System.nanoTime();
        Map<String, byte[]> replacements = new HashMap<>();
        int cellEdits = 0;
        for (Map.Entry<Integer, Map<Long, CellEdit>> e : edits.entrySet()) {
            String partPath = workbook.sheet(e.getKey()).getPartPath();
            byte[] part = patcher.readPart(original, partPath);
            replacements.put(partPath, sheetWriter.rewrite(part, partPath, e.getValue().values()));
            cellEdits += e.getValue().size();
        }

        byte[] out = patcher.replaceParts(original, replacements);
        log.info("Saved workbook: {} sheet part(s) rewritten, {} cell edit(s) in {} ms",
                replacements.size(), cellEdits, (System.nanoTime() - started) / 1_000_000);
        return out;
    }

    private void requireLoaded() {
        if (workbook == null) throw XlsxException.notLoaded();
    }
}
