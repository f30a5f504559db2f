package infra.xml;

import domain.model.Cell;
import domain.model.CellRef;
import domain.model.CellType;
import domain.model.Comment;
import domain.model.Drawing;
import domain.model.ParseWarning;
import domain.model.ParseWarningCode;
import domain.model.ParseWarningSink;
import domain.model.Sheet;
import domain.model.Theme;
import domain.model.Workbook;
import domain.model.XlsxErrorCode;
import domain.model.XlsxException;
import domain.numfmt.NumberFormatEngine;
import domain.read.ParseOptions;
import domain.read.WorkbookReader;
import domain.style.StyleResolver;
import domain.style.StyleSheet;
import infra.pkg.Relationship;
import infra.pkg.XlsxPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads a whole .xlsx package: workbook part, theme, styles, shared strings, then every
 * worksheet with its comments and drawings.
 *
 * <p>The workbook part and every worksheet part are required. Styles may be absent, but a
 * styles part that is present must parse. Theme, shared strings, comments and drawings are
 * optional: when absent or malformed they are replaced with defaults and a warning is
 * reported.</p>
 */
public class XlsxWorkbookReader implements WorkbookReader {

    private static final Logger log = LoggerFactory.getLogger(XlsxWorkbookReader.class);

    @Override
    public Workbook read(byte[] packageBytes, ParseOptions options) {
        return read(XlsxPackage.open(packageBytes), options);
    }

    public Workbook read(XlsxPackage pkg, ParseOptions options) {
        long started = System.nanoTime();
        ParseOptions opts = options == null ? ParseOptions.defaults() : options;
        ParseWarningSink warnings = opts.getWarnings();

        String workbookPath = pkg.workbookPath();
        WorkbookPartDecoder.Result wb = new WorkbookPartDecoder().decode(pkg.requirePart(workbookPath), workbookPath);

        Workbook workbook = new Workbook();
        workbook.setDate1904(wb.date1904());
        workbook.getDefinedNames().addAll(wb.definedNames());

        Theme theme = optionalPart(pkg, workbookPath, "theme", "xl/theme/theme1.xml", warnings,
                (bytes, path) -> new ThemeDecoder().decode(bytes, path));
        workbook.setTheme(theme == null ? Theme.office() : theme);

        StyleSheet styleSheet = readStyles(pkg, workbookPath, warnings);
        StyleResolver styles = new StyleResolver(styleSheet, workbook.getTheme(), warnings);
        workbook.getDxfStyles().addAll(styles.resolveDxfs());
        workbook.getNamedStyles().addAll(styleSheet.getCellStyles());

        List<String> sharedStrings = optionalPart(pkg, workbookPath, "sharedStrings", "xl/sharedStrings.xml", warnings,
                (bytes, path) -> new SharedStringsDecoder().decode(bytes, path));

        WorksheetDecoder sheetDecoder = new WorksheetDecoder(styles, sharedStrings, new NumberFormatEngine(),
                wb.date1904(), warnings).conditionalFormats(opts.isEvaluateConditionalFormats());

        int cellCount = 0;
        for (WorkbookPartDecoder.SheetEntry entry : wb.sheets()) {
            Relationship rel = pkg.relationship(workbookPath, entry.relId());
            String sheetPath = rel != null ? rel.target() : "xl/worksheets/sheet" + entry.sheetId() + ".xml";

            Sheet sheet = new Sheet(entry.name(), sheetPath);
            sheet.setState(entry.state());
            workbook.addSheet(sheet);

            if (rel != null && rel.isType("chartsheet")) {
                sheet.setChartsheet(true);
                log.debug("Chart sheet {} kept without cells", entry.name());
                continue;
            }

            byte[] xml = pkg.requirePart(sheetPath);
            List<Relationship> sheetRels = pkg.relationshipsOf(sheetPath);
            sheetDecoder.decode(xml, sheet, sheetRels);
            readComments(pkg, sheet, sheetRels, warnings);
            readDrawings(pkg, sheet, sheetRels, warnings);

            cellCount += sheet.cellCount();
            log.debug("Decoded {} ({} cells, {} merges)", sheetPath, sheet.cellCount(), sheet.getMerges().size());
        }

        log.info("Parsed workbook: {} sheet(s), {} cell(s) in {} ms",
                workbook.sheetCount(), cellCount, (System.nanoTime() - started) / 1_000_000);
        return workbook;
    }

    private void readComments(XlsxPackage pkg, Sheet sheet, List<Relationship> rels, ParseWarningSink warnings) {
        for (Relationship rel : rels) {
            if (!rel.isType("comments") || rel.external()) continue;
            List<Comment> comments = optionalTarget(pkg, rel.target(), warnings,
                    (bytes, path) -> new CommentsDecoder().decode(bytes, path));
            if (comments == null) continue;

            for (Comment c : comments) {
                CellRef ref;
                try {
                    ref = CellRef.parse(c.getCellRef());
                } catch (XlsxException e) {
                    warnings.warn(ParseWarning.of(ParseWarningCode.RANGE_SKIPPED, rel.target(), "comment ref=" + c.getCellRef()));
                    continue;
                }
                sheet.addComment(c);
                Cell cell = sheet.cellAt(ref.getRow(), ref.getCol());
                if (cell == null) {
                    cell = Cell.of(CellType.EMPTY, null);
                }
                sheet.putCell(ref.getRow(), ref.getCol(), cell.withComment(true));
            }
        }
    }

    private void readDrawings(XlsxPackage pkg, Sheet sheet, List<Relationship> rels, ParseWarningSink warnings) {
        for (Relationship rel : rels) {
            if (!rel.isType("drawing") || rel.external()) continue;
            String path = rel.target();
            List<Relationship> drawingRels = pkg.relationshipsOf(path);
            List<Drawing> drawings = optionalTarget(pkg, path, warnings,
                    (bytes, p) -> new DrawingDecoder().decode(bytes, p, drawingRels));
            if (drawings != null) sheet.getDrawings().addAll(drawings);
        }
    }

    /**
     * Styles fall back to an empty sheet only when the part is absent.
     *
     * @throws XlsxException XML_PARSE_ERROR when the styles part is not well-formed
     */
    private StyleSheet readStyles(XlsxPackage pkg, String workbookPath, ParseWarningSink warnings) {
        Relationship rel = pkg.firstOfType(workbookPath, "styles");
        String path = rel != null && !rel.external() ? rel.target() : "xl/styles.xml";
        if (!pkg.hasPart(path)) {
            if (rel != null) {
                warnings.warn(ParseWarning.of(ParseWarningCode.OPTIONAL_PART_UNAVAILABLE, path, "styles part is missing"));
            }
            return StyleSheet.empty();
        }
        return new StylesDecoder().decode(pkg.part(path), path);
    }

    /**
     * Decodes the workbook-related part of the given relationship type, falling back to a
     * conventional path. Null when the part is absent or malformed.
     */
    private <T> T optionalPart(XlsxPackage pkg, String workbookPath, String relType, String fallback,
                               ParseWarningSink warnings, PartDecoder<T> decoder) {
        Relationship rel = pkg.firstOfType(workbookPath, relType);
        String path = rel != null && !rel.external() ? rel.target() : fallback;
        if (!pkg.hasPart(path)) {
            if (rel != null) {
                warnings.warn(ParseWarning.of(ParseWarningCode.OPTIONAL_PART_UNAVAILABLE, path, relType + " part is missing"));
            }
            return null;
        }
        return optionalTarget(pkg, path, warnings, decoder);
    }

    private <T> T optionalTarget(XlsxPackage pkg, String path, ParseWarningSink warnings, PartDecoder<T> decoder) {
        byte[] bytes = pkg.part(path);
        if (bytes == null) {
            warnings.warn(ParseWarning.of(ParseWarningCode.OPTIONAL_PART_UNAVAILABLE, path, "part is missing"));
            return null;
        }
        try {
            return decoder.decode(bytes, path);
        } catch (XlsxException e) {
            if (e.getCode() != XlsxErrorCode.XML_PARSE_ERROR) throw e;
            log.warn("Ignoring malformed optional part {}: {}", path, e.getMessage());
            warnings.warn(ParseWarning.of(ParseWarningCode.OPTIONAL_PART_UNAVAILABLE, path, "malformed XML"));
            return null;
        }
    }

    @FunctionalInterface
    private interface PartDecoder<T> {
        T decode(byte[] bytes, String partPath);
    }
}
