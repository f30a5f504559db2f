package infra.xml;

import domain.conditional.ConditionalFormatting;
import domain.model.Cell;
import domain.model.CellData;
import domain.model.CellRef;
import domain.model.CellType;
import domain.model.DataValidation;
import domain.model.HeaderFooter;
import domain.model.Hyperlink;
import domain.model.OutlineLevel;
import domain.model.PageMargins;
import domain.model.PageSetup;
import domain.model.ParseWarning;
import domain.model.ParseWarningCode;
import domain.model.ParseWarningSink;
import domain.model.RangeRef;
import domain.model.Sheet;
import domain.model.Sparkline;
import domain.model.SparklineGroup;
import domain.model.Style;
import domain.model.XlsxException;
import domain.numfmt.DateSerial;
import domain.numfmt.NumberFormatEngine;
import domain.style.StyleResolver;
import infra.pkg.Relationship;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * One worksheet part into a {@link Sheet}: cells with resolved styles and display values,
 * plus layout, merges, hyperlinks, validations, conditional formats and sparklines.
 *
 * <p>Rows and cells without an {@code r} attribute take the position after the previous
 * one. A malformed cell reference aborts with INVALID_REFERENCE; malformed optional ranges
 * are skipped with a warning.</p>
 */
public class WorksheetDecoder {

    private static final String ISO_DATE_FORMAT = "yyyy-mm-dd";

    private final StyleResolver styles;
    private final List<String> sharedStrings;
    private final NumberFormatEngine formats;
    private final boolean date1904;
    private final ParseWarningSink warnings;
    private boolean conditionalFormats = true;

    public WorksheetDecoder(StyleResolver styles, List<String> sharedStrings, NumberFormatEngine formats,
                            boolean date1904, ParseWarningSink warnings) {
        this.styles = styles;
        this.sharedStrings = sharedStrings == null ? List.of() : sharedStrings;
        this.formats = formats;
        this.date1904 = date1904;
        this.warnings = warnings == null ? ParseWarningSink.none() : warnings;
    }

    /** Whether {@code <conditionalFormatting>} blocks are decoded (default true). */
    public WorksheetDecoder conditionalFormats(boolean enabled) {
        this.conditionalFormats = enabled;
        return this;
    }

    /**
     * @param rels relationships of the worksheet part, used for external hyperlinks
     */
    public void decode(byte[] xml, Sheet sheet, List<Relationship> rels) {
        String part = sheet.getPartPath();
        Document doc = XmlDom.parse(xml, part);
        Element root = doc.getDocumentElement();

        readSheetProperties(root, sheet);
        readDimension(root, sheet);
        readViews(root, sheet);
        readFormat(root, sheet);
        readColumns(root, sheet);
        readSheetData(root, sheet);
        readMerges(root, sheet);
        readHyperlinks(root, sheet, rels);
        readDataValidations(root, sheet);
        readPrintSettings(root, sheet);

        Element autoFilter = XmlDom.child(root, "autoFilter");
        if (autoFilter != null) sheet.setAutoFilter(XmlDom.attr(autoFilter, "ref"));
        Element protection = XmlDom.child(root, "sheetProtection");
        if (protection != null) sheet.setProtectedSheet(XmlDom.bool(protection, "sheet", false));

        if (conditionalFormats) {
            List<ConditionalFormatting> cfs =
                    new ConditionalFormattingDecoder(styles.colors(), warnings, part).decode(root);
            sheet.getConditionalFormats().addAll(cfs);
        }
        readSparklines(root, sheet);
    }

    private void readSheetProperties(Element root, Sheet sheet) {
        Element pr = XmlDom.child(root, "sheetPr");
        Element tab = XmlDom.child(pr, "tabColor");
        if (tab != null) sheet.setTabColor(styles.colors().resolve(XmlDom.color(tab)));
        Element outline = XmlDom.child(pr, "outlinePr");
        sheet.setSummaryBelow(XmlDom.bool(outline, "summaryBelow", true));
        sheet.setSummaryRight(XmlDom.bool(outline, "summaryRight", true));
    }

    private void readDimension(Element root, Sheet sheet) {
        String ref = XmlDom.attr(XmlDom.child(root, "dimension"), "ref");
        if (ref == null) return;
        try {
            RangeRef dim = RangeRef.parse(ref);
            sheet.extendTo(dim.getLastRow(), dim.getLastCol());
        } catch (XlsxException e) {
            warn(ParseWarningCode.RANGE_SKIPPED, sheet, "dimension ref=" + ref);
        }
    }

    private void readViews(Element root, Sheet sheet) {
        for (Element view : XmlDom.children(XmlDom.child(root, "sheetViews"), "sheetView")) {
            Element pane = XmlDom.child(view, "pane");
            if (pane == null) continue;
            String state = XmlDom.attr(pane, "state");
            if (!"frozen".equals(state) && !"frozenSplit".equals(state)) continue;
            Double x = XmlDom.decimal(pane, "xSplit");
            Double y = XmlDom.decimal(pane, "ySplit");
            if (x != null) sheet.setFrozenCols(x.intValue());
            if (y != null) sheet.setFrozenRows(y.intValue());
            return;
        }
    }

    private void readFormat(Element root, Sheet sheet) {
        Element fmt = XmlDom.child(root, "sheetFormatPr");
        if (fmt == null) return;
        Double colWidth = XmlDom.decimal(fmt, "defaultColWidth");
        if (colWidth != null) sheet.setDefaultColWidth(colWidth);
        Double rowHeight = XmlDom.decimal(fmt, "defaultRowHeight");
        if (rowHeight != null) sheet.setDefaultRowHeight(rowHeight);
    }

    private void readColumns(Element root, Sheet sheet) {
        for (Element cols : XmlDom.children(root, "cols")) {
            for (Element col : XmlDom.children(cols, "col")) {
                Integer min = XmlDom.integer(col, "min");
                Integer max = XmlDom.integer(col, "max");
                if (min == null || max == null || min < 1) continue;
                int last = Math.min(max, CellRef.MAX_COLS);
                Double width = XmlDom.decimal(col, "width");
                boolean hidden = XmlDom.bool(col, "hidden", false);
                int level = XmlDom.integer(col, "outlineLevel", 0);
                boolean collapsed = XmlDom.bool(col, "collapsed", false);
                for (int c = min - 1; c < last; c++) {
                    if (width != null) sheet.getColumnWidths().put(c, width);
                    if (hidden) sheet.getHiddenColumns().add(c);
                    if (level > 0) sheet.getColumnOutlines().add(new OutlineLevel(c, level, collapsed, hidden));
                }
            }
        }
    }

    private void readPrintSettings(Element root, Sheet sheet) {
        Element margins = XmlDom.child(root, "pageMargins");
        if (margins != null) {
            sheet.setPageMargins(new PageMargins(
                    inches(margins, "left"),
                    inches(margins, "right"),
                    inches(margins, "top"),
                    inches(margins, "bottom"),
                    inches(margins, "header"),
                    inches(margins, "footer")));
        }
        Element setup = XmlDom.child(root, "pageSetup");
        if (setup != null) {
            String orientation = XmlDom.attr(setup, "orientation");
            sheet.setPageSetup(new PageSetup(
                    XmlDom.integer(setup, "paperSize"),
                    "landscape".equals(orientation) ? "landscape" : "portrait",
                    XmlDom.integer(setup, "scale"),
                    XmlDom.integer(setup, "fitToWidth"),
                    XmlDom.integer(setup, "fitToHeight")));
        }
        Element hf = XmlDom.child(root, "headerFooter");
        if (hf != null) {
            sheet.setHeaderFooter(new HeaderFooter(
                    XmlDom.childText(hf, "oddHeader"),
                    XmlDom.childText(hf, "oddFooter"),
                    XmlDom.childText(hf, "evenHeader"),
                    XmlDom.childText(hf, "evenFooter"),
                    XmlDom.childText(hf, "firstHeader"),
                    XmlDom.childText(hf, "firstFooter")));
        }
    }

    private static double inches(Element el, String name) {
        Double v = XmlDom.decimal(el, name);
        return v == null ? 0.0 : v;
    }

    // ------------------------------------------------------------
    // cells
    // ------------------------------------------------------------

    private void readSheetData(Element root, Sheet sheet) {
        Element data = XmlDom.child(root, "sheetData");
        if (data == null) return;

        int rowIndex = -1;
        for (Element row : XmlDom.children(data, "row")) {
            Integer r = XmlDom.integer(row, "r");
            rowIndex = r == null ? rowIndex + 1 : r - 1;
            if (rowIndex < 0 || rowIndex >= CellRef.MAX_ROWS) {
                throw XlsxException.invalidReference("row r=" + r);
            }

            Double ht = XmlDom.decimal(row, "ht");
            if (ht != null) sheet.getRowHeights().put(rowIndex, ht);
            boolean hidden = XmlDom.bool(row, "hidden", false);
            if (hidden) sheet.getHiddenRows().add(rowIndex);
            int level = XmlDom.integer(row, "outlineLevel", 0);
            if (level > 0) {
                sheet.getRowOutlines().add(new OutlineLevel(rowIndex, level, XmlDom.bool(row, "collapsed", false), hidden));
            }

            int colIndex = -1;
            for (Element c : XmlDom.children(row, "c")) {
                String ref = XmlDom.attr(c, "r");
                int cellRow = rowIndex;
                if (ref == null) {
                    colIndex++;
                } else {
                    CellRef parsed = CellRef.parse(ref);
                    cellRow = parsed.getRow();
                    colIndex = parsed.getCol();
                }
                if (colIndex >= CellRef.MAX_COLS) {
                    throw XlsxException.invalidReference("column " + (colIndex + 1) + " in row " + (cellRow + 1));
                }

                Cell cell = cell(c, sheet);
                if (cell == null) continue;
                if (sheet.putCell(cellRow, colIndex, cell)) {
                    warn(ParseWarningCode.DUPLICATE_CELL, sheet, CellRef.format(cellRow, colIndex));
                }
            }
        }
    }

    /** Null for an unstyled element with no value and no formula. */
    private Cell cell(Element c, Sheet sheet) {
        Integer styleIndex = XmlDom.integer(c, "s");
        Style style = styleIndex == null ? null : styles.resolve(styleIndex);
        String t = XmlDom.attr(c, "t");

        Element f = XmlDom.child(c, "f");
        Element v = XmlDom.child(c, "v");
        Element is = XmlDom.child(c, "is");

        String formula = null;
        if (f != null) {
            String text = f.getTextContent();
            formula = text == null || text.isBlank() ? null : text;
        }

        CellType kind;
        String value;
        if ("inlineStr".equals(t)) {
            kind = CellType.STRING;
            value = is != null ? SharedStringsDecoder.plainText(is) : XmlDom.text(v);
        } else if ("s".equals(t)) {
            kind = CellType.STRING;
            value = sharedString(XmlDom.text(v), sheet);
        } else if ("str".equals(t)) {
            kind = CellType.STRING;
            value = XmlDom.text(v);
        } else if ("b".equals(t)) {
            kind = CellType.BOOLEAN;
            String raw = XmlDom.text(v);
            value = raw == null ? null : ("1".equals(raw.trim()) || "true".equalsIgnoreCase(raw.trim()) ? "TRUE" : "FALSE");
        } else if ("e".equals(t)) {
            kind = CellType.ERROR;
            value = XmlDom.text(v);
        } else if ("d".equals(t)) {
            return isoDateCell(XmlDom.text(v), formula, style, styleIndex);
        } else {
            kind = CellType.NUMBER;
            value = XmlDom.text(v);
            if (value != null && value.isBlank()) value = null;
        }

        if (f != null) {
            CellType cached = value == null ? null : kind;
            String display = value == null ? null : display(cached, value, style);
            return new Cell(CellType.FORMULA, value, display, formula, cached, style, styleIndex,
                    cached == CellType.NUMBER && isDate(style), false, null);
        }
        if (value == null) {
            if (styleIndex == null) return null;
            return new Cell(CellType.EMPTY, null, null, null, null, style, styleIndex, false, false, null);
        }
        return new Cell(kind, value, display(kind, value, style), null, null, style, styleIndex,
                kind == CellType.NUMBER && isDate(style), false, null);
    }

    private Cell isoDateCell(String raw, String formula, Style style, Integer styleIndex) {
        if (raw == null || raw.length() < 10) {
            return new Cell(CellType.STRING, raw, raw, formula, null, style, styleIndex, false, false, null);
        }
        try {
            double serial = DateSerial.toSerial(LocalDate.parse(raw.substring(0, 10)), date1904);
            String value = NumberFormatEngine.formatGeneral(serial);
            String code = isDate(style) ? style.getNumberFormat() : ISO_DATE_FORMAT;
            return new Cell(CellType.NUMBER, value, formats.format(serial, code, date1904), formula, null,
                    style, styleIndex, true, false, null);
        } catch (DateTimeParseException e) {
            return new Cell(CellType.STRING, raw, raw, formula, null, style, styleIndex, false, false, null);
        }
    }

    private String sharedString(String rawIndex, Sheet sheet) {
        if (rawIndex == null) return null;
        int idx = parseIndex(rawIndex);
        if (idx >= 0 && idx < sharedStrings.size()) return sharedStrings.get(idx);
        warn(ParseWarningCode.SHARED_STRING_OUT_OF_RANGE, sheet,
                "index " + rawIndex + " (count=" + sharedStrings.size() + ")");
        return "";
    }

    private static int parseIndex(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private String display(CellType kind, String value, Style style) {
        if (kind != CellType.NUMBER) return value;
        double d;
        try {
            d = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return value;
        }
        String code = style == null ? Style.GENERAL : style.getNumberFormat();
        return formats.format(d, code, date1904);
    }

    private boolean isDate(Style style) {
        return style != null && formats.isDateCode(style.getNumberFormat());
    }

    // ------------------------------------------------------------
    // annotations
    // ------------------------------------------------------------

    private void readMerges(Element root, Sheet sheet) {
        for (Element m : XmlDom.children(XmlDom.child(root, "mergeCells"), "mergeCell")) {
            String ref = XmlDom.attr(m, "ref");
            RangeRef range;
            try {
                range = RangeRef.parse(ref);
            } catch (XlsxException e) {
                warn(ParseWarningCode.RANGE_SKIPPED, sheet, "mergeCell ref=" + ref);
                continue;
            }
            if (!sheet.addMerge(range)) {
                warn(ParseWarningCode.RANGE_SKIPPED, sheet, "overlapping merge " + ref);
            }
        }
    }

    private void readHyperlinks(Element root, Sheet sheet, List<Relationship> rels) {
        for (Element h : XmlDom.children(XmlDom.child(root, "hyperlinks"), "hyperlink")) {
            String ref = XmlDom.attr(h, "ref");
            RangeRef range;
            try {
                range = RangeRef.parse(ref);
            } catch (XlsxException e) {
                warn(ParseWarningCode.RANGE_SKIPPED, sheet, "hyperlink ref=" + ref);
                continue;
            }

            String target = null;
            boolean external = false;
            String relId = XmlDom.attr(h, "id");
            if (relId != null && rels != null) {
                for (Relationship rel : rels) {
                    if (relId.equals(rel.id())) {
                        target = rel.target();
                        external = rel.external();
                        break;
                    }
                }
            }

            Hyperlink link = new Hyperlink(ref, target, XmlDom.attr(h, "location"),
                    XmlDom.attr(h, "tooltip"), XmlDom.attr(h, "display"), external);
            sheet.getHyperlinks().add(link);

            for (CellData d : sheet.getCells()) {
                if (range.contains(d.getR(), d.getC())) {
                    sheet.putCell(d.getR(), d.getC(), d.getCell().withHyperlink(link));
                }
            }
        }
    }

    private void readDataValidations(Element root, Sheet sheet) {
        for (Element dv : XmlDom.children(XmlDom.child(root, "dataValidations"), "dataValidation")) {
            sheet.getDataValidations().add(new DataValidation(
                    XmlDom.attr(dv, "sqref"),
                    XmlDom.attr(dv, "type"),
                    XmlDom.attr(dv, "operator"),
                    XmlDom.childText(dv, "formula1"),
                    XmlDom.childText(dv, "formula2"),
                    XmlDom.bool(dv, "allowBlank", false),
                    XmlDom.bool(dv, "showDropDown", false),
                    XmlDom.bool(dv, "showInputMessage", false),
                    XmlDom.bool(dv, "showErrorMessage", false),
                    XmlDom.attr(dv, "errorStyle"),
                    XmlDom.attr(dv, "promptTitle"),
                    XmlDom.attr(dv, "prompt"),
                    XmlDom.attr(dv, "errorTitle"),
                    XmlDom.attr(dv, "error")));
        }
    }

    private void readSparklines(Element root, Sheet sheet) {
        for (Element groups : XmlDom.descendants(root, "sparklineGroups")) {
            for (Element g : XmlDom.children(groups, "sparklineGroup")) {
                SparklineGroup group = new SparklineGroup();
                String type = XmlDom.attr(g, "type");
                if (type != null) group.setType(type);
                group.setMarkers(XmlDom.bool(g, "markers", false));
                group.setHigh(XmlDom.bool(g, "high", false));
                group.setLow(XmlDom.bool(g, "low", false));
                group.setFirst(XmlDom.bool(g, "first", false));
                group.setLast(XmlDom.bool(g, "last", false));
                group.setNegative(XmlDom.bool(g, "negative", false));
                group.setDisplayXAxis(XmlDom.bool(g, "displayXAxis", false));
                group.setDisplayEmptyCellsAs(XmlDom.attr(g, "displayEmptyCellsAs"));
                group.setLineWeight(XmlDom.decimal(g, "lineWeight"));

                group.setSeriesColor(color(g, "colorSeries"));
                group.setNegativeColor(color(g, "colorNegative"));
                group.setMarkersColor(color(g, "colorMarkers"));
                group.setHighColor(color(g, "colorHigh"));
                group.setLowColor(color(g, "colorLow"));
                group.setFirstColor(color(g, "colorFirst"));
                group.setLastColor(color(g, "colorLast"));

                for (Element s : XmlDom.children(XmlDom.child(g, "sparklines"), "sparkline")) {
                    group.getSparklines().add(new Sparkline(
                            XmlDom.childText(s, "sqref"),
                            XmlDom.childText(s, "f")));
                }
                sheet.getSparklineGroups().add(group);
            }
        }
    }

    private String color(Element parent, String name) {
        return styles.colors().resolve(XmlDom.color(XmlDom.child(parent, name)));
    }

    private void warn(ParseWarningCode code, Sheet sheet, String message) {
        warnings.warn(ParseWarning.of(code, sheet.getPartPath(), message));
    }
}
