package infra.xml;

import domain.edit.CellEdit;
import domain.edit.EditValue;
import domain.edit.SheetPartWriter;
import domain.model.CellRef;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Applies cell edits to the {@code <sheetData>} of an existing worksheet part.
 *
 * <p>Everything outside {@code <sheetData>} and {@code <dimension>} is kept as parsed. Rows
 * and cells get explicit {@code r} references and stay sorted. Edited cells keep their
 * {@code s} attribute; formulas and old values are dropped. Strings are written inline
 * ({@code t="inlineStr"}) so the shared string table is not touched.</p>
 */
public class WorksheetRewriter implements SheetPartWriter {

    /** Worksheet children that must come after sheetData, in schema order. */
    private static final Set<String> AFTER_SHEET_DATA = Set.of(
            "sheetCalcPr", "sheetProtection", "protectedRanges", "scenarios", "autoFilter", "sortState",
            "dataConsolidate", "customSheetViews", "mergeCells", "phoneticPr", "conditionalFormatting",
            "dataValidations", "hyperlinks", "printOptions", "pageMargins", "pageSetup", "headerFooter",
            "rowBreaks", "colBreaks", "customProperties", "cellWatches", "ignoredErrors", "smartTags",
            "drawing", "legacyDrawing", "legacyDrawingHF", "picture", "oleObjects", "controls",
            "webPublishItems", "tableParts", "extLst");

    @Override
    public byte[] rewrite(byte[] originalPart, String partPath, Collection<CellEdit> edits) {
        Document doc = XmlDom.parse(originalPart, partPath);
        Element root = doc.getDocumentElement();
        String prefix = prefixOf(root);

        Element sheetData = XmlDom.child(root, "sheetData");
        if (sheetData == null) {
            sheetData = doc.createElement(prefix + "sheetData");
            root.insertBefore(sheetData, firstChildAfterSheetData(root));
        }

        TreeMap<Integer, Element> rows = indexRows(sheetData);
        for (CellEdit edit : edits) {
            apply(doc, prefix, sheetData, rows, edit);
        }
        updateDimension(doc, prefix, root, rows);
        return serialize(doc, partPath);
    }

    private static String prefixOf(Element el) {
        String name = el.getNodeName();
        int colon = name.indexOf(':');
        return colon < 0 ? "" : name.substring(0, colon + 1);
    }

    private static Node firstChildAfterSheetData(Element root) {
        for (Element child : XmlDom.children(root)) {
            if (AFTER_SHEET_DATA.contains(XmlDom.localName(child))) return child;
        }
        return null;
    }

    /**
     * Row index to row element. Implicit row and cell positions are made explicit.
     */
    private static TreeMap<Integer, Element> indexRows(Element sheetData) {
        TreeMap<Integer, Element> rows = new TreeMap<>();
        int rowIndex = -1;
        for (Element row : XmlDom.children(sheetData, "row")) {
            Integer r = XmlDom.integer(row, "r");
            rowIndex = r == null ? rowIndex + 1 : r - 1;
            row.setAttribute("r", String.valueOf(rowIndex + 1));
            rows.put(rowIndex, row);

            int colIndex = -1;
            for (Element c : XmlDom.children(row, "c")) {
                String ref = XmlDom.attr(c, "r");
                colIndex = ref == null ? colIndex + 1 : CellRef.parse(ref).getCol();
                c.setAttribute("r", CellRef.format(rowIndex, colIndex));
            }
        }
        return rows;
    }

    private static void apply(Document doc, String prefix, Element sheetData, TreeMap<Integer, Element> rows, CellEdit edit) {
        EditValue value = edit.value();
        Element row = rows.get(edit.row());

        if (value.isClear()) {
            if (row == null) return;
            Element cell = findCell(row, edit.col());
            if (cell != null) row.removeChild(cell);
            if (XmlDom.children(row, "c").isEmpty() && row.getAttributes().getLength() <= 2) {
                sheetData.removeChild(row);
                rows.remove(edit.row());
            }
            return;
        }

        if (row == null) {
            row = doc.createElement(prefix + "row");
            row.setAttribute("r", String.valueOf(edit.row() + 1));
            Integer next = rows.higherKey(edit.row());
            sheetData.insertBefore(row, next == null ? null : rows.get(next));
            rows.put(edit.row(), row);
        }
        row.removeAttribute("spans");

        Element cell = findCell(row, edit.col());
        if (cell == null) {
            cell = doc.createElement(prefix + "c");
            cell.setAttribute("r", CellRef.format(edit.row(), edit.col()));
            row.insertBefore(cell, firstCellAfter(row, edit.col()));
        }
        writeValue(doc, prefix, cell, value);
    }

    private static Element findCell(Element row, int col) {
        for (Element c : XmlDom.children(row, "c")) {
            if (CellRef.parse(XmlDom.attr(c, "r")).getCol() == col) return c;
        }
        return null;
    }

    private static Node firstCellAfter(Element row, int col) {
        for (Element c : XmlDom.children(row, "c")) {
            if (CellRef.parse(XmlDom.attr(c, "r")).getCol() > col) return c;
        }
        // keep a trailing extLst last
        return XmlDom.child(row, "extLst");
    }

    private static void writeValue(Document doc, String prefix, Element cell, EditValue value) {
        for (String name : List.of("f", "v", "is")) {
            Element old;
            while ((old = XmlDom.child(cell, name)) != null) {
                cell.removeChild(old);
            }
        }
        cell.removeAttribute("t");
        Node anchor = XmlDom.child(cell, "extLst");

        switch (value.kind()) {
            case NUMBER -> cell.insertBefore(textElement(doc, prefix + "v", value.text()), anchor);
            case BOOLEAN -> {
                cell.setAttribute("t", "b");
                cell.insertBefore(textElement(doc, prefix + "v", "TRUE".equals(value.text()) ? "1" : "0"), anchor);
            }
            case STRING -> {
                cell.setAttribute("t", "inlineStr");
                Element is = doc.createElement(prefix + "is");
                is.appendChild(textElement(doc, prefix + "t", OoxmlText.escape(value.text())));
                cell.insertBefore(is, anchor);
            }
            default -> throw new IllegalStateException("Unexpected edit kind: " + value.kind());
        }
    }

    private static Element textElement(Document doc, String name, String text) {
        Element el = doc.createElement(name);
        el.setTextContent(text);
        return el;
    }

    private static void updateDimension(Document doc, String prefix, Element root, TreeMap<Integer, Element> rows) {
        int minRow = Integer.MAX_VALUE;
        int maxRow = -1;
        int minCol = Integer.MAX_VALUE;
        int maxCol = -1;
        for (Map.Entry<Integer, Element> e : rows.entrySet()) {
            for (Element c : XmlDom.children(e.getValue(), "c")) {
                int col = CellRef.parse(XmlDom.attr(c, "r")).getCol();
                minRow = Math.min(minRow, e.getKey());
                maxRow = Math.max(maxRow, e.getKey());
                minCol = Math.min(minCol, col);
                maxCol = Math.max(maxCol, col);
            }
        }
        String ref;
        if (maxRow < 0) {
            ref = "A1";
        } else if (minRow == maxRow && minCol == maxCol) {
            ref = CellRef.format(minRow, minCol);
        } else {
            ref = CellRef.format(minRow, minCol) + ":" + CellRef.format(maxRow, maxCol);
        }

        Element dimension = XmlDom.child(root, "dimension");
        if (dimension == null) {
            dimension = doc.createElement(prefix + "dimension");
            Element sheetPr = XmlDom.child(root, "sheetPr");
            Node before = sheetPr != null ? sheetPr.getNextSibling() : root.getFirstChild();
            root.insertBefore(dimension, before);
        }
        dimension.setAttribute("ref", ref);
    }

    private static byte[] serialize(Document doc, String partPath) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            doc.setXmlStandalone(true);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toByteArray();
        } catch (TransformerException e) {
            throw new RuntimeException("Failed to serialize: " + partPath, e);
        }
    }
}
