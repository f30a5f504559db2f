package infra.xml;

import domain.model.Drawing;
import infra.pkg.Relationship;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * SpreadsheetML drawing part: one {@link Drawing} per anchor. Picture and chart references
 * are resolved through the drawing part's relationships.
 */
public class DrawingDecoder {

    public List<Drawing> decode(byte[] xml, String partPath, List<Relationship> rels) {
        Document doc = XmlDom.parse(xml, partPath);
        List<Drawing> out = new ArrayList<>();
        for (Element anchor : XmlDom.children(doc.getDocumentElement())) {
            String anchorType = XmlDom.localName(anchor);
            if (!anchorType.endsWith("Anchor")) continue;

            Drawing d = new Drawing();
            d.setAnchorType(anchorType);
            readMarker(XmlDom.child(anchor, "from"), d, true);
            readMarker(XmlDom.child(anchor, "to"), d, false);
            Element ext = XmlDom.child(anchor, "ext");
            if (ext != null) {
                d.setExtentCx(XmlDom.longValue(ext, "cx"));
                d.setExtentCy(XmlDom.longValue(ext, "cy"));
            }
            readObject(anchor, d, rels);
            out.add(d);
        }
        return out;
    }

    private static void readMarker(Element marker, Drawing d, boolean from) {
        if (marker == null) return;
        Integer col = intText(marker, "col");
        Integer row = intText(marker, "row");
        Long colOff = longText(marker, "colOff");
        Long rowOff = longText(marker, "rowOff");
        if (from) {
            d.setFromCol(col);
            d.setFromRow(row);
            d.setFromColOff(colOff);
            d.setFromRowOff(rowOff);
        } else {
            d.setToCol(col);
            d.setToRow(row);
            d.setToColOff(colOff);
            d.setToRowOff(rowOff);
        }
    }

    private static void readObject(Element anchor, Drawing d, List<Relationship> rels) {
        Element pic = XmlDom.child(anchor, "pic");
        Element shape = XmlDom.child(anchor, "sp");
        Element frame = XmlDom.child(anchor, "graphicFrame");
        Element group = XmlDom.child(anchor, "grpSp");
        Element connector = XmlDom.child(anchor, "cxnSp");

        Element obj;
        if (pic != null) {
            d.setKind("picture");
            obj = pic;
            Element blip = first(pic, "blip");
            Relationship rel = find(rels, XmlDom.attr(blip, "embed"));
            if (rel != null) d.setImagePath(rel.target());
        } else if (frame != null) {
            obj = frame;
            Element chart = first(frame, "chart");
            if (chart != null) {
                d.setKind("chart");
                Relationship rel = find(rels, XmlDom.attr(chart, "id"));
                if (rel != null) d.setChartPath(rel.target());
            } else {
                d.setKind("graphicFrame");
            }
        } else if (shape != null) {
            d.setKind("shape");
            obj = shape;
        } else if (connector != null) {
            d.setKind("connector");
            obj = connector;
        } else if (group != null) {
            d.setKind("group");
            obj = group;
        } else {
            d.setKind("unknown");
            return;
        }

        Element cNvPr = first(obj, "cNvPr");
        if (cNvPr != null) {
            d.setName(XmlDom.attr(cNvPr, "name"));
            d.setDescription(XmlDom.attr(cNvPr, "descr"));
        }
    }

    private static Element first(Element root, String localName) {
        List<Element> found = XmlDom.descendants(root, localName);
        return found.isEmpty() ? null : found.get(0);
    }

    private static Relationship find(List<Relationship> rels, String id) {
        if (id == null || rels == null) return null;
        for (Relationship rel : rels) {
            if (id.equals(rel.id())) return rel;
        }
        return null;
    }

    private static Integer intText(Element parent, String name) {
        Long v = longText(parent, name);
        return v == null ? null : v.intValue();
    }

    private static Long longText(Element parent, String name) {
        String text = XmlDom.childText(parent, name);
        if (text == null) return null;
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
