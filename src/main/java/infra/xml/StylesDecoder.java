package infra.xml;

import domain.model.NamedStyle;
import domain.style.ColorSpec;
import domain.style.RawAlignment;
import domain.style.RawBorder;
import domain.style.RawBorderSide;
import domain.style.RawDxf;
import domain.style.RawFill;
import domain.style.RawFont;
import domain.style.RawProtection;
import domain.style.RawXf;
import domain.style.StyleSheet;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code xl/styles.xml} to {@link StyleSheet}. Values are kept as written; inheritance and
 * color lookup happen later in the style resolver.
 */
public class StylesDecoder {

    public StyleSheet decode(byte[] xml, String partPath) {
        StyleSheet sheet = StyleSheet.empty();
        Document doc = XmlDom.parse(xml, partPath);
        Element root = doc.getDocumentElement();

        for (Element nf : XmlDom.children(XmlDom.child(root, "numFmts"), "numFmt")) {
            Integer id = XmlDom.integer(nf, "numFmtId");
            String code = XmlDom.attr(nf, "formatCode");
            if (id != null && code != null) sheet.getNumFmts().put(id, code);
        }
        for (Element font : XmlDom.children(XmlDom.child(root, "fonts"), "font")) {
            sheet.getFonts().add(font(font));
        }
        for (Element fill : XmlDom.children(XmlDom.child(root, "fills"), "fill")) {
            sheet.getFills().add(fill(fill));
        }
        for (Element border : XmlDom.children(XmlDom.child(root, "borders"), "border")) {
            sheet.getBorders().add(border(border));
        }
        for (Element xf : XmlDom.children(XmlDom.child(root, "cellStyleXfs"), "xf")) {
            sheet.getCellStyleXfs().add(xf(xf));
        }
        for (Element xf : XmlDom.children(XmlDom.child(root, "cellXfs"), "xf")) {
            sheet.getCellXfs().add(xf(xf));
        }
        for (Element cs : XmlDom.children(XmlDom.child(root, "cellStyles"), "cellStyle")) {
            sheet.getCellStyles().add(new NamedStyle(
                    XmlDom.attr(cs, "name"),
                    XmlDom.integer(cs, "xfId", 0),
                    XmlDom.integer(cs, "builtinId")));
        }
        for (Element dxf : XmlDom.children(XmlDom.child(root, "dxfs"), "dxf")) {
            Element f = XmlDom.child(dxf, "font");
            Element fill = XmlDom.child(dxf, "fill");
            Element border = XmlDom.child(dxf, "border");
            sheet.getDxfs().add(new RawDxf(
                    f == null ? null : font(f),
                    fill == null ? null : fill(fill),
                    border == null ? null : border(border)));
        }
        Element colors = XmlDom.child(root, "colors");
        for (Element rgb : XmlDom.children(XmlDom.child(colors, "indexedColors"), "rgbColor")) {
            sheet.getIndexedColors().add(XmlDom.attr(rgb, "rgb"));
        }
        return sheet;
    }

    static RawFont font(Element font) {
        Element u = XmlDom.child(font, "u");
        String underline = null;
        if (u != null) {
            String val = XmlDom.attr(u, "val");
            underline = val == null ? "single" : val;
        }
        return new RawFont(
                valAttr(font, "name"),
                valDouble(font, "sz"),
                flag(font, "b"),
                flag(font, "i"),
                underline,
                flag(font, "strike"),
                valAttr(font, "vertAlign"),
                XmlDom.color(XmlDom.child(font, "color")),
                valAttr(font, "scheme"));
    }

    /** {@code <b/>} is true, {@code <b val="0"/>} false, absent null. */
    private static Boolean flag(Element parent, String name) {
        Element el = XmlDom.child(parent, name);
        if (el == null) return null;
        Boolean v = XmlDom.bool(el, "val");
        return v == null ? Boolean.TRUE : v;
    }

    private static String valAttr(Element parent, String name) {
        return XmlDom.attr(XmlDom.child(parent, name), "val");
    }

    private static Double valDouble(Element parent, String name) {
        return XmlDom.decimal(XmlDom.child(parent, name), "val");
    }

    static RawFill fill(Element fill) {
        Element gradient = XmlDom.child(fill, "gradientFill");
        if (gradient != null) {
            List<RawFill.RawGradientStop> stops = new ArrayList<>();
            for (Element stop : XmlDom.children(gradient, "stop")) {
                Double pos = XmlDom.decimal(stop, "position");
                stops.add(new RawFill.RawGradientStop(pos == null ? 0.0 : pos, XmlDom.color(XmlDom.child(stop, "color"))));
            }
            String type = XmlDom.attr(gradient, "type");
            Double degree = XmlDom.decimal(gradient, "degree");
            return new RawFill(null, null, null,
                    new RawFill.RawGradient(type == null ? "linear" : type, degree == null ? 0.0 : degree, stops));
        }
        Element pattern = XmlDom.child(fill, "patternFill");
        if (pattern == null) return RawFill.NONE;
        return new RawFill(
                XmlDom.attr(pattern, "patternType"),
                XmlDom.color(XmlDom.child(pattern, "fgColor")),
                XmlDom.color(XmlDom.child(pattern, "bgColor")),
                null);
    }

    static RawBorder border(Element border) {
        RawBorderSide left = side(XmlDom.child(border, "left"));
        if (left == null) left = side(XmlDom.child(border, "start"));
        RawBorderSide right = side(XmlDom.child(border, "right"));
        if (right == null) right = side(XmlDom.child(border, "end"));
        return new RawBorder(
                left,
                right,
                side(XmlDom.child(border, "top")),
                side(XmlDom.child(border, "bottom")),
                side(XmlDom.child(border, "diagonal")),
                XmlDom.bool(border, "diagonalUp", false),
                XmlDom.bool(border, "diagonalDown", false));
    }

    private static RawBorderSide side(Element el) {
        if (el == null) return null;
        String style = XmlDom.attr(el, "style");
        if (style == null) return null;
        ColorSpec color = XmlDom.color(XmlDom.child(el, "color"));
        return new RawBorderSide(style, color);
    }

    static RawXf xf(Element xf) {
        Element align = XmlDom.child(xf, "alignment");
        RawAlignment alignment = null;
        if (align != null) {
            alignment = new RawAlignment(
                    XmlDom.attr(align, "horizontal"),
                    XmlDom.attr(align, "vertical"),
                    XmlDom.bool(align, "wrapText"),
                    XmlDom.bool(align, "shrinkToFit"),
                    XmlDom.integer(align, "indent"),
                    XmlDom.integer(align, "textRotation"),
                    XmlDom.integer(align, "readingOrder"));
        }
        Element prot = XmlDom.child(xf, "protection");
        RawProtection protection = null;
        if (prot != null) {
            protection = new RawProtection(XmlDom.bool(prot, "locked"), XmlDom.bool(prot, "hidden"));
        }
        return new RawXf(
                XmlDom.integer(xf, "numFmtId"),
                XmlDom.integer(xf, "fontId"),
                XmlDom.integer(xf, "fillId"),
                XmlDom.integer(xf, "borderId"),
                XmlDom.integer(xf, "xfId"),
                XmlDom.bool(xf, "applyNumberFormat"),
                XmlDom.bool(xf, "applyFont"),
                XmlDom.bool(xf, "applyFill"),
                XmlDom.bool(xf, "applyBorder"),
                XmlDom.bool(xf, "applyAlignment"),
                XmlDom.bool(xf, "applyProtection"),
                alignment,
                protection);
    }
}
