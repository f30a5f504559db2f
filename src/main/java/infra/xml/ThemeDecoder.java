package infra.xml;

import domain.model.Theme;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code xl/theme/theme1.xml}: the 12 scheme colors and the major/minor latin fonts.
 */
public class ThemeDecoder {

    public Theme decode(byte[] xml, String partPath) {
        Document doc = XmlDom.parse(xml, partPath);
        Element root = doc.getDocumentElement();

        List<Element> schemes = XmlDom.descendants(root, "clrScheme");
        List<String> colors = new ArrayList<>();
        if (!schemes.isEmpty()) {
            Element scheme = schemes.get(0);
            for (String slot : Theme.SLOT_NAMES) {
                colors.add(slotColor(XmlDom.child(scheme, slot)));
            }
        }

        String major = null;
        String minor = null;
        List<Element> fontSchemes = XmlDom.descendants(root, "fontScheme");
        if (!fontSchemes.isEmpty()) {
            major = XmlDom.attr(XmlDom.child(XmlDom.child(fontSchemes.get(0), "majorFont"), "latin"), "typeface");
            minor = XmlDom.attr(XmlDom.child(XmlDom.child(fontSchemes.get(0), "minorFont"), "latin"), "typeface");
        }
        Theme office = Theme.office();
        return new Theme(colors,
                blankToNull(major) == null ? office.getMajorFont() : major,
                blankToNull(minor) == null ? office.getMinorFont() : minor);
    }

    /** {@code <a:srgbClr val>} or {@code <a:sysClr lastClr>}; null when neither is present. */
    private static String slotColor(Element slot) {
        if (slot == null) return null;
        Element srgb = XmlDom.child(slot, "srgbClr");
        if (srgb != null) return hex(XmlDom.attr(srgb, "val"));
        Element sys = XmlDom.child(slot, "sysClr");
        if (sys != null) return hex(XmlDom.attr(sys, "lastClr"));
        return null;
    }

    private static String hex(String raw) {
        if (raw == null || raw.length() != 6) return null;
        return "#" + raw.toUpperCase();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
