package infra.xml;

import domain.model.XlsxException;
import domain.style.ColorSpec;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers shared by the part decoders.
 *
 * <p>Parsing is namespace-unaware; elements are matched on their local name so that both
 * {@code <c>} and {@code <x:c>} are accepted.</p>
 */
public final class XmlDom {

    private XmlDom() {
    }

    /**
     * Parses a part with external DTDs and entities disabled.
     *
     * @throws XlsxException XML_PARSE_ERROR when the part is not well-formed
     */
    public static Document parse(byte[] xml, String partPath) {
        try {
            return newBuilder().parse(new ByteArrayInputStream(xml));
        } catch (Exception e) {
            throw XlsxException.xmlParseError(partPath, e);
        }
    }

    static DocumentBuilder newBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();

        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        factory.setValidating(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
        return builder;
    }

    /** Tag name without its prefix. */
    public static String localName(Node node) {
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    public static boolean is(Node node, String localName) {
        return node != null && node.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(node));
    }

    /** Direct element children with the given local name, in document order. */
    public static List<Element> children(Node parent, String localName) {
        List<Element> out = new ArrayList<>();
        if (parent == null) return out;
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (is(n, localName)) out.add((Element) n);
        }
        return out;
    }

    /** All direct element children. */
    public static List<Element> children(Node parent) {
        List<Element> out = new ArrayList<>();
        if (parent == null) return out;
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
        }
        return out;
    }

    public static Element child(Node parent, String localName) {
        if (parent == null) return null;
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (is(n, localName)) return (Element) n;
        }
        return null;
    }

    /** Depth-first descendants with the given local name. */
    public static List<Element> descendants(Node root, String localName) {
        List<Element> out = new ArrayList<>();
        collect(root, localName, out);
        return out;
    }

    private static void collect(Node node, String localName, List<Element> out) {
        NodeList nodes = node.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            if (localName.equals(localName(n))) out.add((Element) n);
            collect(n, localName, out);
        }
    }

    /**
     * Attribute by local name; null when absent. Prefixed attributes ({@code r:id}) match
     * on {@code id} only when no unprefixed attribute of that name exists.
     */
    public static String attr(Element el, String localName) {
        if (el == null) return null;
        if (el.hasAttribute(localName)) return el.getAttribute(localName);
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node a = attrs.item(i);
            String name = a.getNodeName();
            if (name.startsWith("xmlns")) continue;
            if (localName.equals(localName(a))) return a.getNodeValue();
        }
        return null;
    }

    /** {@code 1}/{@code true} are true, {@code 0}/{@code false} false; otherwise null. */
    public static Boolean bool(Element el, String localName) {
        String v = attr(el, localName);
        if (v == null) return null;
        return switch (v.trim()) {
            case "1", "true" -> Boolean.TRUE;
            case "0", "false" -> Boolean.FALSE;
            default -> null;
        };
    }

    public static boolean bool(Element el, String localName, boolean def) {
        Boolean b = bool(el, localName);
        return b == null ? def : b;
    }

    public static Integer integer(Element el, String localName) {
        String v = attr(el, localName);
        if (v == null) return null;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static int integer(Element el, String localName, int def) {
        Integer v = integer(el, localName);
        return v == null ? def : v;
    }

    public static Long longValue(Element el, String localName) {
        String v = attr(el, localName);
        if (v == null) return null;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double decimal(Element el, String localName) {
        String v = attr(el, localName);
        if (v == null) return null;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Text content of the element, or null when the element is null. */
    public static String text(Element el) {
        return el == null ? null : el.getTextContent();
    }

    /** Text of the first child with the given local name. */
    public static String childText(Node parent, String localName) {
        return text(child(parent, localName));
    }

    /**
     * Color element ({@code rgb}, {@code theme}, {@code indexed}, {@code auto}, with optional
     * {@code tint}) to a {@link ColorSpec}; null when the element carries none of them.
     */
    public static ColorSpec color(Element el) {
        if (el == null) return null;
        double tint = 0.0;
        Double t = decimal(el, "tint");
        if (t != null) tint = t;

        String rgb = attr(el, "rgb");
        if (rgb != null) return ColorSpec.rgb(rgb, tint);
        Integer theme = integer(el, "theme");
        if (theme != null) return ColorSpec.theme(theme, tint);
        Integer indexed = integer(el, "indexed");
        if (indexed != null) return ColorSpec.indexed(indexed, tint);
        if (Boolean.TRUE.equals(bool(el, "auto"))) return ColorSpec.auto();
        return null;
    }
}
