package infra.xml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code xl/sharedStrings.xml}: one plain string per {@code <si>}. Rich-text runs are
 * concatenated; phonetic runs ({@code rPh}) are dropped.
 */
public class SharedStringsDecoder {

    public List<String> decode(byte[] xml, String partPath) {
        Document doc = XmlDom.parse(xml, partPath);
        List<String> out = new ArrayList<>();
        for (Element si : XmlDom.children(doc.getDocumentElement(), "si")) {
            out.add(plainText(si));
        }
        return out;
    }

    /**
     * Text of a string item ({@code <si>} / {@code <is>}): direct {@code <t>} or all
     * {@code <r><t>}, with {@code _xHHHH_} escapes decoded.
     */
    public static String plainText(Element item) {
        StringBuilder sb = new StringBuilder();
        appendText(item, sb);
        return OoxmlText.unescape(sb.toString());
    }

    private static void appendText(Node node, StringBuilder sb) {
        NodeList nodes = node.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            String name = XmlDom.localName(n);
            if ("t".equals(name)) {
                sb.append(n.getTextContent());
            } else if ("r".equals(name)) {
                appendText(n, sb);
            }
        }
    }
}
