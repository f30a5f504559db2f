package infra.xml;

import domain.model.Comment;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Legacy comments part ({@code xl/commentsN.xml}). Rich text is flattened.
 */
public class CommentsDecoder {

    public List<Comment> decode(byte[] xml, String partPath) {
        Document doc = XmlDom.parse(xml, partPath);
        Element root = doc.getDocumentElement();

        List<String> authors = new ArrayList<>();
        for (Element a : XmlDom.children(XmlDom.child(root, "authors"), "author")) {
            authors.add(a.getTextContent());
        }

        List<Comment> out = new ArrayList<>();
        for (Element c : XmlDom.children(XmlDom.child(root, "commentList"), "comment")) {
            String ref = XmlDom.attr(c, "ref");
            if (ref == null) continue;
            int authorId = XmlDom.integer(c, "authorId", -1);
            String author = authorId >= 0 && authorId < authors.size() ? authors.get(authorId) : null;
            Element text = XmlDom.child(c, "text");
            out.add(new Comment(ref, author, text == null ? "" : SharedStringsDecoder.plainText(text)));
        }
        return out;
    }
}
