package infra.xml;

import domain.model.DefinedName;
import domain.model.SheetState;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code xl/workbook.xml}: sheet list, epoch flag and defined names.
 */
public class WorkbookPartDecoder {

    public record SheetEntry(String name, String relId, int sheetId, SheetState state) {
    }

    public record Result(List<SheetEntry> sheets, boolean date1904, List<DefinedName> definedNames) {
    }

    public Result decode(byte[] xml, String partPath) {
        Document doc = XmlDom.parse(xml, partPath);
        Element root = doc.getDocumentElement();

        boolean date1904 = XmlDom.bool(XmlDom.child(root, "workbookPr"), "date1904", false);

        List<SheetEntry> sheets = new ArrayList<>();
        for (Element s : XmlDom.children(XmlDom.child(root, "sheets"), "sheet")) {
            sheets.add(new SheetEntry(
                    XmlDom.attr(s, "name"),
                    XmlDom.attr(s, "id"),
                    XmlDom.integer(s, "sheetId", sheets.size() + 1),
                    SheetState.fromXml(XmlDom.attr(s, "state"))));
        }

        List<DefinedName> names = new ArrayList<>();
        for (Element dn : XmlDom.children(XmlDom.child(root, "definedNames"), "definedName")) {
            names.add(new DefinedName(
                    XmlDom.attr(dn, "name"),
                    dn.getTextContent(),
                    XmlDom.integer(dn, "localSheetId"),
                    XmlDom.bool(dn, "hidden", false)));
        }
        return new Result(sheets, date1904, names);
    }
}
