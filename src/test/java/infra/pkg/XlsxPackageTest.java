package infra.pkg;

import domain.model.XlsxErrorCode;
import domain.model.XlsxException;
import infra.xml.XlsxFixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XlsxPackageTest {

    @Test
    void should_reject_empty_and_non_zip_input() {
        assertEquals(XlsxErrorCode.INVALID_ARCHIVE,
                assertThrows(XlsxException.class, () -> XlsxPackage.open(new byte[0])).getCode());
        assertEquals(XlsxErrorCode.INVALID_ARCHIVE,
                assertThrows(XlsxException.class, () -> XlsxPackage.open("not a zip".getBytes())).getCode());
    }

    @Test
    void should_find_workbook_through_root_relationship() {
        Map<String, String> parts = new LinkedHashMap<>();
        parts.put("_rels/.rels", "<Relationships xmlns=\"" + XlsxFixtures.PKG_REL_NS + "\">"
                + "<Relationship Id=\"rId1\" Type=\"" + XlsxFixtures.REL_NS + "/officeDocument\" Target=\"/book/main.xml\"/>"
                + "</Relationships>");
        parts.put("book/main.xml", "<workbook/>");
        parts.put("book/_rels/main.xml.rels", "<Relationships xmlns=\"" + XlsxFixtures.PKG_REL_NS + "\">"
                + "<Relationship Id=\"rId7\" Type=\"" + XlsxFixtures.REL_NS + "/worksheet\" Target=\"sheets/../sheets/one.xml\"/>"
                + "<Relationship Id=\"rId8\" Type=\"" + XlsxFixtures.REL_NS + "/hyperlink\" Target=\"http://x.test/\" TargetMode=\"External\"/>"
                + "</Relationships>");

        XlsxPackage pkg = XlsxPackage.open(XlsxFixtures.zip(parts));

        assertEquals("book/main.xml", pkg.workbookPath());
        Relationship sheet = pkg.relationship("book/main.xml", "rId7");
        assertEquals("book/sheets/one.xml", sheet.target());
        assertTrue(sheet.isType("worksheet"));
        Relationship link = pkg.firstOfType("book/main.xml", "hyperlink");
        assertTrue(link.external());
        assertEquals("http://x.test/", link.target());
        assertNull(pkg.relationship("book/main.xml", "rId99"));
    }

    @Test
    void should_fall_back_to_default_workbook_path() {
        Map<String, String> parts = new LinkedHashMap<>();
        parts.put("xl/workbook.xml", "<workbook/>");

        XlsxPackage pkg = XlsxPackage.open(XlsxFixtures.zip(parts));

        assertEquals("xl/workbook.xml", pkg.workbookPath());
        assertTrue(pkg.relationshipsOf("xl/workbook.xml").isEmpty());
    }

    @Test
    void should_report_missing_required_part() {
        Map<String, String> parts = new LinkedHashMap<>();
        parts.put("a.xml", "<a/>");
        XlsxPackage pkg = XlsxPackage.open(XlsxFixtures.zip(parts));

        assertNull(pkg.part("b.xml"));
        XlsxException ex = assertThrows(XlsxException.class, () -> pkg.requirePart("/b.xml"));
        assertEquals(XlsxErrorCode.MISSING_PART, ex.getCode());
        assertEquals("b.xml", ex.getDetail());
    }

    @Test
    void should_resolve_relative_and_absolute_targets() {
        assertEquals("xl/drawings/drawing1.xml",
                XlsxPackage.resolveTarget("xl/worksheets/sheet1.xml", "../drawings/drawing1.xml"));
        assertEquals("xl/media/image1.png",
                XlsxPackage.resolveTarget("xl/worksheets/sheet1.xml", "/xl/media/image1.png"));
        assertEquals("xl/worksheets/_rels/sheet1.xml.rels", XlsxPackage.relsPathFor("xl/worksheets/sheet1.xml"));
        assertEquals("_rels/.rels", XlsxPackage.relsPathFor(""));
    }
}
