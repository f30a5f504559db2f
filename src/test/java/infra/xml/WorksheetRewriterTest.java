package infra.xml;

import domain.edit.CellEdit;
import domain.edit.EditValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorksheetRewriterTest {

    private static final String PART = "xl/worksheets/sheet1.xml";

    private final WorksheetRewriter rewriter = new WorksheetRewriter();

    private String rewrite(String xml, CellEdit... edits) {
        byte[] out = rewriter.rewrite(xml.getBytes(StandardCharsets.UTF_8), PART, List.of(edits));
        return new String(out, StandardCharsets.UTF_8);
    }

    private static EditValue number(String v) {
        return new EditValue(EditValue.Kind.NUMBER, v);
    }

    @Test
    void should_keep_namespace_prefix_of_existing_part() {
        String xml = "<x:worksheet xmlns:x=\"" + XlsxFixtures.MAIN_NS + "\"><x:sheetData/></x:worksheet>";

        String out = rewrite(xml, new CellEdit(0, 0, number("5")));

        assertTrue(out.contains("<x:dimension ref=\"A1\"/><x:sheetData>"), out);
        assertTrue(out.contains("<x:row r=\"1\"><x:c r=\"A1\"><x:v>5</x:v></x:c></x:row>"), out);
    }

    @Test
    void should_create_sheet_data_before_trailing_elements() {
        String xml = XlsxFixtures.worksheet("<pageMargins left=\"0.7\"/>");

        String out = rewrite(xml,
                new CellEdit(0, 2, new EditValue(EditValue.Kind.STRING, "c")),
                new CellEdit(0, 0, number("1")));

        assertTrue(out.indexOf("<sheetData>") < out.indexOf("<pageMargins"), out);
        assertTrue(out.indexOf("r=\"A1\"") < out.indexOf("r=\"C1\""), out);
        assertTrue(out.contains("<dimension ref=\"A1:C1\"/>"), out);
    }

    @Test
    void should_replace_value_keep_style_and_drop_formula() {
        String xml = XlsxFixtures.worksheet("<sheetData><row r=\"1\"><c r=\"A1\" s=\"3\" t=\"s\"><f>B1</f><v>0</v></c></row></sheetData>");

        String out = rewrite(xml, new CellEdit(0, 0, number("2")));

        assertTrue(out.contains("<c r=\"A1\" s=\"3\"><v>2</v></c>"), out);
        assertFalse(out.contains("<f>"), out);
    }

    @Test
    void should_write_booleans_as_one_or_zero() {
        String xml = XlsxFixtures.worksheet("<sheetData/>");

        String out = rewrite(xml,
                new CellEdit(1, 0, new EditValue(EditValue.Kind.BOOLEAN, "TRUE")),
                new CellEdit(1, 1, new EditValue(EditValue.Kind.BOOLEAN, "FALSE")));

        assertTrue(out.contains("<c r=\"A2\" t=\"b\"><v>1</v></c>"), out);
        assertTrue(out.contains("<c r=\"B2\" t=\"b\"><v>0</v></c>"), out);
    }

    @Test
    void should_make_implicit_positions_explicit() {
        String xml = XlsxFixtures.worksheet("<sheetData><row><c><v>1</v></c><c><v>2</v></c></row></sheetData>");

        String out = rewrite(xml, new CellEdit(0, 1, number("9")));

        assertTrue(out.contains("<row r=\"1\"><c r=\"A1\"><v>1</v></c><c r=\"B1\"><v>9</v></c></row>"), out);
    }
}
