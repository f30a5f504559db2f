package infra.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.conditional.CfRule;
import domain.conditional.CfRuleType;
import domain.conditional.ConditionalFormatting;
import domain.model.Cell;
import domain.model.CellType;
import domain.model.RangeRef;
import domain.model.Sheet;
import domain.model.SheetState;
import domain.model.Workbook;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class JsonWorkbookExporterTest {

    private static Workbook sample() {
        Workbook wb = new Workbook();
        Sheet sheet = new Sheet("Data", "xl/worksheets/sheet1.xml");
        sheet.setState(SheetState.VERY_HIDDEN);
        sheet.putCell(0, 0, new Cell(CellType.NUMBER, "0.5", "50%", null, null, null, null, false, false, null));
        sheet.putCell(1, 2, Cell.of(CellType.STRING, "text"));
        sheet.addMerge(RangeRef.parse("A3:B4"));
        ConditionalFormatting cf = new ConditionalFormatting("A1:A2", RangeRef.parseList("A1:A2"));
        cf.addRule(new CfRule(CfRuleType.CELL_IS, 1));
        sheet.getConditionalFormats().add(cf);
        wb.addSheet(sheet);
        return wb;
    }

    @Test
    void should_write_cells_with_short_keys_and_tags() throws Exception {
        String json = new JsonWorkbookExporter(false).toJson(sample());

        JsonNode sheet = new ObjectMapper().readTree(json).get("sheets").get(0);
        assertEquals("Data", sheet.get("name").asText());
        assertEquals("veryhidden", sheet.get("state").asText().replace("_", ""));
        assertFalse(sheet.has("partPath"));

        JsonNode first = sheet.get("cells").get(0);
        assertEquals(0, first.get("r").asInt());
        assertEquals(0, first.get("c").asInt());
        assertEquals("n", first.get("cell").get("t").asText());
        assertEquals("0.5", first.get("cell").get("v").asText());
        assertEquals("50%", first.get("cell").get("display").asText());
        assertFalse(first.get("cell").has("hasComment"));
        assertFalse(first.get("cell").has("isDate"));
        assertFalse(first.get("cell").has("s"));

        assertEquals("s", sheet.get("cells").get(1).get("cell").get("t").asText());
    }

    @Test
    void should_write_ranges_and_rule_types_as_text() throws Exception {
        JsonNode sheet = new ObjectMapper().readTree(new JsonWorkbookExporter(false).toJson(sample()))
                .get("sheets").get(0);

        assertEquals("A3:B4", sheet.get("merges").get(0).asText());
        JsonNode cf = sheet.get("conditionalFormats").get(0);
        assertEquals("A1:A2", cf.get("ranges").get(0).asText());
        assertEquals("cellIs", cf.get("rules").get(0).get("type").asText());
    }

    @Test
    void should_indent_when_pretty() {
        StringWriter out = new StringWriter();
        new JsonWorkbookExporter(true).write(sample(), out);

        assertTrue(out.toString().contains("\n"));
        assertTrue(out.toString().startsWith("{"));
    }
}
