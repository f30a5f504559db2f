package domain.conditional;

import domain.model.Cell;
import domain.model.CellType;
import domain.model.DxfStyle;
import domain.model.RangeRef;
import domain.model.Sheet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalFormatEvaluatorTest {

    private static final List<DxfStyle> DXFS = List.of(
            new DxfStyle(null, "#FF0000", null, null, null, null, null),
            new DxfStyle("#006100", "#00FF00", Boolean.TRUE, null, null, null, null)
    );

    private static Sheet numbers(double... values) {
        Sheet sheet = new Sheet("Sheet1", "xl/worksheets/sheet1.xml");
        for (int i = 0; i < values.length; i++) {
            String v = Double.toString(values[i]);
            sheet.putCell(i, 0, Cell.of(CellType.NUMBER, v));
        }
        return sheet;
    }

    private static ConditionalFormatting group(Sheet sheet, String sqref) {
        ConditionalFormatting g = new ConditionalFormatting(sqref, RangeRef.parseList(sqref));
        sheet.getConditionalFormats().add(g);
        return g;
    }

    private static CfRule cellIs(int priority, String operator, String operand, int dxfId) {
        CfRule rule = new CfRule(CfRuleType.CELL_IS, priority);
        rule.setOperator(operator);
        rule.addFormula(operand);
        rule.setDxfId(dxfId);
        return rule;
    }

    @Test
    void should_compare_text_operands_without_case() {
        Sheet sheet = new Sheet("Sheet1", "xl/worksheets/sheet1.xml");
        sheet.putCell(0, 0, Cell.of(CellType.STRING, "Apple"));
        sheet.putCell(1, 0, Cell.of(CellType.STRING, "pear"));
        sheet.putCell(2, 0, Cell.of(CellType.NUMBER, "5"));
        group(sheet, "A1:A3").addRule(cellIs(1, "equal", "\"apple\"", 0));

        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);

        assertEquals("#FF0000", evaluator.evaluate(sheet, 0, 0).getBgColor());
        assertNull(evaluator.evaluate(sheet, 1, 0).getBgColor());
        assertNull(evaluator.evaluate(sheet, 2, 0).getBgColor());
    }

    @Test
    void should_let_higher_priority_rule_own_the_background() {
        Sheet sheet = numbers(1, 2, 3, 4, 5);
        ConditionalFormatting g = group(sheet, "A1:A5");
        g.addRule(cellIs(2, "greaterThan", "2", 0));
        g.addRule(cellIs(1, "greaterThan", "3", 1));

        ConditionalFormatResult result = new ConditionalFormatEvaluator(DXFS).evaluate(sheet, 4, 0);

        assertEquals("#00FF00", result.getBgColor());
        assertEquals("#006100", result.getFontColor());
        assertEquals(Boolean.TRUE, result.getBold());
        assertEquals(List.of(1, 2), result.getAppliedRules());

        ConditionalFormatResult lower = new ConditionalFormatEvaluator(DXFS).evaluate(sheet, 2, 0);
        assertEquals("#FF0000", lower.getBgColor());
        assertEquals(List.of(2), lower.getAppliedRules());
    }

    @Test
    void should_stop_after_matching_rule_with_stop_if_true() {
        Sheet sheet = numbers(1, 2, 3, 4, 5);
        ConditionalFormatting g = group(sheet, "A1:A5");
        CfRule first = cellIs(1, "greaterThan", "3", 1);
        first.setStopIfTrue(true);
        g.addRule(first);
        g.addRule(cellIs(2, "greaterThan", "2", 0));

        ConditionalFormatResult result = new ConditionalFormatEvaluator(DXFS).evaluate(sheet, 4, 0);

        assertEquals(List.of(1), result.getAppliedRules());
    }

    @Test
    void should_not_fire_cell_is_on_blank_cells() {
        Sheet sheet = numbers(1, 2);
        ConditionalFormatting g = group(sheet, "A1:A5");
        g.addRule(cellIs(1, "lessThan", "10", 0));

        ConditionalFormatResult result = new ConditionalFormatEvaluator(DXFS).evaluate(sheet, 4, 0);

        assertTrue(result.isEmpty());
        assertNull(result.getBgColor());
    }

    @Test
    void should_interpolate_two_color_scale() {
        Sheet sheet = numbers(0, 50, 100);
        ConditionalFormatting g = group(sheet, "A1:A3");
        CfRule rule = new CfRule(CfRuleType.COLOR_SCALE, 1);
        rule.setColorScale(new ColorScale(
                List.of(new CfValueObject(CfValueObject.Type.MIN, null, true),
                        new CfValueObject(CfValueObject.Type.MAX, null, true)),
                List.of("#FFFFFF", "#FF0000")));
        g.addRule(rule);
        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);

        assertEquals("#FFFFFF", evaluator.evaluate(sheet, 0, 0).getBgColor());
        assertEquals("#FF8080", evaluator.evaluate(sheet, 1, 0).getBgColor());
        assertEquals("#FF0000", evaluator.evaluate(sheet, 2, 0).getBgColor());
    }

    @Test
    void should_highlight_top_and_bottom_ranks() {
        Sheet sheet = numbers(10, 40, 20, 30);
        ConditionalFormatting g = group(sheet, "A1:A4");
        CfRule top = new CfRule(CfRuleType.TOP10, 1);
        top.setRank(1);
        top.setDxfId(0);
        g.addRule(top);
        CfRule bottom = new CfRule(CfRuleType.TOP10, 2);
        bottom.setRank(2);
        bottom.setBottom(true);
        bottom.setDxfId(1);
        g.addRule(bottom);
        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);

        assertEquals("#FF0000", evaluator.evaluate(sheet, 1, 0).getBgColor());
        assertEquals("#00FF00", evaluator.evaluate(sheet, 0, 0).getBgColor());
        assertEquals("#00FF00", evaluator.evaluate(sheet, 2, 0).getBgColor());
        assertTrue(evaluator.evaluate(sheet, 3, 0).isEmpty());
    }

    @Test
    void should_flag_duplicates_case_insensitively() {
        Sheet sheet = new Sheet("Sheet1", "xl/worksheets/sheet1.xml");
        sheet.putCell(0, 0, Cell.of(CellType.STRING, "apple"));
        sheet.putCell(1, 0, Cell.of(CellType.STRING, "APPLE"));
        sheet.putCell(2, 0, Cell.of(CellType.STRING, "pear"));
        ConditionalFormatting g = group(sheet, "A1:A3");
        CfRule rule = new CfRule(CfRuleType.DUPLICATE_VALUES, 1);
        rule.setDxfId(0);
        g.addRule(rule);
        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);

        assertEquals("#FF0000", evaluator.evaluate(sheet, 0, 0).getBgColor());
        assertEquals("#FF0000", evaluator.evaluate(sheet, 1, 0).getBgColor());
        assertNull(evaluator.evaluate(sheet, 2, 0).getBgColor());
    }

    @Test
    void should_compare_against_population_average() {
        Sheet sheet = numbers(1, 2, 3, 4, 5);
        ConditionalFormatting g = group(sheet, "A1:A5");
        CfRule rule = new CfRule(CfRuleType.ABOVE_AVERAGE, 1);
        rule.setDxfId(0);
        g.addRule(rule);
        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);

        assertTrue(evaluator.evaluate(sheet, 2, 0).isEmpty());
        assertEquals("#FF0000", evaluator.evaluate(sheet, 3, 0).getBgColor());
    }

    @Test
    void should_scale_data_bar_between_min_and_max_length() {
        Sheet sheet = numbers(0, 5, 10);
        ConditionalFormatting g = group(sheet, "A1:A3");
        CfRule rule = new CfRule(CfRuleType.DATA_BAR, 1);
        rule.setDataBar(new DataBar(
                new CfValueObject(CfValueObject.Type.MIN, null, true),
                new CfValueObject(CfValueObject.Type.MAX, null, true),
                DataBar.DEFAULT_COLOR, true, 10, 90));
        g.addRule(rule);

        ConditionalFormatResult.Bar bar = new ConditionalFormatEvaluator(DXFS).evaluate(sheet, 1, 0).getDataBar();

        assertNotNull(bar);
        assertEquals(50.0, bar.percent(), 1e-9);
        assertEquals(DataBar.DEFAULT_COLOR, bar.color());
        assertFalse(bar.negative());
    }

    @Test
    void should_pick_icon_from_percent_thresholds() {
        Sheet sheet = numbers(0, 50, 100);
        ConditionalFormatting g = group(sheet, "A1:A3");
        CfRule rule = new CfRule(CfRuleType.ICON_SET, 1);
        rule.setIconSet(new IconSet("3Arrows", List.of(
                new CfValueObject(CfValueObject.Type.PERCENT, "0", true),
                new CfValueObject(CfValueObject.Type.PERCENT, "33", true),
                new CfValueObject(CfValueObject.Type.PERCENT, "67", true)), true, false));
        g.addRule(rule);
        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);

        assertEquals(0, evaluator.evaluate(sheet, 0, 0).getIcon().index());
        assertEquals(1, evaluator.evaluate(sheet, 1, 0).getIcon().index());
        assertEquals(2, evaluator.evaluate(sheet, 2, 0).getIcon().index());
        assertEquals("3Arrows", evaluator.evaluate(sheet, 2, 0).getIcon().setName());
    }

    @Test
    void should_recompute_stats_after_invalidate() {
        Sheet sheet = numbers(1, 2, 3);
        ConditionalFormatting g = group(sheet, "A1:A3");
        CfRule top = new CfRule(CfRuleType.TOP10, 1);
        top.setRank(1);
        top.setDxfId(0);
        g.addRule(top);
        ConditionalFormatEvaluator evaluator = new ConditionalFormatEvaluator(DXFS);
        assertFalse(evaluator.evaluate(sheet, 2, 0).isEmpty());

        sheet.putCell(1, 0, Cell.of(CellType.NUMBER, "9"));
        assertFalse(evaluator.evaluate(sheet, 2, 0).isEmpty());

        evaluator.invalidate();

        assertTrue(evaluator.evaluate(sheet, 2, 0).isEmpty());
        assertFalse(evaluator.evaluate(sheet, 1, 0).isEmpty());
    }
}
