package domain.edit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellInputParserTest {

    @Test
    void should_clear_on_blank_or_null_input() {
        assertTrue(CellInputParser.parse("   ").isClear());
        assertTrue(CellInputParser.parse(null).isClear());
    }

    @Test
    void should_recognize_booleans_in_any_case() {
        assertEquals(new EditValue(EditValue.Kind.BOOLEAN, "TRUE"), CellInputParser.parse(" True "));
        assertEquals(new EditValue(EditValue.Kind.BOOLEAN, "FALSE"), CellInputParser.parse("FALSE"));
    }

    @Test
    void should_canonicalize_numbers() {
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "12.5"), CellInputParser.parse(" 12.50 "));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "1000"), CellInputParser.parse("1e3"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "100"), CellInputParser.parse("100"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "-0.5"), CellInputParser.parse("-.5"));
    }

    @Test
    void should_canonicalize_extreme_exponents_from_parsed_value() {
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "0"), CellInputParser.parse("0e99999999999"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "0"), CellInputParser.parse("1e-999999999"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "0"), CellInputParser.parse("-0"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "1E+300"), CellInputParser.parse("1e300"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "1.5E-30"), CellInputParser.parse("0.0000000000000000000000000000015"));
        assertEquals(new EditValue(EditValue.Kind.NUMBER, "0.001"), CellInputParser.parse("1e-3"));
    }

    @Test
    void should_keep_everything_else_as_trimmed_text() {
        assertEquals(new EditValue(EditValue.Kind.STRING, "1,000"), CellInputParser.parse("1,000"));
        assertEquals(new EditValue(EditValue.Kind.STRING, "NaN"), CellInputParser.parse("NaN"));
        assertEquals(new EditValue(EditValue.Kind.STRING, "1e400"), CellInputParser.parse("1e400"));
        assertEquals(new EditValue(EditValue.Kind.STRING, "hello world"), CellInputParser.parse("  hello world "));
    }
}
