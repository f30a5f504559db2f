package domain.numfmt;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NumberFormatEngineTest {

    private final NumberFormatEngine engine = new NumberFormatEngine();

    @Test
    void should_format_general_values() {
        assertEquals("1234.5", engine.format(1234.5, "General", false));
        assertEquals("42", engine.format(42.0, null, false));
        assertEquals("0.3", NumberFormatEngine.formatGeneral(0.1 + 0.2));
        assertEquals("1E+12", NumberFormatEngine.formatGeneral(1e12));
        assertEquals("7", engine.format(7.0, "@", false));
    }

    @Test
    void should_format_decimals_thousands_and_percent() {
        assertEquals("3.14", engine.format(3.14159, "0.00", false));
        assertEquals("1,234,568", engine.format(1234567.891, "#,##0", false));
        assertEquals("26%", engine.format(0.256, "0%", false));
        assertEquals("12.34%", engine.format(0.1234, "0.00%", false));
    }

    @Test
    void should_use_negative_section_without_minus_sign() {
        assertEquals("(5)", engine.format(-5, "0;(0)", false));
        assertEquals("5", engine.format(5, "0;(0)", false));
    }

    @Test
    void should_format_scientific_and_fraction() {
        assertEquals("1.23E+04", engine.format(12345, "0.00E+00", false));
        assertEquals("1 1/2", engine.format(1.5, "# ?/?", false));
    }

    @Test
    void should_render_dates_and_times() {
        assertEquals("2023-03-15", engine.format(45000, "yyyy-mm-dd", false));
        assertEquals("12:00:00", engine.format(0.5, "h:mm:ss", false));
        assertEquals("6:00 PM", engine.format(0.75, "h:mm AM/PM", false));
    }

    @Test
    void should_fall_back_to_general_for_negative_serial_under_date_code() {
        assertEquals("-1", engine.format(-1, "yyyy-mm-dd", false));
    }

    @Test
    void should_detect_date_codes_outside_literals() {
        assertTrue(NumberFormatEngine.isDateFormat("yyyy-mm-dd"));
        assertTrue(NumberFormatEngine.isDateFormat("[h]:mm"));
        assertTrue(NumberFormatEngine.isDateFormat("mm:ss"));
        assertFalse(NumberFormatEngine.isDateFormat("\"d\"0"));
        assertFalse(NumberFormatEngine.isDateFormat("[Red]0.00"));
        assertFalse(NumberFormatEngine.isDateFormat("#,##0"));
        assertTrue(engine.isDateCode("d-mmm-yy"));
        assertFalse(engine.isDateCode("0.00"));
    }
}
