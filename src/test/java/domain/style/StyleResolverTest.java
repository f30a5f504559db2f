package domain.style;

import domain.model.ListParseWarningSink;
import domain.model.ParseWarning;
import domain.model.ParseWarningCode;
import domain.model.Style;
import domain.model.Theme;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StyleResolverTest {

    private static RawFont font(String name, Boolean bold) {
        return new RawFont(name, 11.0, bold, null, null, null, null, null, null);
    }

    private static RawXf xf(Integer fontId, Integer xfId, Boolean applyFont) {
        return new RawXf(0, fontId, 0, 0, xfId, null, applyFont, null, null, null, null, null, null);
    }

    private static StyleSheet twoFontSheet() {
        StyleSheet sheet = StyleSheet.empty();
        sheet.getFonts().add(font("Calibri", null));
        sheet.getFonts().add(font("Arial", Boolean.TRUE));
        sheet.getFills().add(RawFill.NONE);
        sheet.getFills().add(new RawFill("gray125", null, null, null));
        sheet.getBorders().add(RawBorder.NONE);
        sheet.getCellStyleXfs().add(xf(0, null, null));
        return sheet;
    }

    @Test
    void should_use_own_font_when_apply_flag_is_absent() {
        StyleSheet sheet = twoFontSheet();
        sheet.getCellXfs().add(xf(1, 0, null));

        Style style = new StyleResolver(sheet, Theme.office(), null).resolve(0);

        assertEquals(Boolean.TRUE, style.getBold());
        assertEquals("Arial", style.getFontFamily());
    }

    @Test
    void should_keep_parent_font_when_apply_flag_is_false() {
        StyleSheet sheet = twoFontSheet();
        sheet.getCellXfs().add(xf(1, 0, Boolean.FALSE));

        Style style = new StyleResolver(sheet, Theme.office(), null).resolve(0);

        assertNull(style.getBold());
        assertEquals("Calibri", style.getFontFamily());
    }

    @Test
    void should_inherit_parent_border_when_apply_flag_is_absent() {
        StyleSheet sheet = twoFontSheet();
        sheet.getBorders().add(new RawBorder(new RawBorderSide("thin", ColorSpec.rgb("FF000000", 0.0)),
                null, null, null, null, false, false));
        sheet.getCellStyleXfs().set(0, new RawXf(0, 0, 0, 1, null, null, null, null, null, null, null, null, null));
        sheet.getCellXfs().add(new RawXf(0, 0, 0, 0, 0, null, null, null, null, null, null, null, null));
        sheet.getCellXfs().add(new RawXf(0, 0, 0, 0, 0, null, null, null, Boolean.TRUE, null, null, null, null));

        StyleResolver resolver = new StyleResolver(sheet, Theme.office(), null);

        assertNotNull(resolver.resolve(0).getBorderLeft());
        assertEquals("thin", resolver.resolve(0).getBorderLeft().getStyle());
        assertNull(resolver.resolve(1).getBorderLeft());
    }

    @Test
    void should_share_one_instance_per_xf_index() {
        StyleSheet sheet = twoFontSheet();
        sheet.getCellXfs().add(xf(1, 0, null));
        StyleResolver resolver = new StyleResolver(sheet, Theme.office(), null);

        assertSame(resolver.resolve(0), resolver.resolve(0));
    }

    @Test
    void should_fall_back_and_warn_on_out_of_range_index() {
        StyleSheet sheet = twoFontSheet();
        sheet.getCellXfs().add(xf(1, 0, null));
        List<ParseWarning> warnings = new ArrayList<>();
        StyleResolver resolver = new StyleResolver(sheet, Theme.office(), new ListParseWarningSink(warnings));

        Style style = resolver.resolve(7);

        assertSame(resolver.defaultStyle(), style);
        assertEquals(1, warnings.size());
        assertEquals(ParseWarningCode.STYLE_INDEX_OUT_OF_RANGE, warnings.get(0).getCode());
    }

    @Test
    void should_resolve_builtin_and_custom_number_formats() {
        StyleSheet sheet = twoFontSheet();
        sheet.getNumFmts().put(164, "yyyy/mm/dd");
        sheet.getCellXfs().add(new RawXf(164, 0, 0, 0, 0, Boolean.TRUE, null, null, null, null, null, null, null));
        sheet.getCellXfs().add(new RawXf(10, 0, 0, 0, 0, Boolean.TRUE, null, null, null, null, null, null, null));
        StyleResolver resolver = new StyleResolver(sheet, Theme.office(), null);

        assertEquals("yyyy/mm/dd", resolver.resolve(0).getNumberFormat());
        assertEquals(164, resolver.resolve(0).getNumFmtId());
        assertEquals("0.00%", resolver.resolve(1).getNumberFormat());
    }

    @Test
    void should_resolve_solid_fill_and_alignment() {
        StyleSheet sheet = twoFontSheet();
        sheet.getFills().add(new RawFill("solid", ColorSpec.rgb("FFFFFF00", 0.0), null, null));
        RawAlignment wrapAndShrink = new RawAlignment("center", null, Boolean.TRUE, Boolean.TRUE, null, null, null);
        sheet.getCellXfs().add(new RawXf(0, 0, 2, 0, 0, null, null, Boolean.TRUE, null, Boolean.TRUE,
                null, wrapAndShrink, null));

        Style style = new StyleResolver(sheet, Theme.office(), null).resolve(0);

        assertEquals("solid", style.getPatternType());
        assertEquals("#FFFF00", style.getBgColor());
        assertEquals("center", style.getAlignH());
        assertEquals(Boolean.TRUE, style.getWrap());
        assertNull(style.getShrinkToFit());
    }
}
