package domain.style;

import domain.model.BorderSide;
import domain.model.DxfStyle;
import domain.model.GradientFill;
import domain.model.ParseWarning;
import domain.model.ParseWarningCode;
import domain.model.ParseWarningSink;
import domain.model.Style;
import domain.model.Theme;
import domain.numfmt.BuiltinFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a cellXfs index into a final {@link Style}.
 *
 * <p>Two-level merge, one category at a time (number format, font, fill, border, alignment,
 * protection):</p>
 * <ol>
 *   <li>baseline = the parent cellStyleXfs entry named by {@code xfId} (format defaults when absent)</li>
 *   <li>explicit {@code apply*="1"} takes the xf's own value</li>
 *   <li>explicit {@code apply*="0"} keeps the baseline</li>
 *   <li>absent flag: own value when the xf declares that category, baseline otherwise</li>
 * </ol>
 *
 * <p>Results are cached per cellXfs index; cells sharing an index share one instance.
 * Out-of-range indices are substituted with the category default and reported as warnings.</p>
 */
public final class StyleResolver {

    private static final Logger log = LoggerFactory.getLogger(StyleResolver.class);

    private static final String PART = "xl/styles.xml";

    private static final Effective DEFAULTS = new Effective(0, 0, 0, 0, null, null);

    private final StyleSheet styles;
    private final Theme theme;
    private final ColorResolver colors;
    private final ParseWarningSink warnings;

    private final Map<Integer, Style> cache = new HashMap<>();
    private Style defaultStyle;

    public StyleResolver(StyleSheet styles, Theme theme, ParseWarningSink warnings) {
        this.styles = styles == null ? StyleSheet.empty() : styles;
        this.theme = theme == null ? Theme.office() : theme;
        this.colors = new ColorResolver(this.theme, this.styles.getIndexedColors());
        this.warnings = warnings == null ? ParseWarningSink.none() : warnings;
    }

    public ColorResolver colors() {
        return colors;
    }

    /**
     * Resolved style for a cellXfs index. Never null.
     */
    public Style resolve(int xfIndex) {
        Style cached = cache.get(xfIndex);
        if (cached != null) return cached;

        Style style;
        List<RawXf> cellXfs = styles.getCellXfs();
        if (xfIndex < 0 || xfIndex >= cellXfs.size()) {
            if (!cellXfs.isEmpty() || xfIndex != 0) {
                warn(ParseWarningCode.STYLE_INDEX_OUT_OF_RANGE,
                        "cellXfs index " + xfIndex + " (count=" + cellXfs.size() + ")");
            }
            style = defaultStyle();
        } else {
            RawXf xf = cellXfs.get(xfIndex);
            Effective base = baseline(xf.xfId(), new HashSet<>());
            style = build(merge(xf, base));
        }

        cache.put(xfIndex, style);
        return style;
    }

    /** Style built from format defaults only (font 0, no fill, no border, General). */
    public Style defaultStyle() {
        if (defaultStyle == null) {
            defaultStyle = build(DEFAULTS);
        }
        return defaultStyle;
    }

    /**
     * Number format code for an id: registered custom code first, then the built-in table,
     * General otherwise.
     */
    public String numberFormatCode(int numFmtId) {
        String custom = styles.getNumFmts().get(numFmtId);
        if (custom != null) return custom;
        String builtin = BuiltinFormats.codeFor(numFmtId);
        if (builtin != null) return builtin;
        warn(ParseWarningCode.NUMBER_FORMAT_UNKNOWN, "numFmtId " + numFmtId);
        return Style.GENERAL;
    }

    public List<DxfStyle> resolveDxfs() {
        List<DxfStyle> out = new ArrayList<>(styles.getDxfs().size());
        for (RawDxf dxf : styles.getDxfs()) {
            out.add(resolveDxf(dxf));
        }
        return out;
    }

    // ------------------------------------------------------------
    // cascade
    // ------------------------------------------------------------

    private Effective baseline(Integer xfId, Set<Integer> visiting) {
        if (xfId == null) return DEFAULTS;
        List<RawXf> parents = styles.getCellStyleXfs();
        if (xfId < 0 || xfId >= parents.size()) {
            if (!parents.isEmpty()) {
                warn(ParseWarningCode.STYLE_INDEX_OUT_OF_RANGE,
                        "cellStyleXfs index " + xfId + " (count=" + parents.size() + ")");
            }
            return DEFAULTS;
        }
        if (!visiting.add(xfId)) {
            return DEFAULTS;
        }
        RawXf parent = parents.get(xfId);
        Effective grand = baseline(parent.xfId(), visiting);

        // named-style level: declared categories always count
        return new Effective(
                parent.numFmtId() != null ? parent.numFmtId() : grand.numFmtId(),
                parent.fontId() != null ? parent.fontId() : grand.fontId(),
                parent.fillId() != null ? parent.fillId() : grand.fillId(),
                parent.borderId() != null ? parent.borderId() : grand.borderId(),
                parent.alignment() != null ? parent.alignment() : grand.alignment(),
                parent.protection() != null ? parent.protection() : grand.protection()
        );
    }

    private static Effective merge(RawXf xf, Effective base) {
        return new Effective(
                pickId(xf.numFmtId(), xf.applyNumberFormat(), base.numFmtId()),
                pickId(xf.fontId(), xf.applyFont(), base.fontId()),
                pickId(xf.fillId(), xf.applyFill(), base.fillId()),
                pickId(xf.borderId(), xf.applyBorder(), base.borderId()),
                pick(xf.alignment(), xf.applyAlignment(), base.alignment()),
                pick(xf.protection(), xf.applyProtection(), base.protection())
        );
    }

    /** Without a flag, an own id of 0 (the default entry) does not replace the parent's id. */
    static int pickId(Integer own, Boolean apply, int inherited) {
        if (Boolean.TRUE.equals(apply)) return own != null ? own : 0;
        if (Boolean.FALSE.equals(apply)) return inherited;
        return own != null && own != 0 ? own : inherited;
    }

    static <T> T pick(T own, Boolean apply, T inherited) {
        if (Boolean.TRUE.equals(apply)) return own;
        if (Boolean.FALSE.equals(apply)) return inherited;
        return own != null ? own : inherited;
    }

    // ------------------------------------------------------------
    // build
    // ------------------------------------------------------------

    private Style build(Effective e) {
        Style.Builder b = Style.builder();
        applyFont(b, e.fontId());
        applyFill(b, e.fillId());
        applyBorder(b, e.borderId());
        applyAlignment(b, e.alignment());

        b.numFmtId(e.numFmtId());
        b.numberFormat(numberFormatCode(e.numFmtId()));

        RawProtection p = e.protection();
        if (p != null) {
            b.locked(p.locked());
            b.hidden(p.hidden());
        }
        return b.build();
    }

    private void applyFont(Style.Builder b, int fontId) {
        List<RawFont> fonts = styles.getFonts();
        RawFont def = fonts.isEmpty() ? RawFont.EMPTY : fonts.get(0);
        RawFont font = def;
        if (fontId >= 0 && fontId < fonts.size()) {
            font = fonts.get(fontId);
        } else if (fontId != 0 || !fonts.isEmpty()) {
            warn(ParseWarningCode.STYLE_COMPONENT_OUT_OF_RANGE, "fontId " + fontId + " (count=" + fonts.size() + ")");
        }

        String family = fontFamily(font);
        if (family == null) family = fontFamily(def);
        b.fontFamily(family);
        b.fontSize(font.size() != null ? font.size() : def.size());

        if (Boolean.TRUE.equals(font.bold())) b.bold(Boolean.TRUE);
        if (Boolean.TRUE.equals(font.italic())) b.italic(Boolean.TRUE);
        if (Boolean.TRUE.equals(font.strike())) b.strikethrough(Boolean.TRUE);

        String u = font.underline();
        if (u != null && !"none".equals(u)) {
            b.underline(Boolean.TRUE);
            b.underlineStyle(u);
        }

        String va = font.vertAlign();
        if ("superscript".equals(va) || "subscript".equals(va)) {
            b.vertAlign(va);
        }

        b.fontColor(colors.resolve(font.color()));
    }

    private String fontFamily(RawFont font) {
        if ("minor".equals(font.scheme())) return theme.getMinorFont();
        if ("major".equals(font.scheme())) return theme.getMajorFont();
        return font.name();
    }

    private void applyFill(Style.Builder b, int fillId) {
        List<RawFill> fills = styles.getFills();
        if (fillId < 0 || fillId >= fills.size()) {
            if (fillId != 0) {
                warn(ParseWarningCode.STYLE_COMPONENT_OUT_OF_RANGE, "fillId " + fillId + " (count=" + fills.size() + ")");
            }
            return;
        }
        RawFill fill = fills.get(fillId);

        if (fill.gradient() != null) {
            RawFill.RawGradient g = fill.gradient();
            List<GradientFill.Stop> stops = new ArrayList<>(g.stops().size());
            for (RawFill.RawGradientStop s : g.stops()) {
                stops.add(new GradientFill.Stop(s.position(), colors.resolve(s.color())));
            }
            b.gradient(new GradientFill(g.type(), g.degree(), stops));
            return;
        }

        String pattern = fill.patternType();
        if (pattern == null || "none".equals(pattern)) return;

        if ("solid".equals(pattern)) {
            String c = colors.resolve(fill.fgColor());
            if (c == null) c = colors.resolve(fill.bgColor());
            b.patternType(pattern);
            b.bgColor(c);
            return;
        }

        b.patternType(pattern);
        b.fgColor(colors.resolve(fill.fgColor()));
        b.bgColor(colors.resolve(fill.bgColor()));
    }

    private void applyBorder(Style.Builder b, int borderId) {
        List<RawBorder> borders = styles.getBorders();
        if (borderId < 0 || borderId >= borders.size()) {
            if (borderId != 0) {
                warn(ParseWarningCode.STYLE_COMPONENT_OUT_OF_RANGE, "borderId " + borderId + " (count=" + borders.size() + ")");
            }
            return;
        }
        RawBorder border = borders.get(borderId);
        b.borderLeft(side(border.left()));
        b.borderRight(side(border.right()));
        b.borderTop(side(border.top()));
        b.borderBottom(side(border.bottom()));

        BorderSide diagonal = side(border.diagonal());
        if (diagonal != null && (border.diagonalUp() || border.diagonalDown())) {
            b.borderDiagonal(diagonal);
            if (border.diagonalUp()) b.diagonalUp(Boolean.TRUE);
            if (border.diagonalDown()) b.diagonalDown(Boolean.TRUE);
        }
    }

    private BorderSide side(RawBorderSide raw) {
        if (raw == null || !raw.isVisible()) return null;
        String color = colors.resolve(raw.color());
        return new BorderSide(raw.style(), color == null ? "#000000" : color);
    }

    private static void applyAlignment(Style.Builder b, RawAlignment a) {
        if (a == null) return;
        if (a.horizontal() != null && !"general".equals(a.horizontal())) b.alignH(a.horizontal());
        if (a.vertical() != null) b.alignV(a.vertical());
        if (Boolean.TRUE.equals(a.wrapText())) b.wrap(Boolean.TRUE);
        if (Boolean.TRUE.equals(a.shrinkToFit())) b.shrinkToFit(Boolean.TRUE);
        if (a.indent() != null && a.indent() > 0) b.indent(a.indent());
        if (a.textRotation() != null && a.textRotation() != 0) b.rotation(a.textRotation());
        if (a.readingOrder() != null && a.readingOrder() != 0) b.readingOrder(a.readingOrder());
    }

    private DxfStyle resolveDxf(RawDxf dxf) {
        String fontColor = null;
        Boolean bold = null;
        Boolean italic = null;
        Boolean underline = null;
        Boolean strike = null;
        RawFont f = dxf.font();
        if (f != null) {
            fontColor = colors.resolve(f.color());
            bold = f.bold();
            italic = f.italic();
            strike = f.strike();
            if (f.underline() != null) underline = !"none".equals(f.underline());
        }

        String bg = null;
        RawFill fill = dxf.fill();
        if (fill != null && !"none".equals(fill.patternType())) {
            // dxf solid fills conventionally carry the color in bgColor
            bg = colors.resolve(fill.bgColor());
            if (bg == null) bg = colors.resolve(fill.fgColor());
        }

        BorderSide border = null;
        RawBorder rb = dxf.border();
        if (rb != null) {
            for (RawBorderSide s : new RawBorderSide[]{rb.left(), rb.right(), rb.top(), rb.bottom()}) {
                border = side(s);
                if (border != null) break;
            }
        }
        return new DxfStyle(fontColor, bg, bold, italic, underline, strike, border);
    }

    private void warn(ParseWarningCode code, String message) {
        log.debug("style fallback: {} {}", code, message);
        warnings.warn(ParseWarning.of(code, PART, message));
    }

    private record Effective(
            int numFmtId,
            int fontId,
            int fillId,
            int borderId,
            RawAlignment alignment,
            RawProtection protection
    ) {
    }
}
