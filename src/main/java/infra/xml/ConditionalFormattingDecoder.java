package infra.xml;

import domain.conditional.CfRule;
import domain.conditional.CfRuleType;
import domain.conditional.CfValueObject;
import domain.conditional.ColorScale;
import domain.conditional.ConditionalFormatting;
import domain.conditional.DataBar;
import domain.conditional.IconSet;
import domain.model.ParseWarning;
import domain.model.ParseWarningCode;
import domain.model.ParseWarningSink;
import domain.model.RangeRef;
import domain.model.XlsxException;
import domain.style.ColorResolver;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code <conditionalFormatting>} blocks of a worksheet, plus the {@code x14} data bar
 * extension that carries negative-value and axis settings.
 */
class ConditionalFormattingDecoder {

    private final ColorResolver colors;
    private final ParseWarningSink warnings;
    private final String partPath;

    /** x14 rule id to the base data bar it extends. */
    private final Map<String, DataBar> extensible = new HashMap<>();

    ConditionalFormattingDecoder(ColorResolver colors, ParseWarningSink warnings, String partPath) {
        this.colors = colors;
        this.warnings = warnings;
        this.partPath = partPath;
    }

    List<ConditionalFormatting> decode(Element worksheet) {
        List<ConditionalFormatting> out = new ArrayList<>();
        int ordinal = 0;
        for (Element cf : XmlDom.children(worksheet, "conditionalFormatting")) {
            String sqref = XmlDom.attr(cf, "sqref");
            List<RangeRef> ranges = ranges(sqref);
            if (ranges.isEmpty()) continue;

            ConditionalFormatting group = new ConditionalFormatting(sqref, ranges);
            for (Element r : XmlDom.children(cf, "cfRule")) {
                group.addRule(rule(r, ++ordinal));
            }
            out.add(group);
        }

        for (Element ext : XmlDom.descendants(worksheet, "conditionalFormattings")) {
            for (Element x14Rule : XmlDom.descendants(ext, "cfRule")) {
                applyExtension(x14Rule);
            }
        }
        return out;
    }

    private List<RangeRef> ranges(String sqref) {
        if (sqref == null || sqref.isBlank()) return List.of();
        try {
            return RangeRef.parseList(sqref);
        } catch (XlsxException e) {
            warnings.warn(ParseWarning.of(ParseWarningCode.RANGE_SKIPPED, partPath,
                    "conditionalFormatting sqref=" + sqref));
            return List.of();
        }
    }

    private CfRule rule(Element el, int ordinal) {
        CfRuleType type = CfRuleType.fromXml(XmlDom.attr(el, "type"));
        CfRule rule = new CfRule(type, XmlDom.integer(el, "priority", ordinal));
        rule.setStopIfTrue(XmlDom.bool(el, "stopIfTrue", false));
        rule.setDxfId(XmlDom.integer(el, "dxfId"));
        rule.setOperator(XmlDom.attr(el, "operator"));
        rule.setText(XmlDom.attr(el, "text"));
        rule.setRank(XmlDom.integer(el, "rank"));
        rule.setPercent(XmlDom.bool(el, "percent", false));
        rule.setBottom(XmlDom.bool(el, "bottom", false));
        rule.setAboveAverage(XmlDom.bool(el, "aboveAverage", true));
        rule.setEqualAverage(XmlDom.bool(el, "equalAverage", false));
        rule.setStdDev(XmlDom.integer(el, "stdDev"));
        rule.setTimePeriod(XmlDom.attr(el, "timePeriod"));
        for (Element f : XmlDom.children(el, "formula")) {
            rule.addFormula(f.getTextContent());
        }

        Element scale = XmlDom.child(el, "colorScale");
        if (scale != null) rule.setColorScale(colorScale(scale));

        Element bar = XmlDom.child(el, "dataBar");
        if (bar != null) {
            DataBar dataBar = dataBar(bar);
            rule.setDataBar(dataBar);
            for (Element id : XmlDom.descendants(el, "id")) {
                extensible.put(id.getTextContent().trim(), dataBar);
            }
        }

        Element icons = XmlDom.child(el, "iconSet");
        if (icons != null) rule.setIconSet(iconSet(icons));
        return rule;
    }

    private ColorScale colorScale(Element el) {
        List<CfValueObject> stops = new ArrayList<>();
        for (Element c : XmlDom.children(el, "cfvo")) {
            stops.add(cfvo(c));
        }
        List<String> cs = new ArrayList<>();
        for (Element c : XmlDom.children(el, "color")) {
            String resolved = colors.resolve(XmlDom.color(c));
            cs.add(resolved == null ? "#FFFFFF" : resolved);
        }
        return new ColorScale(stops, cs);
    }

    private DataBar dataBar(Element el) {
        List<Element> cfvos = XmlDom.children(el, "cfvo");
        CfValueObject min = cfvos.size() > 0 ? cfvo(cfvos.get(0)) : new CfValueObject(CfValueObject.Type.MIN, null, true);
        CfValueObject max = cfvos.size() > 1 ? cfvo(cfvos.get(1)) : new CfValueObject(CfValueObject.Type.MAX, null, true);
        return new DataBar(min, max,
                colors.resolve(XmlDom.color(XmlDom.child(el, "color"))),
                XmlDom.bool(el, "showValue", true),
                XmlDom.integer(el, "minLength", 10),
                XmlDom.integer(el, "maxLength", 90));
    }

    private IconSet iconSet(Element el) {
        List<CfValueObject> thresholds = new ArrayList<>();
        for (Element c : XmlDom.children(el, "cfvo")) {
            thresholds.add(cfvo(c));
        }
        return new IconSet(
                XmlDom.attr(el, "iconSet"),
                thresholds,
                XmlDom.bool(el, "showValue", true),
                XmlDom.bool(el, "reverse", false));
    }

    /** {@code val} attribute, or an {@code xm:f} child in the x14 form. */
    private static CfValueObject cfvo(Element el) {
        String val = XmlDom.attr(el, "val");
        if (val == null) val = XmlDom.childText(el, "f");
        return new CfValueObject(
                CfValueObject.Type.fromXml(XmlDom.attr(el, "type")),
                val,
                XmlDom.bool(el, "gte", true));
    }

    private void applyExtension(Element x14Rule) {
        DataBar base = extensible.get(nullToEmpty(XmlDom.attr(x14Rule, "id")).trim());
        Element bar = XmlDom.child(x14Rule, "dataBar");
        if (base == null || bar == null) return;

        Element negative = XmlDom.child(bar, "negativeFillColor");
        if (negative != null) base.setNegativeFillColor(colors.resolve(XmlDom.color(negative)));
        Element axis = XmlDom.child(bar, "axisColor");
        if (axis != null) base.setAxisColor(colors.resolve(XmlDom.color(axis)));
        String position = XmlDom.attr(bar, "axisPosition");
        base.setAxisPosition(position == null ? "automatic" : position);
        base.setGradient(XmlDom.bool(bar, "gradient", true));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
