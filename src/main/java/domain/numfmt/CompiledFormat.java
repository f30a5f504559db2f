package domain.numfmt;

import java.util.ArrayList;
import java.util.List;

/**
 * A format code split into sections: positive;negative;zero;text, or conditional sections.
 */
final class CompiledFormat {

    private final List<FormatSection> sections;
    private final boolean conditional;
    private final boolean date;

    private CompiledFormat(List<FormatSection> sections) {
        this.sections = sections;
        boolean cond = false;
        for (FormatSection s : sections) {
            if (s.hasCondition()) cond = true;
        }
        this.conditional = cond;
        this.date = !sections.isEmpty() && sections.get(0).kind() == FormatSection.Kind.DATE;
    }

    static CompiledFormat compile(String code) {
        List<FormatSection> out = new ArrayList<>(4);
        for (String part : splitSections(code)) {
            out.add(FormatSection.compile(part));
        }
        if (out.isEmpty()) out.add(FormatSection.compile("General"));
        return new CompiledFormat(out);
    }

    boolean isDate() {
        return date;
    }

    String format(double value, boolean date1904) {
        FormatSection chosen;
        boolean signed;

        if (conditional) {
            chosen = null;
            for (int i = 0; i < Math.min(2, sections.size()); i++) {
                FormatSection s = sections.get(i);
                if (s.hasCondition() && s.conditionMatches(value)) {
                    chosen = s;
                    break;
                }
            }
            if (chosen == null) {
                chosen = sections.size() > 2 ? sections.get(2) : sections.get(sections.size() - 1);
            }
            signed = true;
        } else if (sections.size() == 1 || value > 0 || (value == 0 && sections.size() < 3)) {
            chosen = sections.get(0);
            signed = true;
        } else if (value < 0) {
            chosen = sections.get(1);
            signed = false;
        } else {
            chosen = sections.get(2);
            signed = true;
        }

        String text = chosen.render(value, signed, date1904);
        return text != null ? text : NumberFormatEngine.formatGeneral(value);
    }

    /** Splits on ';' outside quotes, escapes and brackets. */
    static List<String> splitSections(String code) {
        List<String> parts = new ArrayList<>(4);
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean bracket = false;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '\\' && !quoted && i + 1 < code.length()) {
                cur.append(c).append(code.charAt(++i));
                continue;
            }
            if (c == '"') quoted = !quoted;
            else if (c == '[' && !quoted) bracket = true;
            else if (c == ']' && !quoted) bracket = false;

            if (c == ';' && !quoted && !bracket) {
                parts.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        parts.add(cur.toString());
        return parts;
    }
}
