package domain.conditional;

import domain.model.Cell;
import domain.model.CellType;
import domain.model.DxfStyle;
import domain.model.Sheet;
import domain.model.Workbook;
import domain.style.ColorResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates the conditional formats of a sheet for one cell.
 *
 * <p>Rules from every group covering the cell run in ascending priority. The first rule to
 * set a property owns it; a matching rule with {@code stopIfTrue} ends evaluation. Range
 * aggregates are computed once per rule group and reused until {@link #invalidate()}.</p>
 *
 * <p>Expression, time-period and unknown rules never fire: they need formula evaluation
 * or the current date.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class ConditionalFormatEvaluator {

    private final List<DxfStyle> dxfs;
    private final Map<ConditionalFormatting, RangeStats> statsCache = new IdentityHashMap<>();

    public ConditionalFormatEvaluator(List<DxfStyle> dxfs) {
        this.dxfs = dxfs == null ? List.of() : dxfs;
    }

    public static ConditionalFormatEvaluator forWorkbook(Workbook workbook) {
        return new ConditionalFormatEvaluator(workbook.getDxfStyles());
    }

    /** Drops memoized range aggregates, e.g. after cells were edited. */
    public void invalidate() {
        statsCache.clear();
    }

    public ConditionalFormatResult evaluate(Sheet sheet, int row, int col) {
        ConditionalFormatResult result = new ConditionalFormatResult();

        List<Candidate> candidates = new ArrayList<>();
        for (ConditionalFormatting group : sheet.getConditionalFormats()) {
            if (!group.covers(row, col)) continue;
            for (CfRule rule : group.getRules()) {
                candidates.add(new Candidate(group, rule));
            }
        }
        if (candidates.isEmpty()) return result;
        candidates.sort(Comparator.comparingInt(c -> c.rule().getPriority()));

        Cell cell = sheet.cellAt(row, col);
        for (Candidate c : candidates) {
            CfRule rule = c.rule();
            RangeStats stats = rule.getType().needsRangeStats() ? stats(sheet, c.group()) : null;
            if (!apply(rule, cell, stats, result)) continue;
            result.markApplied(rule.getPriority());
            if (rule.isStopIfTrue()) break;
        }
        return result;
    }

    private RangeStats stats(Sheet sheet, ConditionalFormatting group) {
        return statsCache.computeIfAbsent(group, g -> RangeStats.collect(sheet, g));
    }

    /** @return true when the rule matched the cell */
    private boolean apply(CfRule rule, Cell cell, RangeStats stats, ConditionalFormatResult out) {
        switch (rule.getType()) {
            case COLOR_SCALE:
                return applyColorScale(rule.getColorScale(), cell, stats, out);
            case DATA_BAR:
                return applyDataBar(rule.getDataBar(), cell, stats, out);
            case ICON_SET:
                return applyIconSet(rule.getIconSet(), cell, stats, out);
            default:
                break;
        }
        if (!matches(rule, cell, stats)) return false;
        applyDxf(rule.getDxfId(), out);
        return true;
    }

    boolean matches(CfRule rule, Cell cell, RangeStats stats) {
        return switch (rule.getType()) {
            case CELL_IS -> matchesCellIs(rule, cell);
            case TOP10 -> matchesTop10(rule, cell, stats);
            case ABOVE_AVERAGE -> matchesAverage(rule, cell, stats);
            case DUPLICATE_VALUES -> {
                String key = RangeStats.valueKey(cell);
                yield key != null && stats.occurrences(key) > 1;
            }
            case UNIQUE_VALUES -> {
                String key = RangeStats.valueKey(cell);
                yield key != null && stats.occurrences(key) == 1;
            }
            case CONTAINS_TEXT -> rule.getText() != null && lower(text(cell)).contains(lower(rule.getText()));
            case NOT_CONTAINS_TEXT -> rule.getText() != null && !lower(text(cell)).contains(lower(rule.getText()));
            case BEGINS_WITH -> rule.getText() != null && lower(text(cell)).startsWith(lower(rule.getText()));
            case ENDS_WITH -> rule.getText() != null && lower(text(cell)).endsWith(lower(rule.getText()));
            case CONTAINS_BLANKS -> isBlank(cell);
            case NOT_CONTAINS_BLANKS -> !isBlank(cell);
            case CONTAINS_ERRORS -> cell != null && cell.valueType() == CellType.ERROR;
            case NOT_CONTAINS_ERRORS -> cell == null || cell.valueType() != CellType.ERROR;
            default -> false;
        };
    }

    // ------------------------------------------------------------
    // dxf-based rules
    // ------------------------------------------------------------

    private boolean matchesCellIs(CfRule rule, Cell cell) {
        if (isBlank(cell) || rule.getOperator() == null || rule.getFormulas().isEmpty()) return false;
        Operand a = Operand.parse(rule.getFormulas().get(0));
        Operand b = rule.getFormulas().size() > 1 ? Operand.parse(rule.getFormulas().get(1)) : null;
        if (a == null) return false;

        Integer cmpA = compare(cell, a);
        switch (rule.getOperator()) {
            case "equal":
                return cmpA != null && cmpA == 0;
            case "notEqual":
                return cmpA == null || cmpA != 0;
            case "greaterThan":
                return cmpA != null && cmpA > 0;
            case "greaterThanOrEqual":
                return cmpA != null && cmpA >= 0;
            case "lessThan":
                return cmpA != null && cmpA < 0;
            case "lessThanOrEqual":
                return cmpA != null && cmpA <= 0;
            case "between":
            case "notBetween": {
                if (b == null) return false;
                Integer cmpB = compare(cell, b);
                if (cmpA == null || cmpB == null) return "notBetween".equals(rule.getOperator());
                // operands may be given high-to-low
                boolean inside = (cmpA >= 0 && cmpB <= 0) || (cmpA <= 0 && cmpB >= 0);
                return "between".equals(rule.getOperator()) == inside;
            }
            default:
                return false;
        }
    }

    /** Cell compared with operand, or null when the kinds differ. */
    private static Integer compare(Cell cell, Operand op) {
        if (op.number() != null) {
            double v = cell.numericValue();
            return Double.isNaN(v) ? null : Double.compare(v, op.number());
        }
        if (cell.valueType() == CellType.NUMBER) return null;
        return Integer.signum(lower(text(cell)).compareTo(lower(op.text())));
    }

    private static boolean matchesTop10(CfRule rule, Cell cell, RangeStats stats) {
        double v = cell == null ? Double.NaN : cell.numericValue();
        if (Double.isNaN(v) || stats.isEmpty()) return false;
        int rank = rule.getRank() == null ? 10 : rule.getRank();
        int k = rule.isPercent() ? Math.max(1, (int) Math.floor(stats.count() * rank / 100.0)) : rank;
        if (k <= 0) return false;
        return rule.isBottom() ? v <= stats.smallest(k) : v >= stats.largest(k);
    }

    private static boolean matchesAverage(CfRule rule, Cell cell, RangeStats stats) {
        double v = cell == null ? Double.NaN : cell.numericValue();
        if (Double.isNaN(v) || stats.isEmpty()) return false;
        double avg = stats.average();
        int sd = rule.getStdDev() == null ? 0 : rule.getStdDev();
        if (rule.isAboveAverage()) {
            double limit = avg + sd * stats.stdDev();
            return rule.isEqualAverage() ? v >= limit : v > limit;
        }
        double limit = avg - sd * stats.stdDev();
        return rule.isEqualAverage() ? v <= limit : v < limit;
    }

    private void applyDxf(Integer dxfId, ConditionalFormatResult out) {
        if (dxfId == null || dxfId < 0 || dxfId >= dxfs.size()) return;
        DxfStyle dxf = dxfs.get(dxfId);
        if (dxf.getBgColor() != null) out.applyBg(dxf.getBgColor());
        if (dxf.getFontColor() != null) out.applyFontColor(dxf.getFontColor());
        if (dxf.getBold() != null) out.applyBold(dxf.getBold());
        if (dxf.getItalic() != null) out.applyItalic(dxf.getItalic());
    }

    // ------------------------------------------------------------
    // range rules
    // ------------------------------------------------------------

    private static boolean applyColorScale(ColorScale scale, Cell cell, RangeStats stats, ConditionalFormatResult out) {
        double v = cell == null ? Double.NaN : cell.numericValue();
        if (scale == null || Double.isNaN(v) || stats.isEmpty()) return false;
        List<String> colors = scale.getColors();
        int n = Math.min(colors.size(), scale.getStops().size());
        if (n < 2) return false;

        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            Double resolved = threshold(scale.getStops().get(i), stats, false);
            if (resolved == null) {
                resolved = i == 0 ? stats.min() : i == n - 1 ? stats.max() : stats.percentile(50);
            }
            t[i] = resolved;
        }

        String color;
        if (v <= t[0]) {
            color = colors.get(0);
        } else if (v >= t[n - 1]) {
            color = colors.get(n - 1);
        } else {
            int seg = 0;
            while (seg < n - 2 && v > t[seg + 1]) seg++;
            double span = t[seg + 1] - t[seg];
            double frac = span <= 0 ? 0 : (v - t[seg]) / span;
            color = interpolate(colors.get(seg), colors.get(seg + 1), frac);
        }
        if (color == null) return false;
        out.applyBg(color);
        return true;
    }

    private static boolean applyDataBar(DataBar bar, Cell cell, RangeStats stats, ConditionalFormatResult out) {
        double v = cell == null ? Double.NaN : cell.numericValue();
        if (bar == null || Double.isNaN(v) || stats.isEmpty()) return false;

        Double lo = threshold(bar.getMin(), stats, true);
        Double hi = threshold(bar.getMax(), stats, true);
        double min = lo == null ? Math.min(0, stats.min()) : lo;
        double max = hi == null ? Math.max(0, stats.max()) : hi;
        boolean negative = v < 0;
        String color = negative && bar.getNegativeFillColor() != null ? bar.getNegativeFillColor() : bar.getColor();

        boolean hasAxis = min < 0 && max > 0 && !"none".equals(bar.getAxisPosition());
        double percent;
        Double axis = null;
        if (hasAxis) {
            axis = "middle".equals(bar.getAxisPosition()) ? 50.0 : (-min) / (max - min) * 100.0;
            percent = negative ? clamp(v / min) * axis : clamp(v / max) * (100.0 - axis);
        } else {
            double pos = max > min ? clamp((v - min) / (max - min)) : 0.5;
            percent = bar.getMinLength() + pos * (bar.getMaxLength() - bar.getMinLength());
        }
        out.applyDataBar(new ConditionalFormatResult.Bar(percent, color, negative, axis));
        return true;
    }

    private static boolean applyIconSet(IconSet set, Cell cell, RangeStats stats, ConditionalFormatResult out) {
        double v = cell == null ? Double.NaN : cell.numericValue();
        if (set == null || Double.isNaN(v) || stats.isEmpty()) return false;

        int count = set.iconCount();
        List<CfValueObject> cfvos = set.getThresholds();
        int index = 0;
        for (int i = Math.min(count, cfvos.size()) - 1; i >= 1; i--) {
            CfValueObject cfvo = cfvos.get(i);
            Double t = threshold(cfvo, stats, false);
            if (t == null) {
                t = stats.min() + (stats.max() - stats.min()) * i / count;
            }
            if (cfvo.isGte() ? v >= t : v > t) {
                index = i;
                break;
            }
        }
        if (cfvos.isEmpty()) {
            double span = stats.max() - stats.min();
            double pos = span <= 0 ? 0.5 : (v - stats.min()) / span;
            index = Math.min(count - 1, (int) Math.floor(pos * count));
        }
        if (set.isReverse()) index = count - 1 - index;
        out.applyIcon(new ConditionalFormatResult.Icon(set.getName(), index));
        return true;
    }

    /**
     * Numeric threshold for a cfvo over the range, or null when it cannot be resolved
     * (formula references, unparseable values).
     */
    static Double threshold(CfValueObject cfvo, RangeStats stats, boolean zeroAnchored) {
        if (cfvo == null) return null;
        return switch (cfvo.getType()) {
            case MIN -> stats.min();
            case MAX -> stats.max();
            case AUTO_MIN -> zeroAnchored ? Math.min(0, stats.min()) : stats.min();
            case AUTO_MAX -> zeroAnchored ? Math.max(0, stats.max()) : stats.max();
            case PERCENT -> {
                Double p = parseNumber(cfvo.getValue());
                yield p == null ? null : stats.min() + (stats.max() - stats.min()) * p / 100.0;
            }
            case PERCENTILE -> {
                Double p = parseNumber(cfvo.getValue());
                yield p == null ? null : stats.percentile(p);
            }
            case NUM, FORMULA -> parseNumber(cfvo.getValue());
        };
    }

    static String interpolate(String from, String to, double frac) {
        String a = ColorResolver.normalizeRgb(from);
        String b = ColorResolver.normalizeRgb(to);
        if (a == null || b == null) return a != null ? a : b;
        int[] ca = rgb(a);
        int[] cb = rgb(b);
        double f = clamp(frac);
        return String.format("#%02X%02X%02X",
                lerp(ca[0], cb[0], f), lerp(ca[1], cb[1], f), lerp(ca[2], cb[2], f));
    }

    private static int[] rgb(String hex) {
        return new int[]{
                Integer.parseInt(hex.substring(1, 3), 16),
                Integer.parseInt(hex.substring(3, 5), 16),
                Integer.parseInt(hex.substring(5, 7), 16)
        };
    }

    private static int lerp(int a, int b, double t) {
        return (int) Math.max(0, Math.min(255, Math.round(a + (b - a) * t)));
    }

    private static double clamp(double d) {
        return Math.max(0.0, Math.min(1.0, d));
    }

    private static Double parseNumber(String raw) {
        if (raw == null) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(Cell cell) {
        return cell == null
                || cell.valueType() == CellType.EMPTY
                || cell.getValue() == null
                || cell.getValue().trim().isEmpty();
    }

    private static String text(Cell cell) {
        return cell == null || cell.getValue() == null ? "" : cell.getValue();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private record Candidate(ConditionalFormatting group, CfRule rule) {
    }

    /** cellIs operand: a number or a quoted string literal. */
    private record Operand(Double number, String text) {

        static Operand parse(String formula) {
            if (formula == null) return null;
            String f = formula.trim();
            if (f.length() >= 2 && f.startsWith("\"") && f.endsWith("\"")) {
                return new Operand(null, f.substring(1, f.length() - 1).replace("\"\"", "\""));
            }
            Double n = parseNumber(f);
            return n == null ? null : new Operand(n, null);
        }
    }
}
