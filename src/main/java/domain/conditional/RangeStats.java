package domain.conditional;

import domain.model.Cell;
import domain.model.CellData;
import domain.model.CellType;
import domain.model.Sheet;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates over every value covered by one rule group, computed in a single pass.
 */
final class RangeStats {

    private final double[] sorted;
    private final double sum;
    private final Map<String, Integer> occurrences;

    private RangeStats(double[] sorted, double sum, Map<String, Integer> occurrences) {
        this.sorted = sorted;
        this.sum = sum;
        this.occurrences = occurrences;
    }

    static RangeStats collect(Sheet sheet, ConditionalFormatting group) {
        double[] values = new double[16];
        int n = 0;
        double sum = 0;
        Map<String, Integer> occurrences = new HashMap<>();

        for (CellData d : sheet.getCells()) {
            if (!group.covers(d.getR(), d.getC())) continue;
            Cell cell = d.getCell();
            String key = valueKey(cell);
            if (key == null) continue;
            occurrences.merge(key, 1, Integer::sum);

            double v = cell.numericValue();
            if (Double.isNaN(v)) continue;
            if (n == values.length) values = Arrays.copyOf(values, n * 2);
            values[n++] = v;
            sum += v;
        }

        double[] sorted = Arrays.copyOf(values, n);
        Arrays.sort(sorted);
        return new RangeStats(sorted, sum, occurrences);
    }

    /**
     * Identity used by duplicate/unique rules: numbers by value, text case-insensitively.
     * Null for blank cells.
     */
    static String valueKey(Cell cell) {
        if (cell == null) return null;
        CellType t = cell.valueType();
        if (t == CellType.EMPTY) return null;
        String v = cell.getValue();
        if (v == null || v.isEmpty()) return null;
        if (t == CellType.NUMBER) {
            double d = cell.numericValue();
            return Double.isNaN(d) ? "s:" + v : "n:" + d;
        }
        return t.getTag() + ":" + v.toLowerCase(Locale.ROOT);
    }

    int count() {
        return sorted.length;
    }

    boolean isEmpty() {
        return sorted.length == 0;
    }

    double min() {
        return sorted[0];
    }

    double max() {
        return sorted[sorted.length - 1];
    }

    double average() {
        return sum / sorted.length;
    }

    /** Population standard deviation. */
    double stdDev() {
        double avg = average();
        double acc = 0;
        for (double v : sorted) {
            acc += (v - avg) * (v - avg);
        }
        return Math.sqrt(acc / sorted.length);
    }

    /** Inclusive percentile with linear interpolation, {@code p} in 0..100. */
    double percentile(double p) {
        double clamped = Math.max(0, Math.min(100, p));
        double pos = clamped / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    /** k-th largest (k from 1), clamped to the available values. */
    double largest(int k) {
        int idx = Math.max(0, sorted.length - Math.min(k, sorted.length));
        return sorted[idx];
    }

    /** k-th smallest (k from 1), clamped to the available values. */
    double smallest(int k) {
        int idx = Math.min(sorted.length, Math.max(k, 1)) - 1;
        return sorted[idx];
    }

    int occurrences(String key) {
        return occurrences.getOrDefault(key, 0);
    }
}
