package domain.edit;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Infers the cell type of edited text.
 *
 * <ul>
 *   <li>blank after trimming: clear the cell</li>
 *   <li>{@code true}/{@code false} in any case: boolean</li>
 *   <li>a finite decimal number ({@code 12}, {@code -3.5}, {@code 1e3}): number</li>
 *   <li>anything else: string</li>
 * </ul>
 */
public final class CellInputParser {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final int MAX_PLAIN_SCALE = 20;

    private CellInputParser() {
    }

    public static EditValue parse(String input) {
        if (input == null) return EditValue.CLEAR;
        String trimmed = input.trim();
        if (trimmed.isEmpty()) return EditValue.CLEAR;

        if ("true".equalsIgnoreCase(trimmed)) return new EditValue(EditValue.Kind.BOOLEAN, "TRUE");
        if ("false".equalsIgnoreCase(trimmed)) return new EditValue(EditValue.Kind.BOOLEAN, "FALSE");

        if (DECIMAL.matcher(trimmed).matches()) {
            double d = Double.parseDouble(trimmed);
            if (Double.isFinite(d)) return new EditValue(EditValue.Kind.NUMBER, canonical(d));
        }
        return new EditValue(EditValue.Kind.STRING, trimmed);
    }

    /** Shortest decimal text of the double; scientific notation outside a plain-width window. */
    static String canonical(double d) {
        BigDecimal bd = BigDecimal.valueOf(d).stripTrailingZeros();
        if (bd.signum() == 0) return "0";
        if (bd.scale() > MAX_PLAIN_SCALE || bd.scale() < -MAX_PLAIN_SCALE) return bd.toString();
        return bd.toPlainString();
    }
}
