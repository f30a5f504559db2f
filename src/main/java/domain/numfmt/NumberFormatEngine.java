package domain.numfmt;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Formats numeric cell values through Excel number format codes.
 *
 * <p>Compiled codes are cached per instance; create one engine per parse or edit session.
 * Negative serials and serials past 9999-12-31 under a date code fall back to General.</p>
 */
public final class NumberFormatEngine {

    private final Map<String, CompiledFormat> cache = new HashMap<>();

    /**
     * @param date1904 workbook date system flag
     */
    public String format(double value, String formatCode, boolean date1904) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return formatGeneral(value);
        String code = formatCode == null ? "General" : formatCode.trim();
        if (code.isEmpty() || code.equalsIgnoreCase("General") || code.equals("@")) {
            return formatGeneral(value);
        }
        CompiledFormat compiled = cache.computeIfAbsent(code, CompiledFormat::compile);
        return compiled.format(value, date1904);
    }

    /** One-shot formatting in the 1900 date system. */
    public static String formatNumber(double value, String formatCode) {
        return new NumberFormatEngine().format(value, formatCode, false);
    }

    /**
     * True iff the code has date/time placeholders outside quoted literals, escapes and
     * bracketed color/locale tags. Elapsed-time tags ({@code [h]}, {@code [mm]}, {@code [ss]})
     * count as time placeholders.
     */
    public static boolean isDateFormat(String formatCode) {
        if (formatCode == null) return false;
        String lower = formatCode.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        boolean elapsed = false;
        int n = lower.length();
        int i = 0;
        while (i < n) {
            char c = lower.charAt(i);
            if (c == '"') {
                int end = lower.indexOf('"', i + 1);
                i = end < 0 ? n : end + 1;
            } else if (c == '\\' || c == '_' || c == '*') {
                i += 2;
            } else if (c == '[') {
                int end = lower.indexOf(']', i);
                String inner = lower.substring(i + 1, end < 0 ? n : end);
                if (inner.matches("h+|m+|s+")) elapsed = true;
                i = end < 0 ? n : end + 1;
            } else {
                sb.append(c);
                i++;
            }
        }
        if (elapsed) return true;

        String s = sb.toString();
        if (s.contains("general")) {
            s = s.replace("general", "");
        }
        if (s.indexOf('y') >= 0 || s.indexOf('d') >= 0 || s.indexOf('h') >= 0) return true;
        if (s.indexOf('m') >= 0 && s.indexOf('#') < 0) return true;
        return s.indexOf('s') >= 0 && s.indexOf(':') >= 0;
    }

    /**
     * General display: integers below 1e11 as integers, very large or very small magnitudes in
     * scientific notation, otherwise up to 10 decimals with trailing zeros trimmed.
     */
    public static String formatGeneral(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return Double.toString(value);
        double abs = Math.abs(value);
        if (value == Math.rint(value) && abs < 1e11) {
            return Long.toString((long) value);
        }
        if (abs >= 1e11 || (abs < 1e-4 && value != 0.0)) {
            int exponent = (int) Math.floor(Math.log10(abs));
            BigDecimal mantissa = new BigDecimal(Double.toString(abs / Math.pow(10, exponent)))
                    .setScale(5, RoundingMode.HALF_UP);
            if (mantissa.compareTo(BigDecimal.TEN) >= 0) {
                exponent++;
                mantissa = new BigDecimal(Double.toString(abs / Math.pow(10, exponent)))
                        .setScale(5, RoundingMode.HALF_UP);
            }
            String m = mantissa.stripTrailingZeros().toPlainString();
            String exp = Integer.toString(Math.abs(exponent));
            if (exp.length() < 2) exp = "0" + exp;
            return (value < 0 ? "-" : "") + m + "E" + (exponent < 0 ? "-" : "+") + exp;
        }
        BigDecimal bd = new BigDecimal(Double.toString(value)).setScale(10, RoundingMode.HALF_UP).stripTrailingZeros();
        String s = bd.toPlainString();
        return s.equals("-0") ? "0" : s;
    }

    /** True when the code's first section renders dates or times. */
    public boolean isDateCode(String formatCode) {
        if (formatCode == null) return false;
        String code = formatCode.trim();
        if (code.isEmpty() || code.equalsIgnoreCase("General")) return false;
        return cache.computeIfAbsent(code, CompiledFormat::compile).isDate();
    }
}
