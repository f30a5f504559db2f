package domain.numfmt;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * One {@code ;}-separated section of a format code, compiled once.
 */
final class FormatSection {

    enum Kind { GENERAL, DATE, SCIENTIFIC, FRACTION, NUMBER, LITERAL }

    private final Kind kind;
    private final String code;
    private final String condOp;
    private final double condValue;

    // NUMBER / LITERAL
    private String prefix = "";
    private String suffix = "";
    private int intZeros;
    private int fracMin;
    private int fracMax;
    private boolean decimalPoint;
    private boolean thousands;
    private int percentCount;
    private int scaleCount;

    // DATE
    private DateFormatPattern datePattern;

    private FormatSection(Kind kind, String code, String condOp, double condValue) {
        this.kind = kind;
        this.code = code;
        this.condOp = condOp;
        this.condValue = condValue;
    }

    static FormatSection compile(String raw) {
        String section = raw;
        String op = null;
        double opValue = 0;

        // leading [condition]; colors and locale tags are handled by the renderers
        int k = 0;
        while (k < section.length() && section.charAt(k) == '[') {
            int end = section.indexOf(']', k);
            if (end < 0) break;
            String inner = section.substring(k + 1, end).trim();
            if (!inner.isEmpty() && "<>=".indexOf(inner.charAt(0)) >= 0) {
                int split = 1;
                while (split < inner.length() && "<>=".indexOf(inner.charAt(split)) >= 0) split++;
                try {
                    opValue = Double.parseDouble(inner.substring(split).trim());
                    op = inner.substring(0, split);
                } catch (NumberFormatException ignore) {
                    op = null;
                }
            }
            k = end + 1;
        }

        String cleaned = stripLiterals(section).toLowerCase(Locale.ROOT).trim();
        Kind kind;
        if (section.isEmpty()) {
            kind = Kind.LITERAL;
        } else if (cleaned.equals("general") || cleaned.equals("@")) {
            kind = Kind.GENERAL;
        } else if (hasPlaceholder(cleaned) && (cleaned.contains("e+") || cleaned.contains("e-"))) {
            kind = Kind.SCIENTIFIC;
        } else if (isFraction(cleaned)) {
            kind = Kind.FRACTION;
        } else if (NumberFormatEngine.isDateFormat(section)) {
            kind = Kind.DATE;
        } else if (cleaned.contains("general")) {
            kind = Kind.GENERAL;
        } else if (hasPlaceholder(cleaned)) {
            kind = Kind.NUMBER;
        } else {
            kind = Kind.LITERAL;
        }

        FormatSection fs = new FormatSection(kind, section, op, opValue);
        if (kind == Kind.DATE) {
            fs.datePattern = DateFormatPattern.compile(section);
        } else if (kind == Kind.NUMBER || kind == Kind.LITERAL) {
            fs.compileNumeric(section);
        }
        return fs;
    }

    Kind kind() {
        return kind;
    }

    boolean hasCondition() {
        return condOp != null;
    }

    boolean conditionMatches(double v) {
        if (condOp == null) return false;
        return switch (condOp) {
            case "<" -> v < condValue;
            case "<=", "=<" -> v <= condValue;
            case ">" -> v > condValue;
            case ">=", "=>" -> v >= condValue;
            case "=" -> v == condValue;
            case "<>" -> v != condValue;
            default -> false;
        };
    }

    /**
     * @param signed when true a negative value gets a leading minus; otherwise the section's
     *               literals carry the sign (e.g. parentheses) and {@code value} is made absolute
     * @return text, or null when a date section cannot represent the value
     */
    String render(double value, boolean signed, boolean date1904) {
        double v = signed ? value : Math.abs(value);
        return switch (kind) {
            case GENERAL -> NumberFormatEngine.formatGeneral(v);
            case DATE -> datePattern.render(v, date1904);
            case SCIENTIFIC -> formatScientific(v);
            case FRACTION -> formatFraction(v);
            case NUMBER -> formatNumber(v);
            case LITERAL -> prefix + suffix;
        };
    }

    // ------------------------------------------------------------
    // numeric
    // ------------------------------------------------------------

    private void compileNumeric(String section) {
        StringBuilder pre = new StringBuilder();
        StringBuilder post = new StringBuilder();
        boolean seenPlaceholder = false;
        boolean afterPoint = false;
        int pendingCommas = 0;
        int n = section.length();
        int i = 0;

        while (i < n) {
            char c = section.charAt(i);
            StringBuilder lit = seenPlaceholder ? post : pre;

            if (c == '"') {
                int end = section.indexOf('"', i + 1);
                if (end < 0) end = n;
                scaleCount += pendingCommas;
                pendingCommas = 0;
                lit.append(section, i + 1, end);
                i = end + 1;
                continue;
            }
            if (c == '\\') {
                if (i + 1 < n) lit.append(section.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '_' || c == '*') {
                i += 2;
                continue;
            }
            if (c == '[') {
                int end = section.indexOf(']', i);
                if (end < 0) end = n - 1;
                String inner = section.substring(i + 1, end);
                if (inner.startsWith("$")) {
                    int dash = inner.indexOf('-');
                    lit.append(dash < 0 ? inner.substring(1) : inner.substring(1, dash));
                }
                i = end + 1;
                continue;
            }
            if (c == '0' || c == '#' || c == '?') {
                if (pendingCommas > 0 && !afterPoint) thousands = true;
                pendingCommas = 0;
                if (post.length() > 0) {
                    // literal between placeholders (e.g. 000-00-0000): kept out of the number
                    post.setLength(0);
                }
                seenPlaceholder = true;
                if (afterPoint) {
                    fracMax++;
                    if (c == '0') fracMin++;
                } else if (c == '0') {
                    intZeros++;
                }
                i++;
                continue;
            }
            if (c == '.' && (seenPlaceholder || nextIsPlaceholder(section, i + 1)) && !afterPoint) {
                afterPoint = true;
                decimalPoint = true;
                seenPlaceholder = true;
                i++;
                continue;
            }
            if (c == ',' && seenPlaceholder) {
                pendingCommas++;
                i++;
                continue;
            }
            if (c == '%') {
                percentCount++;
            }
            if (c == '@') {
                i++;
                continue;
            }
            // commas right after the last placeholder scale even when a literal follows
            scaleCount += pendingCommas;
            pendingCommas = 0;
            lit.append(c);
            i++;
        }
        // trailing commas scale by 1000 each
        scaleCount += pendingCommas;
        prefix = pre.toString();
        suffix = post.toString();
    }

    private static boolean nextIsPlaceholder(String s, int i) {
        return i < s.length() && "0#?".indexOf(s.charAt(i)) >= 0;
    }

    private String formatNumber(double value) {
        boolean negative = value < 0;
        double v = Math.abs(value);
        for (int p = 0; p < percentCount; p++) v *= 100.0;
        for (int p = 0; p < scaleCount; p++) v /= 1000.0;

        BigDecimal bd = new BigDecimal(Double.toString(v)).setScale(fracMax, RoundingMode.HALF_UP);
        String plain = bd.toPlainString();
        int dot = plain.indexOf('.');
        String intPart = dot < 0 ? plain : plain.substring(0, dot);
        String fracPart = dot < 0 ? "" : plain.substring(dot + 1);

        intPart = stripLeadingZeros(intPart);
        StringBuilder ib = new StringBuilder(intPart);
        while (ib.length() < intZeros) ib.insert(0, '0');
        String ints = thousands ? group(ib.toString()) : ib.toString();

        int keep = fracPart.length();
        while (keep > fracMin && fracPart.charAt(keep - 1) == '0') keep--;
        String fracs = fracPart.substring(0, keep);

        StringBuilder out = new StringBuilder();
        if (negative && bd.signum() != 0) out.append('-');
        out.append(prefix).append(ints);
        if (decimalPoint) out.append('.').append(fracs);
        out.append(suffix);
        return out.toString();
    }

    private static String stripLeadingZeros(String s) {
        int k = 0;
        while (k < s.length() && s.charAt(k) == '0') k++;
        return s.substring(k);
    }

    static String group(String digits) {
        if (digits.length() <= 3) return digits;
        StringBuilder sb = new StringBuilder(digits.length() + digits.length() / 3);
        int first = digits.length() % 3;
        if (first == 0) first = 3;
        sb.append(digits, 0, first);
        for (int k = first; k < digits.length(); k += 3) {
            sb.append(',').append(digits, k, k + 3);
        }
        return sb.toString();
    }

    // ------------------------------------------------------------
    // scientific
    // ------------------------------------------------------------

    private String formatScientific(double value) {
        String upper = stripLiterals(code).toUpperCase(Locale.ROOT);
        boolean alwaysSign = upper.contains("E+");
        int e = upper.indexOf('E');
        String mantissaPart = upper.substring(0, e);
        String exponentPart = upper.substring(e + 1);

        int decimals = 0;
        int dot = mantissaPart.indexOf('.');
        if (dot >= 0) {
            for (int k = dot; k < mantissaPart.length(); k++) {
                char c = mantissaPart.charAt(k);
                if (c == '0' || c == '#' || c == '?') decimals++;
            }
        }
        int expWidth = 0;
        for (int k = 0; k < exponentPart.length(); k++) {
            char c = exponentPart.charAt(k);
            if (c == '0' || c == '#') expWidth++;
        }
        expWidth = Math.max(expWidth, 2);

        if (value == 0.0) {
            String mant = decimals > 0 ? "0." + "0".repeat(decimals) : "0";
            return mant + "E" + (alwaysSign ? "+" : "") + "0".repeat(expWidth);
        }

        boolean negative = value < 0;
        double abs = Math.abs(value);
        int exponent = (int) Math.floor(Math.log10(abs));
        BigDecimal mantissa = new BigDecimal(Double.toString(abs / Math.pow(10, exponent)))
                .setScale(decimals, RoundingMode.HALF_UP);
        if (mantissa.compareTo(BigDecimal.TEN) >= 0) {
            exponent++;
            mantissa = new BigDecimal(Double.toString(abs / Math.pow(10, exponent)))
                    .setScale(decimals, RoundingMode.HALF_UP);
        }

        String sign = exponent < 0 ? "-" : (alwaysSign ? "+" : "");
        String exp = Integer.toString(Math.abs(exponent));
        String padded = "0".repeat(Math.max(0, expWidth - exp.length())) + exp;
        return (negative ? "-" : "") + mantissa.toPlainString() + "E" + sign + padded;
    }

    // ------------------------------------------------------------
    // fraction
    // ------------------------------------------------------------

    private String formatFraction(double value) {
        String cleaned = stripLiterals(code).trim();
        int slash = cleaned.indexOf('/');
        String numPart = cleaned.substring(0, slash);
        String denPart = cleaned.substring(slash + 1).trim();

        Integer fixed = null;
        String denDigits = denPart.replaceAll("[^0-9]", "");
        if (!denDigits.isEmpty() && denPart.replaceAll("[0-9]", "").isBlank()) {
            int d = Integer.parseInt(denDigits);
            if (d > 0) fixed = d;
        }
        int qmarks = (int) denPart.chars().filter(ch -> ch == '?' || ch == '#').count();
        int maxDenom = switch (Math.max(1, qmarks)) {
            case 1 -> 9;
            case 2 -> 99;
            case 3 -> 999;
            default -> 9999;
        };

        String trimmedNum = numPart.trim();
        int space = trimmedNum.lastIndexOf(' ');
        boolean mixed = space > 0 && hasPlaceholder(trimmedNum.substring(0, space));

        boolean negative = value < 0;
        double abs = Math.abs(value);
        long whole = mixed ? (long) Math.floor(abs) : 0L;
        double frac = abs - whole;

        long num;
        long den;
        if (fixed != null) {
            den = fixed;
            num = Math.round(frac * den);
        } else {
            long[] best = approximate(frac, maxDenom);
            num = best[0];
            den = best[1];
        }
        if (mixed && num == den) {
            whole++;
            num = 0;
        }

        int denWidth = fixed != null ? denDigits.length() : Math.max(1, qmarks);
        String numPlaceholders = space > 0 ? trimmedNum.substring(space + 1) : trimmedNum;
        int numWidth = fixed != null ? denWidth
                : Math.max(1, (int) numPlaceholders.chars().filter(ch -> ch == '?' || ch == '#' || ch == '0').count());

        String sign = negative ? "-" : "";
        if (num == 0) {
            return whole == 0 ? "0" : sign + whole;
        }
        String numStr = padLeft(Long.toString(num), numWidth);
        String denStr = padRight(Long.toString(den), denWidth);
        if (whole == 0) {
            return sign + numStr + "/" + denStr;
        }
        return sign + whole + " " + numStr + "/" + denStr;
    }

    /** Best rational approximation of x in [0,1) with denominator ≤ maxDenom. */
    static long[] approximate(double x, int maxDenom) {
        long bestNum = 0;
        long bestDen = 1;
        double bestErr = Math.abs(x);
        for (int d = 1; d <= maxDenom; d++) {
            long nm = Math.round(x * d);
            double err = Math.abs(x - (double) nm / d);
            if (err < bestErr - 1e-12) {
                bestErr = err;
                bestNum = nm;
                bestDen = d;
                if (err == 0.0) break;
            }
        }
        return new long[]{bestNum, bestDen};
    }

    private static String padLeft(String s, int width) {
        return s.length() >= width ? s : " ".repeat(width - s.length()) + s;
    }

    private static String padRight(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }

    // ------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------

    /** Removes quoted text, escaped characters, _x / *x fillers and [..] tags. */
    static String stripLiterals(String code) {
        StringBuilder sb = new StringBuilder(code.length());
        int n = code.length();
        int i = 0;
        while (i < n) {
            char c = code.charAt(i);
            if (c == '"') {
                int end = code.indexOf('"', i + 1);
                i = end < 0 ? n : end + 1;
            } else if (c == '\\' || c == '_' || c == '*') {
                i += 2;
            } else if (c == '[') {
                int end = code.indexOf(']', i);
                i = end < 0 ? n : end + 1;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static boolean hasPlaceholder(String s) {
        for (int k = 0; k < s.length(); k++) {
            char c = s.charAt(k);
            if (c == '0' || c == '#' || c == '?') return true;
        }
        return false;
    }

    private static boolean isFraction(String cleaned) {
        int slash = cleaned.indexOf('/');
        if (slash <= 0 || slash == cleaned.length() - 1) return false;
        String before = cleaned.substring(0, slash);
        String after = cleaned.substring(slash + 1).trim();
        if (!before.contains("?") && !before.contains("#") && !before.contains("0")) return false;
        return after.contains("?") || (!after.isEmpty() && after.chars().allMatch(Character::isDigit));
    }
}
