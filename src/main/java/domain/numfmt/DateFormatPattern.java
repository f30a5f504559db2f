package domain.numfmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compiled date/time section of a number format code.
 *
 * <p>An {@code m} run means minutes when it follows an hour token or is followed by a
 * seconds token, months otherwise.</p>
 */
final class DateFormatPattern {

    enum Kind {
        YEAR2, YEAR4,
        MONTH1, MONTH2, MONTH_ABBR, MONTH_FULL, MONTH_LETTER,
        DAY1, DAY2, WEEKDAY_ABBR, WEEKDAY_FULL,
        HOUR1, HOUR2,
        MINUTE1, MINUTE2,
        SECOND1, SECOND2,
        FRACTION,
        AM_PM, A_P,
        ELAPSED_HOURS, ELAPSED_MINUTES, ELAPSED_SECONDS,
        LITERAL
    }

    record Token(Kind kind, String text, int width) {
        static Token of(Kind kind) {
            return new Token(kind, "", 0);
        }

        static Token literal(String text) {
            return new Token(Kind.LITERAL, text, 0);
        }
    }

    private static final String[] MONTH_FULL = {
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"};
    private static final String[] WEEKDAY_FULL = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"};

    private final List<Token> tokens;
    private final boolean twelveHour;
    private final boolean hasFraction;

    private DateFormatPattern(List<Token> tokens) {
        this.tokens = tokens;
        boolean ampm = false;
        boolean frac = false;
        for (Token t : tokens) {
            if (t.kind() == Kind.AM_PM || t.kind() == Kind.A_P) ampm = true;
            if (t.kind() == Kind.FRACTION) frac = true;
        }
        this.twelveHour = ampm;
        this.hasFraction = frac;
    }

    List<Token> tokens() {
        return tokens;
    }

    static DateFormatPattern compile(String section) {
        List<Token> out = new ArrayList<>();
        StringBuilder lit = new StringBuilder();
        String s = section;
        int n = s.length();
        int i = 0;

        while (i < n) {
            char c = s.charAt(i);
            char lc = Character.toLowerCase(c);

            if (c == '"') {
                int end = s.indexOf('"', i + 1);
                if (end < 0) end = n;
                lit.append(s, i + 1, end);
                i = end + 1;
                continue;
            }
            if (c == '\\') {
                if (i + 1 < n) lit.append(s.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '_' || c == '*') {
                i += 2;
                continue;
            }
            if (c == '[') {
                int end = s.indexOf(']', i);
                if (end < 0) end = n - 1;
                String inner = s.substring(i + 1, end).toLowerCase(Locale.ROOT);
                Kind elapsed = elapsedKind(inner);
                if (elapsed != null) {
                    flush(out, lit);
                    out.add(new Token(elapsed, "", inner.length()));
                }
                i = end + 1;
                continue;
            }
            if (regionMatches(s, i, "am/pm")) {
                flush(out, lit);
                out.add(Token.of(Kind.AM_PM));
                i += 5;
                continue;
            }
            if (regionMatches(s, i, "a/p")) {
                flush(out, lit);
                out.add(Token.of(Kind.A_P));
                i += 3;
                continue;
            }

            if (lc == 'y' || lc == 'm' || lc == 'd' || lc == 'h' || lc == 's') {
                int run = runLength(s, i, lc);
                flush(out, lit);
                out.add(letterToken(lc, run, s, i + run, out));
                i += run;
                continue;
            }

            if (c == '.' && i + 1 < n && s.charAt(i + 1) == '0' && lastIsSeconds(out)) {
                int run = runLength(s, i + 1, '0');
                flush(out, lit);
                out.add(new Token(Kind.FRACTION, "", Math.min(run, 3)));
                i += 1 + run;
                continue;
            }

            lit.append(c);
            i++;
        }
        flush(out, lit);
        return new DateFormatPattern(out);
    }

    private static Kind elapsedKind(String inner) {
        if (inner.isEmpty()) return null;
        char first = inner.charAt(0);
        for (int k = 1; k < inner.length(); k++) {
            if (inner.charAt(k) != first) return null;
        }
        return switch (first) {
            case 'h' -> Kind.ELAPSED_HOURS;
            case 'm' -> Kind.ELAPSED_MINUTES;
            case 's' -> Kind.ELAPSED_SECONDS;
            default -> null;
        };
    }

    private static Token letterToken(char lc, int run, String s, int after, List<Token> prior) {
        switch (lc) {
            case 'y':
                return Token.of(run <= 2 ? Kind.YEAR2 : Kind.YEAR4);
            case 'd':
                if (run == 1) return Token.of(Kind.DAY1);
                if (run == 2) return Token.of(Kind.DAY2);
                return Token.of(run == 3 ? Kind.WEEKDAY_ABBR : Kind.WEEKDAY_FULL);
            case 'h':
                return Token.of(run == 1 ? Kind.HOUR1 : Kind.HOUR2);
            case 's':
                return Token.of(run == 1 ? Kind.SECOND1 : Kind.SECOND2);
            default:
                break;
        }
        if (run <= 2 && (afterHour(prior) || followedBySeconds(s, after))) {
            return Token.of(run == 1 ? Kind.MINUTE1 : Kind.MINUTE2);
        }
        return switch (run) {
            case 1 -> Token.of(Kind.MONTH1);
            case 2 -> Token.of(Kind.MONTH2);
            case 3 -> Token.of(Kind.MONTH_ABBR);
            case 4 -> Token.of(Kind.MONTH_FULL);
            default -> Token.of(Kind.MONTH_LETTER);
        };
    }

    private static boolean afterHour(List<Token> prior) {
        for (int k = prior.size() - 1; k >= 0; k--) {
            Kind kind = prior.get(k).kind();
            if (kind == Kind.LITERAL) continue;
            return kind == Kind.HOUR1 || kind == Kind.HOUR2 || kind == Kind.ELAPSED_HOURS;
        }
        return false;
    }

    private static boolean followedBySeconds(String s, int from) {
        for (int k = from; k < s.length(); k++) {
            char c = Character.toLowerCase(s.charAt(k));
            if (c == 's') return true;
            if (c == '[' && k + 1 < s.length() && Character.toLowerCase(s.charAt(k + 1)) == 's') return true;
            if (c == 'y' || c == 'm' || c == 'd' || c == 'h') return false;
        }
        return false;
    }

    private static boolean lastIsSeconds(List<Token> out) {
        if (out.isEmpty()) return false;
        Kind k = out.get(out.size() - 1).kind();
        return k == Kind.SECOND1 || k == Kind.SECOND2 || k == Kind.ELAPSED_SECONDS;
    }

    private static int runLength(String s, int from, char lc) {
        int k = from;
        while (k < s.length() && Character.toLowerCase(s.charAt(k)) == lc) k++;
        return k - from;
    }

    private static boolean regionMatches(String s, int i, String word) {
        return s.regionMatches(true, i, word, 0, word.length());
    }

    private static void flush(List<Token> out, StringBuilder lit) {
        if (lit.length() > 0) {
            out.add(Token.literal(lit.toString()));
            lit.setLength(0);
        }
    }

    /**
     * @return rendered text, or null when the serial has no calendar representation
     */
    String render(double serial, boolean date1904) {
        SerialDateTime dt = DateSerial.toDateTime(serial, date1904, hasFraction);
        if (dt == null) return null;

        long totalSeconds = Math.round(serial * 86_400.0);
        int hour12 = dt.hour() % 12 == 0 ? 12 : dt.hour() % 12;
        int hour = twelveHour ? hour12 : dt.hour();

        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            switch (t.kind()) {
                case YEAR2 -> sb.append(pad2(dt.year() % 100));
                case YEAR4 -> sb.append(String.format(Locale.ROOT, "%04d", dt.year()));
                case MONTH1 -> sb.append(dt.month());
                case MONTH2 -> sb.append(pad2(dt.month()));
                case MONTH_ABBR -> sb.append(MONTH_FULL[dt.month() - 1], 0, 3);
                case MONTH_FULL -> sb.append(MONTH_FULL[dt.month() - 1]);
                case MONTH_LETTER -> sb.append(MONTH_FULL[dt.month() - 1].charAt(0));
                case DAY1 -> sb.append(dt.day());
                case DAY2 -> sb.append(pad2(dt.day()));
                case WEEKDAY_ABBR -> sb.append(WEEKDAY_FULL[dt.dayOfWeek()], 0, 3);
                case WEEKDAY_FULL -> sb.append(WEEKDAY_FULL[dt.dayOfWeek()]);
                case HOUR1 -> sb.append(hour);
                case HOUR2 -> sb.append(pad2(hour));
                case MINUTE1 -> sb.append(dt.minute());
                case MINUTE2 -> sb.append(pad2(dt.minute()));
                case SECOND1 -> sb.append(dt.second());
                case SECOND2 -> sb.append(pad2(dt.second()));
                case FRACTION -> sb.append('.').append(String.format(Locale.ROOT, "%03d", dt.millis()), 0, t.width());
                case AM_PM -> sb.append(dt.hour() >= 12 ? "PM" : "AM");
                case A_P -> sb.append(dt.hour() >= 12 ? "P" : "A");
                case ELAPSED_HOURS -> sb.append(padTo(totalSeconds / 3600, t.width()));
                case ELAPSED_MINUTES -> sb.append(padTo(totalSeconds / 60, t.width()));
                case ELAPSED_SECONDS -> sb.append(padTo(totalSeconds, t.width()));
                case LITERAL -> sb.append(t.text());
            }
        }
        return sb.toString();
    }

    private static String pad2(int v) {
        return v < 10 ? "0" + v : Integer.toString(v);
    }

    private static String padTo(long v, int width) {
        String s = Long.toString(v);
        StringBuilder sb = new StringBuilder();
        for (int k = s.length(); k < width; k++) sb.append('0');
        return sb.append(s).toString();
    }
}
