package infra.xml;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code _xHHHH_} escape used by spreadsheet text for characters XML 1.0 cannot carry.
 *
 * <p>A literal {@code _xHHHH_} in the text is protected by escaping its leading underscore
 * ({@code _x005F_}), so unescaping the written text restores the input exactly.</p>
 */
public final class OoxmlText {

    private static final Pattern ESCAPE = Pattern.compile("_x([0-9A-Fa-f]{4})_");

    private OoxmlText() {
    }

    public static String escape(String text) {
        if (text == null) return null;
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            String replacement = null;
            if (!allowed(text, i)) {
                replacement = hex(ch);
            } else if (ch == '_' && ESCAPE.matcher(text).region(i, text.length()).lookingAt()) {
                replacement = hex('_');
            }
            if (replacement != null) {
                if (sb == null) sb = new StringBuilder(text.length() + 16).append(text, 0, i);
                sb.append(replacement);
            } else if (sb != null) {
                sb.append(ch);
            }
        }
        return sb == null ? text : sb.toString();
    }

    public static String unescape(String text) {
        if (text == null || text.indexOf("_x") < 0) return text;
        Matcher m = ESCAPE.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (m.find()) {
            char ch = (char) Integer.parseInt(m.group(1), 16);
            m.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(ch)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean allowed(String text, int i) {
        char ch = text.charAt(i);
        if (ch == '\t' || ch == '\n' || ch == '\r') return true;
        if (ch < 0x20 || ch == 0xFFFE || ch == 0xFFFF) return false;
        if (Character.isHighSurrogate(ch)) {
            return i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1));
        }
        if (Character.isLowSurrogate(ch)) {
            return i > 0 && Character.isHighSurrogate(text.charAt(i - 1));
        }
        return true;
    }

    private static String hex(char ch) {
        return String.format("_x%04X_", (int) ch);
    }
}
