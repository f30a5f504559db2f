package domain.style;

import java.util.List;

/**
 * Legacy 64-entry indexed color table (BIFF8 default palette).
 */
public final class IndexedPalette {

    /** {@code indexed="64"}: system foreground. */
    public static final int SYSTEM_FOREGROUND = 64;
    /** {@code indexed="65"}: system background. */
    public static final int SYSTEM_BACKGROUND = 65;

    private static final List<String> COLORS = List.of(
            "#000000", "#FFFFFF", "#FF0000", "#00FF00", "#0000FF", "#FFFF00", "#FF00FF", "#00FFFF",
            "#000000", "#FFFFFF", "#FF0000", "#00FF00", "#0000FF", "#FFFF00", "#FF00FF", "#00FFFF",
            "#800000", "#008000", "#000080", "#808000", "#800080", "#008080", "#C0C0C0", "#808080",
            "#9999FF", "#993366", "#FFFFCC", "#CCFFFF", "#660066", "#FF8080", "#0066CC", "#CCCCFF",
            "#000080", "#FF00FF", "#FFFF00", "#00FFFF", "#800080", "#800000", "#008080", "#0000FF",
            "#00CCFF", "#CCFFFF", "#CCFFCC", "#FFFF99", "#99CCFF", "#FF99CC", "#CC99FF", "#FFCC99",
            "#3366FF", "#33CCCC", "#99CC00", "#FFCC00", "#FF9900", "#FF6600", "#666699", "#969696",
            "#003366", "#339966", "#003300", "#333300", "#993300", "#993366", "#333399", "#333333");

    private IndexedPalette() {
    }

    public static int size() {
        return COLORS.size();
    }

    /** Color for index, or null when outside the table. */
    public static String get(int index) {
        if (index < 0 || index >= COLORS.size()) return null;
        return COLORS.get(index);
    }
}
