package domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Theme palette and font pair.
 *
 * <p>Colors are stored in clrScheme document order: dk1, lt1, dk2, lt2, accent1-6, hlink,
 * folHlink. Cell color references index the palette with the first two pairs swapped
 * (theme 0 is lt1, theme 1 is dk1), see {@link #colorAt(int)}.</p>
 */
public final class Theme {

    public static final List<String> SLOT_NAMES = List.of(
            "dk1", "lt1", "dk2", "lt2",
            "accent1", "accent2", "accent3", "accent4", "accent5", "accent6",
            "hlink", "folHlink");

    private static final List<String> OFFICE_COLORS = List.of(
            "#000000", "#FFFFFF", "#44546A", "#E7E6E6",
            "#4472C4", "#ED7D31", "#A5A5A5", "#FFC000", "#5B9BD5", "#70AD47",
            "#0563C1", "#954F72");

    private static final Theme OFFICE = new Theme(OFFICE_COLORS, "Calibri Light", "Calibri");

    private final List<String> colors;
    private final String majorFont;
    private final String minorFont;

    /**
     * @param colors scheme-ordered colors; missing or null slots fall back to Office defaults
     */
    public Theme(List<String> colors, String majorFont, String minorFont) {
        List<String> merged = new ArrayList<>(OFFICE_COLORS.size());
        for (int i = 0; i < OFFICE_COLORS.size(); i++) {
            String c = (colors != null && i < colors.size()) ? colors.get(i) : null;
            merged.add(c == null ? OFFICE_COLORS.get(i) : c);
        }
        this.colors = List.copyOf(merged);
        this.majorFont = majorFont == null ? "Calibri Light" : majorFont;
        this.minorFont = minorFont == null ? "Calibri" : minorFont;
    }

    /** Built-in Office 2013+ theme. Shared, read-only. */
    public static Theme office() {
        return OFFICE;
    }

    /**
     * Color for a {@code theme="n"} reference, or null when n is outside 0..11.
     */
    public String colorAt(int themeIndex) {
        if (themeIndex < 0 || themeIndex >= colors.size()) return null;
        int slot = themeIndex < 4 ? themeIndex ^ 1 : themeIndex;
        return colors.get(slot);
    }

    public List<String> getColors() {
        return colors;
    }

    public String getMajorFont() {
        return majorFont;
    }

    public String getMinorFont() {
        return minorFont;
    }
}
