package domain.conditional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Visual override for one cell after all matching rules were merged.
 * A property set by a higher-priority rule is never replaced by a lower one.
 */
public final class ConditionalFormatResult {

    private String bgColor;
    private String fontColor;
    private Boolean bold;
    private Boolean italic;
    private Bar dataBar;
    private Icon icon;
    private final List<Integer> appliedRules = new ArrayList<>();

    public boolean isEmpty() {
        return appliedRules.isEmpty();
    }

    void applyBg(String color) {
        if (bgColor == null) bgColor = color;
    }

    void applyFontColor(String color) {
        if (fontColor == null) fontColor = color;
    }

    void applyBold(Boolean value) {
        if (bold == null) bold = value;
    }

    void applyItalic(Boolean value) {
        if (italic == null) italic = value;
    }

    void applyDataBar(Bar bar) {
        if (dataBar == null) dataBar = bar;
    }

    void applyIcon(Icon value) {
        if (icon == null) icon = value;
    }

    void markApplied(int priority) {
        appliedRules.add(priority);
    }

    public String getBgColor() {
        return bgColor;
    }

    public String getFontColor() {
        return fontColor;
    }

    public Boolean getBold() {
        return bold;
    }

    public Boolean getItalic() {
        return italic;
    }

    public Bar getDataBar() {
        return dataBar;
    }

    public Icon getIcon() {
        return icon;
    }

    /** Priorities of the rules that matched, in evaluation order. */
    public List<Integer> getAppliedRules() {
        return Collections.unmodifiableList(appliedRules);
    }

    /**
     * @param percent bar length as a percentage of the cell width, 0..100
     * @param axisPercent position of the zero axis, null when the range has no axis
     */
    public record Bar(double percent, String color, boolean negative, Double axisPercent) {
    }

    public record Icon(String setName, int index) {
    }
}
