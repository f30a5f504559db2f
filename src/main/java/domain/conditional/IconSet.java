package domain.conditional;

import java.util.List;

public final class IconSet {

    public static final String DEFAULT_NAME = "3TrafficLights1";

    private final String name;
    private final List<CfValueObject> thresholds;
    private final boolean showValue;
    private final boolean reverse;

    public IconSet(String name, List<CfValueObject> thresholds, boolean showValue, boolean reverse) {
        this.name = name == null ? DEFAULT_NAME : name;
        this.thresholds = List.copyOf(thresholds);
        this.showValue = showValue;
        this.reverse = reverse;
    }

    public String getName() {
        return name;
    }

    public List<CfValueObject> getThresholds() {
        return thresholds;
    }

    public boolean isShowValue() {
        return showValue;
    }

    public boolean isReverse() {
        return reverse;
    }

    /** Icon count from the set name's leading digit (3, 4 or 5). */
    public int iconCount() {
        if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
            return name.charAt(0) - '0';
        }
        return Math.max(thresholds.size(), 3);
    }
}
