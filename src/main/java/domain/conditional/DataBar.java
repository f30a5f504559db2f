package domain.conditional;

/**
 * Data bar definition, including the x14 extension fields when present.
 */
public final class DataBar {

    public static final String DEFAULT_COLOR = "#638EC6";

    private final CfValueObject min;
    private final CfValueObject max;
    private final String color;
    private final boolean showValue;
    private final int minLength;
    private final int maxLength;
    private String negativeFillColor;
    private String axisColor;
    private String axisPosition;
    private boolean gradient = true;

    public DataBar(CfValueObject min, CfValueObject max, String color, boolean showValue, int minLength, int maxLength) {
        this.min = min;
        this.max = max;
        this.color = color == null ? DEFAULT_COLOR : color;
        this.showValue = showValue;
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public CfValueObject getMin() {
        return min;
    }

    public CfValueObject getMax() {
        return max;
    }

    public String getColor() {
        return color;
    }

    public boolean isShowValue() {
        return showValue;
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public String getNegativeFillColor() {
        return negativeFillColor;
    }

    public void setNegativeFillColor(String negativeFillColor) {
        this.negativeFillColor = negativeFillColor;
    }

    public String getAxisColor() {
        return axisColor;
    }

    public void setAxisColor(String axisColor) {
        this.axisColor = axisColor;
    }

    /** automatic (default), middle or none. */
    public String getAxisPosition() {
        return axisPosition;
    }

    public void setAxisPosition(String axisPosition) {
        this.axisPosition = axisPosition;
    }

    public boolean isGradient() {
        return gradient;
    }

    public void setGradient(boolean gradient) {
        this.gradient = gradient;
    }
}
