package domain.conditional;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code <cfRule>}. Only the fields relevant to its {@link CfRuleType} are populated.
 */
public final class CfRule {

    private final CfRuleType type;
    private final int priority;
    private boolean stopIfTrue;
    private Integer dxfId;
    private String operator;
    private final List<String> formulas = new ArrayList<>();
    private String text;
    private Integer rank;
    private boolean percent;
    private boolean bottom;
    private boolean aboveAverage = true;
    private boolean equalAverage;
    private Integer stdDev;
    private String timePeriod;
    private ColorScale colorScale;
    private DataBar dataBar;
    private IconSet iconSet;

    public CfRule(CfRuleType type, int priority) {
        this.type = type == null ? CfRuleType.OTHER : type;
        this.priority = priority;
    }

    public CfRuleType getType() {
        return type;
    }

    /** Lower value is evaluated first. */
    public int getPriority() {
        return priority;
    }

    public boolean isStopIfTrue() {
        return stopIfTrue;
    }

    public void setStopIfTrue(boolean stopIfTrue) {
        this.stopIfTrue = stopIfTrue;
    }

    public Integer getDxfId() {
        return dxfId;
    }

    public void setDxfId(Integer dxfId) {
        this.dxfId = dxfId;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public List<String> getFormulas() {
        return formulas;
    }

    public void addFormula(String formula) {
        if (formula != null) formulas.add(formula);
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Integer getRank() {
        return rank;
    }

    public void setRank(Integer rank) {
        this.rank = rank;
    }

    public boolean isPercent() {
        return percent;
    }

    public void setPercent(boolean percent) {
        this.percent = percent;
    }

    public boolean isBottom() {
        return bottom;
    }

    public void setBottom(boolean bottom) {
        this.bottom = bottom;
    }

    public boolean isAboveAverage() {
        return aboveAverage;
    }

    public void setAboveAverage(boolean aboveAverage) {
        this.aboveAverage = aboveAverage;
    }

    public boolean isEqualAverage() {
        return equalAverage;
    }

    public void setEqualAverage(boolean equalAverage) {
        this.equalAverage = equalAverage;
    }

    public Integer getStdDev() {
        return stdDev;
    }

    public void setStdDev(Integer stdDev) {
        this.stdDev = stdDev;
    }

    public String getTimePeriod() {
        return timePeriod;
    }

    public void setTimePeriod(String timePeriod) {
        this.timePeriod = timePeriod;
    }

    public ColorScale getColorScale() {
        return colorScale;
    }

    public void setColorScale(ColorScale colorScale) {
        this.colorScale = colorScale;
    }

    public DataBar getDataBar() {
        return dataBar;
    }

    public void setDataBar(DataBar dataBar) {
        this.dataBar = dataBar;
    }

    public IconSet getIconSet() {
        return iconSet;
    }

    public void setIconSet(IconSet iconSet) {
        this.iconSet = iconSet;
    }
}
