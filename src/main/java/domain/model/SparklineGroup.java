package domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code x14:sparklineGroup} extension content. Colors are resolved hex.
 */
public final class SparklineGroup {

    private String type = "line";
    private String seriesColor;
    private String negativeColor;
    private String markersColor;
    private String highColor;
    private String lowColor;
    private String firstColor;
    private String lastColor;
    private boolean markers;
    private boolean high;
    private boolean low;
    private boolean first;
    private boolean last;
    private boolean negative;
    private boolean displayXAxis;
    private String displayEmptyCellsAs;
    private Double lineWeight;
    private final List<Sparkline> sparklines = new ArrayList<>();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSeriesColor() {
        return seriesColor;
    }

    public void setSeriesColor(String seriesColor) {
        this.seriesColor = seriesColor;
    }

    public String getNegativeColor() {
        return negativeColor;
    }

    public void setNegativeColor(String negativeColor) {
        this.negativeColor = negativeColor;
    }

    public String getMarkersColor() {
        return markersColor;
    }

    public void setMarkersColor(String markersColor) {
        this.markersColor = markersColor;
    }

    public String getHighColor() {
        return highColor;
    }

    public void setHighColor(String highColor) {
        this.highColor = highColor;
    }

    public String getLowColor() {
        return lowColor;
    }

    public void setLowColor(String lowColor) {
        this.lowColor = lowColor;
    }

    public String getFirstColor() {
        return firstColor;
    }

    public void setFirstColor(String firstColor) {
        this.firstColor = firstColor;
    }

    public String getLastColor() {
        return lastColor;
    }

    public void setLastColor(String lastColor) {
        this.lastColor = lastColor;
    }

    public boolean isMarkers() {
        return markers;
    }

    public void setMarkers(boolean markers) {
        this.markers = markers;
    }

    public boolean isHigh() {
        return high;
    }

    public void setHigh(boolean high) {
        this.high = high;
    }

    public boolean isLow() {
        return low;
    }

    public void setLow(boolean low) {
        this.low = low;
    }

    public boolean isFirst() {
        return first;
    }

    public void setFirst(boolean first) {
        this.first = first;
    }

    public boolean isLast() {
        return last;
    }

    public void setLast(boolean last) {
        this.last = last;
    }

    public boolean isNegative() {
        return negative;
    }

    public void setNegative(boolean negative) {
        this.negative = negative;
    }

    public boolean isDisplayXAxis() {
        return displayXAxis;
    }

    public void setDisplayXAxis(boolean displayXAxis) {
        this.displayXAxis = displayXAxis;
    }

    public String getDisplayEmptyCellsAs() {
        return displayEmptyCellsAs;
    }

    public void setDisplayEmptyCellsAs(String displayEmptyCellsAs) {
        this.displayEmptyCellsAs = displayEmptyCellsAs;
    }

    public Double getLineWeight() {
        return lineWeight;
    }

    public void setLineWeight(Double lineWeight) {
        this.lineWeight = lineWeight;
    }

    public List<Sparkline> getSparklines() {
        return sparklines;
    }
}
