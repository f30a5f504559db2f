package domain.model;

/**
 * One anchored object from a drawing part: picture, shape, chart frame or group.
 * Anchor columns/rows are 0-indexed; offsets are EMU.
 */
public final class Drawing {

    private String anchorType;
    private String kind;
    private String name;
    private String description;
    private Integer fromCol;
    private Integer fromRow;
    private Long fromColOff;
    private Long fromRowOff;
    private Integer toCol;
    private Integer toRow;
    private Long toColOff;
    private Long toRowOff;
    private Long extentCx;
    private Long extentCy;
    private String imagePath;
    private String chartPath;

    public String getAnchorType() {
        return anchorType;
    }

    public void setAnchorType(String anchorType) {
        this.anchorType = anchorType;
    }

    /** picture, shape, chart, group or connector. */
    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Integer getFromCol() {
        return fromCol;
    }

    public void setFromCol(Integer fromCol) {
        this.fromCol = fromCol;
    }

    public Integer getFromRow() {
        return fromRow;
    }

    public void setFromRow(Integer fromRow) {
        this.fromRow = fromRow;
    }

    public Long getFromColOff() {
        return fromColOff;
    }

    public void setFromColOff(Long fromColOff) {
        this.fromColOff = fromColOff;
    }

    public Long getFromRowOff() {
        return fromRowOff;
    }

    public void setFromRowOff(Long fromRowOff) {
        this.fromRowOff = fromRowOff;
    }

    public Integer getToCol() {
        return toCol;
    }

    public void setToCol(Integer toCol) {
        this.toCol = toCol;
    }

    public Integer getToRow() {
        return toRow;
    }

    public void setToRow(Integer toRow) {
        this.toRow = toRow;
    }

    public Long getToColOff() {
        return toColOff;
    }

    public void setToColOff(Long toColOff) {
        this.toColOff = toColOff;
    }

    public Long getToRowOff() {
        return toRowOff;
    }

    public void setToRowOff(Long toRowOff) {
        this.toRowOff = toRowOff;
    }

    public Long getExtentCx() {
        return extentCx;
    }

    public void setExtentCx(Long extentCx) {
        this.extentCx = extentCx;
    }

    public Long getExtentCy() {
        return extentCy;
    }

    public void setExtentCy(Long extentCy) {
        this.extentCy = extentCy;
    }

    /** Package path of the embedded image (pictures only). */
    public String getImagePath() {
        return imagePath;
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    /** Package path of the chart part (chart frames only). */
    public String getChartPath() {
        return chartPath;
    }

    public void setChartPath(String chartPath) {
        this.chartPath = chartPath;
    }
}
