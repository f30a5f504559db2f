package domain.model;

/**
 * One cell value.
 *
 * <p>{@code value} is the raw stored value (numeric text, TRUE/FALSE, error code, string);
 * {@code display} is the value rendered through the cell's number format. Formula text
 * is kept separately in {@code formula} and is never evaluated.</p>
 */
public final class Cell {

    private final CellType type;
    private final String value;
    private final String display;
    private final String formula;
    private final CellType cachedType;
    private final Style style;
    private final Integer styleIndex;
    private final boolean date;
    private final boolean hasComment;
    private final Hyperlink hyperlink;

    public Cell(CellType type, String value, String display, String formula, CellType cachedType,
                Style style, Integer styleIndex, boolean date, boolean hasComment, Hyperlink hyperlink) {
        this.type = type == null ? CellType.EMPTY : type;
        this.value = value;
        this.display = display;
        this.formula = formula;
        this.cachedType = cachedType;
        this.style = style;
        this.styleIndex = styleIndex;
        this.date = date;
        this.hasComment = hasComment;
        this.hyperlink = hyperlink;
    }

    public static Cell of(CellType type, String value) {
        return new Cell(type, value, value, null, null, null, null, false, false, null);
    }

    public Cell withComment(boolean flag) {
        return new Cell(type, value, display, formula, cachedType, style, styleIndex, date, flag, hyperlink);
    }

    public Cell withHyperlink(Hyperlink link) {
        return new Cell(type, value, display, formula, cachedType, style, styleIndex, date, hasComment, link);
    }

    public CellType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public String getFormula() {
        return formula;
    }

    public CellType getCachedType() {
        return cachedType;
    }

    public Style getStyle() {
        return style;
    }

    public Integer getStyleIndex() {
        return styleIndex;
    }

    public boolean isDate() {
        return date;
    }

    public boolean isHasComment() {
        return hasComment;
    }

    public Hyperlink getHyperlink() {
        return hyperlink;
    }

    /** Kind of the value actually held: the cached type for formulas, the type otherwise. */
    public CellType valueType() {
        return type == CellType.FORMULA && cachedType != null ? cachedType : type;
    }

    /** Numeric value for NUMBER cells (or formulas caching a number), otherwise NaN. */
    public double numericValue() {
        if (valueType() != CellType.NUMBER || value == null) return Double.NaN;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
