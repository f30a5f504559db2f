package domain.model;

/**
 * Hyperlink attached to a cell. External links carry {@code target}; in-workbook links carry
 * {@code location} (e.g. {@code Sheet2!A1}).
 */
public final class Hyperlink {

    private final String cellRef;
    private final String target;
    private final String location;
    private final String tooltip;
    private final String display;
    private final boolean external;

    public Hyperlink(String cellRef, String target, String location, String tooltip, String display, boolean external) {
        this.cellRef = cellRef;
        this.target = target;
        this.location = location;
        this.tooltip = tooltip;
        this.display = display;
        this.external = external;
    }

    public String getCellRef() {
        return cellRef;
    }

    public String getTarget() {
        return target;
    }

    public String getLocation() {
        return location;
    }

    public String getTooltip() {
        return tooltip;
    }

    public String getDisplay() {
        return display;
    }

    public boolean isExternal() {
        return external;
    }
}
