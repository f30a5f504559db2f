package domain.conditional;

/**
 * {@code cfRule/@type} values. Unknown types map to {@link #OTHER} and never fire.
 */
public enum CfRuleType {
    COLOR_SCALE("colorScale"),
    DATA_BAR("dataBar"),
    ICON_SET("iconSet"),
    CELL_IS("cellIs"),
    EXPRESSION("expression"),
    TOP10("top10"),
    ABOVE_AVERAGE("aboveAverage"),
    DUPLICATE_VALUES("duplicateValues"),
    UNIQUE_VALUES("uniqueValues"),
    CONTAINS_TEXT("containsText"),
    NOT_CONTAINS_TEXT("notContainsText"),
    BEGINS_WITH("beginsWith"),
    ENDS_WITH("endsWith"),
    CONTAINS_BLANKS("containsBlanks"),
    NOT_CONTAINS_BLANKS("notContainsBlanks"),
    CONTAINS_ERRORS("containsErrors"),
    NOT_CONTAINS_ERRORS("notContainsErrors"),
    TIME_PERIOD("timePeriod"),
    OTHER("");

    private final String xmlName;

    CfRuleType(String xmlName) {
        this.xmlName = xmlName;
    }

    public String getXmlName() {
        return xmlName;
    }

    public static CfRuleType fromXml(String raw) {
        if (raw == null) return OTHER;
        for (CfRuleType t : values()) {
            if (t != OTHER && t.xmlName.equals(raw)) return t;
        }
        return OTHER;
    }

    /** Rules that need a pass over every value of the covered range. */
    public boolean needsRangeStats() {
        return switch (this) {
            case COLOR_SCALE, DATA_BAR, ICON_SET, TOP10, ABOVE_AVERAGE, DUPLICATE_VALUES, UNIQUE_VALUES -> true;
            default -> false;
        };
    }
}
