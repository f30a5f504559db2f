package domain.model;

/**
 * Codes for recoverable decoding conditions.
 *
 * <p>Keep the set small and stable. A warning never aborts a parse; the decoder
 * substitutes a default and continues.</p>
 */
public enum ParseWarningCode {

    /**
     * cellXfs / cellStyleXfs index points past the end of its list.
     */
    STYLE_INDEX_OUT_OF_RANGE,

    /**
     * fontId / fillId / borderId inside an xf points past the end of its list.
     */
    STYLE_COMPONENT_OUT_OF_RANGE,

    /**
     * numFmtId is neither built in nor registered in the style sheet.
     */
    NUMBER_FORMAT_UNKNOWN,

    /**
     * Shared string index points past the end of the table.
     */
    SHARED_STRING_OUT_OF_RANGE,

    /**
     * An optional part (styles, theme, shared strings, comments, drawing) is referenced but absent
     * or unreadable.
     */
    OPTIONAL_PART_UNAVAILABLE,

    /**
     * An optional range attribute (merge, sqref, hyperlink ref) could not be parsed and was skipped.
     */
    RANGE_SKIPPED,

    /**
     * Two cells with the same coordinates; the later one wins.
     */
    DUPLICATE_CELL
}
