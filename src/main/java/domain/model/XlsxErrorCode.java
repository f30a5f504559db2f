package domain.model;

/**
 * Fatal failure kinds surfaced to callers.
 *
 * <p>Anything not listed here is absorbed by the decoders and reported as a
 * {@link ParseWarning} instead.</p>
 */
public enum XlsxErrorCode {

    /**
     * The input is not a readable zip archive.
     */
    INVALID_ARCHIVE,

    /**
     * A structurally required part (workbook definition, a referenced worksheet) is absent.
     */
    MISSING_PART,

    /**
     * A required part is not well-formed XML or has the wrong root element.
     */
    XML_PARSE_ERROR,

    /**
     * A cell or range reference does not match the A1 grammar.
     */
    INVALID_REFERENCE,

    /**
     * Editor call addressed a sheet that does not exist.
     */
    INVALID_SHEET_INDEX,

    /**
     * Editor was asked to save before any package was loaded.
     */
    NOT_LOADED
}
