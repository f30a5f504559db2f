package domain.model;

/**
 * Typed failure for package reading, decoding and editing.
 */
public class XlsxException extends RuntimeException {

    private final XlsxErrorCode code;
    private final String detail;

    public XlsxException(XlsxErrorCode code, String message, String detail, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.detail = detail == null ? "" : detail;
    }

    public static XlsxException invalidArchive(String message, Throwable cause) {
        return new XlsxException(XlsxErrorCode.INVALID_ARCHIVE, message, "", cause);
    }

    public static XlsxException missingPart(String partPath) {
        return new XlsxException(XlsxErrorCode.MISSING_PART, "Missing package part: " + partPath, partPath, null);
    }

    public static XlsxException xmlParseError(String partPath, Throwable cause) {
        return new XlsxException(XlsxErrorCode.XML_PARSE_ERROR, "Failed to parse XML part: " + partPath, partPath, cause);
    }

    public static XlsxException invalidReference(String ref) {
        return new XlsxException(XlsxErrorCode.INVALID_REFERENCE, "Invalid cell reference: '" + ref + "'", ref, null);
    }

    public static XlsxException invalidSheetIndex(int index, int sheetCount) {
        return new XlsxException(XlsxErrorCode.INVALID_SHEET_INDEX,
                "Sheet index " + index + " out of range (sheets=" + sheetCount + ")", String.valueOf(index), null);
    }

    public static XlsxException notEditableSheet(int index, String name) {
        return new XlsxException(XlsxErrorCode.INVALID_SHEET_INDEX,
                "Sheet index " + index + " (" + name + ") is a chart sheet and cannot be edited", String.valueOf(index), null);
    }

    public static XlsxException notLoaded() {
        return new XlsxException(XlsxErrorCode.NOT_LOADED, "No workbook loaded", "", null);
    }

    public XlsxErrorCode getCode() {
        return code;
    }

    /** Part path, reference text or index the failure is about (may be empty). */
    public String getDetail() {
        return detail;
    }
}
