package domain.model;

/**
 * A single recoverable condition found while decoding a package.
 */
public final class ParseWarning {

    private final ParseWarningCode code;
    private final String part;
    private final String message;

    public ParseWarning(ParseWarningCode code, String part, String message) {
        this.code = code;
        this.part = nullToEmpty(part);
        this.message = nullToEmpty(message);
    }

    public static ParseWarning of(ParseWarningCode code, String part, String message) {
        return new ParseWarning(code, part, message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public ParseWarningCode getCode() {
        return code;
    }

    public String getPart() {
        return part;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return code + " [" + part + "] " + message;
    }
}
