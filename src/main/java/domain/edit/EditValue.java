package domain.edit;

/**
 * Typed value inferred from user input.
 *
 * @param text canonical text: plain decimal for numbers, {@code TRUE}/{@code FALSE} for
 *             booleans, the trimmed input for strings, null for {@link Kind#CLEAR}
 */
public record EditValue(Kind kind, String text) {

    public enum Kind {
        NUMBER,
        BOOLEAN,
        STRING,
        /** Removes the cell. */
        CLEAR
    }

    public static final EditValue CLEAR = new EditValue(Kind.CLEAR, null);

    public boolean isClear() {
        return kind == Kind.CLEAR;
    }
}
