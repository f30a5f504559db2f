package domain.model;

/**
 * Stored cell kind. The tag is the short code used in dumps.
 */
public enum CellType {

    NUMBER("n"),
    STRING("s"),
    BOOLEAN("b"),
    ERROR("e"),
    /** Formula with a cached result; the result's own kind is {@link Cell#getCachedType()}. */
    FORMULA("f"),
    /** Styled but valueless cell. */
    EMPTY("z");

    private final String tag;

    CellType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
