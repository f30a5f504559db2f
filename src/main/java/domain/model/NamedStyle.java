package domain.model;

/**
 * Entry of {@code <cellStyles>}: a display name bound to a cellStyleXfs index.
 */
public final class NamedStyle {

    private final String name;
    private final int xfId;
    private final Integer builtinId;

    public NamedStyle(String name, int xfId, Integer builtinId) {
        this.name = name;
        this.xfId = xfId;
        this.builtinId = builtinId;
    }

    public String getName() {
        return name;
    }

    public int getXfId() {
        return xfId;
    }

    public Integer getBuiltinId() {
        return builtinId;
    }
}
