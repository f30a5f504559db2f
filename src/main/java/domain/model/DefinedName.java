package domain.model;

public final class DefinedName {

    private final String name;
    private final String value;
    private final Integer localSheetId;
    private final boolean hidden;

    public DefinedName(String name, String value, Integer localSheetId, boolean hidden) {
        this.name = name;
        this.value = value == null ? "" : value;
        this.localSheetId = localSheetId;
        this.hidden = hidden;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public Integer getLocalSheetId() {
        return localSheetId;
    }

    public boolean isHidden() {
        return hidden;
    }
}
