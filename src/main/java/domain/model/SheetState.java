package domain.model;

public enum SheetState {
    VISIBLE,
    HIDDEN,
    VERY_HIDDEN;

    /** Maps the {@code state} attribute of {@code <sheet>}; anything unknown is visible. */
    public static SheetState fromXml(String raw) {
        if (raw == null) return VISIBLE;
        return switch (raw.trim()) {
            case "hidden" -> HIDDEN;
            case "veryHidden" -> VERY_HIDDEN;
            default -> VISIBLE;
        };
    }
}
