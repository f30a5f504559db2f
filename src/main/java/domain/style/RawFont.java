package domain.style;

/**
 * {@code <font>} as written. {@code underline} holds the {@code u/@val} value
 * (single when the element has no val), null when absent.
 */
public record RawFont(
        String name,
        Double size,
        Boolean bold,
        Boolean italic,
        String underline,
        Boolean strike,
        String vertAlign,
        ColorSpec color,
        String scheme
) {
    public static final RawFont EMPTY = new RawFont(null, null, null, null, null, null, null, null, null);
}
