package domain.style;

/**
 * {@code <dxf>}: partial font / fill / border used by conditional formatting.
 */
public record RawDxf(RawFont font, RawFill fill, RawBorder border) {
}
