package domain.style;

import java.util.List;

/**
 * {@code <fill>}: either a pattern fill or a gradient fill.
 */
public record RawFill(
        String patternType,
        ColorSpec fgColor,
        ColorSpec bgColor,
        RawGradient gradient
) {
    public static final RawFill NONE = new RawFill("none", null, null, null);

    public record RawGradient(String type, double degree, List<RawGradientStop> stops) {
    }

    public record RawGradientStop(double position, ColorSpec color) {
    }
}
