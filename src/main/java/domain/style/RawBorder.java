package domain.style;

public record RawBorder(
        RawBorderSide left,
        RawBorderSide right,
        RawBorderSide top,
        RawBorderSide bottom,
        RawBorderSide diagonal,
        boolean diagonalUp,
        boolean diagonalDown
) {
    public static final RawBorder NONE = new RawBorder(null, null, null, null, null, false, false);
}
