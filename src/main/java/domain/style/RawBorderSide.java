package domain.style;

public record RawBorderSide(String style, ColorSpec color) {

    public boolean isVisible() {
        return style != null && !style.isBlank() && !"none".equals(style);
    }
}
