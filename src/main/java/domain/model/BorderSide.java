package domain.model;

import java.util.Objects;

/**
 * One resolved border edge: line style name (thin, medium, dashed, ...) and hex color.
 */
public final class BorderSide {

    private final String style;
    private final String color;

    public BorderSide(String style, String color) {
        this.style = style;
        this.color = color;
    }

    public String getStyle() {
        return style;
    }

    public String getColor() {
        return color;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BorderSide that)) return false;
        return Objects.equals(style, that.style) && Objects.equals(color, that.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(style, color);
    }

    @Override
    public String toString() {
        return style + " " + color;
    }
}
