package domain.model;

import java.util.Objects;

/**
 * Fully resolved cell style.
 *
 * <p>Produced once per distinct cellXfs index and shared by every cell that references it.
 * A {@code null} field means "format default" (not bold, no border, general alignment, ...);
 * {@link #getNumberFormat()} is never null.</p>
 */
public final class Style {

    public static final String GENERAL = "General";

    private final Boolean bold;
    private final Boolean italic;
    private final Boolean underline;
    private final String underlineStyle;
    private final Boolean strikethrough;
    private final String vertAlign;
    private final String fontColor;
    private final Double fontSize;
    private final String fontFamily;

    private final String bgColor;
    private final String patternType;
    private final String fgColor;
    private final GradientFill gradient;

    private final BorderSide borderTop;
    private final BorderSide borderBottom;
    private final BorderSide borderLeft;
    private final BorderSide borderRight;
    private final BorderSide borderDiagonal;
    private final Boolean diagonalUp;
    private final Boolean diagonalDown;

    private final String alignH;
    private final String alignV;
    private final Boolean wrap;
    private final Boolean shrinkToFit;
    private final Integer rotation;
    private final Integer indent;
    private final Integer readingOrder;

    private final String numberFormat;
    private final int numFmtId;

    private final Boolean locked;
    private final Boolean hidden;

    private Style(Builder b) {
        this.bold = b.bold;
        this.italic = b.italic;
        this.underline = b.underline;
        this.underlineStyle = b.underlineStyle;
        this.strikethrough = b.strikethrough;
        this.vertAlign = b.vertAlign;
        this.fontColor = b.fontColor;
        this.fontSize = b.fontSize;
        this.fontFamily = b.fontFamily;
        this.bgColor = b.bgColor;
        this.patternType = b.patternType;
        this.fgColor = b.fgColor;
        this.gradient = b.gradient;
        this.borderTop = b.borderTop;
        this.borderBottom = b.borderBottom;
        this.borderLeft = b.borderLeft;
        this.borderRight = b.borderRight;
        this.borderDiagonal = b.borderDiagonal;
        this.diagonalUp = b.diagonalUp;
        this.diagonalDown = b.diagonalDown;
        this.alignH = b.alignH;
        this.alignV = b.alignV;
        // wrap and shrink are mutually exclusive; wrap wins
        this.wrap = b.wrap;
        this.shrinkToFit = Boolean.TRUE.equals(b.wrap) ? null : b.shrinkToFit;
        this.rotation = b.rotation;
        this.indent = b.indent;
        this.readingOrder = b.readingOrder;
        this.numberFormat = b.numberFormat == null ? GENERAL : b.numberFormat;
        this.numFmtId = b.numFmtId;
        this.locked = b.locked;
        this.hidden = b.hidden;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Boolean getBold() {
        return bold;
    }

    public Boolean getItalic() {
        return italic;
    }

    public Boolean getUnderline() {
        return underline;
    }

    public String getUnderlineStyle() {
        return underlineStyle;
    }

    public Boolean getStrikethrough() {
        return strikethrough;
    }

    public String getVertAlign() {
        return vertAlign;
    }

    public String getFontColor() {
        return fontColor;
    }

    public Double getFontSize() {
        return fontSize;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public String getBgColor() {
        return bgColor;
    }

    public String getPatternType() {
        return patternType;
    }

    public String getFgColor() {
        return fgColor;
    }

    public GradientFill getGradient() {
        return gradient;
    }

    public BorderSide getBorderTop() {
        return borderTop;
    }

    public BorderSide getBorderBottom() {
        return borderBottom;
    }

    public BorderSide getBorderLeft() {
        return borderLeft;
    }

    public BorderSide getBorderRight() {
        return borderRight;
    }

    public BorderSide getBorderDiagonal() {
        return borderDiagonal;
    }

    public Boolean getDiagonalUp() {
        return diagonalUp;
    }

    public Boolean getDiagonalDown() {
        return diagonalDown;
    }

    public String getAlignH() {
        return alignH;
    }

    public String getAlignV() {
        return alignV;
    }

    public Boolean getWrap() {
        return wrap;
    }

    public Boolean getShrinkToFit() {
        return shrinkToFit;
    }

    /** 0-90 counter-clockwise, 91-180 clockwise as 90+deg, 255 vertical stacked. */
    public Integer getRotation() {
        return rotation;
    }

    public Integer getIndent() {
        return indent;
    }

    public Integer getReadingOrder() {
        return readingOrder;
    }

    public String getNumberFormat() {
        return numberFormat;
    }

    public int getNumFmtId() {
        return numFmtId;
    }

    public Boolean getLocked() {
        return locked;
    }

    public Boolean getHidden() {
        return hidden;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Style s)) return false;
        return numFmtId == s.numFmtId
                && Objects.equals(bold, s.bold)
                && Objects.equals(italic, s.italic)
                && Objects.equals(underline, s.underline)
                && Objects.equals(underlineStyle, s.underlineStyle)
                && Objects.equals(strikethrough, s.strikethrough)
                && Objects.equals(vertAlign, s.vertAlign)
                && Objects.equals(fontColor, s.fontColor)
                && Objects.equals(fontSize, s.fontSize)
                && Objects.equals(fontFamily, s.fontFamily)
                && Objects.equals(bgColor, s.bgColor)
                && Objects.equals(patternType, s.patternType)
                && Objects.equals(fgColor, s.fgColor)
                && Objects.equals(gradient, s.gradient)
                && Objects.equals(borderTop, s.borderTop)
                && Objects.equals(borderBottom, s.borderBottom)
                && Objects.equals(borderLeft, s.borderLeft)
                && Objects.equals(borderRight, s.borderRight)
                && Objects.equals(borderDiagonal, s.borderDiagonal)
                && Objects.equals(diagonalUp, s.diagonalUp)
                && Objects.equals(diagonalDown, s.diagonalDown)
                && Objects.equals(alignH, s.alignH)
                && Objects.equals(alignV, s.alignV)
                && Objects.equals(wrap, s.wrap)
                && Objects.equals(shrinkToFit, s.shrinkToFit)
                && Objects.equals(rotation, s.rotation)
                && Objects.equals(indent, s.indent)
                && Objects.equals(readingOrder, s.readingOrder)
                && Objects.equals(numberFormat, s.numberFormat)
                && Objects.equals(locked, s.locked)
                && Objects.equals(hidden, s.hidden);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bold, italic, underline, underlineStyle, strikethrough, vertAlign, fontColor,
                fontSize, fontFamily, bgColor, patternType, fgColor, gradient, borderTop, borderBottom,
                borderLeft, borderRight, borderDiagonal, diagonalUp, diagonalDown, alignH, alignV, wrap,
                shrinkToFit, rotation, indent, readingOrder, numberFormat, numFmtId, locked, hidden);
    }

    public static final class Builder {
        private Boolean bold;
        private Boolean italic;
        private Boolean underline;
        private String underlineStyle;
        private Boolean strikethrough;
        private String vertAlign;
        private String fontColor;
        private Double fontSize;
        private String fontFamily;
        private String bgColor;
        private String patternType;
        private String fgColor;
        private GradientFill gradient;
        private BorderSide borderTop;
        private BorderSide borderBottom;
        private BorderSide borderLeft;
        private BorderSide borderRight;
        private BorderSide borderDiagonal;
        private Boolean diagonalUp;
        private Boolean diagonalDown;
        private String alignH;
        private String alignV;
        private Boolean wrap;
        private Boolean shrinkToFit;
        private Integer rotation;
        private Integer indent;
        private Integer readingOrder;
        private String numberFormat;
        private int numFmtId;
        private Boolean locked;
        private Boolean hidden;

        private Builder() {
        }

        public Builder bold(Boolean v) { this.bold = v; return this; }
        public Builder italic(Boolean v) { this.italic = v; return this; }
        public Builder underline(Boolean v) { this.underline = v; return this; }
        public Builder underlineStyle(String v) { this.underlineStyle = v; return this; }
        public Builder strikethrough(Boolean v) { this.strikethrough = v; return this; }
        public Builder vertAlign(String v) { this.vertAlign = v; return this; }
        public Builder fontColor(String v) { this.fontColor = v; return this; }
        public Builder fontSize(Double v) { this.fontSize = v; return this; }
        public Builder fontFamily(String v) { this.fontFamily = v; return this; }
        public Builder bgColor(String v) { this.bgColor = v; return this; }
        public Builder patternType(String v) { this.patternType = v; return this; }
        public Builder fgColor(String v) { this.fgColor = v; return this; }
        public Builder gradient(GradientFill v) { this.gradient = v; return this; }
        public Builder borderTop(BorderSide v) { this.borderTop = v; return this; }
        public Builder borderBottom(BorderSide v) { this.borderBottom = v; return this; }
        public Builder borderLeft(BorderSide v) { this.borderLeft = v; return this; }
        public Builder borderRight(BorderSide v) { this.borderRight = v; return this; }
        public Builder borderDiagonal(BorderSide v) { this.borderDiagonal = v; return this; }
        public Builder diagonalUp(Boolean v) { this.diagonalUp = v; return this; }
        public Builder diagonalDown(Boolean v) { this.diagonalDown = v; return this; }
        public Builder alignH(String v) { this.alignH = v; return this; }
        public Builder alignV(String v) { this.alignV = v; return this; }
        public Builder wrap(Boolean v) { this.wrap = v; return this; }
        public Builder shrinkToFit(Boolean v) { this.shrinkToFit = v; return this; }
        public Builder rotation(Integer v) { this.rotation = v; return this; }
        public Builder indent(Integer v) { this.indent = v; return this; }
        public Builder readingOrder(Integer v) { this.readingOrder = v; return this; }
        public Builder numberFormat(String v) { this.numberFormat = v; return this; }
        public Builder numFmtId(int v) { this.numFmtId = v; return this; }
        public Builder locked(Boolean v) { this.locked = v; return this; }
        public Builder hidden(Boolean v) { this.hidden = v; return this; }

        public Style build() {
            return new Style(this);
        }
    }
}
