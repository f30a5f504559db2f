package domain.model;

/**
 * Resolved differential format ({@code <dxf>}), applied by conditional formatting.
 */
public final class DxfStyle {

    private final String fontColor;
    private final String bgColor;
    private final Boolean bold;
    private final Boolean italic;
    private final Boolean underline;
    private final Boolean strikethrough;
    private final BorderSide border;

    public DxfStyle(String fontColor, String bgColor, Boolean bold, Boolean italic, Boolean underline,
                    Boolean strikethrough, BorderSide border) {
        this.fontColor = fontColor;
        this.bgColor = bgColor;
        this.bold = bold;
        this.italic = italic;
        this.underline = underline;
        this.strikethrough = strikethrough;
        this.border = border;
    }

    public String getFontColor() {
        return fontColor;
    }

    public String getBgColor() {
        return bgColor;
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

    public Boolean getStrikethrough() {
        return strikethrough;
    }

    public BorderSide getBorder() {
        return border;
    }
}
