package domain.style;

import domain.model.NamedStyle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw content of {@code xl/styles.xml}, mirroring the XML lists. Consumed only by
 * {@link StyleResolver}.
 */
public final class StyleSheet {

    private final Map<Integer, String> numFmts = new HashMap<>();
    private final List<RawFont> fonts = new ArrayList<>();
    private final List<RawFill> fills = new ArrayList<>();
    private final List<RawBorder> borders = new ArrayList<>();
    private final List<RawXf> cellStyleXfs = new ArrayList<>();
    private final List<RawXf> cellXfs = new ArrayList<>();
    private final List<NamedStyle> cellStyles = new ArrayList<>();
    private final List<RawDxf> dxfs = new ArrayList<>();
    private final List<String> indexedColors = new ArrayList<>();

    public static StyleSheet empty() {
        return new StyleSheet();
    }

    public Map<Integer, String> getNumFmts() {
        return numFmts;
    }

    public List<RawFont> getFonts() {
        return fonts;
    }

    public List<RawFill> getFills() {
        return fills;
    }

    public List<RawBorder> getBorders() {
        return borders;
    }

    public List<RawXf> getCellStyleXfs() {
        return cellStyleXfs;
    }

    public List<RawXf> getCellXfs() {
        return cellXfs;
    }

    public List<NamedStyle> getCellStyles() {
        return cellStyles;
    }

    public List<RawDxf> getDxfs() {
        return dxfs;
    }

    /** Custom palette; empty when the file keeps the legacy table. */
    public List<String> getIndexedColors() {
        return indexedColors;
    }
}
