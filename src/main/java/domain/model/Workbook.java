package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed workbook: ordered sheets plus the workbook-level data they share.
 */
public final class Workbook {

    private final List<Sheet> sheets = new ArrayList<>();
    private final List<DefinedName> definedNames = new ArrayList<>();
    private final List<DxfStyle> dxfStyles = new ArrayList<>();
    private final List<NamedStyle> namedStyles = new ArrayList<>();
    private Theme theme = Theme.office();
    private boolean date1904;

    public void addSheet(Sheet sheet) {
        sheets.add(sheet);
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    public int sheetCount() {
        return sheets.size();
    }

    public Sheet sheet(int index) {
        if (index < 0 || index >= sheets.size()) {
            throw XlsxException.invalidSheetIndex(index, sheets.size());
        }
        return sheets.get(index);
    }

    public List<DefinedName> getDefinedNames() {
        return definedNames;
    }

    public List<DxfStyle> getDxfStyles() {
        return dxfStyles;
    }

    public List<NamedStyle> getNamedStyles() {
        return namedStyles;
    }

    public Theme getTheme() {
        return theme;
    }

    public void setTheme(Theme theme) {
        this.theme = theme == null ? Theme.office() : theme;
    }

    public boolean isDate1904() {
        return date1904;
    }

    public void setDate1904(boolean date1904) {
        this.date1904 = date1904;
    }
}
