package domain.model;

import domain.conditional.ConditionalFormatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One worksheet: sparse cells keyed by (row, col) plus layout and annotation data.
 *
 * <p>{@code maxRow}/{@code maxCol} are the 0-indexed bounding box of cells, merges and the
 * declared dimension.</p>
 */
public final class Sheet {

    public static final double DEFAULT_COL_WIDTH = 8.43;
    public static final double DEFAULT_ROW_HEIGHT = 15.0;

    private final String name;
    private final String partPath;
    private SheetState state = SheetState.VISIBLE;
    private String tabColor;

    private final TreeMap<Long, CellData> cells = new TreeMap<>();
    private final List<RangeRef> merges = new ArrayList<>();
    private int maxRow;
    private int maxCol;

    private int frozenRows;
    private int frozenCols;
    private double defaultColWidth = DEFAULT_COL_WIDTH;
    private double defaultRowHeight = DEFAULT_ROW_HEIGHT;
    private final Map<Integer, Double> columnWidths = new TreeMap<>();
    private final Map<Integer, Double> rowHeights = new TreeMap<>();
    private final Set<Integer> hiddenColumns = new TreeSet<>();
    private final Set<Integer> hiddenRows = new TreeSet<>();

    private final List<ConditionalFormatting> conditionalFormats = new ArrayList<>();
    private final List<Hyperlink> hyperlinks = new ArrayList<>();
    private final Map<String, Comment> comments = new LinkedHashMap<>();
    private final List<Drawing> drawings = new ArrayList<>();
    private final List<SparklineGroup> sparklineGroups = new ArrayList<>();
    private final List<DataValidation> dataValidations = new ArrayList<>();
    private String autoFilter;
    private boolean protectedSheet;
    private boolean chartsheet;

    private final List<OutlineLevel> rowOutlines = new ArrayList<>();
    private final List<OutlineLevel> columnOutlines = new ArrayList<>();
    private boolean summaryBelow = true;
    private boolean summaryRight = true;

    private PageMargins pageMargins;
    private PageSetup pageSetup;
    private HeaderFooter headerFooter;

    public Sheet(String name, String partPath) {
        this.name = name;
        this.partPath = partPath;
    }

    private static long key(int row, int col) {
        return ((long) row << 20) | col;
    }

    // ------------------------------------------------------------
    // cells
    // ------------------------------------------------------------

    /** Cell at (row, col), or null when absent. */
    public Cell cellAt(int row, int col) {
        CellData d = cells.get(key(row, col));
        return d == null ? null : d.getCell();
    }

    /**
     * Puts or replaces a cell and grows the bounding box.
     *
     * @return true when a cell already existed at those coordinates
     */
    public boolean putCell(int row, int col, Cell cell) {
        CellData prev = cells.put(key(row, col), new CellData(row, col, cell));
        extendTo(row, col);
        return prev != null;
    }

    /** @return true when a cell was removed */
    public boolean removeCell(int row, int col) {
        return cells.remove(key(row, col)) != null;
    }

    public int cellCount() {
        return cells.size();
    }

    /** Row-major order. */
    public List<CellData> getCells() {
        return List.copyOf(cells.values());
    }

    public void extendTo(int row, int col) {
        if (row > maxRow) maxRow = row;
        if (col > maxCol) maxCol = col;
    }

    // ------------------------------------------------------------
    // merges
    // ------------------------------------------------------------

    /**
     * Adds a merge unless it overlaps an existing one.
     *
     * @return false when rejected for overlap
     */
    public boolean addMerge(RangeRef range) {
        for (RangeRef m : merges) {
            if (m.overlaps(range)) return false;
        }
        merges.add(range);
        extendTo(range.getLastRow(), range.getLastCol());
        return true;
    }

    public List<RangeRef> getMerges() {
        return Collections.unmodifiableList(merges);
    }

    // ------------------------------------------------------------
    // comments
    // ------------------------------------------------------------

    public void addComment(Comment comment) {
        comments.putIfAbsent(comment.getCellRef(), comment);
    }

    public Comment commentAt(String cellRef) {
        return comments.get(cellRef);
    }

    public List<Comment> getComments() {
        return List.copyOf(comments.values());
    }

    // ------------------------------------------------------------
    // simple properties
    // ------------------------------------------------------------

    public String getName() {
        return name;
    }

    public String getPartPath() {
        return partPath;
    }

    public SheetState getState() {
        return state;
    }

    public void setState(SheetState state) {
        this.state = state == null ? SheetState.VISIBLE : state;
    }

    public String getTabColor() {
        return tabColor;
    }

    public void setTabColor(String tabColor) {
        this.tabColor = tabColor;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMaxCol() {
        return maxCol;
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public void setFrozenRows(int frozenRows) {
        this.frozenRows = frozenRows;
    }

    public int getFrozenCols() {
        return frozenCols;
    }

    public void setFrozenCols(int frozenCols) {
        this.frozenCols = frozenCols;
    }

    public double getDefaultColWidth() {
        return defaultColWidth;
    }

    public void setDefaultColWidth(double defaultColWidth) {
        this.defaultColWidth = defaultColWidth;
    }

    public double getDefaultRowHeight() {
        return defaultRowHeight;
    }

    public void setDefaultRowHeight(double defaultRowHeight) {
        this.defaultRowHeight = defaultRowHeight;
    }

    public Map<Integer, Double> getColumnWidths() {
        return columnWidths;
    }

    public Map<Integer, Double> getRowHeights() {
        return rowHeights;
    }

    public Set<Integer> getHiddenColumns() {
        return hiddenColumns;
    }

    public Set<Integer> getHiddenRows() {
        return hiddenRows;
    }

    /** Ordered rule groups; evaluation order across groups is by rule priority. */
    public List<ConditionalFormatting> getConditionalFormats() {
        return conditionalFormats;
    }

    public List<Hyperlink> getHyperlinks() {
        return hyperlinks;
    }

    public List<Drawing> getDrawings() {
        return drawings;
    }

    public List<SparklineGroup> getSparklineGroups() {
        return sparklineGroups;
    }

    public List<DataValidation> getDataValidations() {
        return dataValidations;
    }

    public String getAutoFilter() {
        return autoFilter;
    }

    public void setAutoFilter(String autoFilter) {
        this.autoFilter = autoFilter;
    }

    public boolean isProtectedSheet() {
        return protectedSheet;
    }

    public void setProtectedSheet(boolean protectedSheet) {
        this.protectedSheet = protectedSheet;
    }

    /** Chart sheets carry no cells and cannot be edited. */
    public boolean isChartsheet() {
        return chartsheet;
    }

    public void setChartsheet(boolean chartsheet) {
        this.chartsheet = chartsheet;
    }

    // ------------------------------------------------------------
    // outlines
    // ------------------------------------------------------------

    /** Rows with an outline level above 0, in document order. */
    public List<OutlineLevel> getRowOutlines() {
        return rowOutlines;
    }

    public List<OutlineLevel> getColumnOutlines() {
        return columnOutlines;
    }

    public boolean isSummaryBelow() {
        return summaryBelow;
    }

    public void setSummaryBelow(boolean summaryBelow) {
        this.summaryBelow = summaryBelow;
    }

    public boolean isSummaryRight() {
        return summaryRight;
    }

    public void setSummaryRight(boolean summaryRight) {
        this.summaryRight = summaryRight;
    }

    // ------------------------------------------------------------
    // printing
    // ------------------------------------------------------------

    public PageMargins getPageMargins() {
        return pageMargins;
    }

    public void setPageMargins(PageMargins pageMargins) {
        this.pageMargins = pageMargins;
    }

    public PageSetup getPageSetup() {
        return pageSetup;
    }

    public void setPageSetup(PageSetup pageSetup) {
        this.pageSetup = pageSetup;
    }

    public HeaderFooter getHeaderFooter() {
        return headerFooter;
    }

    public void setHeaderFooter(HeaderFooter headerFooter) {
        this.headerFooter = headerFooter;
    }
}
