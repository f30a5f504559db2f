package domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive rectangular range, 0-indexed. A single cell is a 1x1 range.
 *
 * <p>Accepts {@code A1}, {@code A1:C3}, whole columns {@code A:C} and whole rows {@code 2:4}.</p>
 */
public final class RangeRef {

    private final int firstRow;
    private final int firstCol;
    private final int lastRow;
    private final int lastCol;

    public RangeRef(int firstRow, int firstCol, int lastRow, int lastCol) {
        this.firstRow = Math.min(firstRow, lastRow);
        this.lastRow = Math.max(firstRow, lastRow);
        this.firstCol = Math.min(firstCol, lastCol);
        this.lastCol = Math.max(firstCol, lastCol);
    }

    public static RangeRef parse(String ref) {
        if (ref == null || ref.isBlank()) throw XlsxException.invalidReference(String.valueOf(ref));
        String s = ref.trim().replace("$", "");
        int colon = s.indexOf(':');
        if (colon < 0) {
            CellRef c = CellRef.parse(s);
            return new RangeRef(c.getRow(), c.getCol(), c.getRow(), c.getCol());
        }
        String a = s.substring(0, colon);
        String b = s.substring(colon + 1);

        if (isAllLetters(a) && isAllLetters(b)) {
            int c1 = CellRef.columnIndex(a);
            int c2 = CellRef.columnIndex(b);
            if (c1 < 0 || c2 < 0 || c1 >= CellRef.MAX_COLS || c2 >= CellRef.MAX_COLS) {
                throw XlsxException.invalidReference(ref);
            }
            return new RangeRef(0, c1, CellRef.MAX_ROWS - 1, c2);
        }
        if (isAllDigits(a) && isAllDigits(b)) {
            int r1 = parseRow(a, ref);
            int r2 = parseRow(b, ref);
            return new RangeRef(r1, 0, r2, CellRef.MAX_COLS - 1);
        }

        CellRef c1 = CellRef.parse(a);
        CellRef c2 = CellRef.parse(b);
        return new RangeRef(c1.getRow(), c1.getCol(), c2.getRow(), c2.getCol());
    }

    /** Whitespace-separated list, as used by {@code sqref} attributes. */
    public static List<RangeRef> parseList(String sqref) {
        List<RangeRef> out = new ArrayList<>();
        if (sqref == null) return out;
        for (String part : sqref.trim().split("\\s+")) {
            if (part.isEmpty()) continue;
            out.add(parse(part));
        }
        return out;
    }

    private static int parseRow(String digits, String ref) {
        try {
            int r = Integer.parseInt(digits);
            if (r < 1 || r > CellRef.MAX_ROWS) throw XlsxException.invalidReference(ref);
            return r - 1;
        } catch (NumberFormatException e) {
            throw XlsxException.invalidReference(ref);
        }
    }

    private static boolean isAllLetters(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 'A' || c > 'Z') return false;
        }
        return true;
    }

    private static boolean isAllDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    public boolean contains(int row, int col) {
        return row >= firstRow && row <= lastRow && col >= firstCol && col <= lastCol;
    }

    public boolean overlaps(RangeRef other) {
        return firstRow <= other.lastRow && other.firstRow <= lastRow
                && firstCol <= other.lastCol && other.firstCol <= lastCol;
    }

    public int getFirstRow() {
        return firstRow;
    }

    public int getFirstCol() {
        return firstCol;
    }

    public int getLastRow() {
        return lastRow;
    }

    public int getLastCol() {
        return lastCol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeRef that)) return false;
        return firstRow == that.firstRow && firstCol == that.firstCol
                && lastRow == that.lastRow && lastCol == that.lastCol;
    }

    @Override
    public int hashCode() {
        int h = firstRow;
        h = 31 * h + firstCol;
        h = 31 * h + lastRow;
        h = 31 * h + lastCol;
        return h;
    }

    @Override
    public String toString() {
        String a = CellRef.format(firstRow, firstCol);
        if (firstRow == lastRow && firstCol == lastCol) return a;
        return a + ":" + CellRef.format(lastRow, lastCol);
    }
}
