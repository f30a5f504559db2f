package domain.model;

/**
 * 0-indexed grid coordinate parsed from / formatted to A1 notation.
 */
public final class CellRef {

    public static final int MAX_ROWS = 1_048_576;
    public static final int MAX_COLS = 16_384;

    private final int row;
    private final int col;

    public CellRef(int row, int col) {
        this.row = row;
        this.col = col;
    }

    /**
     * Parses {@code [A-Z]+[0-9]+}; {@code $} absolute markers are ignored.
     *
     * @throws XlsxException INVALID_REFERENCE when the text does not match
     */
    public static CellRef parse(String ref) {
        if (ref == null) throw XlsxException.invalidReference("null");
        String s = ref.trim().replace("$", "");
        int n = s.length();
        int i = 0;
        int col = 0;
        while (i < n) {
            char c = s.charAt(i);
            if (c < 'A' || c > 'Z') break;
            col = col * 26 + (c - 'A' + 1);
            if (col > MAX_COLS) throw XlsxException.invalidReference(ref);
            i++;
        }
        if (i == 0 || i == n) throw XlsxException.invalidReference(ref);

        long row = 0;
        for (int j = i; j < n; j++) {
            char c = s.charAt(j);
            if (c < '0' || c > '9') throw XlsxException.invalidReference(ref);
            row = row * 10 + (c - '0');
            if (row > MAX_ROWS) throw XlsxException.invalidReference(ref);
        }
        if (row < 1) throw XlsxException.invalidReference(ref);

        return new CellRef((int) row - 1, col - 1);
    }

    /** 0-indexed column to letters: 0 → A, 25 → Z, 26 → AA. */
    public static String columnName(int col) {
        StringBuilder sb = new StringBuilder(3);
        int n = col + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /** Letters to 0-indexed column, or -1 when the text is not all A-Z. */
    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) return -1;
        int col = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') return -1;
            col = col * 26 + (c - 'A' + 1);
        }
        return col - 1;
    }

    public static String format(int row, int col) {
        return columnName(col) + (row + 1);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellRef that)) return false;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return format(row, col);
    }
}
