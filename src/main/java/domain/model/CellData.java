package domain.model;

/**
 * Cell with its 0-indexed coordinates.
 */
public final class CellData {

    private final int r;
    private final int c;
    private final Cell cell;

    public CellData(int r, int c, Cell cell) {
        this.r = r;
        this.c = c;
        this.cell = cell;
    }

    public int getR() {
        return r;
    }

    public int getC() {
        return c;
    }

    public Cell getCell() {
        return cell;
    }
}
