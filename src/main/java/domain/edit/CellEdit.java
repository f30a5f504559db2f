package domain.edit;

/** A committed edit of one cell; the last edit of a cell replaces earlier ones. */
public record CellEdit(int row, int col, EditValue value) {
}
