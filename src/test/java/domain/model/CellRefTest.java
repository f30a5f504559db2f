package domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellRefTest {

    @Test
    void should_parse_a1_to_zero_indexed_coordinates() {
        CellRef ref = CellRef.parse("A1");
        assertEquals(0, ref.getRow());
        assertEquals(0, ref.getCol());

        CellRef abs = CellRef.parse("$AB$12");
        assertEquals(11, abs.getRow());
        assertEquals(27, abs.getCol());
    }

    @Test
    void should_format_column_names_across_letter_boundaries() {
        assertEquals("A", CellRef.columnName(0));
        assertEquals("Z", CellRef.columnName(25));
        assertEquals("AA", CellRef.columnName(26));
        assertEquals("XFD", CellRef.columnName(CellRef.MAX_COLS - 1));
        assertEquals(CellRef.MAX_COLS - 1, CellRef.columnIndex("XFD"));
        assertEquals("C5", new CellRef(4, 2).toString());
    }

    @Test
    void should_reject_malformed_or_out_of_grid_references() {
        for (String bad : new String[]{"", "1A", "A0", "A", "a1", "XFE1", "A1048577"}) {
            XlsxException ex = assertThrows(XlsxException.class, () -> CellRef.parse(bad), bad);
            assertEquals(XlsxErrorCode.INVALID_REFERENCE, ex.getCode());
        }
    }
}
