package domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RangeRefTest {

    @Test
    void should_normalize_reversed_corners() {
        RangeRef r = RangeRef.parse("C3:A1");
        assertEquals(0, r.getFirstRow());
        assertEquals(0, r.getFirstCol());
        assertEquals(2, r.getLastRow());
        assertEquals(2, r.getLastCol());
        assertEquals("A1:C3", r.toString());
    }

    @Test
    void should_expand_whole_columns_and_rows() {
        RangeRef cols = RangeRef.parse("B:C");
        assertEquals(0, cols.getFirstRow());
        assertEquals(CellRef.MAX_ROWS - 1, cols.getLastRow());
        assertTrue(cols.contains(500_000, 2));
        assertFalse(cols.contains(0, 3));

        RangeRef rows = RangeRef.parse("2:4");
        assertEquals(1, rows.getFirstRow());
        assertEquals(3, rows.getLastRow());
        assertEquals(CellRef.MAX_COLS - 1, rows.getLastCol());
    }

    @Test
    void should_parse_space_separated_sqref_lists() {
        List<RangeRef> list = RangeRef.parseList(" A1:B2  D4 ");
        assertEquals(2, list.size());
        assertEquals("D4", list.get(1).toString());
    }

    @Test
    void should_detect_overlaps() {
        RangeRef a = RangeRef.parse("A1:B2");
        assertTrue(a.overlaps(RangeRef.parse("B2:C3")));
        assertFalse(a.overlaps(RangeRef.parse("C1:D2")));
    }
}
