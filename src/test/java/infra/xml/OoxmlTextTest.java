package infra.xml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OoxmlTextTest {

    @Test
    void should_escape_control_characters_and_keep_whitespace() {
        assertEquals("a_x0001_b", OoxmlText.escape("a\u0001b"));
        assertEquals("tab\there\nnext", OoxmlText.escape("tab\there\nnext"));
        assertEquals("_xFFFF_", OoxmlText.escape("\uFFFF"));
    }

    @Test
    void should_protect_literal_escape_sequences() {
        assertEquals("_x005F_x0041_", OoxmlText.escape("_x0041_"));
        assertEquals("_x0041_", OoxmlText.unescape(OoxmlText.escape("_x0041_")));
        assertEquals("plain_text", OoxmlText.escape("plain_text"));
    }

    @Test
    void should_escape_unpaired_surrogates_only() {
        String pair = "\uD83D\uDE00";
        assertSame(pair, OoxmlText.escape(pair));
        assertEquals("_xD83D_", OoxmlText.escape("\uD83D"));
    }

    @Test
    void should_decode_escapes_written_by_other_producers() {
        assertEquals("line\rbreak", OoxmlText.unescape("line_x000D_break"));
        assertEquals("a_x00G1_", OoxmlText.unescape("a_x00G1_"));
        assertNull(OoxmlText.unescape(null));
    }
}
