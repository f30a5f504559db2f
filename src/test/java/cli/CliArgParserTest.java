package cli;

import domain.output.OutputFormat;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void should_split_options_and_positional_arguments() {
        CliArgParser.CliArgs args = CliArgParser.parse(new String[]{"book.xlsx", "--format=csv", "--pretty", "-o", "out.csv"});

        assertEquals(List.of("book.xlsx"), args.positional());
        assertEquals("csv", args.get("format"));
        assertEquals("", args.get("pretty"));
        assertEquals("out.csv", args.get("out"));
    }

    @Test
    void should_read_presence_flags() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--a", "--b=false", "--c=yes"});

        assertTrue(CliArgParser.flag(m, "a"));
        assertFalse(CliArgParser.flag(m, "b"));
        assertTrue(CliArgParser.flag(m, "c"));
        assertFalse(CliArgParser.flag(m, "d"));
    }

    @Test
    void should_map_format_spellings() {
        assertEquals(OutputFormat.JSON, CliArgParser.parseFormat(null));
        assertEquals(OutputFormat.JSON, CliArgParser.parseFormat("Dump"));
        assertEquals(OutputFormat.CSV, CliArgParser.parseFormat(" csv "));
        assertEquals(OutputFormat.NONE, CliArgParser.parseFormat("check"));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseFormat("xml"));
    }

    @Test
    void should_fall_back_to_defaults_for_bad_numbers() {
        assertEquals(3, CliArgParser.parseInt("x", 3));
        assertEquals(7, CliArgParser.parseInt(" 7 ", 3));
        assertTrue(CliArgParser.parseBoolean(null, true));
        assertFalse(CliArgParser.parseBoolean("no", true));
    }
}
