package cli;

import domain.output.OutputFormat;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    /** Parsed command line: {@code --key=value} options plus positional arguments. */
    public record CliArgs(Map<String, String> options, List<String> positional) {

        public String get(String key) {
            return options.get(key);
        }
    }

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (Exception e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--pretty       => true</li>
     *   <li>--pretty=true  => true</li>
     *   <li>--pretty=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Output format, accepting a few spellings.
     * <ul>
     *   <li>json / dump -> JSON</li>
     *   <li>csv -> CSV</li>
     *   <li>none / validate / check -> NONE</li>
     * </ul>
     * Default: JSON
     *
     * @throws IllegalArgumentException for any other value
     */
    public static OutputFormat parseFormat(String raw) {
        if (raw == null || raw.isBlank()) return OutputFormat.JSON;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);
        return switch (v) {
            case "json", "dump" -> OutputFormat.JSON;
            case "csv" -> OutputFormat.CSV;
            case "none", "validate", "check" -> OutputFormat.NONE;
            default -> throw new IllegalArgumentException("Unknown format: " + raw);
        };
    }

    public static Map<String, String> parseArgs(String[] args) {
        return parse(args).options();
    }

    /**
     * {@code --key=value} and bare {@code --key} (empty value) become options; {@code -o <file>}
     * is stored as {@code out}; everything else is positional.
     */
    public static CliArgs parse(String[] args) {
        Map<String, String> m = new HashMap<>();
        List<String> positional = new ArrayList<>();
        if (args == null) return new CliArgs(m, positional);

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();

            if (a.equals("-o") || a.equals("--output")) {
                if (i + 1 < args.length && args[i + 1] != null) {
                    m.put("out", args[i + 1].trim());
                    i++;
                }
                continue;
            }
            if (!a.startsWith("--")) {
                if (!a.isEmpty()) positional.add(a);
                continue;
            }

            String k;
            String v;
            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return new CliArgs(m, positional);
    }
}
