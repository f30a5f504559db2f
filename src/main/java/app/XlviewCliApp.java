package app;

import cli.CliArgParser;
import cli.XlviewCli;
import domain.model.ListParseWarningSink;
import domain.model.ParseWarning;
import domain.model.Workbook;
import domain.model.XlsxException;
import domain.output.OutputFormat;
import domain.output.WorkbookExporter;
import domain.read.ParseOptions;
import domain.read.WorkbookReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** CLI entry (invoked by {@link XlviewCli}). */
public final class XlviewCliApp {

    private static final Logger log = LoggerFactory.getLogger(XlviewCliApp.class);

    static final String PROP_FORMAT = "xlview.format";
    static final String PROP_PRETTY = "xlview.pretty";

    static final String USAGE = "usage: xlview <input.xlsx> [-o <file>] [--format=json|csv|none] "
            + "[--sheet=<index>] [--pretty=true|false] [--warnings=true|false]";

    private XlviewCliApp() {
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    /**
     * Runs one command line.
     *
     * @return process exit status: 0 on success, 1 on any failure
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgParser.CliArgs argv = CliArgParser.parse(args);
        if (argv.positional().isEmpty() || CliArgParser.flag(argv.options(), "help")) {
            err.println(USAGE);
            return argv.positional().isEmpty() ? 1 : 0;
        }

        try {
            OutputFormat format = CliArgParser.parseFormat(firstNonBlank(argv.get("format"), System.getProperty(PROP_FORMAT)));
            boolean pretty = CliArgParser.parseBoolean(firstNonBlank(argv.get("pretty"), System.getProperty(PROP_PRETTY)), true);
            boolean showWarnings = CliArgParser.parseBoolean(argv.get("warnings"), true);
            int sheetIndex = CliArgParser.parseInt(argv.get("sheet"), 0);
            String outPath = firstNonBlank(argv.get("out"), argv.get("output"));

            Path input = Path.of(argv.positional().get(0));
            byte[] bytes = readInput(input);

            List<ParseWarning> warnings = new ArrayList<>();
            XlviewComponentsFactory factory = new XlviewComponentsFactory();
            WorkbookReader reader = factory.createReader();
            Workbook workbook = reader.read(bytes, ParseOptions.defaults().withWarnings(new ListParseWarningSink(warnings)));

            WorkbookExporter exporter = factory.createExporter(format, sheetIndex, pretty);
            if (outPath == null) {
                Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                exporter.write(workbook, w);
                w.flush();
                if (format == OutputFormat.JSON) out.println();
            } else {
                writeFile(Path.of(outPath), workbook, exporter);
            }

            if (showWarnings && !warnings.isEmpty()) {
                err.println("[WARN] " + warnings.size() + " warning(s)");
                for (ParseWarning w : warnings) {
                    err.println("  " + w);
                }
            }
            return 0;
        } catch (XlsxException e) {
            log.debug("Parse failed", e);
            err.println("error: " + e.getCode() + ": " + e.getMessage());
            return 1;
        } catch (IOException | RuntimeException e) {
            log.debug("Run failed", e);
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    private static byte[] readInput(Path input) {
        try {
            return Files.readAllBytes(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input: " + input, e);
        }
    }

    private static void writeFile(Path target, Workbook workbook, WorkbookExporter exporter) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            exporter.write(workbook, w);
        }
        log.info("Wrote {}", target);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
