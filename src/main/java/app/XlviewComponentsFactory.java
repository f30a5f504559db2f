package app;

import domain.edit.WorkbookEditor;
import domain.output.OutputFormat;
import domain.output.WorkbookExporter;
import domain.read.WorkbookReader;
import infra.output.CsvSheetExporter;
import infra.output.JsonWorkbookExporter;
import infra.output.NullWorkbookExporter;
import infra.pkg.ZipPackagePatcher;
import infra.xml.WorksheetRewriter;
import infra.xml.XlsxWorkbookReader;

/**
 * Object-assembly factory for {@link XlviewCliApp} and embedding callers.
 * <p>
 * Keeps "new" of infra implementations out of the orchestration code.
 */
public final class XlviewComponentsFactory {

    public WorkbookReader createReader() {
        return new XlsxWorkbookReader();
    }

    public WorkbookEditor createEditor() {
        return new WorkbookEditor(createReader(), new WorksheetRewriter(), new ZipPackagePatcher());
    }

    public WorkbookExporter createExporter(OutputFormat format, int sheetIndex, boolean pretty) {
        if (format == null) format = OutputFormat.JSON;

        return switch (format) {
            case JSON -> new JsonWorkbookExporter(pretty);
            case CSV -> new CsvSheetExporter(sheetIndex);
            case NONE -> new NullWorkbookExporter();
        };
    }
}
