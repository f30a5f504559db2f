package infra.output;

import domain.model.Workbook;
import domain.output.WorkbookExporter;

import java.io.Writer;

/**
 * No-op implementation (parse-only runs).
 */
public final class NullWorkbookExporter implements WorkbookExporter {
    @Override
    public void write(Workbook workbook, Writer out) {
        // intentionally no-op
    }
}
