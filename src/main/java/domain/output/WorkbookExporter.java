package domain.output;

import domain.model.Workbook;

import java.io.Writer;

/** Writes a parsed workbook in some external format. */
public interface WorkbookExporter {

    void write(Workbook workbook, Writer out);
}
