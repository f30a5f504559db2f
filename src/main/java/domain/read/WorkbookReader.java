package domain.read;

import domain.model.Workbook;

/** Turns package bytes into a resolved {@link Workbook}. */
public interface WorkbookReader {

    /**
     * @throws domain.model.XlsxException on any of the fatal error kinds
     */
    Workbook read(byte[] packageBytes, ParseOptions options);

    default Workbook read(byte[] packageBytes) {
        return read(packageBytes, ParseOptions.defaults());
    }
}
