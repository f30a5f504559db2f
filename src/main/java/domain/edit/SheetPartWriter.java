package domain.edit;

import java.util.Collection;

/**
 * Regenerates a worksheet part with a set of cell edits applied.
 */
public interface SheetPartWriter {

    byte[] rewrite(byte[] originalPart, String partPath, Collection<CellEdit> edits);
}
