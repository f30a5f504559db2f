package domain.edit;

import java.util.Map;

/**
 * Byte-level access to the zip package behind an edit session.
 */
public interface PackagePatcher {

    /**
     * @return the part bytes
     * @throws domain.model.XlsxException MISSING_PART when absent
     */
    byte[] readPart(byte[] packageBytes, String partPath);

    /**
     * Builds a new package in which the given parts are replaced and every other member is
     * copied unchanged, in the original order.
     */
    byte[] replaceParts(byte[] packageBytes, Map<String, byte[]> replacements);
}
