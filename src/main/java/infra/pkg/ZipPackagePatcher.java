package infra.pkg;

import domain.edit.PackagePatcher;
import domain.model.XlsxException;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;

/**
 * Rebuilds a package with Commons Compress. Untouched members are copied as raw compressed
 * data, so their bytes (and CRCs) stay identical; only replaced parts are deflated again.
 */
public class ZipPackagePatcher implements PackagePatcher {

    @Override
    public byte[] readPart(byte[] packageBytes, String partPath) {
        String wanted = XlsxPackage.normalize(partPath);
        try (ZipFile zip = open(packageBytes)) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                if (!wanted.equals(XlsxPackage.normalize(entry.getName()))) continue;
                try (InputStream in = zip.getInputStream(entry)) {
                    return in.readAllBytes();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read part: " + wanted, e);
        }
        throw XlsxException.missingPart(wanted);
    }

    @Override
    public byte[] replaceParts(byte[] packageBytes, Map<String, byte[]> replacements) {
        Map<String, byte[]> pending = new LinkedHashMap<>();
        replacements.forEach((k, v) -> pending.put(XlsxPackage.normalize(k), v));
        Set<String> written = new HashSet<>();

        ByteArrayOutputStream bos = new ByteArrayOutputStream(packageBytes.length + 4096);
        try (ZipFile zip = open(packageBytes);
             ZipArchiveOutputStream out = new ZipArchiveOutputStream(bos)) {

            Enumeration<ZipArchiveEntry> entries = zip.getEntriesInPhysicalOrder();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                String name = XlsxPackage.normalize(entry.getName());
                byte[] replacement = pending.get(name);
                if (replacement == null) {
                    try (InputStream raw = zip.getRawInputStream(entry)) {
                        out.addRawArchiveEntry(entry, raw);
                    }
                    continue;
                }
                writeDeflated(out, entry.getName(), entry.getTime(), replacement);
                written.add(name);
            }

            // parts that did not exist before go last
            for (Map.Entry<String, byte[]> e : pending.entrySet()) {
                if (!written.contains(e.getKey())) {
                    writeDeflated(out, e.getKey(), System.currentTimeMillis(), e.getValue());
                }
            }
            out.finish();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write package", e);
        }
        return bos.toByteArray();
    }

    private static void writeDeflated(ZipArchiveOutputStream out, String name, long time, byte[] data) throws IOException {
        ZipArchiveEntry fresh = new ZipArchiveEntry(name);
        fresh.setMethod(ZipEntry.DEFLATED);
        fresh.setTime(time);
        out.putArchiveEntry(fresh);
        out.write(data);
        out.closeArchiveEntry();
    }

    private static ZipFile open(byte[] packageBytes) {
        try {
            return ZipFile.builder()
                    .setSeekableByteChannel(new SeekableInMemoryByteChannel(packageBytes))
                    .get();
        } catch (IOException e) {
            throw XlsxException.invalidArchive("Not a readable zip archive: " + e.getMessage(), e);
        }
    }
}
