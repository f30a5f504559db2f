package infra.pkg;

import domain.model.XlsxException;
import infra.xml.XmlDom;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully materialized OPC package: every member's bytes, in archive order, plus lazily
 * parsed relationship parts.
 */
public final class XlsxPackage {

    public static final String OFFICE_DOCUMENT_REL = "officeDocument";
    static final String DEFAULT_WORKBOOK = "xl/workbook.xml";

    private final byte[] original;
    private final Map<String, byte[]> parts;
    private final Map<String, List<Relationship>> relsCache = new HashMap<>();

    private XlsxPackage(byte[] original, Map<String, byte[]> parts) {
        this.original = original;
        this.parts = parts;
    }

    /**
     * @throws XlsxException INVALID_ARCHIVE when the bytes are not a readable zip
     */
    public static XlsxPackage open(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw XlsxException.invalidArchive("Empty input", null);
        }
        Map<String, byte[]> parts = new LinkedHashMap<>();
        try (ZipFile zip = ZipFile.builder()
                .setSeekableByteChannel(new SeekableInMemoryByteChannel(bytes))
                .get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntriesInPhysicalOrder();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                if (entry.isDirectory()) continue;
                try (InputStream in = zip.getInputStream(entry)) {
                    parts.put(normalize(entry.getName()), in.readAllBytes());
                }
            }
        } catch (IOException | RuntimeException e) {
            throw XlsxException.invalidArchive("Not a readable zip archive: " + e.getMessage(), e);
        }
        if (parts.isEmpty()) {
            throw XlsxException.invalidArchive("Archive has no members", null);
        }
        return new XlsxPackage(bytes, parts);
    }

    public byte[] originalBytes() {
        return original;
    }

    public boolean hasPart(String path) {
        return parts.containsKey(normalize(path));
    }

    /** Part bytes, or null when absent. */
    public byte[] part(String path) {
        return parts.get(normalize(path));
    }

    /**
     * @throws XlsxException MISSING_PART when absent
     */
    public byte[] requirePart(String path) {
        byte[] data = part(path);
        if (data == null) throw XlsxException.missingPart(normalize(path));
        return data;
    }

    /** Member names in archive order. */
    public List<String> partNames() {
        return Collections.unmodifiableList(new ArrayList<>(parts.keySet()));
    }

    /** Main workbook part from the root relationships, falling back to {@code xl/workbook.xml}. */
    public String workbookPath() {
        for (Relationship rel : relationshipsOf("")) {
            if (rel.isType(OFFICE_DOCUMENT_REL) && !rel.external() && hasPart(rel.target())) {
                return rel.target();
            }
        }
        return DEFAULT_WORKBOOK;
    }

    /**
     * Relationships declared by a part; empty when it has no {@code .rels}. Use {@code ""}
     * for the package root.
     */
    public List<Relationship> relationshipsOf(String partPath) {
        String source = normalize(partPath);
        return relsCache.computeIfAbsent(source, this::loadRelationships);
    }

    public Relationship relationship(String partPath, String id) {
        if (id == null) return null;
        for (Relationship rel : relationshipsOf(partPath)) {
            if (id.equals(rel.id())) return rel;
        }
        return null;
    }

    /** First relationship of the given type suffix, or null. */
    public Relationship firstOfType(String partPath, String typeSuffix) {
        for (Relationship rel : relationshipsOf(partPath)) {
            if (rel.isType(typeSuffix)) return rel;
        }
        return null;
    }

    private List<Relationship> loadRelationships(String source) {
        String relsPath = relsPathFor(source);
        byte[] data = parts.get(relsPath);
        if (data == null) return List.of();

        Document doc = XmlDom.parse(data, relsPath);
        List<Relationship> out = new ArrayList<>();
        for (Element rel : XmlDom.children(doc.getDocumentElement(), "Relationship")) {
            String target = XmlDom.attr(rel, "Target");
            if (target == null) continue;
            boolean external = "External".equals(XmlDom.attr(rel, "TargetMode"));
            out.add(new Relationship(
                    XmlDom.attr(rel, "Id"),
                    XmlDom.attr(rel, "Type"),
                    external ? target : resolveTarget(source, target),
                    external
            ));
        }
        return Collections.unmodifiableList(out);
    }

    static String relsPathFor(String source) {
        if (source.isEmpty()) return "_rels/.rels";
        int slash = source.lastIndexOf('/');
        String dir = slash < 0 ? "" : source.substring(0, slash + 1);
        String file = source.substring(slash + 1);
        return dir + "_rels/" + file + ".rels";
    }

    /**
     * Resolves a relationship target against its source part: absolute targets are taken
     * from the package root, relative ones from the source's directory.
     */
    static String resolveTarget(String source, String target) {
        if (target.startsWith("/")) return normalize(target);
        int slash = source.lastIndexOf('/');
        String base = slash < 0 ? "" : source.substring(0, slash + 1);

        Deque<String> segments = new ArrayDeque<>();
        for (String seg : (base + target).split("/")) {
            if (seg.isEmpty() || ".".equals(seg)) continue;
            if ("..".equals(seg)) {
                if (!segments.isEmpty()) segments.removeLast();
            } else {
                segments.addLast(seg);
            }
        }
        return String.join("/", segments);
    }

    static String normalize(String path) {
        if (path == null) return "";
        String p = path.replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }
}
