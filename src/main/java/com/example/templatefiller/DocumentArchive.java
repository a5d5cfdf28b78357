package com.example.templatefiller;

import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.apache.xmlbeans.XmlOptions;

import javax.xml.namespace.QName;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * A Word package held in memory as a map from part name to bytes. Parts that are never written to come out of
 * {@link #serialize()} with exactly the bytes they went in with; relationship and content-type parts
 * are re-generated only when something was added to them.
 */
@Slf4j
public final class DocumentArchive {

    public static final String CONTENT_TYPES = "[Content_Types].xml";
    public static final String PACKAGE_RELS = "_rels/.rels";

    private static final String NS_RELS = "http://schemas.openxmlformats.org/package/2006/relationships";
    private static final String NS_CT   = "http://schemas.openxmlformats.org/package/2006/content-types";
    private static final String NS_REL_TYPES = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/";
    private static final String NS_REL_TYPES_STRICT = "http://purl.oclc.org/ooxml/officeDocument/relationships/";

    public static final String REL_OFFICE_DOCUMENT = NS_REL_TYPES + "officeDocument";
    public static final String REL_IMAGE     = NS_REL_TYPES + "image";
    public static final String REL_HEADER    = NS_REL_TYPES + "header";
    public static final String REL_FOOTER    = NS_REL_TYPES + "footer";
    public static final String REL_FOOTNOTES = NS_REL_TYPES + "footnotes";
    public static final String REL_ENDNOTES  = NS_REL_TYPES + "endnotes";

    private static final QName QN_RELATIONSHIP = new QName(NS_RELS, "Relationship");
    private static final QName QN_DEFAULT      = new QName(NS_CT, "Default");
    private static final QName QN_OVERRIDE     = new QName(NS_CT, "Override");
    private static final QName QN_ID           = new QName("Id");
    private static final QName QN_TYPE         = new QName("Type");
    private static final QName QN_TARGET       = new QName("Target");
    private static final QName QN_TARGET_MODE  = new QName("TargetMode");
    private static final QName QN_EXTENSION    = new QName("Extension");
    private static final QName QN_PART_NAME    = new QName("PartName");
    private static final QName QN_CONTENT_TYPE = new QName("ContentType");

    private static final Map<String, String> EXTENSION_BY_MIME = Map.of(
            "image/png", "png",
            "image/jpeg", "jpeg",
            "image/gif", "gif",
            "image/bmp", "bmp",
            "image/tiff", "tiff");

    /** One entry of a part's relationship list. */
    public static final class Relationship {
        public final String id;
        public final String type;
        public final String target;
        public final boolean external;

        Relationship(String id, String type, String target, boolean external) {
            this.id = id; this.type = type; this.target = target; this.external = external;
        }
    }

    private final Map<String, byte[]> parts;
    private final Set<String> dirty = new LinkedHashSet<>();
    private final Map<String, XmlObject> relationshipModels = new HashMap<>();
    private final Set<String> dirtyModels = new HashSet<>();
    private final XmlObject contentTypes;
    private final String mainDocumentPart;

    private DocumentArchive(Map<String, byte[]> parts) {
        this.parts = parts;
        if (!parts.containsKey(CONTENT_TYPES)) throw new CorruptArchiveException("Missing " + CONTENT_TYPES);
        if (!parts.containsKey(PACKAGE_RELS)) throw new CorruptArchiveException("Missing " + PACKAGE_RELS);
        this.contentTypes = parseXml(parts.get(CONTENT_TYPES), CONTENT_TYPES);
        this.mainDocumentPart = findMainDocument();
    }

    /** Reads a package. The input array is never modified. */
    public static DocumentArchive open(byte[] bytes) {
        if (bytes == null || bytes.length == 0) throw new CorruptArchiveException("Template is empty");
        Map<String, byte[]> parts = new LinkedHashMap<>();
        try (ZipInputStream zin = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry e;
            while ((e = zin.getNextEntry()) != null) {
                if (e.isDirectory()) continue;
                String name = stripLeadingSlash(e.getName());
                if (parts.put(name, zin.readAllBytes()) != null) {
                    throw new CorruptArchiveException("Duplicate zip entry: " + name);
                }
            }
        } catch (ZipException e) {
            throw new CorruptArchiveException("Not a zip archive: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CorruptArchiveException("Cannot read archive: " + e.getMessage(), e);
        }
        if (parts.isEmpty()) throw new CorruptArchiveException("Not a zip archive or archive has no entries");

        DocumentArchive archive = new DocumentArchive(parts);
        log.debug("opened archive: {} parts, main document {}", parts.size(), archive.mainDocumentPart);
        return archive;
    }

    public String mainDocumentPart() { return mainDocumentPart; }

    Set<String> partNames() { return Collections.unmodifiableSet(parts.keySet()); }

    boolean hasPart(String path) { return parts.containsKey(stripLeadingSlash(path)); }

    Optional<byte[]> getPart(String path) {
        return Optional.ofNullable(parts.get(stripLeadingSlash(path)));
    }

    /** Adds or replaces a part and marks it for writing. */
    public void setPart(String path, byte[] bytes) {
        String p = stripLeadingSlash(path);
        parts.put(p, Objects.requireNonNull(bytes, "bytes"));
        dirty.add(p);
    }

    /** Parts written through this archive since it was opened. */
    public Set<String> dirtyParts() {
        Set<String> all = new LinkedHashSet<>(dirty);
        all.addAll(dirtyModels);
        return Collections.unmodifiableSet(all);
    }

    /**
     * Stores image bytes under a fresh name in the main document's media folder and registers the
     * extension's content type when the package does not know it yet.
     *
     * @return the new part path
     */
    public String addMediaPart(byte[] bytes, String mimeType) {
        String ext = EXTENSION_BY_MIME.get(mimeType);
        if (ext == null) throw new IllegalArgumentException("Unsupported media type: " + mimeType);

        String mediaDir = directoryOf(mainDocumentPart) + "media/";
        String path;
        int n = 1;
        do { path = mediaDir + "image" + n++ + "." + ext; } while (parts.containsKey(path));

        setPart(path, bytes);
        ensureDefaultContentType(ext, mimeType);
        return path;
    }

    /**
     * Appends a relationship from {@code fromPart} to {@code targetPart}.
     *
     * @return the relationship id, unique within the source part's list
     */
    public String addRelationship(String fromPart, String targetPart, String type) {
        String source = stripLeadingSlash(fromPart);
        String relsPath = relationshipsPartOf(source);
        XmlObject rels = relationshipModel(source);

        Set<String> used = new HashSet<>();
        int max = 0;
        for (Relationship r : readRelationships(rels)) {
            used.add(r.id);
            if (r.id.startsWith("rId")) {
                try { max = Math.max(max, Integer.parseInt(r.id.substring(3))); } catch (NumberFormatException ignore) { /* non-numeric id */ }
            }
        }
        String id;
        do { id = "rId" + ++max; } while (used.contains(id));

        try (XmlCursor c = rels.newCursor()) {
            c.toFirstChild();
            c.toEndToken();
            c.beginElement(QN_RELATIONSHIP);
            c.insertAttributeWithValue(QN_ID, id);
            c.insertAttributeWithValue(QN_TYPE, type);
            c.insertAttributeWithValue(QN_TARGET, relativize(source, stripLeadingSlash(targetPart)));
        }
        dirtyModels.add(relsPath);
        return id;
    }

    List<Relationship> relationships(String fromPart) {
        return readRelationships(relationshipModel(stripLeadingSlash(fromPart)));
    }

    /** Absolute part paths related from {@code fromPart} with the given type, in list order. */
    public List<String> partsRelatedBy(String fromPart, String type) {
        String source = stripLeadingSlash(fromPart);
        List<String> out = new ArrayList<>();
        for (Relationship r : relationships(source)) {
            if (r.external || !sameRelationshipType(r.type, type)) continue;
            String target = resolveTarget(source, r.target);
            if (parts.containsKey(target)) out.add(target);
            else log.warn("relationship {} of {} points at missing part {}", r.id, source, target);
        }
        return out;
    }

    /** Content type of a part from its Override, falling back to the Default of its extension. */
    Optional<String> contentTypeOf(String path) {
        String partName = "/" + stripLeadingSlash(path);
        String ext = extensionOf(partName);
        String byDefault = null;
        try (XmlCursor c = contentTypes.newCursor()) {
            c.toFirstChild();
            if (c.toFirstChild()) {
                do {
                    if (QN_OVERRIDE.equals(c.getName()) && partName.equalsIgnoreCase(c.getAttributeText(QN_PART_NAME))) {
                        return Optional.ofNullable(c.getAttributeText(QN_CONTENT_TYPE));
                    }
                    if (QN_DEFAULT.equals(c.getName()) && ext.equalsIgnoreCase(c.getAttributeText(QN_EXTENSION))) {
                        byDefault = c.getAttributeText(QN_CONTENT_TYPE);
                    }
                } while (c.toNextSibling());
            }
        }
        return Optional.ofNullable(byDefault);
    }

    /** Re-packs the archive: original entries in their original order, new parts last. */
    public byte[] serialize() {
        for (String relsPath : dirtyModels) {
            XmlObject model = CONTENT_TYPES.equals(relsPath) ? contentTypes : relationshipModels.get(relsPath);
            parts.put(relsPath, toBytes(model));
        }
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ZipOutputStream zout = new ZipOutputStream(bos)) {
            for (Map.Entry<String, byte[]> e : parts.entrySet()) {
                zout.putNextEntry(new ZipEntry(e.getKey()));
                zout.write(e.getValue());
                zout.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write archive", e);
        }
        return bos.toByteArray();
    }

    // ===== relationships & content types =====

    private String findMainDocument() {
        for (Relationship r : relationships("")) {
            if (!r.external && sameRelationshipType(r.type, REL_OFFICE_DOCUMENT)) {
                String target = resolveTarget("", r.target);
                if (!parts.containsKey(target)) throw new CorruptArchiveException("Main document part missing: " + target);
                return target;
            }
        }
        throw new CorruptArchiveException("No main document relationship in " + PACKAGE_RELS);
    }

    private XmlObject relationshipModel(String sourcePart) {
        String relsPath = relationshipsPartOf(sourcePart);
        XmlObject model = relationshipModels.get(relsPath);
        if (model == null) {
            byte[] raw = parts.get(relsPath);
            if (raw != null) {
                model = parseXml(raw, relsPath);
            } else {
                try {
                    model = XmlObject.Factory.parse("<Relationships xmlns=\"" + NS_RELS + "\"/>");
                } catch (XmlException e) {
                    throw new IllegalStateException(e);
                }
            }
            relationshipModels.put(relsPath, model);
        }
        return model;
    }

    private static List<Relationship> readRelationships(XmlObject rels) {
        List<Relationship> out = new ArrayList<>();
        try (XmlCursor c = rels.newCursor()) {
            if (!c.toFirstChild() || !c.toFirstChild()) return out;
            do {
                if (!QN_RELATIONSHIP.equals(c.getName())) continue;
                out.add(new Relationship(
                        c.getAttributeText(QN_ID),
                        c.getAttributeText(QN_TYPE),
                        c.getAttributeText(QN_TARGET),
                        "External".equals(c.getAttributeText(QN_TARGET_MODE))));
            } while (c.toNextSibling());
        }
        return out;
    }

    private void ensureDefaultContentType(String ext, String mimeType) {
        try (XmlCursor c = contentTypes.newCursor()) {
            c.toFirstChild();
            XmlObject root = c.getObject();
            if (c.toFirstChild()) {
                do {
                    if (QN_DEFAULT.equals(c.getName()) && ext.equalsIgnoreCase(c.getAttributeText(QN_EXTENSION))) return;
                } while (c.toNextSibling());
            }
            try (XmlCursor ins = root.newCursor()) {
                // Defaults come before Overrides
                if (ins.toFirstChild()) {
                    while (QN_DEFAULT.equals(ins.getName())) {
                        if (!ins.toNextSibling()) { ins.toParent(); ins.toEndToken(); break; }
                    }
                } else {
                    ins.toEndToken();
                }
                ins.beginElement(QN_DEFAULT);
                ins.insertAttributeWithValue(QN_EXTENSION, ext);
                ins.insertAttributeWithValue(QN_CONTENT_TYPE, mimeType);
            }
        }
        dirtyModels.add(CONTENT_TYPES);
    }

    private static boolean sameRelationshipType(String actual, String expected) {
        if (actual == null) return false;
        if (actual.equals(expected)) return true;
        return expected.startsWith(NS_REL_TYPES)
                && actual.equals(NS_REL_TYPES_STRICT + expected.substring(NS_REL_TYPES.length()));
    }

    // ===== part names =====

    static String relationshipsPartOf(String sourcePart) {
        if (sourcePart.isEmpty()) return PACKAGE_RELS;
        int slash = sourcePart.lastIndexOf('/');
        return sourcePart.substring(0, slash + 1) + "_rels/" + sourcePart.substring(slash + 1) + ".rels";
    }

    static String directoryOf(String part) {
        int slash = part.lastIndexOf('/');
        return slash < 0 ? "" : part.substring(0, slash + 1);
    }

    /** Absolute part path of a relationship target given relative to {@code sourcePart}. */
    static String resolveTarget(String sourcePart, String target) {
        if (target.startsWith("/")) return normalize(target.substring(1));
        return normalize(directoryOf(sourcePart) + target);
    }

    /** Relationship target for {@code targetPart} as seen from {@code sourcePart}. */
    static String relativize(String sourcePart, String targetPart) {
        String[] from = directoryOf(sourcePart).split("/");
        String[] to = targetPart.split("/");
        int fromLen = directoryOf(sourcePart).isEmpty() ? 0 : from.length;
        int common = 0;
        while (common < fromLen && common < to.length - 1 && from[common].equals(to[common])) common++;
        StringBuilder sb = new StringBuilder();
        for (int i = common; i < fromLen; i++) sb.append("../");
        for (int i = common; i < to.length; i++) {
            sb.append(to[i]);
            if (i < to.length - 1) sb.append('/');
        }
        return sb.toString();
    }

    private static String normalize(String path) {
        Deque<String> segs = new ArrayDeque<>();
        for (String s : path.split("/")) {
            if (s.isEmpty() || ".".equals(s)) continue;
            if ("..".equals(s)) { if (!segs.isEmpty()) segs.removeLast(); }
            else segs.addLast(s);
        }
        return String.join("/", segs);
    }

    private static String stripLeadingSlash(String path) {
        return path != null && path.startsWith("/") ? path.substring(1) : path;
    }

    private static String extensionOf(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 || dot < path.lastIndexOf('/') ? "" : path.substring(dot + 1);
    }

    // ===== xml =====

    /** Parses an XML part of the package; a part that is not well-formed makes the package corrupt. */
    public XmlObject readXmlPart(String path) {
        String p = stripLeadingSlash(path);
        byte[] raw = parts.get(p);
        if (raw == null) throw new CorruptArchiveException("Missing part " + p);
        return parseXml(raw, p);
    }

    static XmlObject parseXml(byte[] bytes, String partName) {
        XmlOptions options = new XmlOptions();
        options.setDisallowDocTypeDeclaration(true);
        try (ByteArrayInputStream in = new ByteArrayInputStream(bytes)) {
            return XmlObject.Factory.parse(in, options);
        } catch (XmlException | IOException e) {
            throw new CorruptArchiveException("Cannot parse part " + partName + ": " + e.getMessage(), e);
        }
    }

    static byte[] toBytes(XmlObject xml) {
        XmlOptions options = new XmlOptions();
        options.setCharacterEncoding("UTF-8");
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            xml.save(bos, options);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }
}
