package com.example.templatefiller;

import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.IntSupplier;

/**
 * Fills {@code {{NAME}}} placeholders of a Word template with text and images. Every call works on
 * its own in-memory copy of the package, so the service holds no state and calls may run in
 * parallel. Any failure aborts the whole fill; no partially filled document is ever returned.
 */
@Slf4j
@Service
public class TemplateFiller {

    private static final List<String> TEXT_PART_RELATIONS = List.of(
            DocumentArchive.REL_HEADER,
            DocumentArchive.REL_FOOTER,
            DocumentArchive.REL_FOOTNOTES,
            DocumentArchive.REL_ENDNOTES);

    public FillResult fill(byte[] template, Map<String, String> placeholders, Map<String, String> images) {
        long t0 = System.currentTimeMillis();
        FillRun run = new FillRun(DocumentArchive.open(template),
                placeholders == null ? Map.of() : placeholders,
                images == null ? Map.of() : images);

        for (String part : textParts(run.archive)) run.fillPart(part);

        byte[] out = run.archive.serialize();
        if (!run.unresolved.isEmpty()) log.warn("unresolved placeholders left as text: {}", run.unresolved);
        log.info("filled template: {} -> {} bytes, {} text, {} images, {} unresolved, parts {} ({} ms)",
                template.length, out.length, run.textReplacements, run.imagesInjected, run.unresolved.size(),
                run.archive.dirtyParts(), System.currentTimeMillis() - t0);
        return new FillResult(out, run.unresolved, run.textReplacements, run.imagesInjected, run.archive.dirtyParts());
    }

    /** Names of all placeholders in a template, in document order. */
    public Set<String> placeholders(byte[] template) {
        DocumentArchive archive = DocumentArchive.open(template);
        Set<String> names = new LinkedHashSet<>();
        for (String part : textParts(archive)) {
            XmlObject xml = archive.readXmlPart(part);
            for (XmlObject p : ParagraphCodec.paragraphs(xml)) {
                names.addAll(TokenScanner.placeholderNames(ParagraphCodec.parse(p)));
            }
        }
        return names;
    }

    /** Main document first, then headers, footers, footnotes and endnotes it relates to. */
    static List<String> textParts(DocumentArchive archive) {
        String main = archive.mainDocumentPart();
        List<String> parts = new ArrayList<>();
        parts.add(main);
        for (String type : TEXT_PART_RELATIONS) {
            for (String p : archive.partsRelatedBy(main, type)) {
                if (!parts.contains(p)) parts.add(p);
            }
        }
        return parts;
    }

    /** State of one fill call. */
    private static final class FillRun {
        final DocumentArchive archive;
        final Map<String, String> values;
        final Map<String, String> images;
        final Map<String, ImageInjector.DecodedImage> decoded = new HashMap<>();
        final Set<String> unresolved = new TreeSet<>();
        int textReplacements;
        int imagesInjected;

        FillRun(DocumentArchive archive, Map<String, String> values, Map<String, String> images) {
            this.archive = archive; this.values = values; this.images = images;
        }

        void fillPart(String part) {
            XmlObject xml = archive.readXmlPart(part);
            int[] lastDrawingId = {ParagraphCodec.maxDrawingId(xml)};
            IntSupplier drawingIds = () -> ++lastDrawingId[0];

            List<XmlObject> paragraphs = ParagraphCodec.paragraphs(xml);
            boolean changed = false;
            // innermost first: a picture replacing a paragraph's runs may drop text boxes nested in them
            for (int i = paragraphs.size() - 1; i >= 0; i--) {
                FormattedContainer<XmlObject> c = ParagraphCodec.parse(paragraphs.get(i));
                fillContainer(c, part, drawingIds);
                changed |= ParagraphCodec.serialize(c);
            }
            if (changed) {
                archive.setPart(part, DocumentArchive.toBytes(xml));
                log.debug("rewrote {} ({} paragraphs)", part, paragraphs.size());
            }
        }

        void fillContainer(FormattedContainer<XmlObject> c, String part, IntSupplier drawingIds) {
            List<TokenMatch> matches = TokenScanner.scan(c);
            if (matches.isEmpty()) return;

            for (TokenMatch m : matches) {
                Optional<ImageSlot> slot = ImageSlot.forToken(m.name);
                String payload = images.get(m.name);
                if (slot.isEmpty() || payload == null) continue;

                ImageInjector.DecodedImage img = decoded.get(m.name);
                if (img == null) {
                    img = ImageInjector.decode(m.name, payload);
                    decoded.put(m.name, img);
                }
                ImageInjector.inject(c, m, slot.get(), img, archive, part, drawingIds);
                imagesInjected++;
                return;
            }
            textReplacements += TextSubstitution.substituteAll(c, values, unresolved);
        }
    }
}
