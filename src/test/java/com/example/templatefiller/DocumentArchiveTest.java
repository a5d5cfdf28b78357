package com.example.templatefiller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.example.templatefiller.TestDocuments.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentArchiveTest {

    private static byte[] simpleDocx() {
        return docx().body(paragraph(run("Hello {{NAME}}"))).header(paragraph(run("Header"))).build();
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        void findsMainDocumentThroughPackageRelationships() {
            DocumentArchive archive = DocumentArchive.open(simpleDocx());

            assertThat(archive.mainDocumentPart()).isEqualTo("word/document.xml");
            assertThat(archive.partNames()).contains("word/document.xml", "word/styles.xml", "word/header1.xml");
            assertThat(archive.contentTypeOf("/word/document.xml"))
                    .hasValue("application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml");
            assertThat(archive.contentTypeOf("word/_rels/document.xml.rels"))
                    .hasValue("application/vnd.openxmlformats-package.relationships+xml");
        }

        @Test
        void rejectsEmptyAndNonZipInput() {
            assertThatThrownBy(() -> DocumentArchive.open(new byte[0])).isInstanceOf(CorruptArchiveException.class);
            assertThatThrownBy(() -> DocumentArchive.open("not a zip at all".getBytes(StandardCharsets.UTF_8)))
                    .isInstanceOf(CorruptArchiveException.class);
        }

        @Test
        void rejectsPackageWithoutContentTypes() {
            Map<String, byte[]> parts = unzip(simpleDocx());
            parts.remove(DocumentArchive.CONTENT_TYPES);

            assertThatThrownBy(() -> DocumentArchive.open(zip(parts)))
                    .isInstanceOf(CorruptArchiveException.class)
                    .hasMessageContaining("[Content_Types].xml");
        }

        @Test
        void rejectsPackageWithoutMainDocument() {
            Map<String, byte[]> parts = unzip(simpleDocx());
            parts.remove("word/document.xml");

            assertThatThrownBy(() -> DocumentArchive.open(zip(parts)))
                    .isInstanceOf(CorruptArchiveException.class)
                    .hasMessageContaining("word/document.xml");
        }

        @Test
        void rejectsMalformedXmlPart() {
            Map<String, byte[]> parts = unzip(simpleDocx());
            parts.put("word/document.xml", "<w:document><w:body>".getBytes(StandardCharsets.UTF_8));
            DocumentArchive archive = DocumentArchive.open(zip(parts));

            assertThatThrownBy(() -> archive.readXmlPart("word/document.xml"))
                    .isInstanceOf(CorruptArchiveException.class)
                    .hasMessageContaining("word/document.xml");
        }
    }

    @Nested
    @DisplayName("serialize")
    class Serialize {

        @Test
        void untouchedArchiveKeepsEveryPartByteForByte() {
            byte[] input = simpleDocx();

            byte[] output = DocumentArchive.open(input).serialize();

            Map<String, byte[]> before = unzip(input);
            Map<String, byte[]> after = unzip(output);
            assertThat(after.keySet()).containsExactlyElementsOf(before.keySet());
            before.forEach((name, bytes) -> assertThat(after.get(name)).as(name).isEqualTo(bytes));
        }

        @Test
        void onlyWrittenPartsChange() {
            byte[] input = simpleDocx();
            DocumentArchive archive = DocumentArchive.open(input);
            byte[] newDocument = "<w:document xmlns:w=\"x\"/>".getBytes(StandardCharsets.UTF_8);

            archive.setPart("/word/document.xml", newDocument);
            Map<String, byte[]> after = unzip(archive.serialize());

            assertThat(archive.dirtyParts()).containsExactly("word/document.xml");
            assertThat(after.get("word/document.xml")).isEqualTo(newDocument);
            Map<String, byte[]> before = unzip(input);
            for (String name : before.keySet()) {
                if (!name.equals("word/document.xml")) assertThat(after.get(name)).as(name).isEqualTo(before.get(name));
            }
        }
    }

    @Nested
    @DisplayName("media and relationships")
    class Media {

        @Test
        void addsMediaUnderFreshNameAndRegistersExtension() {
            DocumentArchive archive = DocumentArchive.open(simpleDocx());
            byte[] png = png(4, 2);

            String first = archive.addMediaPart(png, "image/png");
            String second = archive.addMediaPart(png, "image/png");

            assertThat(first).isEqualTo("word/media/image1.png");
            assertThat(second).isEqualTo("word/media/image2.png");
            assertThat(archive.getPart(first)).hasValueSatisfying(b -> assertThat(b).isEqualTo(png));
            assertThat(archive.contentTypeOf(first)).hasValue("image/png");
            assertThat(archive.dirtyParts()).contains(first, second, DocumentArchive.CONTENT_TYPES);

            String types = new String(unzip(archive.serialize()).get(DocumentArchive.CONTENT_TYPES), StandardCharsets.UTF_8);
            assertThat(types.indexOf("Extension=\"png\"")).isGreaterThan(0).isLessThan(types.indexOf("<Override"));
            assertThat(types.split("Extension=\"png\"", -1)).hasSize(2);
        }

        @Test
        void relationshipIdsAreUniqueWithinTheList() {
            DocumentArchive archive = DocumentArchive.open(simpleDocx());
            String media = archive.addMediaPart(png(1, 1), "image/png");

            String id1 = archive.addRelationship("word/document.xml", media, DocumentArchive.REL_IMAGE);
            String id2 = archive.addRelationship("word/document.xml", media, DocumentArchive.REL_IMAGE);

            assertThat(id1).isEqualTo("rId3");
            assertThat(id2).isEqualTo("rId4");
            assertThat(archive.relationships("word/document.xml"))
                    .filteredOn(r -> r.id.equals(id1))
                    .singleElement()
                    .satisfies(r -> assertThat(r.target).isEqualTo("media/image1.png"));
            assertThat(archive.partsRelatedBy("word/document.xml", DocumentArchive.REL_IMAGE))
                    .containsExactly(media, media);
        }

        @Test
        void createsRelationshipPartWhenSourceHasNone() {
            DocumentArchive archive = DocumentArchive.open(simpleDocx());
            String media = archive.addMediaPart(png(1, 1), "image/png");

            String id = archive.addRelationship("word/header1.xml", media, DocumentArchive.REL_IMAGE);

            assertThat(id).isEqualTo("rId1");
            Map<String, byte[]> after = unzip(archive.serialize());
            assertThat(new String(after.get("word/_rels/header1.xml.rels"), StandardCharsets.UTF_8))
                    .contains("Target=\"media/image1.png\"");
        }

        @Test
        void listsHeadersRelatedToTheMainDocument() {
            DocumentArchive archive = DocumentArchive.open(simpleDocx());

            assertThat(archive.partsRelatedBy("word/document.xml", DocumentArchive.REL_HEADER))
                    .containsExactly("word/header1.xml");
            assertThat(archive.partsRelatedBy("word/document.xml", DocumentArchive.REL_FOOTER)).isEmpty();
        }
    }

    @Test
    void resolvesAndRelativizesPartNames() {
        assertThat(DocumentArchive.resolveTarget("word/document.xml", "media/image1.png")).isEqualTo("word/media/image1.png");
        assertThat(DocumentArchive.resolveTarget("word/document.xml", "../customXml/item1.xml")).isEqualTo("customXml/item1.xml");
        assertThat(DocumentArchive.resolveTarget("", "/word/document.xml")).isEqualTo("word/document.xml");
        assertThat(DocumentArchive.relativize("word/document.xml", "word/media/image1.png")).isEqualTo("media/image1.png");
        assertThat(DocumentArchive.relativize("word/glossary/document.xml", "word/media/image1.png")).isEqualTo("../media/image1.png");
        assertThat(DocumentArchive.relativize("", "word/document.xml")).isEqualTo("word/document.xml");
        assertThat(DocumentArchive.relationshipsPartOf("word/document.xml")).isEqualTo("word/_rels/document.xml.rels");
    }

    @Test
    void rejectsUnsupportedMediaType() {
        DocumentArchive archive = DocumentArchive.open(simpleDocx());

        assertThatThrownBy(() -> archive.addMediaPart(new byte[]{1}, "image/svg+xml"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
