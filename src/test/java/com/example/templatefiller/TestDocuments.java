package com.example.templatefiller;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/** Builds small Word packages in memory for tests. */
final class TestDocuments {
    private TestDocuments() {}

    static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final String NS_R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    static final String NS_WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    static final String NS_PKG_RELS = "http://schemas.openxmlformats.org/package/2006/relationships";

    static final String STYLES_XML = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
            + "<w:styles xmlns:w=\"" + NS_W + "\"><w:style w:type=\"paragraph\" w:default=\"1\" w:styleId=\"Normal\">"
            + "<w:name w:val=\"Normal\"/></w:style></w:styles>";

    static String run(String text) {
        return "<w:r><w:t xml:space=\"preserve\">" + escape(text) + "</w:t></w:r>";
    }

    static String boldRun(String text) {
        return "<w:r><w:rPr><w:b/></w:rPr><w:t xml:space=\"preserve\">" + escape(text) + "</w:t></w:r>";
    }

    static String colorRun(String text, String hex) {
        return "<w:r><w:rPr><w:color w:val=\"" + hex + "\"/></w:rPr><w:t xml:space=\"preserve\">" + escape(text) + "</w:t></w:r>";
    }

    /** A run holding a complex field character; opaque to the scanner. */
    static String fieldRun() {
        return "<w:r><w:fldChar w:fldCharType=\"begin\"/></w:r>";
    }

    static String paragraph(String... runs) {
        return "<w:p>" + String.join("", runs) + "</w:p>";
    }

    static String table(String... cellParagraphs) {
        StringBuilder sb = new StringBuilder("<w:tbl><w:tr>");
        for (String p : cellParagraphs) sb.append("<w:tc>").append(p).append("</w:tc>");
        return sb.append("</w:tr></w:tbl>").toString();
    }

    static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static Builder docx() {
        return new Builder();
    }

    static final class Builder {
        private String body = "";
        private String header;
        private String footer;

        Builder body(String... blocks) { this.body = String.join("", blocks); return this; }

        Builder header(String... paragraphs) { this.header = String.join("", paragraphs); return this; }

        Builder footer(String... paragraphs) { this.footer = String.join("", paragraphs); return this; }

        byte[] build() {
            Map<String, String> parts = new LinkedHashMap<>();
            StringBuilder ct = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
                    + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
                    + "<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
                    + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
                    + "<Override PartName=\"/word/document.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/>"
                    + "<Override PartName=\"/word/styles.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.styles+xml\"/>");
            if (header != null) ct.append("<Override PartName=\"/word/header1.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.header+xml\"/>");
            if (footer != null) ct.append("<Override PartName=\"/word/footer1.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.footer+xml\"/>");
            ct.append("</Types>");
            parts.put(DocumentArchive.CONTENT_TYPES, ct.toString());

            parts.put(DocumentArchive.PACKAGE_RELS, "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
                    + "<Relationships xmlns=\"" + NS_PKG_RELS + "\">"
                    + "<Relationship Id=\"rId1\" Type=\"" + DocumentArchive.REL_OFFICE_DOCUMENT + "\" Target=\"word/document.xml\"/>"
                    + "</Relationships>");

            StringBuilder sect = new StringBuilder("<w:sectPr>");
            if (header != null) sect.append("<w:headerReference w:type=\"default\" r:id=\"rId2\"/>");
            if (footer != null) sect.append("<w:footerReference w:type=\"default\" r:id=\"rId3\"/>");
            sect.append("<w:pgSz w:w=\"12240\" w:h=\"15840\"/></w:sectPr>");

            parts.put("word/document.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
                    + "<w:document xmlns:w=\"" + NS_W + "\" xmlns:r=\"" + NS_R + "\"><w:body>" + body + sect + "</w:body></w:document>");

            StringBuilder rels = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
                    + "<Relationships xmlns=\"" + NS_PKG_RELS + "\">"
                    + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/styles\" Target=\"styles.xml\"/>");
            if (header != null) rels.append("<Relationship Id=\"rId2\" Type=\"" + DocumentArchive.REL_HEADER + "\" Target=\"header1.xml\"/>");
            if (footer != null) rels.append("<Relationship Id=\"rId3\" Type=\"" + DocumentArchive.REL_FOOTER + "\" Target=\"footer1.xml\"/>");
            rels.append("</Relationships>");
            parts.put("word/_rels/document.xml.rels", rels.toString());
            parts.put("word/styles.xml", STYLES_XML);

            if (header != null) {
                parts.put("word/header1.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
                        + "<w:hdr xmlns:w=\"" + NS_W + "\" xmlns:r=\"" + NS_R + "\">" + header + "</w:hdr>");
            }
            if (footer != null) {
                parts.put("word/footer1.xml", "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\r\n"
                        + "<w:ftr xmlns:w=\"" + NS_W + "\" xmlns:r=\"" + NS_R + "\">" + footer + "</w:ftr>");
            }

            Map<String, byte[]> raw = new LinkedHashMap<>();
            parts.forEach((k, v) -> raw.put(k, v.getBytes(StandardCharsets.UTF_8)));
            return zip(raw);
        }
    }

    static byte[] zip(Map<String, byte[]> entries) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ZipOutputStream zout = new ZipOutputStream(bos)) {
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                zout.putNextEntry(new ZipEntry(e.getKey()));
                zout.write(e.getValue());
                zout.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    static Map<String, byte[]> unzip(byte[] zip) {
        Map<String, byte[]> out = new LinkedHashMap<>();
        try (ZipInputStream zin = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry e;
            while ((e = zin.getNextEntry()) != null) out.put(e.getName(), zin.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    static String partText(byte[] docx, String part) {
        return new String(unzip(docx).get(part), StandardCharsets.UTF_8);
    }

    static byte[] png(int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.ORANGE);
        g.fillRect(0, 0, width, height);
        g.dispose();
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            ImageIO.write(img, "png", bos);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    static String base64Png(int width, int height) {
        return Base64.getEncoder().encodeToString(png(width, height));
    }
}
