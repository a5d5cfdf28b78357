package com.example.templatefiller;

import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;

import javax.xml.namespace.QName;
import java.util.*;

/**
 * Binds {@code <w:p>} elements to {@link FormattedContainer}s. The formatting of a run is the live
 * {@code <w:r>} node itself; derived runs are written as copies of it with the text payload swapped.
 * Runs holding anything besides text (drawings, fields, references) are anchored and never split.
 */
public final class ParagraphCodec {
    private ParagraphCodec() {}

    private static final String NS_W   = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    private static final String NS_WP  = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    private static final String NS_A   = "http://schemas.openxmlformats.org/drawingml/2006/main";
    private static final String NS_PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    private static final String NS_R   = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    private static final QName QN_W_R      = new QName(NS_W, "r");
    private static final QName QN_W_T      = new QName(NS_W, "t");
    private static final QName QN_W_TAB    = new QName(NS_W, "tab");
    private static final QName QN_W_BR     = new QName(NS_W, "br");
    private static final QName QN_W_TYPE   = new QName(NS_W, "type");
    private static final QName QN_W_NB_HYPHEN   = new QName(NS_W, "noBreakHyphen");
    private static final QName QN_W_SOFT_HYPHEN = new QName(NS_W, "softHyphen");
    private static final QName QN_XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");
    private static final QName QN_ID = new QName("id");

    /** Run children that carry text; everything else except rPr makes a run anchored. */
    private static final Set<String> PAYLOAD = Set.of(
            "t", "tab", "br", "cr", "noBreakHyphen", "softHyphen", "lastRenderedPageBreak");

    /** Paragraph children whose runs count as the paragraph's own; {@code del} and {@code sdtPr} are not among them. */
    private static final Set<String> RUN_WRAPPERS = Set.of(
            "hyperlink", "ins", "moveTo", "smartTag", "customXml", "sdt", "sdtContent", "fldSimple", "dir", "bdo");

    /** All paragraphs of a part in document order, nested ones (tables, text boxes) included. */
    public static List<XmlObject> paragraphs(XmlObject part) {
        List<XmlObject> out = new ArrayList<>();
        try (XmlCursor c = part.newCursor()) {
            c.selectPath("declare namespace w='" + NS_W + "' .//w:p");
            while (c.toNextSelection()) out.add(c.getObject());
        }
        return out;
    }

    /**
     * Runs of a paragraph in document order. Runs inside hyperlinks, inserted revisions, smart tags,
     * inline content controls and simple fields belong to the paragraph too; deleted revisions do not.
     */
    public static FormattedContainer<XmlObject> parse(XmlObject paragraph) {
        List<Run<XmlObject>> runs = new ArrayList<>();
        collectRuns(paragraph, runs);
        return new FormattedContainer<>(runs);
    }

    private static void collectRuns(XmlObject parent, List<Run<XmlObject>> runs) {
        try (XmlCursor c = parent.newCursor()) {
            if (!c.toFirstChild()) return;
            do {
                QName n = c.getName();
                if (QN_W_R.equals(n)) {
                    XmlObject r = c.getObject();
                    int idx = runs.size();
                    runs.add(isAnchoredRun(r) ? Run.anchor(r, idx) : Run.of(runText(r), r, idx));
                } else if (n != null && NS_W.equals(n.getNamespaceURI()) && RUN_WRAPPERS.contains(n.getLocalPart())) {
                    collectRuns(c.getObject(), runs);
                }
            } while (c.toNextSibling());
        }
    }

    /**
     * Writes a changed container back into its paragraph: derived runs go in front of the run they
     * were cut from, runs that are gone are removed. Other paragraph children stay in place.
     *
     * @return whether the paragraph was touched
     */
    public static boolean serialize(FormattedContainer<XmlObject> container) {
        if (!container.isModified()) return false;

        Set<Run<XmlObject>> kept = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Run<XmlObject> r : container.runs()) {
            if (r.derived) writeDerivedRun(r);
            else kept.add(r);
        }
        for (Run<XmlObject> r : container.parsedRuns()) {
            if (kept.contains(r)) continue;
            try (XmlCursor c = r.formatting.newCursor()) {
                c.removeXml();
            }
        }
        return true;
    }

    /** Largest {@code wp:docPr} id in a part, 0 when there is none. */
    public static int maxDrawingId(XmlObject part) {
        int max = 0;
        try (XmlCursor c = part.newCursor()) {
            c.selectPath("declare namespace wp='" + NS_WP + "' .//wp:docPr");
            while (c.toNextSelection()) {
                String v = c.getAttributeText(QN_ID);
                if (v == null) continue;
                try { max = Math.max(max, Integer.parseInt(v.trim())); } catch (NumberFormatException ignore) { /* not numeric, cannot collide */ }
            }
        }
        return max;
    }

    // ===== parse helpers =====

    static String runText(XmlObject r) {
        StringBuilder sb = new StringBuilder();
        try (XmlCursor rc = r.newCursor()) {
            if (rc.toFirstChild()) {
                do {
                    QName n = rc.getName();
                    if (n == null || !NS_W.equals(n.getNamespaceURI())) continue;
                    switch (n.getLocalPart()) {
                        case "t": { String v = rc.getTextValue(); if (v != null) sb.append(v); break; }
                        case "tab": sb.append('\t'); break;
                        case "br": case "cr": sb.append('\n'); break;
                        case "noBreakHyphen": sb.append('\u2011'); break;
                        case "softHyphen": sb.append('\u00AD'); break;
                        default: break;
                    }
                } while (rc.toNextSibling());
            }
        }
        return sb.toString();
    }

    static boolean isAnchoredRun(XmlObject r) {
        try (XmlCursor rc = r.newCursor()) {
            if (!rc.toFirstChild()) return false;
            do {
                QName n = rc.getName();
                if (n == null) continue;
                if (!NS_W.equals(n.getNamespaceURI())) return true;
                String ln = n.getLocalPart();
                if ("rPr".equals(ln)) continue;
                if (!PAYLOAD.contains(ln)) return true;
                if ("br".equals(ln)) {
                    String type = rc.getAttributeText(QN_W_TYPE);
                    if (type != null && !"textWrapping".equals(type)) return true; // page / column break
                }
            } while (rc.toNextSibling());
        }
        return false;
    }

    private static boolean isPayload(QName n) {
        return n != null && NS_W.equals(n.getNamespaceURI()) && PAYLOAD.contains(n.getLocalPart());
    }

    // ===== serialize helpers =====

    private static void writeDerivedRun(Run<XmlObject> run) {
        XmlObject source = run.formatting;
        try (XmlCursor dest = source.newCursor()) {
            dest.beginElement(QN_W_R);

            try (XmlCursor attr = source.newCursor()) {
                if (attr.toFirstAttribute()) {
                    do { dest.insertAttributeWithValue(attr.getName(), attr.getTextValue()); } while (attr.toNextAttribute());
                }
            }
            try (XmlCursor child = source.newCursor()) {
                if (child.toFirstChild()) {
                    do {
                        if (isPayload(child.getName())) continue;
                        child.copyXml(dest);
                    } while (child.toNextSibling());
                }
            }

            if (run.picture != null) writePicture(dest, run.picture);
            else writeText(dest, run.text);
        }
    }

    /** One {@code <w:t xml:space="preserve">} per stretch of plain text; tabs, breaks and hyphens as their own marks. */
    static void writeText(XmlCursor dest, String text) {
        StringBuilder pending = new StringBuilder();
        boolean wrote = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            QName mark;
            switch (ch) {
                case '\t': mark = QN_W_TAB; break;
                case '\n': mark = QN_W_BR; break;
                case '\r': if (i + 1 < text.length() && text.charAt(i + 1) == '\n') continue; mark = QN_W_BR; break;
                case '\u2011': mark = QN_W_NB_HYPHEN; break;
                case '\u00AD': mark = QN_W_SOFT_HYPHEN; break;
                default: pending.append(ch); continue;
            }
            if (pending.length() > 0) { writeT(dest, pending.toString()); pending.setLength(0); }
            dest.beginElement(mark);
            dest.toNextToken();
            wrote = true;
        }
        if (pending.length() > 0 || !wrote) writeT(dest, pending.toString());
    }

    private static void writeT(XmlCursor dest, String s) {
        dest.beginElement(QN_W_T);
        dest.insertAttributeWithValue(QN_XML_SPACE, "preserve");
        dest.insertChars(s);
        dest.toNextToken();
    }

    private static void writePicture(XmlCursor dest, Run.InlinePicture pic) {
        XmlObject drawing;
        try {
            drawing = XmlObject.Factory.parse(drawingXml(pic));
        } catch (XmlException e) {
            throw new IllegalStateException("drawing template is not well-formed", e);
        }
        try (XmlCursor src = drawing.newCursor()) {
            src.toFirstChild();
            src.copyXml(dest);
        }
    }

    static String drawingXml(Run.InlinePicture pic) {
        String ext = "cx=\"" + pic.widthEmu + "\" cy=\"" + pic.heightEmu + "\"";
        String name = escapeAttr(pic.name);
        return "<w:drawing xmlns:w=\"" + NS_W + "\" xmlns:wp=\"" + NS_WP + "\" xmlns:a=\"" + NS_A
                + "\" xmlns:pic=\"" + NS_PIC + "\" xmlns:r=\"" + NS_R + "\">"
                + "<wp:inline distT=\"0\" distB=\"0\" distL=\"0\" distR=\"0\">"
                + "<wp:extent " + ext + "/>"
                + "<wp:docPr id=\"" + pic.drawingId + "\" name=\"Picture " + pic.drawingId + "\"/>"
                + "<wp:cNvGraphicFramePr><a:graphicFrameLocks noChangeAspect=\"1\"/></wp:cNvGraphicFramePr>"
                + "<a:graphic><a:graphicData uri=\"" + NS_PIC + "\">"
                + "<pic:pic><pic:nvPicPr><pic:cNvPr id=\"0\" name=\"" + name + "\"/><pic:cNvPicPr/></pic:nvPicPr>"
                + "<pic:blipFill><a:blip r:embed=\"" + pic.relationshipId + "\"/><a:stretch><a:fillRect/></a:stretch></pic:blipFill>"
                + "<pic:spPr><a:xfrm><a:off x=\"0\" y=\"0\"/><a:ext " + ext + "/></a:xfrm>"
                + "<a:prstGeom prst=\"rect\"><a:avLst/></a:prstGeom></pic:spPr></pic:pic>"
                + "</a:graphicData></a:graphic></wp:inline></w:drawing>";
    }

    private static String escapeAttr(String s) {
        return s.replace("&", "&amp;").replace("\"", "&quot;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
