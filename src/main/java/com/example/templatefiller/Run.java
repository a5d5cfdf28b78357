package com.example.templatefiller;

import java.util.Objects;

/**
 * One formatted run of a container. The formatting value is opaque: it is only ever handed on to
 * derived runs, never inspected.
 */
public final class Run<F> {

    /** Logical text of a run whose content cannot be split (drawings, fields, references). */
    public static final String ANCHOR_TEXT = "\uFFFC";

    public final String text;
    public final F formatting;
    /** Index of the parsed run this one descends from. */
    public final int sourceIndex;
    public final boolean derived;
    public final boolean anchored;
    /** Non-null only for runs produced by image injection. */
    public final InlinePicture picture;

    private Run(String text, F formatting, int sourceIndex, boolean derived, boolean anchored, InlinePicture picture) {
        this.text = Objects.requireNonNull(text, "text");
        this.formatting = formatting;
        this.sourceIndex = sourceIndex;
        this.derived = derived;
        this.anchored = anchored;
        this.picture = picture;
    }

    public static <F> Run<F> of(String text, F formatting, int sourceIndex) {
        return new Run<>(text, formatting, sourceIndex, false, false, null);
    }

    public static <F> Run<F> anchor(F formatting, int sourceIndex) {
        return new Run<>(ANCHOR_TEXT, formatting, sourceIndex, false, true, null);
    }

    /** A new run with this run's formatting and the given text. */
    public Run<F> withText(String newText) {
        return new Run<>(newText, formatting, sourceIndex, true, false, null);
    }

    /** A new run with this run's formatting holding only an inline picture. */
    public Run<F> withPicture(InlinePicture pic) {
        return new Run<>(ANCHOR_TEXT, formatting, sourceIndex, true, true, Objects.requireNonNull(pic, "picture"));
    }

    public int length() { return text.length(); }

    @Override
    public String toString() {
        return (derived ? "Run*[" : "Run[") + sourceIndex + "]'" + text + "'";
    }

    /** Reference to a media part drawn inline at a fixed size. */
    public static final class InlinePicture {
        public final String relationshipId;
        public final String name;
        public final long widthEmu;
        public final long heightEmu;
        /** Drawing object id, unique within the part. */
        public final int drawingId;

        public InlinePicture(String relationshipId, String name, long widthEmu, long heightEmu, int drawingId) {
            this.relationshipId = relationshipId;
            this.name = name;
            this.widthEmu = widthEmu;
            this.heightEmu = heightEmu;
            this.drawingId = drawingId;
        }
    }
}
