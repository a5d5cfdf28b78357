package com.example.templatefiller;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Output of one fill: the new document plus what happened on the way. */
public final class FillResult {
    public final byte[] document;
    /** Placeholders found in the template that had no value, sorted by name. */
    public final Set<String> unresolved;
    public final int textReplacements;
    public final int imagesInjected;
    public final Set<String> modifiedParts;

    public FillResult(byte[] document, Set<String> unresolved, int textReplacements, int imagesInjected, Set<String> modifiedParts) {
        this.document = document;
        this.unresolved = Collections.unmodifiableSet(new TreeSet<>(unresolved));
        this.textReplacements = textReplacements;
        this.imagesInjected = imagesInjected;
        this.modifiedParts = Collections.unmodifiableSet(new TreeSet<>(modifiedParts));
    }
}
