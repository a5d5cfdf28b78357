package com.example.templatefiller;

/**
 * Half-open range over the runs of a container: from {@code startOffset} in run {@code startRun}
 * up to (excluding) {@code endOffset} in run {@code endRun}.
 */
public final class TokenSpan {
    public final int startRun;
    public final int startOffset;
    public final int endRun;
    public final int endOffset;

    public TokenSpan(int startRun, int startOffset, int endRun, int endOffset) {
        if (startRun > endRun || (startRun == endRun && startOffset >= endOffset)) {
            throw new IllegalArgumentException("empty or inverted span: " + startRun + ":" + startOffset + " -> " + endRun + ":" + endOffset);
        }
        this.startRun = startRun; this.startOffset = startOffset;
        this.endRun = endRun; this.endOffset = endOffset;
    }

    /** True when this span ends at or before the other one starts. */
    public boolean precedes(TokenSpan other) {
        if (endRun != other.startRun) return endRun < other.startRun;
        return endOffset <= other.startOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenSpan)) return false;
        TokenSpan s = (TokenSpan) o;
        return startRun == s.startRun && startOffset == s.startOffset && endRun == s.endRun && endOffset == s.endOffset;
    }

    @Override
    public int hashCode() {
        return ((startRun * 31 + startOffset) * 31 + endRun) * 31 + endOffset;
    }

    @Override
    public String toString() {
        return "[" + startRun + ":" + startOffset + " -> " + endRun + ":" + endOffset + ")";
    }
}
