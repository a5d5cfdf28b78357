package com.example.templatefiller;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered runs of one paragraph-like unit. */
public final class FormattedContainer<F> {

    private final List<Run<F>> parsed;
    private final List<Run<F>> runs;
    private boolean modified;

    public FormattedContainer(List<Run<F>> runs) {
        this.parsed = List.copyOf(runs);
        this.runs = new ArrayList<>(runs);
    }

    public List<Run<F>> runs() { return Collections.unmodifiableList(runs); }

    /** Runs as they were when the container was built. */
    public List<Run<F>> parsedRuns() { return parsed; }

    public Run<F> run(int i) { return runs.get(i); }

    public int size() { return runs.size(); }

    public boolean isEmpty() { return runs.isEmpty(); }

    public boolean isModified() { return modified; }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Run<F> r : runs) sb.append(r.text);
        return sb.toString();
    }

    /** Replaces runs {@code from..to} (inclusive) with the given sequence. */
    public void replaceRuns(int from, int to, List<Run<F>> replacement) {
        if (from < 0 || to >= runs.size() || from > to) {
            throw new IndexOutOfBoundsException("run range [" + from + ", " + to + "] of " + runs.size());
        }
        List<Run<F>> tail = new ArrayList<>(runs.subList(to + 1, runs.size()));
        runs.subList(from, runs.size()).clear();
        runs.addAll(replacement);
        runs.addAll(tail);
        modified = true;
    }

    /** Replaces every run with the given sequence. */
    public void replaceAll(List<Run<F>> replacement) {
        runs.clear();
        runs.addAll(replacement);
        modified = true;
    }
}
