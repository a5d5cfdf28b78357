package com.example.templatefiller;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces text placeholders in a container. The inserted value takes the formatting of the run
 * the placeholder starts in; text around the placeholder stays in runs carrying its own formatting.
 */
public final class TextSubstitution {
    private TextSubstitution() {}

    /** Replaces one matched span with {@code value}. Runs outside the span are left alone. */
    public static <F> void replace(FormattedContainer<F> container, TokenSpan span, String value) {
        Run<F> start = container.run(span.startRun);
        Run<F> end = container.run(span.endRun);
        String prefix = start.text.substring(0, span.startOffset);
        String suffix = end.text.substring(span.endOffset);

        List<Run<F>> replacement = new ArrayList<>(3);
        if (!prefix.isEmpty()) replacement.add(start.withText(prefix));
        replacement.add(start.withText(value == null ? "" : value));
        if (!suffix.isEmpty()) replacement.add(end.withText(suffix));
        container.replaceRuns(span.startRun, span.endRun, replacement);
    }

    /**
     * Substitutes every placeholder of the container that has a value. Matches are applied right to
     * left so spans found earlier stay valid. Names without a value are added to {@code unresolved}
     * and left as literal text.
     *
     * @return number of placeholders replaced
     */
    public static <F> int substituteAll(FormattedContainer<F> container, Map<String, String> values, Set<String> unresolved) {
        List<TokenMatch> matches = TokenScanner.scan(container);
        int replaced = 0;
        for (int i = matches.size() - 1; i >= 0; i--) {
            TokenMatch m = matches.get(i);
            String v = values == null ? null : values.get(m.name);
            if (v == null) {
                if (unresolved != null) unresolved.add(m.name);
                continue;
            }
            replace(container, m.span, v);
            replaced++;
        }
        return replaced;
    }
}
