package com.example.templatefiller;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code {{NAME}}} placeholders in a container even when formatting splits them over
 * several runs. The run texts are joined into one logical string; every logical character keeps
 * the (run, offset) it came from so matches map straight back to spans.
 */
public final class TokenScanner {
    private TokenScanner() {}

    public static final Pattern TOKEN = Pattern.compile("\\{\\{([A-Z0-9_]+)\\}\\}");

    public static <F> List<TokenMatch> scan(FormattedContainer<F> container) {
        List<TokenMatch> out = new ArrayList<>();
        if (container == null || container.isEmpty()) return out;

        int total = 0;
        for (Run<F> r : container.runs()) total += r.length();
        if (total < 5) return out;

        StringBuilder logical = new StringBuilder(total);
        int[] runOf = new int[total];
        int[] offsetOf = new int[total];
        int pos = 0;
        for (int i = 0; i < container.size(); i++) {
            String t = container.run(i).text;
            for (int k = 0; k < t.length(); k++) {
                runOf[pos] = i;
                offsetOf[pos] = k;
                pos++;
            }
            logical.append(t);
        }

        Matcher m = TOKEN.matcher(logical);
        while (m.find()) {
            int s = m.start(), e = m.end() - 1;
            TokenSpan span = new TokenSpan(runOf[s], offsetOf[s], runOf[e], offsetOf[e] + 1);
            out.add(new TokenMatch(m.group(1), span));
        }
        return out;
    }

    /** Distinct placeholder names of a container, in order of first appearance. */
    public static <F> Set<String> placeholderNames(FormattedContainer<F> container) {
        Set<String> names = new LinkedHashSet<>();
        for (TokenMatch m : scan(container)) names.add(m.name);
        return names;
    }
}
