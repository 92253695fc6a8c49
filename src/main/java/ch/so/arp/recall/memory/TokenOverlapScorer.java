package ch.so.arp.recall.memory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic relevance heuristic based on the token overlap between a query
 * and the text of a stored object. It stands in for the store's keyword and
 * vector scoring in the in-memory store.
 */
final class TokenOverlapScorer {

    private TokenOverlapScorer() {
    }

    /**
     * Share of query tokens found in the text, in {@code [0, 1]}.
     */
    static double keywordScore(Set<String> queryTokens, Set<String> textTokens) {
        if (queryTokens.isEmpty()) {
            return 0.0d;
        }
        long overlap = textTokens.stream().filter(queryTokens::contains).count();
        return (double) overlap / (double) queryTokens.size();
    }

    /**
     * Dice coefficient of both token sets, used as certainty of a vector match.
     */
    static double similarity(Set<String> queryTokens, Set<String> textTokens) {
        if (queryTokens.isEmpty() || textTokens.isEmpty()) {
            return 0.0d;
        }
        long overlap = textTokens.stream().filter(queryTokens::contains).count();
        return 2.0d * overlap / (queryTokens.size() + textTokens.size());
    }

    static Set<String> tokenize(String value) {
        String normalized = value == null ? "" : value.toLowerCase(Locale.ROOT);
        Set<String> tokens = new HashSet<>();
        for (String token : normalized.split("\\W+")) {
            if (token.length() >= 2) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Tokens of the selected properties, or of all text values when no
     * properties are selected. Nested maps and lists are searched as well.
     */
    static Set<String> tokenize(Map<String, Object> properties, List<String> selected) {
        Set<String> tokens = new HashSet<>();
        properties.forEach((name, value) -> {
            if (selected.isEmpty() || selected.contains(name)) {
                collect(value, tokens);
            }
        });
        return tokens;
    }

    private static void collect(Object value, Set<String> tokens) {
        if (value instanceof Map<?, ?> map) {
            map.values().forEach(nested -> collect(nested, tokens));
        } else if (value instanceof Collection<?> values) {
            values.forEach(nested -> collect(nested, tokens));
        } else if (value instanceof CharSequence text) {
            tokens.addAll(tokenize(text.toString()));
        }
    }
}
